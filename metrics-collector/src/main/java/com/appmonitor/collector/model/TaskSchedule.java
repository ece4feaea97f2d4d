package com.appmonitor.collector.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A recurring ingestion run. Edited outside this service; read-only to the scheduler.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskSchedule {

    public static final int DEFAULT_RETRY_COUNT = 3;
    public static final int DEFAULT_TIMEOUT_MINUTES = 30;

    private Long id;
    private String name;

    /** Null runs the schedule for every active app. */
    private Long appId;

    @Builder.Default
    private ScheduleFrequency frequency = ScheduleFrequency.DAILY;
    private int hour;
    private int minute;

    /** 0 = Monday. Used by weekly schedules; null reads as Monday. */
    private Integer weekday;

    /** 1-31. Used by monthly schedules; null reads as the 1st. */
    private Integer dayOfMonth;

    @Builder.Default
    private int retryCount = DEFAULT_RETRY_COUNT;
    @Builder.Default
    private int timeoutMinutes = DEFAULT_TIMEOUT_MINUTES;

    private boolean active;
    private boolean skipNotifications;

    public String timeOfDay() {
        return String.format("%02d:%02d", hour, minute);
    }
}
