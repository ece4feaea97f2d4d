package com.appmonitor.collector.scheduler;

import com.appmonitor.collector.model.TaskSchedule;

import java.time.LocalDateTime;

/**
 * Minute-level matching of schedules against local wall-clock time.
 */
public final class ScheduleMatcher {

    private ScheduleMatcher() {
    }

    /**
     * Hour and minute must match. Weekly schedules also need the weekday (0 = Monday, unset
     * reads as Monday); monthly schedules the day of month (unset reads as the 1st).
     */
    public static boolean matches(TaskSchedule schedule, LocalDateTime now) {
        if (schedule.getHour() != now.getHour() || schedule.getMinute() != now.getMinute()) {
            return false;
        }
        return switch (schedule.getFrequency()) {
            case DAILY -> true;
            case WEEKLY -> {
                int weekday = schedule.getWeekday() != null ? schedule.getWeekday() : 0;
                yield now.getDayOfWeek().getValue() - 1 == weekday;
            }
            case MONTHLY -> {
                int day = schedule.getDayOfMonth() != null ? schedule.getDayOfMonth() : 1;
                yield now.getDayOfMonth() == day;
            }
        };
    }
}
