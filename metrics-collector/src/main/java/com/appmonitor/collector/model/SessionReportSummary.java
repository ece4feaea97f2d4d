package com.appmonitor.collector.model;

import lombok.Data;

import java.time.LocalDate;
import java.util.Map;
import java.util.TreeMap;

@Data
public class SessionReportSummary {

    private String reportId;
    private final Map<LocalDate, DailySessionStats> daily = new TreeMap<>();

    private long totalSessions;
    private long totalUniqueDevices;

    private int totalInstances;
    private int failedInstances;

    public DailySessionStats day(LocalDate date) {
        return daily.computeIfAbsent(date, d -> new DailySessionStats());
    }

    public void instanceFailed() {
        failedInstances++;
    }
}
