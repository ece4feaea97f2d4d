package com.appmonitor.collector.model;

import lombok.Data;

import java.time.LocalDate;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregated view of one install report across all of its instances.
 *
 * {@link #daily} is keyed by each row's own date, which can differ from the requested
 * date when the vendor batches several days into one instance.
 */
@Data
public class InstallReportSummary {

    private String reportId;
    private final Map<LocalDate, DailyInstallStats> daily = new TreeMap<>();
    private final ChannelCounts channels = new ChannelCounts();

    private long totalInstalls;
    private long totalUpdates;
    private long totalReinstalls;
    private long totalUninstalls;

    private int totalInstances;
    private int failedInstances;

    public DailyInstallStats day(LocalDate date) {
        return daily.computeIfAbsent(date, d -> new DailyInstallStats());
    }

    public void instanceFailed() {
        failedInstances++;
    }
}
