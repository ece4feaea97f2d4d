package com.appmonitor.collector.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Payload handed to the notification collaborator for an app's daily report.
 */
@Value
@Builder
public class DailyReport {

    public record MetricLine(double value, double dayOverDay, double weekOverWeek) {}

    String appName;
    LocalDate date;
    Map<Metric, MetricLine> metrics;
    Map<DownloadChannel, Long> channelBreakdown;
    List<String> insights;
    String summary;
}
