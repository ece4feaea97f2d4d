package com.appmonitor.collector.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Threshold rule on one metric of one app. At most one rule exists per
 * (app, metric, comparison mode).
 *
 * Thresholds are percentages for {@link ComparisonMode#DOD}/{@link ComparisonMode#WOW}
 * and raw values for {@link ComparisonMode#ABSOLUTE}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertRule {

    private Long id;
    private Long appId;
    private String appName;
    private Metric metric;
    private ComparisonMode comparisonMode;
    private Double thresholdMin;
    private Double thresholdMax;
    private boolean active;
    private String notificationTarget;

    public String growthKey() {
        return metric.getKey() + "_" + comparisonMode.getKey();
    }
}
