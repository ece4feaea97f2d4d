package com.appmonitor.collector.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Result of one rule breaching. Ephemeral: persistence turns it into an alert log entry.
 */
@Value
@Builder
public class Anomaly {

    Long ruleId;
    Long appId;
    String appName;
    LocalDate date;
    Metric metric;
    ComparisonMode comparisonMode;
    double currentValue;
    double thresholdValue;
    AlertDirection direction;
    Severity severity;
    String message;
    String notificationTarget;
}
