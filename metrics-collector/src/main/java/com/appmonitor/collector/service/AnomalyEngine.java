package com.appmonitor.collector.service;

import com.appmonitor.collector.model.AlertDirection;
import com.appmonitor.collector.model.AlertRule;
import com.appmonitor.collector.model.Anomaly;
import com.appmonitor.collector.model.ComparisonMode;
import com.appmonitor.collector.model.GrowthRates;
import com.appmonitor.collector.model.MetricRecord;
import com.appmonitor.collector.model.Severity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Evaluates threshold rules against a day's record and its growth rates.
 *
 * Both bounds are checked, minimum first. When a value somehow breaches both, the maximum
 * is evaluated last and wins.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AnomalyEngine {

    private static final DateTimeFormatter DETECTED_AT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Clock clock;

    public List<Anomaly> detect(String appName, MetricRecord current, GrowthRates growth, List<AlertRule> rules) {
        List<Anomaly> anomalies = new ArrayList<>();
        for (AlertRule rule : rules) {
            if (!rule.isActive() || !rule.getAppId().equals(current.getAppId())) continue;
            try {
                evaluate(rule, appName, current, growth).ifPresent(anomaly -> {
                    log.warn("Rule {} triggered for {}: {} {} ({})", rule.getId(), appName,
                            rule.growthKey(), anomaly.getDirection().getLabel(), anomaly.getSeverity());
                    anomalies.add(anomaly);
                });
            } catch (RuntimeException e) {
                log.error("Could not evaluate rule {} for {}: {}", rule.getId(), appName, e.getMessage(), e);
            }
        }
        log.info("Checked {} rules for {}: {} anomalies", rules.size(), appName, anomalies.size());
        return anomalies;
    }

    public Optional<Anomaly> evaluate(AlertRule rule, String appName, MetricRecord current, GrowthRates growth) {
        double value = rule.getComparisonMode() == ComparisonMode.ABSOLUTE
                ? current.valueOf(rule.getMetric())
                : growth.rate(rule.getMetric(), rule.getComparisonMode());

        AlertDirection direction = null;
        double threshold = 0;
        if (rule.getThresholdMin() != null && value < rule.getThresholdMin()) {
            direction = AlertDirection.BELOW_MINIMUM;
            threshold = rule.getThresholdMin();
        }
        if (rule.getThresholdMax() != null && value > rule.getThresholdMax()) {
            direction = AlertDirection.ABOVE_MAXIMUM;
            threshold = rule.getThresholdMax();
        }
        if (direction == null) {
            return Optional.empty();
        }

        return Optional.of(Anomaly.builder()
                .ruleId(rule.getId())
                .appId(rule.getAppId())
                .appName(appName)
                .date(current.getDate())
                .metric(rule.getMetric())
                .comparisonMode(rule.getComparisonMode())
                .currentValue(value)
                .thresholdValue(threshold)
                .direction(direction)
                .severity(severity(value, threshold))
                .message(message(rule, appName, value, threshold, direction))
                .notificationTarget(rule.getNotificationTarget())
                .build());
    }

    /**
     * Relative deviation from the breached threshold; a zero threshold with a non-zero value
     * counts as infinitely far off.
     */
    public static Severity severity(double value, double threshold) {
        double deviation;
        if (threshold == 0) {
            deviation = value != 0 ? Double.POSITIVE_INFINITY : 0;
        } else {
            deviation = Math.abs(value - threshold) / Math.abs(threshold);
        }
        return Severity.fromDeviation(deviation);
    }

    private String message(AlertRule rule, String appName, double value, double threshold, AlertDirection direction) {
        String unit = rule.getComparisonMode().isRate() ? "%" : "";
        return String.format(Locale.ROOT, "[%s] %s alert\nComparison: %s\nCurrent value: %s%s\nThreshold: %s %s%s\nDetected at: %s",
                appName,
                rule.getMetric().getDisplayName(),
                rule.getComparisonMode().getDisplayName(),
                formatValue(rule.getComparisonMode(), value), unit,
                direction.getLabel(),
                formatValue(rule.getComparisonMode(), threshold), unit,
                LocalDateTime.now(clock).format(DETECTED_AT));
    }

    static String formatValue(ComparisonMode mode, double value) {
        if (mode.isRate()) {
            return String.format(Locale.ROOT, "%+.1f", value);
        }
        return value >= 1
                ? String.format(Locale.ROOT, "%,.0f", value)
                : String.format(Locale.ROOT, "%.2f", value);
    }
}
