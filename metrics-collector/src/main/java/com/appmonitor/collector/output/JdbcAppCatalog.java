package com.appmonitor.collector.output;

import com.appmonitor.collector.model.AlertRule;
import com.appmonitor.collector.model.ComparisonMode;
import com.appmonitor.collector.model.Metric;
import com.appmonitor.collector.model.MonitoredApp;
import com.appmonitor.collector.model.Platform;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Component
@Slf4j
@RequiredArgsConstructor
public class JdbcAppCatalog implements AppCatalog {

    private final JdbcTemplate jdbcTemplate;

    private static final RowMapper<MonitoredApp> APP_MAPPER = (rs, rowNum) -> MonitoredApp.builder()
            .id(rs.getLong("id"))
            .name(rs.getString("name"))
            .platform(Platform.fromString(rs.getString("platform")))
            .externalId(rs.getString("external_id"))
            .active(rs.getBoolean("active"))
            .reportTarget(rs.getString("report_target"))
            .build();

    @Override
    public List<MonitoredApp> findActiveApps() {
        return jdbcTemplate.query(
                "SELECT id, name, platform, external_id, active, report_target FROM apps WHERE active = TRUE ORDER BY id",
                APP_MAPPER);
    }

    @Override
    public Optional<MonitoredApp> findApp(long appId) {
        return jdbcTemplate.query(
                "SELECT id, name, platform, external_id, active, report_target FROM apps WHERE id = ?",
                APP_MAPPER, appId).stream().findFirst();
    }

    /**
     * Rules naming a metric or mode this build does not know are skipped with a warning.
     */
    @Override
    public List<AlertRule> findActiveRules(long appId) {
        List<AlertRule> rules = new ArrayList<>();
        jdbcTemplate.query("""
                SELECT r.id, r.app_id, a.name AS app_name, r.metric, r.comparison_mode,
                       r.threshold_min, r.threshold_max, r.active, r.notification_target
                  FROM alert_rules r
                  JOIN apps a ON a.id = r.app_id
                 WHERE r.app_id = ? AND r.active = TRUE
                 ORDER BY r.id
                """, rs -> {
            try {
                rules.add(AlertRule.builder()
                        .id(rs.getLong("id"))
                        .appId(rs.getLong("app_id"))
                        .appName(rs.getString("app_name"))
                        .metric(Metric.fromKey(rs.getString("metric")))
                        .comparisonMode(ComparisonMode.fromString(rs.getString("comparison_mode")))
                        .thresholdMin(rs.getObject("threshold_min", Double.class))
                        .thresholdMax(rs.getObject("threshold_max", Double.class))
                        .active(rs.getBoolean("active"))
                        .notificationTarget(rs.getString("notification_target"))
                        .build());
            } catch (IllegalArgumentException e) {
                log.warn("Skipping alert rule {}: {}", rs.getLong("id"), e.getMessage());
            }
        }, appId);
        return rules;
    }
}
