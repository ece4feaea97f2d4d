package com.appmonitor.collector.output;

import com.appmonitor.collector.model.Anomaly;
import com.appmonitor.collector.model.MetricRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.SimpleJdbcInsert;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
@Slf4j
@RequiredArgsConstructor
public class JdbcMetricStore implements MetricStore {

    private final JdbcTemplate jdbcTemplate;
    private final Clock clock;

    private static final String COLUMNS = """
            app_id, metric_date, downloads, sessions, uninstalls, unique_devices,
            search_downloads, web_referral_downloads, app_referral_downloads, browse_downloads,
            institutional_downloads, other_downloads, revenue, rating, raw_payload
            """;

    private static final String UPDATE_SQL = """
            UPDATE app_metrics
               SET downloads = ?, sessions = ?, uninstalls = ?, unique_devices = ?,
                   search_downloads = ?, web_referral_downloads = ?, app_referral_downloads = ?,
                   browse_downloads = ?, institutional_downloads = ?, other_downloads = ?,
                   revenue = ?, rating = ?, raw_payload = ?, updated_at = ?
             WHERE app_id = ? AND metric_date = ?
            """;

    private static final String INSERT_SQL = """
            INSERT INTO app_metrics
            (app_id, metric_date, downloads, sessions, uninstalls, unique_devices,
             search_downloads, web_referral_downloads, app_referral_downloads, browse_downloads,
             institutional_downloads, other_downloads, revenue, rating, raw_payload, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """;

    private static final RowMapper<MetricRecord> RECORD_MAPPER = (rs, rowNum) -> MetricRecord.builder()
            .appId(rs.getLong("app_id"))
            .date(rs.getObject("metric_date", LocalDate.class))
            .downloads(rs.getLong("downloads"))
            .sessions(rs.getLong("sessions"))
            .uninstalls(rs.getLong("uninstalls"))
            .uniqueDevices(rs.getObject("unique_devices", Long.class))
            .searchDownloads(rs.getLong("search_downloads"))
            .webReferralDownloads(rs.getLong("web_referral_downloads"))
            .appReferralDownloads(rs.getLong("app_referral_downloads"))
            .browseDownloads(rs.getLong("browse_downloads"))
            .institutionalDownloads(rs.getLong("institutional_downloads"))
            .otherDownloads(rs.getLong("other_downloads"))
            .revenue(rs.getBigDecimal("revenue"))
            .rating(rs.getObject("rating", Double.class))
            .rawPayload(rs.getString("raw_payload"))
            .build();

    // ── Metric records ────────────────────────────────────────────────────────

    @Override
    public Optional<MetricRecord> getRecord(long appId, LocalDate date) {
        List<MetricRecord> rows = jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM app_metrics WHERE app_id = ? AND metric_date = ?",
                RECORD_MAPPER, appId, date);
        return rows.stream().findFirst();
    }

    /**
     * Update first, insert when nothing matched. A concurrent writer inserting the same key in
     * between surfaces as a duplicate key, which turns into a second update.
     */
    @Override
    public void upsertRecord(MetricRecord record) {
        Timestamp now = Timestamp.from(clock.instant());
        if (update(record, now) > 0) {
            log.debug("Updated metrics for app {} on {}", record.getAppId(), record.getDate());
            return;
        }
        try {
            jdbcTemplate.update(INSERT_SQL,
                    record.getAppId(), record.getDate(),
                    record.getDownloads(), record.getSessions(), record.getUninstalls(), record.getUniqueDevices(),
                    record.getSearchDownloads(), record.getWebReferralDownloads(), record.getAppReferralDownloads(),
                    record.getBrowseDownloads(), record.getInstitutionalDownloads(), record.getOtherDownloads(),
                    record.getRevenue(), record.getRating(), record.getRawPayload(), now);
            log.debug("Inserted metrics for app {} on {}", record.getAppId(), record.getDate());
        } catch (DuplicateKeyException e) {
            log.debug("Metrics for app {} on {} inserted concurrently, updating", record.getAppId(), record.getDate());
            update(record, now);
        }
    }

    @Override
    public List<MetricRecord> listRecords(long appId, LocalDate from, LocalDate to) {
        return jdbcTemplate.query(
                "SELECT " + COLUMNS + " FROM app_metrics WHERE app_id = ? AND metric_date BETWEEN ? AND ? ORDER BY metric_date",
                RECORD_MAPPER, appId, from, to);
    }

    private int update(MetricRecord record, Timestamp now) {
        return jdbcTemplate.update(UPDATE_SQL,
                record.getDownloads(), record.getSessions(), record.getUninstalls(), record.getUniqueDevices(),
                record.getSearchDownloads(), record.getWebReferralDownloads(), record.getAppReferralDownloads(),
                record.getBrowseDownloads(), record.getInstitutionalDownloads(), record.getOtherDownloads(),
                record.getRevenue(), record.getRating(), record.getRawPayload(), now,
                record.getAppId(), record.getDate());
    }

    // ── Alert logs ────────────────────────────────────────────────────────────

    @Override
    public long createAlertLog(Anomaly anomaly) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("rule_id", anomaly.getRuleId());
        row.put("app_id", anomaly.getAppId());
        row.put("metric_date", anomaly.getDate());
        row.put("metric", anomaly.getMetric().getKey());
        row.put("comparison_mode", anomaly.getComparisonMode().getKey());
        row.put("current_value", anomaly.getCurrentValue());
        row.put("threshold_value", anomaly.getThresholdValue());
        row.put("direction", anomaly.getDirection().name());
        row.put("severity", anomaly.getSeverity().name());
        row.put("message", anomaly.getMessage());
        row.put("notification_sent", false);
        row.put("created_at", Timestamp.from(clock.instant()));

        Number id = new SimpleJdbcInsert(jdbcTemplate)
                .withTableName("alert_logs")
                .usingColumns(row.keySet().toArray(String[]::new))
                .usingGeneratedKeyColumns("id")
                .executeAndReturnKey(row);
        log.info("Logged {} alert {} for app {} on {}", anomaly.getSeverity(), id, anomaly.getAppName(), anomaly.getDate());
        return id.longValue();
    }

    @Override
    public void markAlertSent(long alertLogId) {
        jdbcTemplate.update("UPDATE alert_logs SET notification_sent = TRUE, sent_at = ? WHERE id = ?",
                Timestamp.from(clock.instant()), alertLogId);
    }
}
