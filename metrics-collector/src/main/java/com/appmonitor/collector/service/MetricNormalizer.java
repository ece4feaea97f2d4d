package com.appmonitor.collector.service;

import com.appmonitor.collector.exception.ReportParseException;
import com.appmonitor.collector.model.BulkStatsMetrics;
import com.appmonitor.collector.model.BulkStatsMetrics.DailyBulkStats;
import com.appmonitor.collector.model.DownloadChannel;
import com.appmonitor.collector.model.InstallReportSummary;
import com.appmonitor.collector.model.MetricRecord;
import com.appmonitor.collector.model.ReportApiMetrics;
import com.appmonitor.collector.model.SessionReportSummary;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps both vendor payloads onto {@link MetricRecord}. Counts are clamped at zero.
 */
@Component
@RequiredArgsConstructor
public class MetricNormalizer {

    private final ObjectMapper objectMapper;

    public MetricRecord fromReport(long appId, LocalDate date, ReportApiMetrics metrics) {
        return MetricRecord.builder()
                .appId(appId)
                .date(date)
                .downloads(nonNegative(metrics.downloads()))
                .sessions(nonNegative(metrics.sessionCount()))
                .uninstalls(nonNegative(metrics.uninstalls()))
                .uniqueDevices(metrics.uniqueDevices() != null ? nonNegative(metrics.uniqueDevices()) : null)
                .searchDownloads(nonNegative(metrics.channel(DownloadChannel.SEARCH)))
                .webReferralDownloads(nonNegative(metrics.channel(DownloadChannel.WEB_REFERRAL)))
                .appReferralDownloads(nonNegative(metrics.channel(DownloadChannel.APP_REFERRAL)))
                .browseDownloads(nonNegative(metrics.channel(DownloadChannel.STORE_BROWSE)))
                .institutionalDownloads(nonNegative(metrics.channel(DownloadChannel.INSTITUTIONAL)))
                .otherDownloads(nonNegative(metrics.channel(DownloadChannel.OTHER)))
                .rawPayload(toJson(reportPayload(metrics)))
                .build();
    }

    /**
     * Record for the bulk payload's effective date, which may be earlier than the requested date.
     */
    public MetricRecord fromBulk(long appId, BulkStatsMetrics metrics) {
        return bulkRecord(appId, metrics.getEffectiveDate(), metrics.getDownloads(), metrics.getUninstalls(),
                toJson(bulkPayload(metrics)));
    }

    /**
     * Records for every date of the bulk month up to its latest date that is neither stored
     * yet nor the effective date itself.
     */
    public List<MetricRecord> backfill(long appId, BulkStatsMetrics metrics, Set<LocalDate> existingDates) {
        List<MetricRecord> records = new ArrayList<>();
        LocalDate maxDate = metrics.maxAvailableDate();
        if (maxDate == null) {
            return records;
        }
        for (Map.Entry<LocalDate, DailyBulkStats> entry : metrics.getDaily().headMap(maxDate, true).entrySet()) {
            LocalDate date = entry.getKey();
            if (date.equals(metrics.getEffectiveDate()) || existingDates.contains(date)) continue;
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("source", "bulk_backfill");
            payload.put("object_name", metrics.getObjectName());
            payload.put("downloads", entry.getValue().downloads());
            payload.put("uninstalls", entry.getValue().uninstalls());
            records.add(bulkRecord(appId, date, entry.getValue().downloads(), entry.getValue().uninstalls(),
                    toJson(payload)));
        }
        return records;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private MetricRecord bulkRecord(long appId, LocalDate date, long downloads, long uninstalls, String payload) {
        return MetricRecord.builder()
                .appId(appId)
                .date(date)
                .downloads(nonNegative(downloads))
                .uninstalls(nonNegative(uninstalls))
                .sessions(0)
                .rawPayload(payload)
                .build();
    }

    private Map<String, Object> reportPayload(ReportApiMetrics metrics) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("source", "report_api");
        payload.put("bundle_id", metrics.getBundleId());
        payload.put("vendor_app_id", metrics.getVendorAppId());
        payload.put("report_request_id", metrics.getReportRequestId());
        payload.put("target_date", String.valueOf(metrics.getTargetDate()));
        payload.put("downloads", metrics.downloads());
        payload.put("updates", metrics.updates());
        payload.put("reinstalls", metrics.reinstalls());
        payload.put("uninstalls", metrics.uninstalls());
        payload.put("sessions", metrics.sessionCount());
        payload.put("unique_devices", metrics.uniqueDevices());
        Map<String, Object> channels = new LinkedHashMap<>();
        for (DownloadChannel channel : DownloadChannel.values()) {
            channels.put(channel.getMetric().getKey(), metrics.channel(channel));
        }
        payload.put("channels", channels);
        if (metrics.getInstalls() != null) payload.put("install_report", installPayload(metrics.getInstalls()));
        if (metrics.getInstallDetail() != null) payload.put("install_detail_report", installPayload(metrics.getInstallDetail()));
        if (metrics.getSessions() != null) payload.put("session_report", sessionPayload(metrics.getSessions()));
        return payload;
    }

    private Map<String, Object> installPayload(InstallReportSummary summary) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("report_id", summary.getReportId());
        payload.put("total_instances", summary.getTotalInstances());
        payload.put("failed_instances", summary.getFailedInstances());
        Map<String, Object> daily = new LinkedHashMap<>();
        summary.getDaily().forEach((date, stats) -> daily.put(date.toString(), Map.of(
                "installs", stats.getInstalls(),
                "updates", stats.getUpdates(),
                "reinstalls", stats.getReinstalls(),
                "uninstalls", stats.getUninstalls(),
                "rows", stats.getRows())));
        payload.put("daily", daily);
        return payload;
    }

    private Map<String, Object> sessionPayload(SessionReportSummary summary) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("report_id", summary.getReportId());
        payload.put("total_instances", summary.getTotalInstances());
        payload.put("failed_instances", summary.getFailedInstances());
        Map<String, Object> daily = new LinkedHashMap<>();
        summary.getDaily().forEach((date, stats) -> daily.put(date.toString(), Map.of(
                "sessions", stats.getSessions(),
                "unique_devices", stats.getUniqueDevices(),
                "rows", stats.getRows())));
        payload.put("daily", daily);
        return payload;
    }

    private Map<String, Object> bulkPayload(BulkStatsMetrics metrics) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("source", "bulk_export");
        payload.put("package_id", metrics.getPackageId());
        payload.put("object_name", metrics.getObjectName());
        payload.put("requested_date", String.valueOf(metrics.getRequestedDate()));
        payload.put("effective_date", String.valueOf(metrics.getEffectiveDate()));
        payload.put("downloads", metrics.getDownloads());
        payload.put("uninstalls", metrics.getUninstalls());
        payload.put("sessions_available", metrics.isSessionsAvailable());
        payload.put("available_dates", metrics.availableDates().stream().map(LocalDate::toString).toList());
        payload.put("max_available_date", String.valueOf(metrics.maxAvailableDate()));
        return payload;
    }

    private String toJson(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(NumericSanitizer.sanitize(payload));
        } catch (JsonProcessingException e) {
            throw new ReportParseException("Could not serialise vendor payload: " + e.getMessage(), e);
        }
    }

    private static long nonNegative(long value) {
        return Math.max(0, value);
    }
}
