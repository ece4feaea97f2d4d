package com.appmonitor.collector.service;

import com.appmonitor.collector.config.AppMonitorProperties;
import com.appmonitor.collector.exception.CollectionException;
import com.appmonitor.collector.exception.ConfigurationException;
import com.appmonitor.collector.exception.ExecutionTimeoutException;
import com.appmonitor.collector.model.Anomaly;
import com.appmonitor.collector.model.BulkStatsMetrics;
import com.appmonitor.collector.model.DailyReport;
import com.appmonitor.collector.model.FailureKind;
import com.appmonitor.collector.model.GrowthRates;
import com.appmonitor.collector.model.MetricRecord;
import com.appmonitor.collector.model.MonitoredApp;
import com.appmonitor.collector.model.ReportApiMetrics;
import com.appmonitor.collector.model.RunSummary;
import com.appmonitor.collector.model.VendorFetchResult;
import com.appmonitor.collector.output.AppCatalog;
import com.appmonitor.collector.output.MetricStore;
import com.appmonitor.collector.output.NotificationSender;
import com.appmonitor.collector.scheduler.ExecutionDeadline;
import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The daily collection run: for each app fetch, normalise, store, analyse, detect and notify.
 *
 * A failure in one app is recorded in the run summary and never stops the others. Only an
 * expired or cancelled deadline ends the run early.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IngestionService {

    private final AppCatalog appCatalog;
    private final MetricStore metricStore;
    private final NotificationSender notificationSender;
    private final VendorClientFactory clientFactory;
    private final MetricNormalizer normalizer;
    private final GrowthAnalyzer growthAnalyzer;
    private final AnomalyEngine anomalyEngine;
    private final ReportFormatter reportFormatter;
    private final AppMonitorProperties properties;
    private final Clock clock;

    @Value
    @Builder
    public static class RunOptions {
        /** Null runs every active app. */
        Long appId;
        /** Null means today minus the configured data delay. */
        LocalDate targetDate;
        boolean dryRun;
        boolean skipNotifications;
    }

    public LocalDate defaultTargetDate() {
        return LocalDate.now(clock).minusDays(properties.getScheduling().getDataDelayDays());
    }

    /**
     * Runs the pipeline, filling {@code summary} as it goes so a caller that gives up on the
     * run can still read the counts reached so far.
     */
    public RunSummary run(RunOptions options, ExecutionDeadline deadline, ExecutionLog executionLog, RunSummary summary) {
        LocalDate targetDate = options.getTargetDate() != null ? options.getTargetDate() : defaultTargetDate();
        List<MonitoredApp> apps = resolveApps(options.getAppId());
        summary.setTotalApps(apps.size());
        executionLog.info("Collecting {} for {} app(s){}", targetDate, apps.size(), options.isDryRun() ? " (dry run)" : "");

        for (MonitoredApp app : apps) {
            deadline.checkpoint();
            try {
                processApp(app, targetDate, options, deadline, executionLog, summary);
                summary.recordSuccess();
            } catch (ExecutionTimeoutException e) {
                throw e;
            } catch (RuntimeException e) {
                deadline.checkpoint();
                String message = app.getName() + ": " + e.getMessage();
                summary.recordError(message);
                executionLog.error("Failed to process {} ({}): {}", app.getName(), kindOf(e), e.getMessage());
                log.error("Failed to process app {}: {}", app.getName(), e.getMessage(), e);
                notifyFailure(app, e, options);
            }
        }

        executionLog.info("Run finished: {}", summary);
        return summary;
    }

    // ── Per-app pipeline ─────────────────────────────────────────────────────

    private void processApp(MonitoredApp app, LocalDate targetDate, RunOptions options,
                            ExecutionDeadline deadline, ExecutionLog executionLog, RunSummary summary) {
        executionLog.info("Processing {} ({}, {})", app.getName(), app.getPlatform().key(), app.getExternalId());

        MetricRecord record = switch (app.getPlatform()) {
            case IOS -> collectReport(app, targetDate, deadline);
            case ANDROID -> collectBulk(app, targetDate, options, deadline, executionLog);
        };
        if (record == null) {
            executionLog.info("No data available for {} on {}, skipping analysis", app.getName(), targetDate);
            return;
        }
        LocalDate dataDate = record.getDate();

        if (!options.isDryRun()) {
            deadline.checkpoint();
            metricStore.upsertRecord(record);
        }
        executionLog.info("{} on {}: downloads={}, sessions={}, uninstalls={}",
                app.getName(), dataDate, record.getDownloads(), record.getSessions(), record.getUninstalls());

        GrowthRates growth = growthAnalyzer.computeGrowth(record, app.getId(), dataDate);
        List<String> insights = growthAnalyzer.generateInsights(app.getId(), record, growth);

        List<Anomaly> anomalies = anomalyEngine.detect(app.getName(), record, growth,
                appCatalog.findActiveRules(app.getId()));
        for (Anomaly anomaly : anomalies) {
            summary.recordAlert();
            if (options.isDryRun()) continue;
            deadline.checkpoint();
            long alertLogId = metricStore.createAlertLog(anomaly);
            if (!options.isSkipNotifications() && anomaly.getNotificationTarget() != null
                    && notificationSender.sendAlert(anomaly.getNotificationTarget(), anomaly)) {
                metricStore.markAlertSent(alertLogId);
                summary.recordNotification();
            }
        }

        if (!options.isDryRun() && !options.isSkipNotifications() && app.getReportTarget() != null) {
            deadline.checkpoint();
            DailyReport report = reportFormatter.format(app.getName(), dataDate, record, growth, insights);
            if (notificationSender.sendDailyReport(app.getReportTarget(), report)) {
                summary.recordNotification();
            }
        }
    }

    private MetricRecord collectReport(MonitoredApp app, LocalDate targetDate, ExecutionDeadline deadline) {
        VendorFetchResult<ReportApiMetrics> result = clientFactory.reportClient()
                .fetchDailyMetrics(app.getExternalId(), targetDate, deadline);
        raiseIfFailed(result);
        return normalizer.fromReport(app.getId(), targetDate, result.metrics());
    }

    /**
     * The bulk record lands on its effective date, and every other date of the month that is
     * not stored yet is backfilled.
     */
    private MetricRecord collectBulk(MonitoredApp app, LocalDate targetDate, RunOptions options,
                                     ExecutionDeadline deadline, ExecutionLog executionLog) {
        VendorFetchResult<BulkStatsMetrics> result = clientFactory.bulkClient()
                .fetchDailyMetrics(app.getExternalId(), targetDate, deadline);
        if (result.failureKind() == FailureKind.DATA_UNAVAILABLE) {
            log.warn("Bulk data unavailable for {}: {}", app.getName(), result.error());
            return null;
        }
        raiseIfFailed(result);

        BulkStatsMetrics metrics = result.metrics();
        if (metrics.isFallback()) {
            executionLog.info("{}: no bulk data for {}, using {}", app.getName(), targetDate, metrics.getEffectiveDate());
        }
        if (!options.isDryRun()) {
            List<LocalDate> dates = metrics.availableDates();
            Set<LocalDate> existing = metricStore.listRecords(app.getId(), dates.get(0), metrics.maxAvailableDate())
                    .stream().map(MetricRecord::getDate).collect(Collectors.toSet());
            List<MetricRecord> backfill = normalizer.backfill(app.getId(), metrics, existing);
            for (MetricRecord missing : backfill) {
                deadline.checkpoint();
                metricStore.upsertRecord(missing);
            }
            if (!backfill.isEmpty()) {
                executionLog.info("{}: backfilled {} missing day(s) up to {}", app.getName(), backfill.size(),
                        metrics.maxAvailableDate());
            }
        }
        return normalizer.fromBulk(app.getId(), metrics);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private List<MonitoredApp> resolveApps(Long appId) {
        if (appId == null) {
            return appCatalog.findActiveApps();
        }
        MonitoredApp app = appCatalog.findApp(appId)
                .orElseThrow(() -> new ConfigurationException("App " + appId + " does not exist"));
        return List.of(app);
    }

    private static void raiseIfFailed(VendorFetchResult<?> result) {
        if (!result.isSuccess()) {
            FailureKind kind = result.failureKind() != null ? result.failureKind() : FailureKind.TRANSIENT_NETWORK;
            throw new CollectionException(kind, result.error());
        }
    }

    private void notifyFailure(MonitoredApp app, RuntimeException error, RunOptions options) {
        if (options.isDryRun() || options.isSkipNotifications() || app.getReportTarget() == null) {
            return;
        }
        try {
            notificationSender.sendSystemNotification(app.getReportTarget(),
                    "Data collection failed: " + app.getName(), error.getMessage(), "error");
        } catch (RuntimeException e) {
            log.warn("Could not send failure notice for {}: {}", app.getName(), e.getMessage());
        }
    }

    private static String kindOf(RuntimeException e) {
        return e instanceof CollectionException ce ? ce.getKind().name() : e.getClass().getSimpleName();
    }
}
