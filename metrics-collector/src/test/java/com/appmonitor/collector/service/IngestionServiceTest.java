package com.appmonitor.collector.service;

import com.appmonitor.collector.config.AppMonitorProperties;
import com.appmonitor.collector.exception.ConfigurationException;
import com.appmonitor.collector.exception.ExecutionTimeoutException;
import com.appmonitor.collector.model.AlertRule;
import com.appmonitor.collector.model.Anomaly;
import com.appmonitor.collector.model.BulkStatsMetrics;
import com.appmonitor.collector.model.BulkStatsMetrics.DailyBulkStats;
import com.appmonitor.collector.model.ComparisonMode;
import com.appmonitor.collector.model.DailyReport;
import com.appmonitor.collector.model.FailureKind;
import com.appmonitor.collector.model.InstallReportSummary;
import com.appmonitor.collector.model.Metric;
import com.appmonitor.collector.model.MetricRecord;
import com.appmonitor.collector.model.MonitoredApp;
import com.appmonitor.collector.model.Platform;
import com.appmonitor.collector.model.ReportApiMetrics;
import com.appmonitor.collector.model.RunSummary;
import com.appmonitor.collector.model.VendorFetchResult;
import com.appmonitor.collector.output.AppCatalog;
import com.appmonitor.collector.output.MetricStore;
import com.appmonitor.collector.output.NotificationSender;
import com.appmonitor.collector.scheduler.ExecutionDeadline;
import com.appmonitor.collector.service.IngestionService.RunOptions;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class IngestionServiceTest {

    private static final LocalDate TARGET = LocalDate.of(2024, 5, 4);

    @Mock
    private AppCatalog appCatalog;
    @Mock
    private MetricStore metricStore;
    @Mock
    private NotificationSender notificationSender;
    @Mock
    private VendorClientFactory clientFactory;
    @Mock
    private AppStoreReportClient reportClient;
    @Mock
    private PlayStatsClient bulkClient;

    private final Clock clock = Clock.fixed(Instant.parse("2024-05-06T03:00:00Z"), ZoneOffset.UTC);
    private IngestionService ingestionService;
    private RunSummary summary;

    private final MonitoredApp iosApp = MonitoredApp.builder()
            .id(1L).name("Demo iOS").platform(Platform.IOS).externalId("com.demo.ios")
            .active(true).reportTarget("https://hooks.test/ios").build();
    private final MonitoredApp androidApp = MonitoredApp.builder()
            .id(2L).name("Demo Android").platform(Platform.ANDROID).externalId("com.demo")
            .active(true).reportTarget("https://hooks.test/android").build();

    @BeforeEach
    void setUp() {
        AppMonitorProperties properties = new AppMonitorProperties();
        ingestionService = new IngestionService(appCatalog, metricStore, notificationSender, clientFactory,
                new MetricNormalizer(new ObjectMapper()), new GrowthAnalyzer(metricStore), new AnomalyEngine(clock),
                new ReportFormatter(), properties, clock);
        summary = new RunSummary();
    }

    @Test
    void testDefaultTargetDateLagsTwoDays() {
        assertEquals(TARGET, ingestionService.defaultTargetDate());
    }

    @Test
    void testRun_OneAppFailingDoesNotStopOthers() {
        // Given
        when(appCatalog.findActiveApps()).thenReturn(List.of(iosApp, androidApp));
        when(clientFactory.reportClient()).thenReturn(reportClient);
        when(clientFactory.bulkClient()).thenReturn(bulkClient);
        when(reportClient.fetchDailyMetrics(eq("com.demo.ios"), eq(TARGET), any()))
                .thenReturn(VendorFetchResult.success(iosMetrics(150)));
        when(bulkClient.fetchDailyMetrics(eq("com.demo"), eq(TARGET), any()))
                .thenReturn(VendorFetchResult.failure(BulkStatsMetrics.empty("com.demo", TARGET),
                        FailureKind.TRANSIENT_NETWORK, 503, "HTTP 503: backend error"));
        stubYesterdayDownloads(100);
        when(appCatalog.findActiveRules(1L)).thenReturn(List.of(downloadsRule()));
        when(metricStore.createAlertLog(any())).thenReturn(42L);
        when(notificationSender.sendAlert(eq("https://hooks.test/alerts"), any())).thenReturn(true);
        when(notificationSender.sendDailyReport(eq("https://hooks.test/ios"), any())).thenReturn(true);

        // When
        ingestionService.run(RunOptions.builder().targetDate(TARGET).build(), ExecutionDeadline.none(),
                new ExecutionLog(clock), summary);

        // Then
        assertEquals(2, summary.getTotalApps());
        assertEquals(1, summary.getSuccessCount());
        assertEquals(1, summary.getErrorCount());
        assertEquals(1, summary.getAlertsGenerated());
        assertEquals(2, summary.getNotificationsSent());
        assertEquals(RunSummary.Outcome.PARTIAL_FAILURE, summary.outcome());
        assertTrue(summary.getErrors().get(0).startsWith("Demo Android: "));

        ArgumentCaptor<MetricRecord> stored = ArgumentCaptor.forClass(MetricRecord.class);
        verify(metricStore).upsertRecord(stored.capture());
        assertEquals(150, stored.getValue().getDownloads());
        assertEquals(TARGET, stored.getValue().getDate());

        ArgumentCaptor<Anomaly> anomaly = ArgumentCaptor.forClass(Anomaly.class);
        verify(metricStore).createAlertLog(anomaly.capture());
        assertEquals(50.0, anomaly.getValue().getCurrentValue());
        verify(metricStore).markAlertSent(42L);

        ArgumentCaptor<DailyReport> report = ArgumentCaptor.forClass(DailyReport.class);
        verify(notificationSender).sendDailyReport(eq("https://hooks.test/ios"), report.capture());
        assertEquals("Demo iOS", report.getValue().getAppName());

        verify(notificationSender).sendSystemNotification(eq("https://hooks.test/android"),
                eq("Data collection failed: Demo Android"), contains("503"), eq("error"));
    }

    @Test
    void testRun_DryRunStoresAndSendsNothing() {
        // Given
        when(appCatalog.findApp(1L)).thenReturn(Optional.of(iosApp));
        when(clientFactory.reportClient()).thenReturn(reportClient);
        when(reportClient.fetchDailyMetrics(eq("com.demo.ios"), eq(TARGET), any()))
                .thenReturn(VendorFetchResult.success(iosMetrics(150)));
        stubYesterdayDownloads(100);
        when(appCatalog.findActiveRules(1L)).thenReturn(List.of(downloadsRule()));

        // When
        ingestionService.run(RunOptions.builder().appId(1L).targetDate(TARGET).dryRun(true).build(),
                ExecutionDeadline.none(), new ExecutionLog(clock), summary);

        // Then
        assertEquals(1, summary.getSuccessCount());
        assertEquals(1, summary.getAlertsGenerated());
        assertEquals(0, summary.getNotificationsSent());
        verify(metricStore, never()).upsertRecord(any());
        verify(metricStore, never()).createAlertLog(any());
        verifyNoInteractions(notificationSender);
    }

    @Test
    void testRun_BulkFallbackStoresEffectiveDateAndBackfills() {
        // Given
        TreeMap<LocalDate, DailyBulkStats> daily = new TreeMap<>();
        daily.put(LocalDate.of(2024, 5, 1), new DailyBulkStats(100, 4));
        daily.put(LocalDate.of(2024, 5, 2), new DailyBulkStats(110, 5));
        daily.put(LocalDate.of(2024, 5, 3), new DailyBulkStats(120, 6));
        BulkStatsMetrics metrics = BulkStatsMetrics.builder()
                .packageId("com.demo").requestedDate(TARGET).effectiveDate(LocalDate.of(2024, 5, 3))
                .downloads(120).uninstalls(6).daily(daily).objectName("overview.csv").build();

        when(appCatalog.findApp(2L)).thenReturn(Optional.of(androidApp));
        when(clientFactory.bulkClient()).thenReturn(bulkClient);
        when(bulkClient.fetchDailyMetrics(eq("com.demo"), eq(TARGET), any())).thenReturn(VendorFetchResult.success(metrics));
        when(metricStore.listRecords(eq(2L), any(), any())).thenReturn(List.of());

        // When
        ingestionService.run(RunOptions.builder().appId(2L).targetDate(TARGET).skipNotifications(true).build(),
                ExecutionDeadline.none(), new ExecutionLog(clock), summary);

        // Then
        ArgumentCaptor<MetricRecord> stored = ArgumentCaptor.forClass(MetricRecord.class);
        verify(metricStore, times(3)).upsertRecord(stored.capture());
        List<LocalDate> dates = stored.getAllValues().stream().map(MetricRecord::getDate).toList();
        assertEquals(List.of(LocalDate.of(2024, 5, 1), LocalDate.of(2024, 5, 2), LocalDate.of(2024, 5, 3)), dates);
        assertEquals(120, stored.getAllValues().get(2).getDownloads());
        assertEquals(1, summary.getSuccessCount());
        verifyNoInteractions(notificationSender);
    }

    @Test
    void testRun_BulkDataUnavailableIsNotAnError() {
        // Given
        when(appCatalog.findApp(2L)).thenReturn(Optional.of(androidApp));
        when(clientFactory.bulkClient()).thenReturn(bulkClient);
        when(bulkClient.fetchDailyMetrics(eq("com.demo"), eq(TARGET), any()))
                .thenReturn(VendorFetchResult.failure(BulkStatsMetrics.empty("com.demo", TARGET),
                        FailureKind.DATA_UNAVAILABLE, null, "No installs overview object"));

        // When
        ingestionService.run(RunOptions.builder().appId(2L).targetDate(TARGET).build(),
                ExecutionDeadline.none(), new ExecutionLog(clock), summary);

        // Then
        assertEquals(1, summary.getSuccessCount());
        assertEquals(0, summary.getErrorCount());
        verify(metricStore, never()).upsertRecord(any());
    }

    @Test
    void testRun_CancelledDeadlineEndsRun() {
        // Given
        when(appCatalog.findActiveApps()).thenReturn(List.of(iosApp, androidApp));
        ExecutionDeadline deadline = ExecutionDeadline.after(Duration.ofMinutes(5), clock);
        deadline.cancel();

        // When / Then
        assertThrows(ExecutionTimeoutException.class, () -> ingestionService.run(
                RunOptions.builder().targetDate(TARGET).build(), deadline, new ExecutionLog(clock), summary));
        assertEquals(2, summary.getTotalApps());
        verifyNoInteractions(clientFactory);
    }

    @Test
    void testRun_UnknownAppFails() {
        // Given
        when(appCatalog.findApp(99L)).thenReturn(Optional.empty());

        // When / Then
        assertThrows(ConfigurationException.class, () -> ingestionService.run(
                RunOptions.builder().appId(99L).build(), ExecutionDeadline.none(), new ExecutionLog(clock), summary));
    }

    private void stubYesterdayDownloads(long downloads) {
        MetricRecord yesterday = MetricRecord.builder().appId(1L).date(TARGET.minusDays(1)).downloads(downloads).build();
        when(metricStore.getRecord(eq(1L), any())).thenAnswer(invocation ->
                TARGET.minusDays(1).equals(invocation.getArgument(1)) ? Optional.of(yesterday) : Optional.empty());
    }

    private static ReportApiMetrics iosMetrics(long installs) {
        InstallReportSummary summary = new InstallReportSummary();
        summary.setTotalInstalls(installs);
        return ReportApiMetrics.builder()
                .bundleId("com.demo.ios")
                .targetDate(TARGET)
                .installs(summary)
                .build();
    }

    private static AlertRule downloadsRule() {
        return AlertRule.builder()
                .id(5L).appId(1L).metric(Metric.DOWNLOADS).comparisonMode(ComparisonMode.DOD)
                .thresholdMax(40.0).active(true).notificationTarget("https://hooks.test/alerts").build();
    }
}
