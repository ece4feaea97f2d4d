package com.appmonitor.collector.service;

import com.appmonitor.collector.config.AppMonitorProperties;
import com.appmonitor.collector.model.BulkStatsMetrics;
import com.appmonitor.collector.model.FailureKind;
import com.appmonitor.collector.model.VendorFetchResult;
import com.appmonitor.collector.output.BulkObjectStore;
import com.appmonitor.collector.output.BulkObjectStore.StoredObject;
import com.appmonitor.collector.scheduler.ExecutionDeadline;
import com.google.cloud.storage.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class PlayStatsClientTest {

    private static final String BUCKET = "pubsite_prod_rev_123";
    private static final String PREFIX = "stats/installs/installs_com.demo_202405";

    @Mock
    private BulkObjectStore objectStore;

    @Mock
    private PlayAccessTokenProvider tokenProvider;

    private PlayStatsClient client;

    @BeforeEach
    void setUp() {
        AppMonitorProperties properties = new AppMonitorProperties();
        properties.getRetry().setDelayBase(Duration.ofMillis(1));
        client = new PlayStatsClient(objectStore, tokenProvider, new OverviewCsvParser(),
                new RetryableHttp(properties), BUCKET, "stats/installs/installs_");
    }

    @Test
    void testFetch_FallsBackToLatestEarlierDate() {
        // Given
        String overview = "Date,Package Name,Daily User Installs,Daily User Uninstalls\n"
                + "2024-05-01,com.demo,100,4\n"
                + "2024-05-02,com.demo,110,5\n"
                + "2024-05-03,com.demo,120,6\n";
        when(objectStore.list(BUCKET, PREFIX)).thenReturn(List.of(
                new StoredObject(PREFIX + "_country.csv", Instant.parse("2024-05-06T00:00:00Z"), 10),
                new StoredObject(PREFIX + "_overview.csv", Instant.parse("2024-05-05T00:00:00Z"), 10)));
        when(objectStore.download(BUCKET, PREFIX + "_overview.csv"))
                .thenReturn(overview.getBytes(StandardCharsets.UTF_16));

        // When
        VendorFetchResult<BulkStatsMetrics> result =
                client.fetchDailyMetrics("com.demo", LocalDate.of(2024, 5, 4), ExecutionDeadline.none());

        // Then
        assertTrue(result.isSuccess());
        BulkStatsMetrics metrics = result.metrics();
        assertEquals(LocalDate.of(2024, 5, 3), metrics.getEffectiveDate());
        assertTrue(metrics.isFallback());
        assertEquals(120, metrics.getDownloads());
        assertEquals(6, metrics.getUninstalls());
        assertEquals(3, metrics.availableDates().size());
        assertFalse(metrics.isSessionsAvailable());
        verify(tokenProvider).currentToken(any());
    }

    @Test
    void testFetch_NoOverviewIsDataUnavailable() {
        // Given
        when(objectStore.list(BUCKET, PREFIX)).thenReturn(List.of());

        // When
        VendorFetchResult<BulkStatsMetrics> result =
                client.fetchDailyMetrics("com.demo", LocalDate.of(2024, 5, 4), ExecutionDeadline.none());

        // Then
        assertFalse(result.isSuccess());
        assertEquals(FailureKind.DATA_UNAVAILABLE, result.failureKind());
        verify(objectStore, never()).download(anyString(), anyString());
    }

    @Test
    void testFetch_NoDateOnOrBeforeTarget() {
        // Given
        when(objectStore.list(BUCKET, PREFIX)).thenReturn(List.of(
                new StoredObject(PREFIX + "_overview.csv", Instant.parse("2024-05-05T00:00:00Z"), 10)));
        when(objectStore.download(BUCKET, PREFIX + "_overview.csv")).thenReturn(
                "Date,Daily User Installs,Daily User Uninstalls\n2024-05-10,1,1\n".getBytes(StandardCharsets.UTF_8));

        // When
        VendorFetchResult<BulkStatsMetrics> result =
                client.fetchDailyMetrics("com.demo", LocalDate.of(2024, 5, 4), ExecutionDeadline.none());

        // Then
        assertEquals(FailureKind.DATA_UNAVAILABLE, result.failureKind());
        assertEquals(0, result.metrics().getDownloads());
    }

    @Test
    void testFetch_ForbiddenBucketIsAuthFailure() {
        // Given
        when(objectStore.list(BUCKET, PREFIX)).thenThrow(new StorageException(403, "Forbidden"));

        // When
        VendorFetchResult<BulkStatsMetrics> result =
                client.fetchDailyMetrics("com.demo", LocalDate.of(2024, 5, 4), ExecutionDeadline.none());

        // Then
        assertEquals(FailureKind.AUTH, result.failureKind());
        assertEquals(403, result.statusCode());
        verify(objectStore, times(1)).list(BUCKET, PREFIX);
    }

    @Test
    void testFetch_MissingBucketIsConfigurationFailure() {
        // Given
        PlayStatsClient unconfigured = new PlayStatsClient(objectStore, tokenProvider, new OverviewCsvParser(),
                new RetryableHttp(new AppMonitorProperties()), " ", "stats/installs/installs_");

        // When
        VendorFetchResult<BulkStatsMetrics> result =
                unconfigured.fetchDailyMetrics("com.demo", LocalDate.of(2024, 5, 4), ExecutionDeadline.none());

        // Then
        assertEquals(FailureKind.CONFIGURATION, result.failureKind());
        verifyNoInteractions(objectStore, tokenProvider);
    }

    @Test
    void testSelectOverview_PrefersNewestExactMatch() {
        List<StoredObject> objects = List.of(
                new StoredObject("a_overview_old.csv", Instant.parse("2024-05-09T00:00:00Z"), 1),
                new StoredObject("a_overview.csv", Instant.parse("2024-05-01T00:00:00Z"), 1),
                new StoredObject("b_overview.csv", Instant.parse("2024-05-02T00:00:00Z"), 1));
        assertEquals("b_overview.csv", PlayStatsClient.selectOverview(objects).orElseThrow().name());
    }
}
