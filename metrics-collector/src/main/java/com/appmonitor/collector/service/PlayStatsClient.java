package com.appmonitor.collector.service;

import com.appmonitor.collector.exception.CollectionException;
import com.appmonitor.collector.exception.ExecutionTimeoutException;
import com.appmonitor.collector.model.BulkStatsMetrics;
import com.appmonitor.collector.model.BulkStatsMetrics.DailyBulkStats;
import com.appmonitor.collector.model.FailureKind;
import com.appmonitor.collector.model.VendorFetchResult;
import com.appmonitor.collector.output.BulkObjectStore;
import com.appmonitor.collector.output.BulkObjectStore.StoredObject;
import com.appmonitor.collector.scheduler.ExecutionDeadline;
import com.google.cloud.storage.StorageException;
import lombok.extern.slf4j.Slf4j;

import java.io.UncheckedIOException;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;

/**
 * Client for the bulk statistics export (Android). The export is one CSV per package and month,
 * refreshed with a lag of several days, so the client reports the closest date on or before the
 * target and hands back the whole month for backfilling.
 *
 * Sessions are not part of the export.
 */
@Slf4j
public class PlayStatsClient implements VendorClient<BulkStatsMetrics> {

    private static final DateTimeFormatter YEAR_MONTH = DateTimeFormatter.ofPattern("yyyyMM");

    private final BulkObjectStore objectStore;
    private final PlayAccessTokenProvider tokenProvider;
    private final OverviewCsvParser parser;
    private final RetryableHttp retryableHttp;
    private final String bucket;
    private final String reportPrefix;

    public PlayStatsClient(BulkObjectStore objectStore,
                           PlayAccessTokenProvider tokenProvider,
                           OverviewCsvParser parser,
                           RetryableHttp retryableHttp,
                           String bucket,
                           String reportPrefix) {
        this.objectStore = objectStore;
        this.tokenProvider = tokenProvider;
        this.parser = parser;
        this.retryableHttp = retryableHttp;
        this.bucket = bucket;
        this.reportPrefix = reportPrefix;
    }

    @Override
    public VendorFetchResult<BulkStatsMetrics> fetchDailyMetrics(String packageId, LocalDate targetDate,
                                                                 ExecutionDeadline deadline) {
        BulkStatsMetrics empty = BulkStatsMetrics.empty(packageId, targetDate);
        if (bucket == null || bucket.isBlank()) {
            return VendorFetchResult.failure(empty, FailureKind.CONFIGURATION, null, "Bulk bucket is not configured");
        }

        try {
            tokenProvider.currentToken(deadline);

            String prefix = reportPrefix + packageId + "_" + targetDate.format(YEAR_MONTH);
            List<StoredObject> objects = retryableHttp.execute("bulkList", deadline,
                    () -> objectStore.list(bucket, prefix));
            Optional<StoredObject> overview = selectOverview(objects);
            if (overview.isEmpty()) {
                log.warn("No installs overview under gs://{}/{}", bucket, prefix);
                return VendorFetchResult.failure(empty, FailureKind.DATA_UNAVAILABLE, null,
                        "No installs overview object for prefix " + prefix);
            }

            String objectName = overview.get().name();
            deadline.checkpoint();
            byte[] content = objectStore.download(bucket, objectName);
            deadline.checkpoint();

            NavigableMap<LocalDate, DailyBulkStats> daily = parser.parse(parser.decode(content));
            Map.Entry<LocalDate, DailyBulkStats> match = daily.floorEntry(targetDate);
            if (match == null) {
                log.warn("Overview {} has no rows on or before {}; available: {}", objectName, targetDate, daily.keySet());
                return VendorFetchResult.failure(empty, FailureKind.DATA_UNAVAILABLE, null,
                        "No bulk data on or before " + targetDate);
            }
            if (!match.getKey().equals(targetDate)) {
                log.info("No bulk row for {} in {}, falling back to {}", targetDate, objectName, match.getKey());
            }

            BulkStatsMetrics metrics = BulkStatsMetrics.builder()
                    .packageId(packageId)
                    .requestedDate(targetDate)
                    .effectiveDate(match.getKey())
                    .downloads(match.getValue().downloads())
                    .uninstalls(match.getValue().uninstalls())
                    .daily(daily)
                    .objectName(objectName)
                    .build();
            log.info("Bulk totals for {} on {}: downloads={}, uninstalls={}",
                    packageId, metrics.getEffectiveDate(), metrics.getDownloads(), metrics.getUninstalls());
            return VendorFetchResult.success(metrics);

        } catch (ExecutionTimeoutException e) {
            throw e;
        } catch (CollectionException e) {
            log.error("Bulk fetch failed for {}: {}", packageId, e.getMessage());
            return VendorFetchResult.failure(empty, e.getKind(), null, e.getMessage());
        } catch (StorageException e) {
            deadline.checkpoint();
            log.error("Bulk storage request failed for {}: {}", packageId, e.getMessage());
            return VendorFetchResult.failure(empty, storageKind(e.getCode()), e.getCode(), e.getMessage());
        } catch (UncheckedIOException e) {
            deadline.checkpoint();
            log.error("Bulk source unreachable for {}: {}", packageId, e.getMessage());
            return VendorFetchResult.failure(empty, FailureKind.TRANSIENT_NETWORK, null, e.getMessage());
        }
    }

    /**
     * Prefers objects named {@code *_overview.csv}, then any CSV with "overview" in its name;
     * among several the most recently updated wins.
     */
    static Optional<StoredObject> selectOverview(List<StoredObject> objects) {
        Comparator<StoredObject> byUpdated = Comparator.comparing(StoredObject::updated,
                Comparator.nullsFirst(Comparator.naturalOrder()));
        Optional<StoredObject> exact = objects.stream()
                .filter(o -> o.name().endsWith("_overview.csv"))
                .max(byUpdated);
        if (exact.isPresent()) {
            return exact;
        }
        return objects.stream()
                .filter(o -> o.name().contains("overview") && o.name().endsWith(".csv"))
                .max(byUpdated);
    }

    private static FailureKind storageKind(int code) {
        if (code == 401 || code == 403) return FailureKind.AUTH;
        if (code == 400 || code == 404) return FailureKind.CONFIGURATION;
        return FailureKind.TRANSIENT_NETWORK;
    }
}
