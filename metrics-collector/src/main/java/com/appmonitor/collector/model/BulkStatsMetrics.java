package com.appmonitor.collector.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Collections;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Typed payload of the bulk object-store source. The bulk export lags and is batched, so the
 * full {@link #daily} map is carried for backfilling earlier dates.
 */
@Value
@Builder
public class BulkStatsMetrics {

    public record DailyBulkStats(long downloads, long uninstalls) {}

    String packageId;
    LocalDate requestedDate;

    /** Date the returned counts belong to; null when the overview had no usable rows. */
    LocalDate effectiveDate;

    long downloads;
    long uninstalls;

    @Builder.Default
    NavigableMap<LocalDate, DailyBulkStats> daily = new TreeMap<>();

    String objectName;

    public static BulkStatsMetrics empty(String packageId, LocalDate requestedDate) {
        return BulkStatsMetrics.builder().packageId(packageId).requestedDate(requestedDate).build();
    }

    /** The bulk export has no per-day session data. */
    public boolean isSessionsAvailable() {
        return false;
    }

    public boolean isFallback() {
        return effectiveDate != null && !effectiveDate.equals(requestedDate);
    }

    public List<LocalDate> availableDates() {
        return List.copyOf(daily.keySet());
    }

    public LocalDate maxAvailableDate() {
        return daily.isEmpty() ? null : daily.lastKey();
    }

    public NavigableMap<LocalDate, DailyBulkStats> getDaily() {
        return Collections.unmodifiableNavigableMap(daily);
    }
}
