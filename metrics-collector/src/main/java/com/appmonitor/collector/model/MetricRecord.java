package com.appmonitor.collector.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Canonical per-day metrics for one app. Unique on (appId, date).
 *
 * Channel counts only cover first-time downloads and need not add up to {@link #downloads}:
 * the vendor may undercount sources.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MetricRecord {

    private Long appId;
    private LocalDate date;

    private long downloads;
    private long sessions;
    private long uninstalls;

    /** Null when the source has no device-level data (bulk source). */
    private Long uniqueDevices;

    // ── Download channels (first-time downloads only) ──────────────────────
    private long searchDownloads;
    private long webReferralDownloads;
    private long appReferralDownloads;
    private long browseDownloads;
    private long institutionalDownloads;
    private long otherDownloads;

    private BigDecimal revenue;
    private Double rating;

    /** Sanitized JSON of the vendor payload the record was built from. */
    private String rawPayload;

    public long channel(DownloadChannel channel) {
        return switch (channel) {
            case SEARCH -> searchDownloads;
            case WEB_REFERRAL -> webReferralDownloads;
            case APP_REFERRAL -> appReferralDownloads;
            case STORE_BROWSE -> browseDownloads;
            case INSTITUTIONAL -> institutionalDownloads;
            case OTHER -> otherDownloads;
        };
    }

    public long channelTotal() {
        long total = 0;
        for (DownloadChannel channel : DownloadChannel.values()) {
            total += channel(channel);
        }
        return total;
    }

    /**
     * Raw value of a metric; a missing unique-device count reads as 0.
     */
    public double valueOf(Metric metric) {
        return switch (metric) {
            case DOWNLOADS -> downloads;
            case SESSIONS -> sessions;
            case UNINSTALLS -> uninstalls;
            case UNIQUE_DEVICES -> uniqueDevices != null ? uniqueDevices : 0;
            case SEARCH_DOWNLOADS -> searchDownloads;
            case WEB_REFERRAL_DOWNLOADS -> webReferralDownloads;
            case APP_REFERRAL_DOWNLOADS -> appReferralDownloads;
            case BROWSE_DOWNLOADS -> browseDownloads;
            case INSTITUTIONAL_DOWNLOADS -> institutionalDownloads;
            case OTHER_DOWNLOADS -> otherDownloads;
        };
    }
}
