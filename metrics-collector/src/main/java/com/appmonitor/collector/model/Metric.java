package com.appmonitor.collector.model;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;

/**
 * Metrics carried by a {@link MetricRecord}. The key is the name used in alert rules and
 * in growth-rate lookups ({@code "{key}_dod"}, {@code "{key}_wow"}).
 */
public enum Metric {
    DOWNLOADS("downloads", "Downloads"),
    SESSIONS("sessions", "Sessions"),
    UNINSTALLS("uninstalls", "Uninstalls"),
    UNIQUE_DEVICES("unique_devices", "Unique devices"),
    SEARCH_DOWNLOADS("downloads_search", "Store search downloads"),
    WEB_REFERRAL_DOWNLOADS("downloads_web_referral", "Web referral downloads"),
    APP_REFERRAL_DOWNLOADS("downloads_app_referral", "App referral downloads"),
    BROWSE_DOWNLOADS("downloads_store_browse", "Store browse downloads"),
    INSTITUTIONAL_DOWNLOADS("downloads_institutional", "Institutional downloads"),
    OTHER_DOWNLOADS("downloads_other", "Other downloads");

    /** Metrics that get day-over-day and week-over-week rates. */
    public static final Set<Metric> GROWTH_TRACKED = EnumSet.of(
            DOWNLOADS, SESSIONS, UNINSTALLS, UNIQUE_DEVICES,
            SEARCH_DOWNLOADS, WEB_REFERRAL_DOWNLOADS, APP_REFERRAL_DOWNLOADS);

    private final String key;
    private final String displayName;

    Metric(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    public String getKey() {
        return key;
    }

    public String getDisplayName() {
        return displayName;
    }

    public static Metric fromKey(String key) {
        return Arrays.stream(values())
                .filter(m -> m.key.equalsIgnoreCase(key))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown metric: " + key));
    }
}
