package com.appmonitor.collector.model;

/**
 * Acquisition source of a first-time download, as reported in the vendor's "Source Type" column.
 */
public enum DownloadChannel {
    SEARCH("App Store search", Metric.SEARCH_DOWNLOADS),
    WEB_REFERRAL("Web referrer", Metric.WEB_REFERRAL_DOWNLOADS),
    APP_REFERRAL("App referrer", Metric.APP_REFERRAL_DOWNLOADS),
    STORE_BROWSE("App Store browse", Metric.BROWSE_DOWNLOADS),
    INSTITUTIONAL("Institutional purchase", Metric.INSTITUTIONAL_DOWNLOADS),
    OTHER("Unavailable", Metric.OTHER_DOWNLOADS);

    private final String vendorLabel;
    private final Metric metric;

    DownloadChannel(String vendorLabel, Metric metric) {
        this.vendorLabel = vendorLabel;
        this.metric = metric;
    }

    public Metric getMetric() {
        return metric;
    }

    /**
     * Unknown, blank, "Unavailable" and "Other" labels all land in {@link #OTHER}.
     */
    public static DownloadChannel fromVendorLabel(String label) {
        if (label == null || label.isBlank()) {
            return OTHER;
        }
        for (DownloadChannel channel : values()) {
            if (channel != OTHER && channel.vendorLabel.equals(label.trim())) {
                return channel;
            }
        }
        return OTHER;
    }
}
