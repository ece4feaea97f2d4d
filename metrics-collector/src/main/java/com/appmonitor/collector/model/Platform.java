package com.appmonitor.collector.model;

/**
 * Store platform an app is published on. Selects which vendor client collects its metrics.
 */
public enum Platform {
    IOS,
    ANDROID;

    public String key() {
        return name().toLowerCase();
    }

    public static Platform fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Platform must not be null");
        }
        return Platform.valueOf(value.trim().toUpperCase());
    }
}
