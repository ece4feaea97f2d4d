package com.appmonitor.collector.model;

public enum ComparisonMode {
    DOD("dod", "Day over day"),
    WOW("wow", "Week over week"),
    ABSOLUTE("absolute", "Absolute value");

    private final String key;
    private final String displayName;

    ComparisonMode(String key, String displayName) {
        this.key = key;
        this.displayName = displayName;
    }

    public String getKey() {
        return key;
    }

    public String getDisplayName() {
        return displayName;
    }

    public boolean isRate() {
        return this != ABSOLUTE;
    }

    public static ComparisonMode fromString(String value) {
        return ComparisonMode.valueOf(value.trim().toUpperCase());
    }
}
