package com.appmonitor.collector.model;

public enum Severity {
    LOW(1, "Low severity - minor deviation"),
    MEDIUM(2, "Medium severity - requires attention"),
    HIGH(3, "High severity - urgent attention needed"),
    CRITICAL(4, "Critical severity - immediate action required");

    private final int level;
    private final String description;

    Severity(int level, String description) {
        this.level = level;
        this.description = description;
    }

    public int getLevel() {
        return level;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Bands on the relative deviation from the breached threshold, inclusive on the lower edge:
     * {@code >= 2.0} critical, {@code >= 1.0} high, {@code >= 0.5} medium, otherwise low.
     */
    public static Severity fromDeviation(double deviationRatio) {
        if (Double.isNaN(deviationRatio)) {
            return MEDIUM;
        }
        if (deviationRatio >= 2.0) return CRITICAL;
        if (deviationRatio >= 1.0) return HIGH;
        if (deviationRatio >= 0.5) return MEDIUM;
        return LOW;
    }
}
