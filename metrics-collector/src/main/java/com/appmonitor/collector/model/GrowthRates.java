package com.appmonitor.collector.model;

import java.util.EnumMap;

/**
 * Day-over-day and week-over-week percentage changes per tracked metric. Derived per run,
 * never stored on its own. Missing entries read as 0.0.
 */
public class GrowthRates {

    public record Rate(double dayOverDay, double weekOverWeek) {
        public static final Rate ZERO = new Rate(0.0, 0.0);
    }

    private final EnumMap<Metric, Rate> rates = new EnumMap<>(Metric.class);

    public static GrowthRates empty() {
        GrowthRates growth = new GrowthRates();
        Metric.GROWTH_TRACKED.forEach(m -> growth.rates.put(m, Rate.ZERO));
        return growth;
    }

    public void put(Metric metric, double dayOverDay, double weekOverWeek) {
        rates.put(metric, new Rate(dayOverDay, weekOverWeek));
    }

    public Rate get(Metric metric) {
        return rates.getOrDefault(metric, Rate.ZERO);
    }

    public double dod(Metric metric) {
        return get(metric).dayOverDay();
    }

    public double wow(Metric metric) {
        return get(metric).weekOverWeek();
    }

    public double rate(Metric metric, ComparisonMode mode) {
        return switch (mode) {
            case DOD -> dod(metric);
            case WOW -> wow(metric);
            case ABSOLUTE -> throw new IllegalArgumentException("Absolute comparisons have no growth rate");
        };
    }

    /**
     * Lookup by rule key, e.g. {@code "downloads_dod"}.
     */
    public double byKey(String key) {
        int split = key.lastIndexOf('_');
        if (split < 0) {
            throw new IllegalArgumentException("Growth key must look like {metric}_{mode}: " + key);
        }
        Metric metric = Metric.fromKey(key.substring(0, split));
        ComparisonMode mode = ComparisonMode.fromString(key.substring(split + 1));
        return rate(metric, mode);
    }
}
