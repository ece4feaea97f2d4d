package com.appmonitor.collector.model;

public enum ScheduleFrequency {
    DAILY,
    WEEKLY,
    MONTHLY;

    public static ScheduleFrequency fromString(String value) {
        if (value == null) {
            return DAILY;
        }
        try {
            return ScheduleFrequency.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return DAILY;
        }
    }
}
