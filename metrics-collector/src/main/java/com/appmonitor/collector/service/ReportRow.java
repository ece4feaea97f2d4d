package com.appmonitor.collector.service;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * One data row of a report segment, keyed by header name.
 */
public record ReportRow(Map<String, String> values) {

    public String get(String column) {
        String value = values.get(column);
        return value != null ? value.trim() : null;
    }

    public boolean isBlank(String column) {
        String value = get(column);
        return value == null || value.isEmpty();
    }

    public Long count(String column) {
        return NumericSanitizer.parseCount(get(column));
    }

    public LocalDate date(String column) {
        String value = get(column);
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return LocalDate.parse(value.length() > 10 ? value.substring(0, 10) : value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
