package com.appmonitor.collector.service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Number handling for vendor text and for payloads that get serialised to JSON.
 */
public final class NumericSanitizer {

    private NumericSanitizer() {
    }

    /**
     * Parses a vendor count such as {@code "1,234"} or {@code "12.0"}. Blank, NaN and
     * infinite values give {@code null}.
     */
    public static Long parseCount(String raw) {
        if (raw == null) {
            return null;
        }
        String cleaned = raw.replace(",", "").trim();
        if (cleaned.isEmpty()) {
            return null;
        }
        try {
            double value = Double.parseDouble(cleaned);
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return null;
            }
            return (long) value;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Like {@link #parseCount(String)} but blank and unparseable values read as 0. */
    public static long parseCountOrZero(String raw) {
        Long value = parseCount(raw);
        return value != null ? value : 0L;
    }

    /**
     * Copy of {@code value} that Jackson can always write: NaN and infinite doubles become null,
     * big decimals become plain doubles, map keys become strings. Other objects are kept as-is.
     */
    public static Object sanitize(Object value) {
        if (value instanceof Double d) {
            return Double.isNaN(d) || Double.isInfinite(d) ? null : d;
        }
        if (value instanceof Float f) {
            return Float.isNaN(f) || Float.isInfinite(f) ? null : f.doubleValue();
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.doubleValue();
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(String.valueOf(k), sanitize(v)));
            return copy;
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            collection.forEach(v -> copy.add(sanitize(v)));
            return copy;
        }
        return value;
    }
}
