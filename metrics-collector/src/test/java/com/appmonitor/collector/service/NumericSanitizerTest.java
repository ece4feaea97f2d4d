package com.appmonitor.collector.service;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class NumericSanitizerTest {

    @Test
    void testParseCount() {
        assertEquals(1234L, NumericSanitizer.parseCount("1,234"));
        assertEquals(12L, NumericSanitizer.parseCount(" 12.0 "));
        assertNull(NumericSanitizer.parseCount(""));
        assertNull(NumericSanitizer.parseCount(null));
        assertNull(NumericSanitizer.parseCount("NaN"));
        assertNull(NumericSanitizer.parseCount("Infinity"));
        assertNull(NumericSanitizer.parseCount("n/a"));
    }

    @Test
    void testParseCountOrZero() {
        assertEquals(0L, NumericSanitizer.parseCountOrZero("  "));
        assertEquals(7L, NumericSanitizer.parseCountOrZero("7"));
    }

    @Test
    @SuppressWarnings("unchecked")
    void testSanitizeNestedStructures() {
        // Given
        Map<Object, Object> payload = new LinkedHashMap<>();
        payload.put("ratio", Double.NaN);
        payload.put("revenue", new BigDecimal("12.50"));
        payload.put(2024, Arrays.asList(1.5, Double.POSITIVE_INFINITY));

        // When
        Map<String, Object> clean = (Map<String, Object>) NumericSanitizer.sanitize(payload);

        // Then
        assertTrue(clean.containsKey("ratio"));
        assertNull(clean.get("ratio"));
        assertEquals(12.5, clean.get("revenue"));
        assertEquals(Arrays.asList(1.5, null), clean.get("2024"));
        assertEquals(List.of("x"), NumericSanitizer.sanitize(List.of("x")));
    }
}
