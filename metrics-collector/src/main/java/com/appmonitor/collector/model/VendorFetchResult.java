package com.appmonitor.collector.model;

/**
 * Outcome of a vendor fetch: the typed payload plus, on failure, what went wrong. A failed
 * result still carries a zero-valued payload.
 */
public record VendorFetchResult<T>(T metrics, FailureKind failureKind, Integer statusCode, String error) {

    public static <T> VendorFetchResult<T> success(T metrics) {
        return new VendorFetchResult<>(metrics, null, null, null);
    }

    public static <T> VendorFetchResult<T> failure(T emptyMetrics, FailureKind kind, Integer statusCode, String error) {
        return new VendorFetchResult<>(emptyMetrics, kind, statusCode, error);
    }

    public boolean isSuccess() {
        return failureKind == null && error == null;
    }
}
