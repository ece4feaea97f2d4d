package com.appmonitor.collector.model;

/**
 * Categories of collection failures. Only {@link #TIMEOUT} is execution-wide; the rest are
 * caught at the per-app boundary and recorded in the run summary.
 */
public enum FailureKind {
    AUTH,
    TRANSIENT_NETWORK,
    DATA_UNAVAILABLE,
    PARSE,
    TIMEOUT,
    CONFIGURATION
}
