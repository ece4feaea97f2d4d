package com.appmonitor.collector.exception;

import com.appmonitor.collector.model.FailureKind;

/**
 * Raised at a cancellation checkpoint once the execution deadline has passed or the run was
 * cancelled. Never caught at the per-app boundary.
 */
public class ExecutionTimeoutException extends CollectionException {

    public ExecutionTimeoutException(String message) {
        super(FailureKind.TIMEOUT, message);
    }
}
