package com.appmonitor.collector.exception;

import com.appmonitor.collector.model.FailureKind;

/**
 * Base for every failure raised while collecting or analysing an app's metrics.
 */
public class CollectionException extends RuntimeException {

    private final FailureKind kind;

    public CollectionException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public CollectionException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }
}
