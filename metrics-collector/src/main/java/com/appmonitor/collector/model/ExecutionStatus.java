package com.appmonitor.collector.model;

public enum ExecutionStatus {
    PENDING("Waiting to start"),
    RUNNING("Execution in progress"),
    SUCCESS("Execution completed successfully"),
    FAILED("Execution failed"),
    TIMEOUT("Execution exceeded its timeout"),
    CANCELLED("Execution was cancelled");

    private final String description;

    ExecutionStatus(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public boolean isTerminal() {
        return this != PENDING && this != RUNNING;
    }

    public boolean isRetryable() {
        return this == FAILED || this == TIMEOUT;
    }

    public static ExecutionStatus fromString(String status) {
        if (status == null) {
            return PENDING;
        }
        try {
            return ExecutionStatus.valueOf(status.toUpperCase());
        } catch (IllegalArgumentException e) {
            return PENDING;
        }
    }
}
