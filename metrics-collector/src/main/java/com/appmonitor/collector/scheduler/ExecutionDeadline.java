package com.appmonitor.collector.scheduler;

import com.appmonitor.collector.exception.ExecutionTimeoutException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Cooperative deadline handed down the ingestion call chain. Every blocking step calls
 * {@link #checkpoint()} first and caps its own network timeout with {@link #capTimeout(Duration)},
 * so a timed-out or cancelled run stops at the next wait instead of running to completion.
 */
public final class ExecutionDeadline {

    private static final ExecutionDeadline NONE = new ExecutionDeadline(null, Clock.systemUTC());

    private final Instant expiresAt;
    private final Clock clock;
    private volatile boolean cancelled;

    private ExecutionDeadline(Instant expiresAt, Clock clock) {
        this.expiresAt = expiresAt;
        this.clock = clock;
    }

    public static ExecutionDeadline after(Duration timeout, Clock clock) {
        return new ExecutionDeadline(clock.instant().plus(timeout), clock);
    }

    /** A deadline that never expires and cannot be cancelled. */
    public static ExecutionDeadline none() {
        return NONE;
    }

    public boolean isExpired() {
        return expiresAt != null && !clock.instant().isBefore(expiresAt);
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public void cancel() {
        if (this != NONE) {
            cancelled = true;
        }
    }

    /**
     * Time left before expiry; {@code null} when unbounded.
     */
    public Duration remaining() {
        if (expiresAt == null) {
            return null;
        }
        Duration left = Duration.between(clock.instant(), expiresAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    public void checkpoint() {
        if (cancelled) {
            throw new ExecutionTimeoutException("Execution cancelled");
        }
        if (Thread.currentThread().isInterrupted()) {
            throw new ExecutionTimeoutException("Execution interrupted");
        }
        if (isExpired()) {
            throw new ExecutionTimeoutException("Execution deadline of " + expiresAt + " exceeded");
        }
    }

    /**
     * The smaller of {@code requested} and the time left, never below one millisecond.
     */
    public Duration capTimeout(Duration requested) {
        Duration left = remaining();
        if (left == null || left.compareTo(requested) >= 0) {
            return requested;
        }
        return left.isZero() ? Duration.ofMillis(1) : left;
    }

    public void sleep(Duration duration) {
        checkpoint();
        try {
            Thread.sleep(capTimeout(duration).toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionTimeoutException("Execution interrupted while waiting");
        }
        checkpoint();
    }
}
