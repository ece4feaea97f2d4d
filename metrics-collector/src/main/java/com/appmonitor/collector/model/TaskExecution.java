package com.appmonitor.collector.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;

/**
 * One triggered run. Created at trigger time and mutated only by the executor that created it:
 * {@code PENDING -> RUNNING -> SUCCESS | FAILED | TIMEOUT | CANCELLED}. Terminal states are final.
 */
@Getter
@Builder(toBuilder = true)
@AllArgsConstructor
@ToString(exclude = {"outputLog", "errorLog"})
public class TaskExecution {

    @Setter
    private Long id;
    private Long scheduleId;
    private TriggerType triggerType;

    @Builder.Default
    private ExecutionStatus status = ExecutionStatus.PENDING;

    private Long appId;
    private LocalDate targetDate;

    private Instant startedAt;
    private Instant completedAt;
    private Long durationSeconds;

    private int successCount;
    private int errorCount;
    private int alertsGenerated;
    private int notificationsSent;

    private String outputLog;
    private String errorLog;

    private int retryCount;
    private Instant createdAt;

    public static TaskExecution pending(TaskSchedule schedule, TriggerType triggerType,
                                        Long appId, LocalDate targetDate, int retryCount, Instant now) {
        return TaskExecution.builder()
                .scheduleId(schedule != null ? schedule.getId() : null)
                .triggerType(triggerType)
                .status(ExecutionStatus.PENDING)
                .appId(appId)
                .targetDate(targetDate)
                .retryCount(retryCount)
                .createdAt(now)
                .build();
    }

    public void markStarted(Instant now) {
        if (status != ExecutionStatus.PENDING) {
            throw new IllegalStateException("Execution " + id + " cannot start from " + status);
        }
        this.status = ExecutionStatus.RUNNING;
        this.startedAt = now;
    }

    public void markCompleted(ExecutionStatus terminal, RunSummary summary,
                              String outputLog, String errorLog, Instant now) {
        if (!terminal.isTerminal()) {
            throw new IllegalArgumentException(terminal + " is not a terminal status");
        }
        if (status.isTerminal()) {
            throw new IllegalStateException("Execution " + id + " already finished as " + status);
        }
        this.status = terminal;
        this.completedAt = now;
        if (startedAt != null) {
            this.durationSeconds = Duration.between(startedAt, now).getSeconds();
        }
        if (summary != null) {
            this.successCount = summary.getSuccessCount();
            this.errorCount = summary.getErrorCount();
            this.alertsGenerated = summary.getAlertsGenerated();
            this.notificationsSent = summary.getNotificationsSent();
        }
        this.outputLog = outputLog;
        this.errorLog = errorLog;
    }

    /**
     * Detached copy for callers that must not share this instance with the thread running it.
     */
    public TaskExecution snapshot() {
        return toBuilder().build();
    }

    public boolean isRunning() {
        return status == ExecutionStatus.RUNNING;
    }

    /**
     * Only failed or timed-out runs of a schedule are retried, and only while the schedule's
     * retry budget lasts. Manual runs without a schedule are never retried.
     */
    public boolean canRetry(TaskSchedule schedule) {
        if (schedule == null || scheduleId == null) {
            return false;
        }
        return status.isRetryable() && retryCount < schedule.getRetryCount();
    }
}
