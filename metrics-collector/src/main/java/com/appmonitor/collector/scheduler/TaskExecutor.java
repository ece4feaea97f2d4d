package com.appmonitor.collector.scheduler;

import com.appmonitor.collector.config.AppMonitorProperties;
import com.appmonitor.collector.exception.ExecutionTimeoutException;
import com.appmonitor.collector.model.ExecutionStatus;
import com.appmonitor.collector.model.RunSummary;
import com.appmonitor.collector.model.TaskExecution;
import com.appmonitor.collector.model.TaskSchedule;
import com.appmonitor.collector.model.TriggerType;
import com.appmonitor.collector.output.TaskStore;
import com.appmonitor.collector.service.ExecutionLog;
import com.appmonitor.collector.service.IngestionService;
import com.appmonitor.collector.service.IngestionService.RunOptions;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Owns the lifecycle of execution records: creates them, runs the ingestion under a deadline
 * and writes the terminal state.
 *
 * A schedule never has two active executions: the check for a pending or running record and
 * the creation of the new one happen under a per-schedule lock. Manual runs without a schedule
 * are not guarded. A record turns RUNNING only when its run actually starts.
 */
@Service("collectionTaskExecutor")
@Slf4j
public class TaskExecutor {

    private final TaskStore taskStore;
    private final IngestionService ingestionService;
    private final AppMonitorProperties properties;
    private final Clock clock;
    private final ExecutorService launcherPool;
    private final ExecutorService workerPool;

    private final ConcurrentMap<Long, Object> scheduleLocks = new ConcurrentHashMap<>();

    public TaskExecutor(TaskStore taskStore,
                        IngestionService ingestionService,
                        AppMonitorProperties properties,
                        Clock clock,
                        @Qualifier("executionLauncherPool") ExecutorService launcherPool,
                        @Qualifier("ingestionWorkerPool") ExecutorService workerPool) {
        this.taskStore = taskStore;
        this.ingestionService = ingestionService;
        this.properties = properties;
        this.clock = clock;
        this.launcherPool = launcherPool;
        this.workerPool = workerPool;
    }

    // ── Blocking entry points ────────────────────────────────────────────────

    /**
     * Runs a schedule and waits for it. Empty when the schedule is inactive or already running.
     */
    public Optional<TaskExecution> executeSchedule(TaskSchedule schedule, TriggerType triggerType) {
        return begin(schedule, triggerType, 0, scheduleOptions(schedule, null))
                .map(execution -> complete(execution, schedule, scheduleOptions(schedule, execution.getTargetDate())));
    }

    public TaskExecution executeManual(RunOptions options) {
        TaskExecution execution = begin(null, TriggerType.MANUAL, 0, options).orElseThrow();
        return complete(execution, null, withTargetDate(options, execution.getTargetDate()));
    }

    /**
     * Retries a failed or timed-out execution as a new record with the next retry count.
     * Empty when the execution is not retryable.
     */
    public Optional<TaskExecution> retry(long executionId) {
        return prepareRetry(executionId).flatMap(retry -> begin(retry.schedule(), TriggerType.RETRY,
                        retry.previous().getRetryCount() + 1, retry.options())
                .map(execution -> complete(execution, retry.schedule(), retry.options())));
    }

    // ── Fire-and-forget entry points ─────────────────────────────────────────
    // Each returns a snapshot of the new record; the live instance belongs to the launcher.

    public Optional<TaskExecution> launchSchedule(TaskSchedule schedule, TriggerType triggerType) {
        return begin(schedule, triggerType, 0, scheduleOptions(schedule, null))
                .map(execution -> launch(execution, schedule, scheduleOptions(schedule, execution.getTargetDate())));
    }

    public TaskExecution launchManual(RunOptions options) {
        TaskExecution execution = begin(null, TriggerType.MANUAL, 0, options).orElseThrow();
        return launch(execution, null, withTargetDate(options, execution.getTargetDate()));
    }

    public Optional<TaskExecution> launchRetry(long executionId) {
        return prepareRetry(executionId).flatMap(retry -> begin(retry.schedule(), TriggerType.RETRY,
                        retry.previous().getRetryCount() + 1, retry.options())
                .map(execution -> launch(execution, retry.schedule(), retry.options())));
    }

    public Optional<TaskExecution> findExecution(long executionId) {
        return taskStore.findExecution(executionId);
    }

    // ── Lifecycle ────────────────────────────────────────────────────────────

    /**
     * Creates the PENDING execution record.
     */
    Optional<TaskExecution> begin(TaskSchedule schedule, TriggerType triggerType, int retryCount, RunOptions options) {
        LocalDate targetDate = options.getTargetDate() != null
                ? options.getTargetDate()
                : ingestionService.defaultTargetDate();

        if (schedule == null) {
            return Optional.of(createPending(null, triggerType, options.getAppId(), targetDate, retryCount));
        }
        if (!schedule.isActive()) {
            log.info("Schedule '{}' is inactive, not starting", schedule.getName());
            return Optional.empty();
        }
        synchronized (scheduleLocks.computeIfAbsent(schedule.getId(), id -> new Object())) {
            Optional<TaskExecution> active = taskStore.findActiveExecution(schedule.getId());
            if (active.isPresent()) {
                log.warn("Schedule '{}' still has execution {} {}, skipping {} trigger",
                        schedule.getName(), active.get().getId(), active.get().getStatus(), triggerType);
                return Optional.empty();
            }
            return Optional.of(createPending(schedule, triggerType, schedule.getAppId(), targetDate, retryCount));
        }
    }

    /**
     * Moves the record to RUNNING, runs the ingestion on a worker thread and waits at most the
     * timeout. On timeout the deadline is cancelled and the worker interrupted; counts reached
     * so far are kept.
     */
    TaskExecution complete(TaskExecution execution, TaskSchedule schedule, RunOptions options) {
        execution.markStarted(clock.instant());
        taskStore.updateExecution(execution);

        Duration timeout = schedule != null
                ? Duration.ofMinutes(schedule.getTimeoutMinutes())
                : properties.getScheduling().getDefaultTimeout();
        ExecutionDeadline deadline = ExecutionDeadline.after(timeout, clock);
        ExecutionLog executionLog = new ExecutionLog(clock);
        RunSummary summary = new RunSummary();

        log.info("Execution {} started ({}, schedule {})", execution.getId(), execution.getTriggerType(),
                schedule != null ? schedule.getName() : "none");

        ExecutionStatus status;
        Future<RunSummary> future = workerPool.submit(() -> ingestionService.run(options, deadline, executionLog, summary));
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            status = summary.outcome() == RunSummary.Outcome.ALL_FAILED ? ExecutionStatus.FAILED : ExecutionStatus.SUCCESS;
        } catch (TimeoutException e) {
            deadline.cancel();
            future.cancel(true);
            status = ExecutionStatus.TIMEOUT;
            executionLog.error("Execution exceeded its timeout of {}", timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof ExecutionTimeoutException) {
                status = ExecutionStatus.TIMEOUT;
            } else {
                status = ExecutionStatus.FAILED;
                log.error("Execution {} failed: {}", execution.getId(), cause.getMessage(), cause);
            }
            executionLog.error("Execution aborted: {}", cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            deadline.cancel();
            future.cancel(true);
            status = ExecutionStatus.CANCELLED;
            executionLog.error("Execution cancelled");
        }

        execution.markCompleted(status, summary.snapshot(), executionLog.output(), executionLog.errors(), clock.instant());
        taskStore.updateExecution(execution);
        log.info("Execution {} finished as {} in {}s: {}", execution.getId(), status,
                execution.getDurationSeconds(), summary);
        return execution;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private TaskExecution launch(TaskExecution execution, TaskSchedule schedule, RunOptions options) {
        TaskExecution accepted = execution.snapshot();
        launcherPool.execute(() -> {
            try {
                complete(execution, schedule, options);
            } catch (RuntimeException e) {
                log.error("Could not finalise execution {}: {}", execution.getId(), e.getMessage(), e);
            }
        });
        return accepted;
    }

    private record RetryPlan(TaskExecution previous, TaskSchedule schedule, RunOptions options) {}

    private Optional<RetryPlan> prepareRetry(long executionId) {
        TaskExecution previous = taskStore.findExecution(executionId)
                .orElseThrow(() -> new IllegalArgumentException("Execution " + executionId + " does not exist"));
        TaskSchedule schedule = previous.getScheduleId() != null
                ? taskStore.findSchedule(previous.getScheduleId()).orElse(null)
                : null;
        if (!previous.canRetry(schedule)) {
            log.info("Execution {} is not retryable (status {}, retry {})", executionId,
                    previous.getStatus(), previous.getRetryCount());
            return Optional.empty();
        }
        return Optional.of(new RetryPlan(previous, schedule, scheduleOptions(schedule, previous.getTargetDate())));
    }

    private TaskExecution createPending(TaskSchedule schedule, TriggerType triggerType, Long appId,
                                        LocalDate targetDate, int retryCount) {
        return taskStore.createExecution(
                TaskExecution.pending(schedule, triggerType, appId, targetDate, retryCount, clock.instant()));
    }

    private static RunOptions scheduleOptions(TaskSchedule schedule, LocalDate targetDate) {
        return RunOptions.builder()
                .appId(schedule.getAppId())
                .targetDate(targetDate)
                .skipNotifications(schedule.isSkipNotifications())
                .build();
    }

    private static RunOptions withTargetDate(RunOptions options, LocalDate targetDate) {
        return RunOptions.builder()
                .appId(options.getAppId())
                .targetDate(targetDate)
                .dryRun(options.isDryRun())
                .skipNotifications(options.isSkipNotifications())
                .build();
    }
}
