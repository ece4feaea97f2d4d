package com.appmonitor.collector.output;

import com.appmonitor.collector.model.TaskExecution;
import com.appmonitor.collector.model.TaskSchedule;

import java.util.List;
import java.util.Optional;

/**
 * Schedules are read-only here; executions are created and updated by the executor only.
 */
public interface TaskStore {

    List<TaskSchedule> findActiveSchedules();

    Optional<TaskSchedule> findSchedule(long scheduleId);

    /** Persists a new execution and assigns its id. */
    TaskExecution createExecution(TaskExecution execution);

    void updateExecution(TaskExecution execution);

    Optional<TaskExecution> findExecution(long executionId);

    /** Latest execution of the schedule that is still pending or running. */
    Optional<TaskExecution> findActiveExecution(long scheduleId);
}
