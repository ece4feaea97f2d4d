package com.appmonitor.collector.scheduler;

import com.appmonitor.collector.config.AppMonitorProperties;
import com.appmonitor.collector.config.ExecutionConfig;
import com.appmonitor.collector.exception.ConfigurationException;
import com.appmonitor.collector.exception.ExecutionTimeoutException;
import com.appmonitor.collector.model.ExecutionStatus;
import com.appmonitor.collector.model.RunSummary;
import com.appmonitor.collector.model.TaskExecution;
import com.appmonitor.collector.model.TaskSchedule;
import com.appmonitor.collector.model.TriggerType;
import com.appmonitor.collector.output.TaskStore;
import com.appmonitor.collector.service.IngestionService;
import com.appmonitor.collector.service.IngestionService.RunOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class TaskExecutorTest {

    private static final LocalDate TARGET = LocalDate.of(2024, 5, 4);

    @Mock
    private TaskStore taskStore;

    @Mock
    private IngestionService ingestionService;

    private ExecutorService launcherPool;
    private ExecutorService workerPool;
    private TaskExecutor taskExecutor;
    private final AtomicLong ids = new AtomicLong(100);

    @BeforeEach
    void setUp() {
        AppMonitorProperties properties = new AppMonitorProperties();
        properties.getScheduling().setDefaultTimeout(Duration.ofMillis(200));
        launcherPool = Executors.newSingleThreadExecutor();
        workerPool = Executors.newCachedThreadPool();
        taskExecutor = new TaskExecutor(taskStore, ingestionService, properties, Clock.systemUTC(),
                launcherPool, workerPool);
    }

    @AfterEach
    void tearDown() {
        launcherPool.shutdownNow();
        workerPool.shutdownNow();
    }

    @Test
    void testExecuteSchedule_SkipsWhenAlreadyRunning() {
        // Given
        TaskSchedule schedule = schedule(3);
        when(ingestionService.defaultTargetDate()).thenReturn(TARGET);
        when(taskStore.findActiveExecution(1L)).thenReturn(Optional.of(TaskExecution.builder()
                .id(7L).scheduleId(1L).status(ExecutionStatus.RUNNING).build()));

        // When
        Optional<TaskExecution> result = taskExecutor.executeSchedule(schedule, TriggerType.SCHEDULED);

        // Then
        assertTrue(result.isEmpty());
        verify(taskStore, never()).createExecution(any());
        verify(ingestionService, never()).run(any(), any(), any(), any());
    }

    @Test
    void testExecuteSchedule_InactiveScheduleDoesNothing() {
        // Given
        TaskSchedule schedule = schedule(3);
        schedule.setActive(false);
        when(ingestionService.defaultTargetDate()).thenReturn(TARGET);

        // When
        Optional<TaskExecution> result = taskExecutor.executeSchedule(schedule, TriggerType.MANUAL);

        // Then
        assertTrue(result.isEmpty());
        verifyNoInteractions(taskStore);
    }

    @Test
    void testExecuteSchedule_SuccessRecordsCounters() {
        // Given
        TaskSchedule schedule = schedule(3);
        schedule.setSkipNotifications(true);
        when(ingestionService.defaultTargetDate()).thenReturn(TARGET);
        when(taskStore.findActiveExecution(1L)).thenReturn(Optional.empty());
        stubCreateExecution();
        when(ingestionService.run(any(), any(), any(), any())).thenAnswer(invocation -> {
            RunSummary summary = invocation.getArgument(3);
            summary.setTotalApps(2);
            summary.recordSuccess();
            summary.recordSuccess();
            summary.recordAlert();
            summary.recordNotification();
            return summary;
        });

        // When
        TaskExecution execution = taskExecutor.executeSchedule(schedule, TriggerType.SCHEDULED).orElseThrow();

        // Then
        assertEquals(ExecutionStatus.SUCCESS, execution.getStatus());
        assertEquals(TriggerType.SCHEDULED, execution.getTriggerType());
        assertEquals(TARGET, execution.getTargetDate());
        assertEquals(2, execution.getSuccessCount());
        assertEquals(1, execution.getAlertsGenerated());
        assertEquals(1, execution.getNotificationsSent());
        assertNotNull(execution.getStartedAt());
        assertNotNull(execution.getCompletedAt());
        assertNotNull(execution.getDurationSeconds());
        verify(taskStore, times(2)).updateExecution(execution);

        ArgumentCaptor<RunOptions> options = ArgumentCaptor.forClass(RunOptions.class);
        verify(ingestionService).run(options.capture(), any(), any(), any());
        assertTrue(options.getValue().isSkipNotifications());
        assertEquals(TARGET, options.getValue().getTargetDate());
    }

    @Test
    void testExecuteManual_AllAppsFailedIsFailure() {
        // Given
        stubCreateExecution();
        when(ingestionService.run(any(), any(), any(), any())).thenAnswer(invocation -> {
            RunSummary summary = invocation.getArgument(3);
            summary.setTotalApps(1);
            summary.recordError("Demo: HTTP 500");
            return summary;
        });

        // When
        TaskExecution execution = taskExecutor.executeManual(RunOptions.builder().appId(1L).targetDate(TARGET).build());

        // Then
        assertEquals(ExecutionStatus.FAILED, execution.getStatus());
        assertNull(execution.getScheduleId());
        assertEquals(1, execution.getErrorCount());
        verify(taskStore, never()).findActiveExecution(anyLong());
    }

    @Test
    void testExecuteManual_TimeoutInterruptsRun() {
        // Given
        stubCreateExecution();
        when(ingestionService.run(any(), any(), any(), any())).thenAnswer(invocation -> {
            RunSummary summary = invocation.getArgument(3);
            summary.setTotalApps(3);
            summary.recordSuccess();
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ExecutionTimeoutException("interrupted");
            }
            return summary;
        });

        // When
        TaskExecution execution = taskExecutor.executeManual(RunOptions.builder().targetDate(TARGET).build());

        // Then
        assertEquals(ExecutionStatus.TIMEOUT, execution.getStatus());
        assertTrue(execution.getErrorLog().contains("timeout"));
        assertNotNull(execution.getCompletedAt());
    }

    @Test
    void testExecuteManual_DeadlineExpiryInsideRunIsTimeout() {
        // Given
        stubCreateExecution();
        when(ingestionService.run(any(), any(), any(), any()))
                .thenThrow(new ExecutionTimeoutException("Execution deadline exceeded"));

        // When
        TaskExecution execution = taskExecutor.executeManual(RunOptions.builder().targetDate(TARGET).build());

        // Then
        assertEquals(ExecutionStatus.TIMEOUT, execution.getStatus());
    }

    @Test
    void testExecuteManual_RunLevelErrorIsFailure() {
        // Given
        stubCreateExecution();
        when(ingestionService.run(any(), any(), any(), any()))
                .thenThrow(new ConfigurationException("App 9 does not exist"));

        // When
        TaskExecution execution = taskExecutor.executeManual(RunOptions.builder().appId(9L).targetDate(TARGET).build());

        // Then
        assertEquals(ExecutionStatus.FAILED, execution.getStatus());
        assertTrue(execution.getErrorLog().contains("App 9 does not exist"));
    }

    @Test
    void testRetry_CreatesNewExecutionWithNextRetryCount() {
        // Given
        TaskExecution failed = TaskExecution.builder()
                .id(5L).scheduleId(1L).triggerType(TriggerType.SCHEDULED)
                .status(ExecutionStatus.FAILED).targetDate(TARGET.minusDays(3)).retryCount(1).build();
        when(taskStore.findExecution(5L)).thenReturn(Optional.of(failed));
        when(taskStore.findSchedule(1L)).thenReturn(Optional.of(schedule(3)));
        when(taskStore.findActiveExecution(1L)).thenReturn(Optional.empty());
        stubCreateExecution();
        when(ingestionService.run(any(), any(), any(), any())).thenAnswer(invocation -> invocation.getArgument(3));

        // When
        TaskExecution retry = taskExecutor.retry(5L).orElseThrow();

        // Then
        assertNotEquals(5L, retry.getId());
        assertEquals(TriggerType.RETRY, retry.getTriggerType());
        assertEquals(2, retry.getRetryCount());
        assertEquals(TARGET.minusDays(3), retry.getTargetDate());
        assertEquals(ExecutionStatus.SUCCESS, retry.getStatus());
        assertEquals(ExecutionStatus.FAILED, failed.getStatus());
    }

    @Test
    void testRetry_BudgetExhausted() {
        // Given
        TaskExecution failed = TaskExecution.builder()
                .id(5L).scheduleId(1L).triggerType(TriggerType.RETRY)
                .status(ExecutionStatus.TIMEOUT).targetDate(TARGET).retryCount(3).build();
        when(taskStore.findExecution(5L)).thenReturn(Optional.of(failed));
        when(taskStore.findSchedule(1L)).thenReturn(Optional.of(schedule(3)));

        // When
        Optional<TaskExecution> retry = taskExecutor.retry(5L);

        // Then
        assertTrue(retry.isEmpty());
        verify(taskStore, never()).createExecution(any());
    }

    @Test
    void testRetry_UnknownExecution() {
        when(taskStore.findExecution(404L)).thenReturn(Optional.empty());
        assertThrows(IllegalArgumentException.class, () -> taskExecutor.retry(404L));
    }

    @Test
    void testLaunchManual_HungRunsDoNotHoldBackNewOnes() throws Exception {
        // Given
        ExecutionConfig config = new ExecutionConfig();
        ExecutorService launchers = config.executionLauncherPool();
        ExecutorService workers = config.ingestionWorkerPool();
        TaskExecutor executor = new TaskExecutor(taskStore, ingestionService, new AppMonitorProperties(),
                Clock.systemUTC(), launchers, workers);
        int runs = 8;
        CountDownLatch started = new CountDownLatch(runs);
        CountDownLatch release = new CountDownLatch(1);
        stubCreateExecution();
        when(ingestionService.run(any(), any(), any(), any())).thenAnswer(invocation -> {
            started.countDown();
            release.await(10, TimeUnit.SECONDS);
            return invocation.getArgument(3);
        });

        try {
            // When
            List<TaskExecution> accepted = new ArrayList<>();
            for (int i = 0; i < runs; i++) {
                accepted.add(executor.launchManual(RunOptions.builder().targetDate(TARGET).build()));
            }

            // Then
            assertTrue(started.await(5, TimeUnit.SECONDS), "every launched run should be collecting at once");
            for (TaskExecution execution : accepted) {
                assertEquals(ExecutionStatus.PENDING, execution.getStatus());
                assertNull(execution.getStartedAt());
            }
        } finally {
            release.countDown();
            launchers.shutdownNow();
            workers.shutdownNow();
        }
    }

    @Test
    void testLaunchManual_ReturnsDetachedSnapshot() {
        // Given
        stubCreateExecution();
        when(ingestionService.run(any(), any(), any(), any())).thenAnswer(invocation -> invocation.getArgument(3));

        // When
        TaskExecution accepted = taskExecutor.launchManual(RunOptions.builder().targetDate(TARGET).build());

        // Then
        ArgumentCaptor<TaskExecution> updates = ArgumentCaptor.forClass(TaskExecution.class);
        verify(taskStore, timeout(5000).times(2)).updateExecution(updates.capture());
        TaskExecution live = updates.getValue();
        assertNotSame(accepted, live);
        assertEquals(accepted.getId(), live.getId());
        assertEquals(ExecutionStatus.SUCCESS, live.getStatus());
        assertEquals(ExecutionStatus.PENDING, accepted.getStatus());
        assertNull(accepted.getCompletedAt());
    }

    private void stubCreateExecution() {
        when(taskStore.createExecution(any())).thenAnswer(invocation -> {
            TaskExecution execution = invocation.getArgument(0);
            execution.setId(ids.incrementAndGet());
            return execution;
        });
    }

    private static TaskSchedule schedule(int retryCount) {
        return TaskSchedule.builder()
                .id(1L)
                .name("nightly")
                .hour(3)
                .minute(30)
                .retryCount(retryCount)
                .timeoutMinutes(5)
                .active(true)
                .build();
    }
}
