package com.appmonitor.collector.config;

import com.appmonitor.collector.model.TaskExecution;
import com.appmonitor.collector.model.TaskSchedule;
import com.appmonitor.collector.model.TriggerType;
import com.appmonitor.collector.output.TaskStore;
import com.appmonitor.collector.scheduler.TaskExecutor;
import com.appmonitor.collector.scheduler.TaskScheduler;
import com.appmonitor.collector.service.IngestionService.RunOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@RestController
@Slf4j
@RequiredArgsConstructor
public class ExecutionController {

    private final TaskExecutor taskExecutor;
    private final TaskScheduler taskScheduler;
    private final TaskStore taskStore;

    // ── Triggers ──────────────────────────────────────────────────────────────

    /**
     * Manual run for one app or all active apps.
     *
     * POST /executions/manual?appId=3&date=2024-05-01&dryRun=true
     */
    @PostMapping("/executions/manual")
    public ResponseEntity<Map<String, Object>> runManual(
            @RequestParam(required = false) Long appId,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam(defaultValue = "false") boolean dryRun,
            @RequestParam(defaultValue = "false") boolean skipNotifications) {
        TaskExecution execution = taskExecutor.launchManual(RunOptions.builder()
                .appId(appId)
                .targetDate(date)
                .dryRun(dryRun)
                .skipNotifications(skipNotifications)
                .build());
        return ResponseEntity.accepted().body(view(execution));
    }

    @PostMapping("/schedules/{scheduleId}/run")
    public ResponseEntity<Map<String, Object>> runSchedule(@PathVariable long scheduleId) {
        Optional<TaskSchedule> schedule = taskStore.findSchedule(scheduleId);
        if (schedule.isEmpty()) {
            return ResponseEntity.notFound().build();
        }
        return taskExecutor.launchSchedule(schedule.get(), TriggerType.MANUAL)
                .map(execution -> ResponseEntity.accepted().body(view(execution)))
                .orElseGet(() -> ResponseEntity.status(409).body(Map.of(
                        "status", "skipped",
                        "reason", "schedule is inactive or already running")));
    }

    @PostMapping("/executions/{executionId}/retry")
    public ResponseEntity<Map<String, Object>> retry(@PathVariable long executionId) {
        try {
            return taskExecutor.launchRetry(executionId)
                    .map(execution -> ResponseEntity.accepted().body(view(execution)))
                    .orElseGet(() -> ResponseEntity.status(409).body(Map.of(
                            "status", "skipped",
                            "reason", "execution is not retryable")));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        }
    }

    // ── Status ────────────────────────────────────────────────────────────────

    @GetMapping("/executions/{executionId}")
    public ResponseEntity<Map<String, Object>> execution(@PathVariable long executionId) {
        return taskExecutor.findExecution(executionId)
                .map(execution -> {
                    Map<String, Object> body = view(execution);
                    body.put("outputLog", execution.getOutputLog());
                    body.put("errorLog", execution.getErrorLog());
                    return ResponseEntity.ok(body);
                })
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/scheduler/status")
    public ResponseEntity<Map<String, Object>> schedulerStatus() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("service", "app-monitor-metrics-collector");
        body.put("running", taskScheduler.isRunning());
        body.put("lastTick", String.valueOf(taskScheduler.getLastTick()));
        body.put("activeSchedules", taskStore.findActiveSchedules().size());
        return ResponseEntity.ok(body);
    }

    private static Map<String, Object> view(TaskExecution execution) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("id", execution.getId());
        body.put("scheduleId", execution.getScheduleId());
        body.put("triggerType", execution.getTriggerType());
        body.put("status", execution.getStatus());
        body.put("appId", execution.getAppId());
        body.put("targetDate", String.valueOf(execution.getTargetDate()));
        body.put("retryCount", execution.getRetryCount());
        body.put("startedAt", String.valueOf(execution.getStartedAt()));
        body.put("completedAt", String.valueOf(execution.getCompletedAt()));
        body.put("durationSeconds", execution.getDurationSeconds());
        body.put("successCount", execution.getSuccessCount());
        body.put("errorCount", execution.getErrorCount());
        body.put("alertsGenerated", execution.getAlertsGenerated());
        body.put("notificationsSent", execution.getNotificationsSent());
        return body;
    }
}
