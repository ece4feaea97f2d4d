package com.appmonitor.collector.output;

import com.appmonitor.collector.model.ExecutionStatus;
import com.appmonitor.collector.model.ScheduleFrequency;
import com.appmonitor.collector.model.TaskExecution;
import com.appmonitor.collector.model.TaskSchedule;
import com.appmonitor.collector.model.TriggerType;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.simple.SimpleJdbcInsert;
import org.springframework.stereotype.Component;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class JdbcTaskStore implements TaskStore {

    private final JdbcTemplate jdbcTemplate;

    private static final String SCHEDULE_COLUMNS = """
            id, name, app_id, frequency, run_hour, run_minute, weekday, day_of_month,
            retry_count, timeout_minutes, active, skip_notifications
            """;

    private static final String EXECUTION_COLUMNS = """
            id, schedule_id, trigger_type, status, app_id, target_date, started_at, completed_at,
            duration_seconds, success_count, error_count, alerts_generated, notifications_sent,
            output_log, error_log, retry_count, created_at
            """;

    private static final RowMapper<TaskSchedule> SCHEDULE_MAPPER = (rs, rowNum) -> TaskSchedule.builder()
            .id(rs.getLong("id"))
            .name(rs.getString("name"))
            .appId(rs.getObject("app_id", Long.class))
            .frequency(ScheduleFrequency.fromString(rs.getString("frequency")))
            .hour(rs.getInt("run_hour"))
            .minute(rs.getInt("run_minute"))
            .weekday(rs.getObject("weekday", Integer.class))
            .dayOfMonth(rs.getObject("day_of_month", Integer.class))
            .retryCount(rs.getInt("retry_count"))
            .timeoutMinutes(rs.getInt("timeout_minutes"))
            .active(rs.getBoolean("active"))
            .skipNotifications(rs.getBoolean("skip_notifications"))
            .build();

    private static final RowMapper<TaskExecution> EXECUTION_MAPPER = (rs, rowNum) -> TaskExecution.builder()
            .id(rs.getLong("id"))
            .scheduleId(rs.getObject("schedule_id", Long.class))
            .triggerType(TriggerType.valueOf(rs.getString("trigger_type")))
            .status(ExecutionStatus.fromString(rs.getString("status")))
            .appId(rs.getObject("app_id", Long.class))
            .targetDate(rs.getObject("target_date", LocalDate.class))
            .startedAt(instant(rs, "started_at"))
            .completedAt(instant(rs, "completed_at"))
            .durationSeconds(rs.getObject("duration_seconds", Long.class))
            .successCount(rs.getInt("success_count"))
            .errorCount(rs.getInt("error_count"))
            .alertsGenerated(rs.getInt("alerts_generated"))
            .notificationsSent(rs.getInt("notifications_sent"))
            .outputLog(rs.getString("output_log"))
            .errorLog(rs.getString("error_log"))
            .retryCount(rs.getInt("retry_count"))
            .createdAt(instant(rs, "created_at"))
            .build();

    // ── Schedules ─────────────────────────────────────────────────────────────

    @Override
    public List<TaskSchedule> findActiveSchedules() {
        return jdbcTemplate.query(
                "SELECT " + SCHEDULE_COLUMNS + " FROM task_schedules WHERE active = TRUE ORDER BY id",
                SCHEDULE_MAPPER);
    }

    @Override
    public Optional<TaskSchedule> findSchedule(long scheduleId) {
        return jdbcTemplate.query("SELECT " + SCHEDULE_COLUMNS + " FROM task_schedules WHERE id = ?",
                SCHEDULE_MAPPER, scheduleId).stream().findFirst();
    }

    // ── Executions ────────────────────────────────────────────────────────────

    @Override
    public TaskExecution createExecution(TaskExecution execution) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("schedule_id", execution.getScheduleId());
        row.put("trigger_type", execution.getTriggerType().name());
        row.put("status", execution.getStatus().name());
        row.put("app_id", execution.getAppId());
        row.put("target_date", execution.getTargetDate());
        row.put("retry_count", execution.getRetryCount());
        row.put("created_at", timestamp(execution.getCreatedAt()));

        Number id = new SimpleJdbcInsert(jdbcTemplate)
                .withTableName("task_executions")
                .usingColumns(row.keySet().toArray(String[]::new))
                .usingGeneratedKeyColumns("id")
                .executeAndReturnKey(row);
        execution.setId(id.longValue());
        return execution;
    }

    @Override
    public void updateExecution(TaskExecution execution) {
        jdbcTemplate.update("""
                UPDATE task_executions
                   SET status = ?, started_at = ?, completed_at = ?, duration_seconds = ?,
                       success_count = ?, error_count = ?, alerts_generated = ?, notifications_sent = ?,
                       output_log = ?, error_log = ?
                 WHERE id = ?
                """,
                execution.getStatus().name(),
                timestamp(execution.getStartedAt()),
                timestamp(execution.getCompletedAt()),
                execution.getDurationSeconds(),
                execution.getSuccessCount(),
                execution.getErrorCount(),
                execution.getAlertsGenerated(),
                execution.getNotificationsSent(),
                execution.getOutputLog(),
                execution.getErrorLog(),
                execution.getId());
    }

    @Override
    public Optional<TaskExecution> findExecution(long executionId) {
        return jdbcTemplate.query("SELECT " + EXECUTION_COLUMNS + " FROM task_executions WHERE id = ?",
                EXECUTION_MAPPER, executionId).stream().findFirst();
    }

    @Override
    public Optional<TaskExecution> findActiveExecution(long scheduleId) {
        return jdbcTemplate.query("SELECT " + EXECUTION_COLUMNS
                        + " FROM task_executions WHERE schedule_id = ? AND status IN (?, ?) ORDER BY id DESC",
                EXECUTION_MAPPER, scheduleId, ExecutionStatus.PENDING.name(), ExecutionStatus.RUNNING.name())
                .stream().findFirst();
    }

    private static Timestamp timestamp(Instant instant) {
        return instant != null ? Timestamp.from(instant) : null;
    }

    private static Instant instant(ResultSet rs, String column) throws SQLException {
        Timestamp value = rs.getTimestamp(column);
        return value != null ? value.toInstant() : null;
    }
}
