package com.appmonitor.collector.scheduler;

import com.appmonitor.collector.config.AppMonitorProperties;
import com.appmonitor.collector.model.TaskSchedule;
import com.appmonitor.collector.model.TriggerType;
import com.appmonitor.collector.output.TaskStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Minute tick over the active schedules. Every matching schedule is launched on its own and
 * the tick returns without waiting, so a slow run never delays the next minute.
 *
 * Times are local wall-clock time. Disable with {@code app-monitor.scheduling.enabled=false}.
 */
@Component("collectionTaskScheduler")
@Slf4j
@RequiredArgsConstructor
public class TaskScheduler {

    private final TaskStore taskStore;
    private final TaskExecutor taskExecutor;
    private final AppMonitorProperties properties;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile LocalDateTime lastTick;

    @PostConstruct
    public void onStartup() {
        if (properties.getScheduling().isEnabled()) {
            start();
        } else {
            log.info("Scheduling disabled; runs only start through the API");
        }
    }

    @PreDestroy
    public void onShutdown() {
        stop();
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            log.info("Task scheduler started");
        }
    }

    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Task scheduler stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public LocalDateTime getLastTick() {
        return lastTick;
    }

    @Scheduled(cron = "0 * * * * *")
    public void scheduledTick() {
        if (!running.get()) {
            return;
        }
        try {
            tick(LocalDateTime.now(clock));
        } catch (Exception e) {
            log.error("Scheduler tick failed: {}", e.getMessage(), e);
        }
    }

    /**
     * Launches every active schedule matching {@code now}. A minute is only processed once.
     *
     * @return number of executions started
     */
    public int tick(LocalDateTime now) {
        LocalDateTime minute = now.truncatedTo(ChronoUnit.MINUTES);
        if (minute.equals(lastTick)) {
            return 0;
        }
        lastTick = minute;

        int launched = 0;
        for (TaskSchedule schedule : taskStore.findActiveSchedules()) {
            if (!ScheduleMatcher.matches(schedule, minute)) continue;
            log.info("Schedule '{}' matched at {}", schedule.getName(), minute);
            try {
                if (taskExecutor.launchSchedule(schedule, TriggerType.SCHEDULED).isPresent()) {
                    launched++;
                }
            } catch (RuntimeException e) {
                log.error("Could not launch schedule '{}': {}", schedule.getName(), e.getMessage(), e);
            }
        }
        return launched;
    }
}
