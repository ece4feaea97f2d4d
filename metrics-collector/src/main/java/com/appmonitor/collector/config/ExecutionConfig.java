package com.appmonitor.collector.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Thread pools for executions. Launchers wait on a run and enforce its timeout; workers do the
 * actual collection and can be interrupted. Neither pool is bounded, so a hung run never holds
 * back another schedule.
 */
@Configuration
public class ExecutionConfig {

    @Bean(name = "executionLauncherPool", destroyMethod = "shutdownNow")
    public ExecutorService executionLauncherPool() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("execution-launcher-"));
    }

    @Bean(name = "ingestionWorkerPool", destroyMethod = "shutdownNow")
    public ExecutorService ingestionWorkerPool() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("ingestion-worker-"));
    }
}
