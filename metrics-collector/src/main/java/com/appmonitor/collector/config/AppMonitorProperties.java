package com.appmonitor.collector.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "app-monitor")
@Data
public class AppMonitorProperties {

    private ReportApi reportApi = new ReportApi();
    private Bulk bulk = new Bulk();
    private RetrySettings retry = new RetrySettings();
    private Scheduling scheduling = new Scheduling();

    /** Opaque per-platform settings, e.g. {@code app-monitor.credentials.ios.key_id}. */
    private Map<String, Map<String, String>> credentials = new HashMap<>();

    @Data
    public static class ReportApi {
        private String baseUrl = "https://api.appstoreconnect.apple.com/v1";
        private Duration requestTimeout = Duration.ofSeconds(30);
        private Duration segmentTimeout = Duration.ofSeconds(60);
        private Duration instanceDelay = Duration.ofMillis(500);
        private Duration instanceJitter = Duration.ofMillis(200);
        private Duration tokenLifetime = Duration.ofMinutes(20);
    }

    @Data
    public static class Bulk {
        private String reportPrefix = "stats/installs/installs_";
        private String tokenScope = "https://www.googleapis.com/auth/devstorage.read_only";
    }

    @Data
    public static class RetrySettings {
        private int maxRetries = 3;
        private Duration delayBase = Duration.ofSeconds(1);
        private double backoffFactor = 2.0;
    }

    @Data
    public static class Scheduling {
        private boolean enabled = true;
        private Duration defaultTimeout = Duration.ofMinutes(30);
        private int dataDelayDays = 2;
    }
}
