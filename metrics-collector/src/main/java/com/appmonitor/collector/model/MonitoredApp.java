package com.appmonitor.collector.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonitoredApp {

    private Long id;
    private String name;
    private Platform platform;

    /** Bundle id (iOS) or package name (Android). */
    private String externalId;

    private boolean active;

    /** Webhook for daily reports and per-app error notices; null disables both. */
    private String reportTarget;
}
