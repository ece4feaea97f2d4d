package com.appmonitor.collector.output;

import com.appmonitor.collector.model.AlertRule;
import com.appmonitor.collector.model.MonitoredApp;

import java.util.List;
import java.util.Optional;

public interface AppCatalog {

    List<MonitoredApp> findActiveApps();

    Optional<MonitoredApp> findApp(long appId);

    List<AlertRule> findActiveRules(long appId);
}
