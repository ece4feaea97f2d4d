package com.appmonitor.collector.model;

import lombok.Data;

/**
 * Install-report counters for one data date.
 */
@Data
public class DailyInstallStats {

    private long installs;
    private long updates;
    private long reinstalls;
    private long uninstalls;
    private int rows;
}
