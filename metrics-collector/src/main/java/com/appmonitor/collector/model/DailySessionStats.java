package com.appmonitor.collector.model;

import lombok.Data;

@Data
public class DailySessionStats {

    private long sessions;
    private long uniqueDevices;
    private int rows;
}
