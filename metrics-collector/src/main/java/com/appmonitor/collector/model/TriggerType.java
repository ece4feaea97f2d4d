package com.appmonitor.collector.model;

public enum TriggerType {
    SCHEDULED,
    MANUAL,
    RETRY
}
