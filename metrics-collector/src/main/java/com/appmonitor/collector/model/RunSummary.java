package com.appmonitor.collector.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Statistics of one ingestion run, filled in by the ingestion service and read by the
 * executor. Thread-safe: the executor may read it while a timed-out worker is still unwinding.
 */
public class RunSummary {

    public enum Outcome {
        NO_APPS, ALL_SUCCEEDED, PARTIAL_FAILURE, ALL_FAILED
    }

    private int totalApps;
    private int successCount;
    private int errorCount;
    private int alertsGenerated;
    private int notificationsSent;
    private final List<String> errors = new ArrayList<>();

    public synchronized void setTotalApps(int totalApps) {
        this.totalApps = totalApps;
    }

    public synchronized void recordSuccess() {
        successCount++;
    }

    public synchronized void recordError(String message) {
        errorCount++;
        errors.add(message);
    }

    public synchronized void recordAlert() {
        alertsGenerated++;
    }

    public synchronized void recordNotification() {
        notificationsSent++;
    }

    public synchronized int getTotalApps() {
        return totalApps;
    }

    public synchronized int getSuccessCount() {
        return successCount;
    }

    public synchronized int getErrorCount() {
        return errorCount;
    }

    public synchronized int getAlertsGenerated() {
        return alertsGenerated;
    }

    public synchronized int getNotificationsSent() {
        return notificationsSent;
    }

    public synchronized List<String> getErrors() {
        return Collections.unmodifiableList(new ArrayList<>(errors));
    }

    public synchronized Outcome outcome() {
        if (totalApps == 0) return Outcome.NO_APPS;
        if (errorCount == 0) return Outcome.ALL_SUCCEEDED;
        if (successCount > 0) return Outcome.PARTIAL_FAILURE;
        return Outcome.ALL_FAILED;
    }

    public synchronized RunSummary snapshot() {
        RunSummary copy = new RunSummary();
        copy.totalApps = totalApps;
        copy.successCount = successCount;
        copy.errorCount = errorCount;
        copy.alertsGenerated = alertsGenerated;
        copy.notificationsSent = notificationsSent;
        copy.errors.addAll(errors);
        return copy;
    }

    @Override
    public synchronized String toString() {
        return String.format("RunSummary[total=%d, success=%d, errors=%d, alerts=%d, notifications=%d]",
                totalApps, successCount, errorCount, alertsGenerated, notificationsSent);
    }
}
