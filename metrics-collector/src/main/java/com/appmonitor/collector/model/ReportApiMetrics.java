package com.appmonitor.collector.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

/**
 * Typed payload of the async-report source for one app and date. Any report may be null when
 * the vendor returned no instances for it; its counts then read as zero.
 */
@Value
@Builder
public class ReportApiMetrics {

    String bundleId;
    String vendorAppId;
    String reportRequestId;
    LocalDate targetDate;

    /** Downloads, updates, reinstalls and source channels; uninstalls merged from the detailed report. */
    InstallReportSummary installs;

    /** Uninstall counts only. Its channel data is never used. */
    InstallReportSummary installDetail;

    SessionReportSummary sessions;

    public static ReportApiMetrics empty(String bundleId, LocalDate targetDate) {
        return ReportApiMetrics.builder().bundleId(bundleId).targetDate(targetDate).build();
    }

    public long downloads() {
        return installs != null ? installs.getTotalInstalls() : 0;
    }

    public long updates() {
        return installs != null ? installs.getTotalUpdates() : 0;
    }

    public long reinstalls() {
        return installs != null ? installs.getTotalReinstalls() : 0;
    }

    public long uninstalls() {
        if (installs != null) {
            return installs.getTotalUninstalls();
        }
        return installDetail != null ? installDetail.getTotalUninstalls() : 0;
    }

    public long sessionCount() {
        return sessions != null ? sessions.getTotalSessions() : 0;
    }

    public Long uniqueDevices() {
        return sessions != null ? sessions.getTotalUniqueDevices() : null;
    }

    public long channel(DownloadChannel channel) {
        return installs != null ? installs.getChannels().get(channel) : 0;
    }
}
