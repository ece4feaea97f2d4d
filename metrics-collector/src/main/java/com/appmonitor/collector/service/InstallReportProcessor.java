package com.appmonitor.collector.service;

import com.appmonitor.collector.model.DailyInstallStats;
import com.appmonitor.collector.model.DailySessionStats;
import com.appmonitor.collector.model.DownloadChannel;
import com.appmonitor.collector.model.InstallReportSummary;
import com.appmonitor.collector.model.SessionReportSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Classifies segment rows of the install and session reports into per-date counters.
 *
 * Install rows without an event, or with an "Install" event, are split by download type:
 * first-time downloads are installs, manual updates are updates, everything else counts as a
 * reinstall. "Delete" events are uninstalls. Only first-time downloads are attributed to a
 * source channel, and only on rows dated on the target date.
 */
@Component
@Slf4j
public class InstallReportProcessor {

    static final String COL_DATE = "Date";
    static final String COL_EVENT = "Event";
    static final String COL_DOWNLOAD_TYPE = "Download Type";
    static final String COL_SOURCE_TYPE = "Source Type";
    static final String COL_COUNTS = "Counts";
    static final String COL_SESSIONS = "Sessions";
    static final String COL_UNIQUE_DEVICES = "Unique Devices";

    private static final String EVENT_INSTALL = "Install";
    private static final String EVENT_DELETE = "Delete";

    private static final String FIRST_TIME_DOWNLOAD = "First-time download";
    private static final String MANUAL_UPDATE = "Manual update";
    private static final Set<String> REINSTALL_TYPES = Set.of("Auto-download", "Auto-update", "Restore", "Redownload");

    /**
     * Adds rows of the standard install report. {@code targetDate} may be null, in which case
     * every first-time download is attributed to a channel.
     */
    public void addInstallRows(InstallReportSummary summary, List<ReportRow> rows, LocalDate targetDate) {
        for (ReportRow row : rows) {
            LocalDate date = row.date(COL_DATE);
            Long counts = row.count(COL_COUNTS);
            if (date == null || counts == null) {
                log.debug("Skipping install row without usable date or counts: {}", row.values());
                continue;
            }

            DailyInstallStats day = summary.day(date);
            day.setRows(day.getRows() + 1);
            String event = row.get(COL_EVENT);

            if (EVENT_DELETE.equals(event)) {
                day.setUninstalls(day.getUninstalls() + counts);
                continue;
            }
            if (event != null && !event.isEmpty() && !EVENT_INSTALL.equals(event)) {
                log.debug("Ignoring install row with event '{}'", event);
                continue;
            }

            String downloadType = row.get(COL_DOWNLOAD_TYPE);
            if (FIRST_TIME_DOWNLOAD.equals(downloadType)) {
                day.setInstalls(day.getInstalls() + counts);
                if (targetDate == null || targetDate.equals(date)) {
                    summary.getChannels().add(DownloadChannel.fromVendorLabel(row.get(COL_SOURCE_TYPE)), counts);
                }
            } else if (MANUAL_UPDATE.equals(downloadType)) {
                day.setUpdates(day.getUpdates() + counts);
            } else {
                if (!REINSTALL_TYPES.contains(downloadType)) {
                    log.warn("Unknown download type '{}' on {}, counted as reinstall", downloadType, date);
                }
                day.setReinstalls(day.getReinstalls() + counts);
            }
        }
    }

    /**
     * Adds rows of the detailed install report. Only "Delete" events are used.
     */
    public void addDeletionRows(InstallReportSummary detail, List<ReportRow> rows) {
        for (ReportRow row : rows) {
            if (!EVENT_DELETE.equals(row.get(COL_EVENT))) continue;
            LocalDate date = row.date(COL_DATE);
            Long counts = row.count(COL_COUNTS);
            if (date == null || counts == null) continue;

            DailyInstallStats day = detail.day(date);
            day.setRows(day.getRows() + 1);
            day.setUninstalls(day.getUninstalls() + counts);
        }
    }

    /**
     * Replaces the standard report's per-date uninstalls with the detailed report's counts.
     * Dates only present in the detailed report are added with zero installs.
     */
    public void mergeDeletions(InstallReportSummary installs, InstallReportSummary detail) {
        detail.getDaily().forEach((date, stats) -> installs.day(date).setUninstalls(stats.getUninstalls()));
    }

    public void addSessionRows(SessionReportSummary summary, List<ReportRow> rows) {
        for (ReportRow row : rows) {
            LocalDate date = row.date(COL_DATE);
            if (date == null) continue;
            Long sessions = row.count(COL_SESSIONS);
            Long devices = row.count(COL_UNIQUE_DEVICES);
            if (sessions == null && devices == null) continue;

            DailySessionStats day = summary.day(date);
            day.setRows(day.getRows() + 1);
            day.setSessions(day.getSessions() + (sessions != null ? sessions : 0));
            day.setUniqueDevices(day.getUniqueDevices() + (devices != null ? devices : 0));
        }
    }

    /**
     * Sets the report totals: the target date's row when a target is given (zero if absent),
     * otherwise the sum over every date.
     */
    public void computeTotals(InstallReportSummary summary, LocalDate targetDate) {
        long installs = 0, updates = 0, reinstalls = 0, uninstalls = 0;
        for (Map.Entry<LocalDate, DailyInstallStats> entry : summary.getDaily().entrySet()) {
            if (targetDate != null && !targetDate.equals(entry.getKey())) continue;
            DailyInstallStats day = entry.getValue();
            installs += day.getInstalls();
            updates += day.getUpdates();
            reinstalls += day.getReinstalls();
            uninstalls += day.getUninstalls();
        }
        if (targetDate != null && !summary.getDaily().containsKey(targetDate)) {
            log.warn("Install report {} has no rows for {}; available dates: {}",
                    summary.getReportId(), targetDate, summary.getDaily().keySet());
        }
        summary.setTotalInstalls(installs);
        summary.setTotalUpdates(updates);
        summary.setTotalReinstalls(reinstalls);
        summary.setTotalUninstalls(uninstalls);

        long channelTotal = summary.getChannels().total();
        if (channelTotal != installs) {
            log.warn("Channel total {} does not match first-time downloads {} for report {}",
                    channelTotal, installs, summary.getReportId());
        }
    }

    public void computeTotals(SessionReportSummary summary, LocalDate targetDate) {
        long sessions = 0, devices = 0;
        for (Map.Entry<LocalDate, DailySessionStats> entry : summary.getDaily().entrySet()) {
            if (targetDate != null && !targetDate.equals(entry.getKey())) continue;
            sessions += entry.getValue().getSessions();
            devices += entry.getValue().getUniqueDevices();
        }
        if (targetDate != null && !summary.getDaily().containsKey(targetDate)) {
            log.warn("Session report {} has no rows for {}; available dates: {}",
                    summary.getReportId(), targetDate, summary.getDaily().keySet());
        }
        summary.setTotalSessions(sessions);
        summary.setTotalUniqueDevices(devices);
    }
}
