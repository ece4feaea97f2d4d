package com.appmonitor.collector.service;

import com.appmonitor.collector.model.DailyReport;
import com.appmonitor.collector.model.DailyReport.MetricLine;
import com.appmonitor.collector.model.DownloadChannel;
import com.appmonitor.collector.model.GrowthRates;
import com.appmonitor.collector.model.Metric;
import com.appmonitor.collector.model.MetricRecord;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@Component
public class ReportFormatter {

    private static final List<Metric> REPORTED = List.of(
            Metric.DOWNLOADS, Metric.SESSIONS, Metric.UNINSTALLS, Metric.UNIQUE_DEVICES,
            Metric.SEARCH_DOWNLOADS, Metric.WEB_REFERRAL_DOWNLOADS, Metric.APP_REFERRAL_DOWNLOADS);

    public DailyReport format(String appName, LocalDate date, MetricRecord record,
                              GrowthRates growth, List<String> insights) {
        Map<Metric, MetricLine> metrics = new EnumMap<>(Metric.class);
        for (Metric metric : REPORTED) {
            metrics.put(metric, new MetricLine(record.valueOf(metric), growth.dod(metric), growth.wow(metric)));
        }
        Map<DownloadChannel, Long> channels = new EnumMap<>(DownloadChannel.class);
        for (DownloadChannel channel : DownloadChannel.values()) {
            channels.put(channel, record.channel(channel));
        }
        return DailyReport.builder()
                .appName(appName)
                .date(date)
                .metrics(metrics)
                .channelBreakdown(channels)
                .insights(List.copyOf(insights))
                .summary(summary(record, growth))
                .build();
    }

    /**
     * One-line verdict on the day followed by the headline counts and their day-over-day change.
     */
    public String summary(MetricRecord record, GrowthRates growth) {
        double downloads = growth.dod(Metric.DOWNLOADS);
        double sessions = growth.dod(Metric.SESSIONS);
        double uninstalls = growth.dod(Metric.UNINSTALLS);

        String performance;
        if (downloads > 10 && sessions > 10 && uninstalls <= 5) {
            performance = "excellent";
        } else if (downloads > 0 && sessions > 0 && uninstalls <= 10) {
            performance = "steady growth";
        } else if (downloads < -10 || sessions < -10 || uninstalls > 20) {
            performance = "needs attention";
        } else {
            performance = "stable";
        }

        return String.format(Locale.ROOT, "Performance %s: downloads %,d (%+.1f%%), sessions %,d (%+.1f%%), uninstalls %,d (%+.1f%%)",
                performance,
                record.getDownloads(), downloads,
                record.getSessions(), sessions,
                record.getUninstalls(), uninstalls);
    }
}
