package com.appmonitor.collector.service;

import com.appmonitor.collector.model.GrowthRates;
import com.appmonitor.collector.model.Metric;
import com.appmonitor.collector.model.MetricRecord;
import com.appmonitor.collector.model.TrendAnalysis;
import com.appmonitor.collector.model.TrendAnalysis.Trend;
import com.appmonitor.collector.output.MetricStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Period-over-period growth, trend classification and daily insights for one app.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class GrowthAnalyzer {

    static final int MAX_INSIGHTS = 5;
    static final String NORMAL_RANGE = "Metrics are within the normal range";

    private final MetricStore metricStore;

    /**
     * Day-over-day against {@code date - 1} and week-over-week against {@code date - 7}. A
     * missing baseline record leaves that comparison at 0.0.
     */
    public GrowthRates computeGrowth(MetricRecord current, long appId, LocalDate date) {
        Optional<MetricRecord> yesterday = metricStore.getRecord(appId, date.minusDays(1));
        Optional<MetricRecord> lastWeek = metricStore.getRecord(appId, date.minusDays(7));
        if (yesterday.isEmpty()) {
            log.debug("No baseline for {} on {}, day-over-day rates default to 0", appId, date.minusDays(1));
        }

        GrowthRates growth = GrowthRates.empty();
        for (Metric metric : Metric.GROWTH_TRACKED) {
            double now = current.valueOf(metric);
            double dod = yesterday.map(r -> percentChange(r.valueOf(metric), now)).orElse(0.0);
            double wow = lastWeek.map(r -> percentChange(r.valueOf(metric), now)).orElse(0.0);
            growth.put(metric, dod, wow);
        }
        return growth;
    }

    /**
     * {@code (new - old) / old * 100} rounded to two decimals. From a zero baseline any growth
     * is reported as 100%.
     */
    public static double percentChange(double oldValue, double newValue) {
        if (oldValue == 0) {
            return newValue > 0 ? 100.0 : 0.0;
        }
        return round((newValue - oldValue) / oldValue * 100, 2);
    }

    /**
     * Classifies the last {@code days} days up to {@code endDate} by the correlation between
     * date and value: above 0.3 increasing, below -0.3 decreasing. Needs at least three records.
     */
    public TrendAnalysis analyzeTrend(long appId, Metric metric, int days, LocalDate endDate) {
        List<MetricRecord> records = metricStore.listRecords(appId, endDate.minusDays(days), endDate);
        int n = records.size();
        if (n < 3) {
            return TrendAnalysis.insufficient(n);
        }

        double[] x = new double[n];
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            x[i] = records.get(i).getDate().toEpochDay();
            y[i] = records.get(i).valueOf(metric);
        }

        double correlation = correlation(x, y);
        Trend trend;
        double confidence;
        if (Double.isNaN(correlation)) {
            // constant series
            trend = Trend.STABLE;
            confidence = 0;
            correlation = 0;
        } else {
            trend = correlation > 0.3 ? Trend.INCREASING : correlation < -0.3 ? Trend.DECREASING : Trend.STABLE;
            confidence = Math.min(Math.abs(correlation) * 100, 100);
        }

        double mean = mean(y);
        double min = y[0], max = y[0];
        for (double v : y) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        return TrendAnalysis.builder()
                .trend(trend)
                .confidence(round(confidence, 2))
                .correlation(round(correlation, 4))
                .dataPoints(n)
                .mean(mean)
                .standardDeviation(sampleStd(y, mean))
                .min(min)
                .max(max)
                .latest(y[n - 1])
                .changeFromStart(percentChange(y[0], y[n - 1]))
                .build();
    }

    /**
     * Ordered checks on day-over-day rates, weekly trends and the channel mix; at most five,
     * with a neutral line when nothing stands out.
     */
    public List<String> generateInsights(long appId, MetricRecord current, GrowthRates growth) {
        List<String> insights = new ArrayList<>();

        double downloads = growth.dod(Metric.DOWNLOADS);
        if (downloads > 50) insights.add(fmt("Downloads surged %.1f%% day over day", downloads));
        else if (downloads < -30) insights.add(fmt("Downloads dropped %.1f%% day over day", downloads));
        else if (downloads > 10) insights.add(fmt("Downloads grew steadily, %.1f%% day over day", downloads));

        double sessions = growth.dod(Metric.SESSIONS);
        if (sessions > 30) insights.add(fmt("Engagement is up: sessions grew %.1f%%", sessions));
        else if (sessions < -20) insights.add(fmt("Engagement is down: sessions fell %.1f%%", sessions));

        double uninstalls = growth.dod(Metric.UNINSTALLS);
        if (uninstalls > 50) insights.add(fmt("Uninstalls jumped %.1f%%, watch for churn", uninstalls));
        else if (uninstalls < -30) insights.add(fmt("Uninstalls fell %.1f%%, retention is improving", uninstalls));
        else if (uninstalls > 20) insights.add(fmt("Uninstalls rose %.1f%%", uninstalls));

        double devices = growth.dod(Metric.UNIQUE_DEVICES);
        if (devices > 25) insights.add(fmt("Active devices grew strongly, %.1f%%", devices));
        else if (devices < -15) insights.add(fmt("Active devices declined %.1f%%", devices));
        else if (devices > 10) insights.add(fmt("Active devices grew steadily, %.1f%%", devices));

        LocalDate date = current.getDate();
        TrendAnalysis downloadTrend = analyzeTrend(appId, Metric.DOWNLOADS, 7, date);
        if (downloadTrend.isConfident(Trend.INCREASING, 70)) insights.add("Downloads have risen consistently over the past week");
        else if (downloadTrend.isConfident(Trend.DECREASING, 70)) insights.add("Downloads have fallen consistently over the past week");

        TrendAnalysis uninstallTrend = analyzeTrend(appId, Metric.UNINSTALLS, 7, date);
        if (uninstallTrend.isConfident(Trend.INCREASING, 70)) insights.add("Uninstalls have risen consistently over the past week");
        else if (uninstallTrend.isConfident(Trend.DECREASING, 70)) insights.add("Uninstalls have fallen consistently over the past week");

        double search = growth.dod(Metric.SEARCH_DOWNLOADS);
        if (search > 30) insights.add(fmt("Store search downloads grew %.1f%%", search));
        else if (search < -30) insights.add(fmt("Store search downloads fell %.1f%%, review search optimisation", search));

        double web = growth.dod(Metric.WEB_REFERRAL_DOWNLOADS);
        double appReferral = growth.dod(Metric.APP_REFERRAL_DOWNLOADS);
        if (web > 50) insights.add(fmt("Web referral downloads surged %.1f%%", web));
        else if (appReferral > 50) insights.add(fmt("App referral downloads surged %.1f%%", appReferral));

        if (current.getDownloads() > 0) {
            double total = current.getDownloads();
            double searchShare = current.getSearchDownloads() / total * 100;
            double externalShare = (current.getWebReferralDownloads() + current.getAppReferralDownloads()) / total * 100;
            if (searchShare > 80) insights.add(fmt("%.1f%% of downloads come from store search; traffic is concentrated", searchShare));
            else if (externalShare > 30) insights.add(fmt("%.1f%% of downloads come from external referrals; traffic is diversified", externalShare));
        }

        if (insights.isEmpty()) {
            insights.add(NORMAL_RANGE);
        }
        return insights.size() > MAX_INSIGHTS ? new ArrayList<>(insights.subList(0, MAX_INSIGHTS)) : insights;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    static double round(double value, int places) {
        return BigDecimal.valueOf(value).setScale(places, RoundingMode.HALF_UP).doubleValue();
    }

    private static String fmt(String pattern, double value) {
        return String.format(Locale.ROOT, pattern, value);
    }

    private static double mean(double[] values) {
        double sum = 0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    private static double sampleStd(double[] values, double mean) {
        double squares = 0;
        for (double v : values) squares += (v - mean) * (v - mean);
        return Math.sqrt(squares / (values.length - 1));
    }

    private static double correlation(double[] x, double[] y) {
        double mx = mean(x), my = mean(y);
        double cov = 0, vx = 0, vy = 0;
        for (int i = 0; i < x.length; i++) {
            cov += (x[i] - mx) * (y[i] - my);
            vx += (x[i] - mx) * (x[i] - mx);
            vy += (y[i] - my) * (y[i] - my);
        }
        if (vx == 0 || vy == 0) {
            return Double.NaN;
        }
        return cov / Math.sqrt(vx * vy);
    }
}
