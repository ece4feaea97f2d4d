package com.appmonitor.collector.output;

import com.appmonitor.collector.model.Anomaly;
import com.appmonitor.collector.model.MetricRecord;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Storage of per-day metric records and alert logs.
 */
public interface MetricStore {

    Optional<MetricRecord> getRecord(long appId, LocalDate date);

    /**
     * Inserts or replaces the record for its (app, date). Safe against concurrent writers of
     * the same key: the last write wins and no duplicate-key error escapes.
     */
    void upsertRecord(MetricRecord record);

    /** Records in {@code [from, to]}, oldest first. */
    List<MetricRecord> listRecords(long appId, LocalDate from, LocalDate to);

    /** @return id of the new alert log entry */
    long createAlertLog(Anomaly anomaly);

    void markAlertSent(long alertLogId);
}
