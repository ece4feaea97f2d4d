package com.appmonitor.collector.service;

import com.appmonitor.collector.model.VendorFetchResult;
import com.appmonitor.collector.scheduler.ExecutionDeadline;

import java.time.LocalDate;

/**
 * One vendor analytics source. Implementations never throw for vendor-side failures: the
 * error comes back in the result with zero-valued metrics. Only an expired or cancelled
 * deadline escapes as {@link com.appmonitor.collector.exception.ExecutionTimeoutException}.
 *
 * @param <T> typed vendor payload
 */
public interface VendorClient<T> {

    VendorFetchResult<T> fetchDailyMetrics(String externalId, LocalDate targetDate, ExecutionDeadline deadline);
}
