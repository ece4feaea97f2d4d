package com.appmonitor.collector.service;

import com.appmonitor.collector.config.AppMonitorProperties;
import com.appmonitor.collector.exception.VendorApiException;
import com.appmonitor.collector.scheduler.ExecutionDeadline;
import com.google.cloud.storage.StorageException;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;

import java.io.UncheckedIOException;
import java.util.Set;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Retries vendor network calls with exponential backoff and jitter.
 *
 * The wait before retry n is {@code delayBase * backoffFactor^(n-1)} plus up to 10% jitter.
 * 400, 401, 403 and 404 responses are rethrown at once; any other HTTP status or transport
 * failure is retried until the attempts run out. Everything else propagates immediately.
 */
@Component
@Slf4j
public class RetryableHttp {

    static final Set<Integer> NON_RETRYABLE_STATUSES = Set.of(400, 401, 403, 404);

    private final RetryRegistry registry;
    private final long delayBaseMillis;
    private final double backoffFactor;

    public RetryableHttp(AppMonitorProperties properties) {
        AppMonitorProperties.RetrySettings settings = properties.getRetry();
        this.delayBaseMillis = settings.getDelayBase().toMillis();
        this.backoffFactor = settings.getBackoffFactor();

        RetryConfig config = RetryConfig.custom()
                .maxAttempts(settings.getMaxRetries() + 1)
                .intervalFunction(this::delayMillis)
                .retryOnException(RetryableHttp::isRetryable)
                .build();
        this.registry = RetryRegistry.of(config);
        this.registry.getEventPublisher().onEntryAdded(event -> event.getAddedEntry().getEventPublisher()
                .onRetry(e -> log.warn("{}: attempt {} failed ({}), retrying in {} ms",
                        e.getName(), e.getNumberOfRetryAttempts(),
                        e.getLastThrowable() != null ? e.getLastThrowable().getMessage() : "unknown",
                        e.getWaitInterval().toMillis()))
                .onError(e -> log.error("{}: giving up after {} attempts: {}",
                        e.getName(), e.getNumberOfRetryAttempts(),
                        e.getLastThrowable() != null ? e.getLastThrowable().getMessage() : "unknown")));
    }

    public <T> T execute(String name, Supplier<T> call) {
        return execute(name, ExecutionDeadline.none(), call);
    }

    /**
     * Runs {@code call} under the named retry. The deadline is checked before every attempt,
     * so a cancelled run never starts another one.
     */
    public <T> T execute(String name, ExecutionDeadline deadline, Supplier<T> call) {
        Retry retry = registry.retry(name);
        Supplier<T> guarded = () -> {
            deadline.checkpoint();
            return call.get();
        };
        return Retry.decorateSupplier(retry, guarded).get();
    }

    long delayMillis(int attempt) {
        double delay = delayBaseMillis * Math.pow(backoffFactor, attempt - 1);
        double jitter = delay * 0.1 * ThreadLocalRandom.current().nextDouble();
        return Math.round(delay + jitter);
    }

    static boolean isRetryable(Throwable error) {
        if (Thread.currentThread().isInterrupted()) {
            return false;
        }
        if (error instanceof RestClientResponseException response) {
            return !NON_RETRYABLE_STATUSES.contains(response.getStatusCode().value());
        }
        if (error instanceof VendorApiException vendor) {
            return !NON_RETRYABLE_STATUSES.contains(vendor.getStatusCode());
        }
        if (error instanceof StorageException storage) {
            return !NON_RETRYABLE_STATUSES.contains(storage.getCode());
        }
        return error instanceof ResourceAccessException || error instanceof UncheckedIOException;
    }
}
