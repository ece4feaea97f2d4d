package com.appmonitor.collector.service;

import com.appmonitor.collector.exception.ConfigurationException;
import com.appmonitor.collector.scheduler.ExecutionDeadline;
import com.google.auth.oauth2.AccessToken;
import com.google.auth.oauth2.GoogleCredentials;
import lombok.extern.slf4j.Slf4j;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * OAuth2 bearer tokens for the bulk object store, from a service-account key. A token is
 * reused until 60 seconds before it expires.
 */
@Slf4j
public class PlayAccessTokenProvider {

    private static final Duration REFRESH_MARGIN = Duration.ofSeconds(60);

    private final GoogleCredentials credentials;
    private final RetryableHttp retryableHttp;
    private final Clock clock;

    private AccessToken current;

    public PlayAccessTokenProvider(GoogleCredentials credentials, RetryableHttp retryableHttp, Clock clock) {
        this.credentials = credentials;
        this.retryableHttp = retryableHttp;
        this.clock = clock;
    }

    public static PlayAccessTokenProvider fromServiceAccountJson(String json, String scope,
                                                                 RetryableHttp retryableHttp, Clock clock) {
        if (json == null || json.isBlank()) {
            throw new ConfigurationException("Bulk source service account key is not configured");
        }
        try {
            GoogleCredentials credentials = GoogleCredentials
                    .fromStream(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)))
                    .createScoped(scope);
            return new PlayAccessTokenProvider(credentials, retryableHttp, clock);
        } catch (IOException e) {
            throw new ConfigurationException("Bulk source service account key is invalid: " + e.getMessage(), e);
        }
    }

    public synchronized AccessToken currentToken(ExecutionDeadline deadline) {
        if (current == null || isExpiring(current)) {
            current = retryableHttp.execute("bulkToken", deadline, () -> {
                try {
                    credentials.refresh();
                    return credentials.getAccessToken();
                } catch (IOException e) {
                    throw new UncheckedIOException("Token refresh failed: " + e.getMessage(), e);
                }
            });
            log.debug("Refreshed bulk source token, expires {}", current.getExpirationTime());
        }
        return current;
    }

    private boolean isExpiring(AccessToken token) {
        if (token.getExpirationTime() == null) {
            return false;
        }
        Instant expires = token.getExpirationTime().toInstant();
        return !clock.instant().isBefore(expires.minus(REFRESH_MARGIN));
    }
}
