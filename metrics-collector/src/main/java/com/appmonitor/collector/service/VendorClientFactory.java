package com.appmonitor.collector.service;

import com.appmonitor.collector.config.AppMonitorProperties;
import com.appmonitor.collector.exception.ConfigurationException;
import com.appmonitor.collector.model.Platform;
import com.appmonitor.collector.output.CredentialProvider;
import com.appmonitor.collector.output.GcsObjectStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.Map;

/**
 * Builds vendor clients from the platform credentials. A client is reused for as long as its
 * credentials stay unchanged, so cached tokens survive between runs.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class VendorClientFactory {

    private final CredentialProvider credentialProvider;
    private final RestTemplate restTemplate;
    private final RetryableHttp retryableHttp;
    private final ObjectMapper objectMapper;
    private final SegmentDownloader segmentDownloader;
    private final InstallReportProcessor installReportProcessor;
    private final OverviewCsvParser overviewCsvParser;
    private final AppMonitorProperties properties;
    private final Clock clock;

    private Map<String, String> reportClientConfig;
    private AppStoreReportClient reportClient;
    private Map<String, String> bulkClientConfig;
    private PlayStatsClient bulkClient;

    public synchronized AppStoreReportClient reportClient() {
        Map<String, String> config = credentialProvider.getPlatformConfig(Platform.IOS);
        if (reportClient != null && config.equals(reportClientConfig)) {
            return reportClient;
        }
        AppStoreTokenProvider tokens = new AppStoreTokenProvider(
                require(config, Platform.IOS, "issuer_id"),
                require(config, Platform.IOS, "key_id"),
                require(config, Platform.IOS, "private_key"),
                properties.getReportApi().getTokenLifetime(),
                clock);
        reportClient = new AppStoreReportClient(restTemplate, retryableHttp, objectMapper, tokens,
                segmentDownloader, installReportProcessor, properties.getReportApi());
        reportClientConfig = Map.copyOf(config);
        log.info("Created report API client for issuer {}", config.get("issuer_id"));
        return reportClient;
    }

    public synchronized PlayStatsClient bulkClient() {
        Map<String, String> config = credentialProvider.getPlatformConfig(Platform.ANDROID);
        if (bulkClient != null && config.equals(bulkClientConfig)) {
            return bulkClient;
        }
        PlayAccessTokenProvider tokens = PlayAccessTokenProvider.fromServiceAccountJson(
                require(config, Platform.ANDROID, "service_account_key"),
                properties.getBulk().getTokenScope(),
                retryableHttp,
                clock);
        String bucket = first(config, "gcs_bucket_name", "bucket_name");
        String projectId = first(config, "gcs_project_id", "project_id");
        bulkClient = new PlayStatsClient(new GcsObjectStore(tokens, projectId), tokens, overviewCsvParser,
                retryableHttp, bucket, properties.getBulk().getReportPrefix());
        bulkClientConfig = Map.copyOf(config);
        log.info("Created bulk export client for bucket {}", bucket);
        return bulkClient;
    }

    private static String require(Map<String, String> config, Platform platform, String key) {
        String value = config.get(key);
        if (value == null || value.isBlank()) {
            throw new ConfigurationException("Missing " + platform.key() + " credential '" + key + "'");
        }
        return value;
    }

    private static String first(Map<String, String> config, String key, String alias) {
        String value = config.get(key);
        return value != null && !value.isBlank() ? value : config.get(alias);
    }
}
