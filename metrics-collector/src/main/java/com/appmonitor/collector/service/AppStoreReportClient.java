package com.appmonitor.collector.service;

import com.appmonitor.collector.config.AppMonitorProperties;
import com.appmonitor.collector.exception.CollectionException;
import com.appmonitor.collector.exception.ConfigurationException;
import com.appmonitor.collector.exception.ExecutionTimeoutException;
import com.appmonitor.collector.exception.VendorApiException;
import com.appmonitor.collector.model.AnalyticsApiDocument;
import com.appmonitor.collector.model.AnalyticsApiErrors;
import com.appmonitor.collector.model.AnalyticsApiPage;
import com.appmonitor.collector.model.AnalyticsApiResource;
import com.appmonitor.collector.model.FailureKind;
import com.appmonitor.collector.model.InstallReportSummary;
import com.appmonitor.collector.model.ReportApiMetrics;
import com.appmonitor.collector.model.SessionReportSummary;
import com.appmonitor.collector.model.VendorFetchResult;
import com.appmonitor.collector.scheduler.ExecutionDeadline;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.UncheckedIOException;
import java.net.URI;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.Supplier;

/**
 * Client for the async-report analytics API (iOS).
 *
 * Report generation is asynchronous: the client keeps a single ONGOING report request per app,
 * which the vendor regenerates daily. A fetch for day D walks
 * app -> report request -> reports -> daily instances processed on D+1 -> segments -> TSV rows.
 *
 * A 4xx response anywhere aborts the fetch. Any other failure inside one instance only marks that
 * instance failed; the remaining instances still count.
 */
@Slf4j
public class AppStoreReportClient implements VendorClient<ReportApiMetrics> {

    static final String INSTALL_REPORT = "App Downloads Standard";
    static final String INSTALL_DETAIL_REPORT = "App Store Installation and Deletion Standard";
    static final String SESSION_REPORT = "App Sessions Standard";

    private final RestTemplate restTemplate;
    private final RetryableHttp retryableHttp;
    private final ObjectMapper objectMapper;
    private final AppStoreTokenProvider tokenProvider;
    private final SegmentDownloader segmentDownloader;
    private final InstallReportProcessor processor;
    private final AppMonitorProperties.ReportApi settings;

    public AppStoreReportClient(RestTemplate restTemplate,
                                RetryableHttp retryableHttp,
                                ObjectMapper objectMapper,
                                AppStoreTokenProvider tokenProvider,
                                SegmentDownloader segmentDownloader,
                                InstallReportProcessor processor,
                                AppMonitorProperties.ReportApi settings) {
        this.restTemplate = restTemplate;
        this.retryableHttp = retryableHttp;
        this.objectMapper = objectMapper;
        this.tokenProvider = tokenProvider;
        this.segmentDownloader = segmentDownloader;
        this.processor = processor;
        this.settings = settings;
    }

    @Override
    public VendorFetchResult<ReportApiMetrics> fetchDailyMetrics(String bundleId, LocalDate targetDate,
                                                                 ExecutionDeadline deadline) {
        try {
            String appId = lookupAppId(bundleId, deadline);
            log.info("Resolved bundle {} to app {}", bundleId, appId);

            String requestId = findOrCreateOngoingRequest(appId, deadline);
            Map<String, String> reports = listReports(requestId, deadline);

            InstallReportSummary installs = null;
            InstallReportSummary installDetail = null;
            SessionReportSummary sessions = null;

            String installReportId = reports.get(INSTALL_REPORT);
            if (installReportId != null) {
                InstallReportSummary summary = new InstallReportSummary();
                summary.setReportId(installReportId);
                if (processInstances(installReportId, targetDate, deadline, summary::setTotalInstances,
                        summary::instanceFailed, rows -> processor.addInstallRows(summary, rows, targetDate))) {
                    installs = summary;
                }
            }

            String detailReportId = reports.get(INSTALL_DETAIL_REPORT);
            if (detailReportId != null) {
                InstallReportSummary summary = new InstallReportSummary();
                summary.setReportId(detailReportId);
                if (processInstances(detailReportId, targetDate, deadline, summary::setTotalInstances,
                        summary::instanceFailed, rows -> processor.addDeletionRows(summary, rows))) {
                    installDetail = summary;
                    processor.computeTotals(installDetail, targetDate);
                    if (installs != null) {
                        processor.mergeDeletions(installs, installDetail);
                    }
                }
            }

            if (installs != null) {
                processor.computeTotals(installs, targetDate);
            }

            String sessionReportId = reports.get(SESSION_REPORT);
            if (sessionReportId != null) {
                SessionReportSummary summary = new SessionReportSummary();
                summary.setReportId(sessionReportId);
                if (processInstances(sessionReportId, targetDate, deadline, summary::setTotalInstances,
                        summary::instanceFailed, rows -> processor.addSessionRows(summary, rows))) {
                    sessions = summary;
                    processor.computeTotals(sessions, targetDate);
                }
            }

            ReportApiMetrics metrics = ReportApiMetrics.builder()
                    .bundleId(bundleId)
                    .vendorAppId(appId)
                    .reportRequestId(requestId)
                    .targetDate(targetDate)
                    .installs(installs)
                    .installDetail(installDetail)
                    .sessions(sessions)
                    .build();

            log.info("Report API totals for {} on {}: downloads={}, uninstalls={}, sessions={}",
                    bundleId, targetDate, metrics.downloads(), metrics.uninstalls(), metrics.sessionCount());
            return VendorFetchResult.success(metrics);

        } catch (ExecutionTimeoutException e) {
            throw e;
        } catch (VendorApiException e) {
            log.error("Report API request failed for {}: {}", bundleId, e.getMessage());
            return VendorFetchResult.failure(ReportApiMetrics.empty(bundleId, targetDate),
                    e.getKind(), e.getStatusCode(), e.getMessage());
        } catch (CollectionException e) {
            log.error("Report API fetch failed for {}: {}", bundleId, e.getMessage());
            return VendorFetchResult.failure(ReportApiMetrics.empty(bundleId, targetDate),
                    e.getKind(), null, e.getMessage());
        } catch (RestClientException | UncheckedIOException e) {
            deadline.checkpoint();
            log.error("Report API unreachable for {}: {}", bundleId, e.getMessage());
            return VendorFetchResult.failure(ReportApiMetrics.empty(bundleId, targetDate),
                    FailureKind.TRANSIENT_NETWORK, null, e.getMessage());
        }
    }

    // ── Protocol steps ───────────────────────────────────────────────────────

    String lookupAppId(String bundleId, ExecutionDeadline deadline) {
        URI uri = endpoint("apps")
                .queryParam("filter[bundleId]", bundleId)
                .queryParam("fields[apps]", "name,bundleId,primaryLocale")
                .encode().build().toUri();
        List<AnalyticsApiResource> apps = getAll(uri, deadline);
        if (apps.isEmpty()) {
            throw new ConfigurationException("No app found for bundle id " + bundleId);
        }
        return apps.get(0).getId();
    }

    String findOrCreateOngoingRequest(String appId, ExecutionDeadline deadline) {
        URI uri = endpoint("apps/" + appId + "/analyticsReportRequests")
                .queryParam("filter[accessType]", "ONGOING")
                .queryParam("fields[analyticsReportRequests]", "accessType,stoppedDueToInactivity")
                .encode().build().toUri();
        for (AnalyticsApiResource request : getAll(uri, deadline)) {
            if (request.isActiveOngoingRequest()) {
                log.info("Reusing ongoing report request {} for app {}", request.getId(), appId);
                return request.getId();
            }
        }

        Map<String, Object> body = Map.of("data", Map.of(
                "type", "analyticsReportRequests",
                "attributes", Map.of("accessType", "ONGOING"),
                "relationships", Map.of("app", Map.of("data", Map.of("type", "apps", "id", appId)))));
        URI createUri = endpoint("analyticsReportRequests").build().toUri();
        AnalyticsApiDocument created = call("createReportRequest", deadline,
                () -> restTemplate.exchange(createUri, HttpMethod.POST, new HttpEntity<>(body, headers()),
                        AnalyticsApiDocument.class).getBody());
        if (created == null || created.getData() == null || created.getData().getId() == null) {
            throw new CollectionException(FailureKind.PARSE, "Report request creation returned no id");
        }
        log.info("Created ongoing report request {} for app {}", created.getData().getId(), appId);
        return created.getData().getId();
    }

    Map<String, String> listReports(String requestId, ExecutionDeadline deadline) {
        URI uri = endpoint("analyticsReportRequests/" + requestId + "/reports")
                .queryParam("filter[name]", String.join(",", INSTALL_REPORT, INSTALL_DETAIL_REPORT, SESSION_REPORT))
                .encode().build().toUri();
        Map<String, String> reportIds = new LinkedHashMap<>();
        for (AnalyticsApiResource report : getAll(uri, deadline)) {
            String name = report.getAttributes() != null ? report.getAttributes().getName() : null;
            if (name != null) {
                reportIds.putIfAbsent(name, report.getId());
            }
        }
        if (reportIds.isEmpty()) {
            log.warn("Report request {} has no generated reports yet", requestId);
        }
        return reportIds;
    }

    List<AnalyticsApiResource> listInstances(String reportId, LocalDate targetDate, ExecutionDeadline deadline) {
        UriComponentsBuilder builder = endpoint("analyticsReports/" + reportId + "/instances")
                .queryParam("filter[granularity]", "DAILY");
        if (targetDate != null) {
            // data for day D is processed on D+1
            builder.queryParam("filter[processingDate]", targetDate.plusDays(1).toString());
        }
        return getAll(builder.encode().build().toUri(), deadline);
    }

    List<AnalyticsApiResource> listSegments(String instanceId, ExecutionDeadline deadline) {
        URI uri = endpoint("analyticsReportInstances/" + instanceId + "/segments").build().toUri();
        return getAll(uri, deadline);
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    /**
     * Downloads every segment of every instance of a report and feeds the rows to
     * {@code rowSink}. Returns false when the report has no instances.
     */
    private boolean processInstances(String reportId, LocalDate targetDate, ExecutionDeadline deadline,
                                     IntConsumer totalSink, Runnable failureSink,
                                     Consumer<List<ReportRow>> rowSink) {
        List<AnalyticsApiResource> instances = listInstances(reportId, targetDate, deadline);
        if (instances.isEmpty()) {
            log.warn("Report {} has no daily instances for {}", reportId, targetDate);
            return false;
        }
        totalSink.accept(instances.size());

        int failed = 0;
        for (int i = 0; i < instances.size(); i++) {
            if (i > 0) {
                pace(deadline);
            }
            AnalyticsApiResource instance = instances.get(i);
            try {
                for (AnalyticsApiResource segment : listSegments(instance.getId(), deadline)) {
                    String url = segment.getAttributes() != null ? segment.getAttributes().getUrl() : null;
                    if (url == null) {
                        log.warn("Segment {} of instance {} has no download url", segment.getId(), instance.getId());
                        continue;
                    }
                    rowSink.accept(retryableHttp.execute("reportSegment", deadline,
                            () -> segmentDownloader.download(url, deadline)));
                }
            } catch (VendorApiException e) {
                if (e.isClientError()) {
                    throw e;
                }
                failed++;
                failureSink.run();
                log.warn("Instance {} of report {} failed: {}", instance.getId(), reportId, e.getMessage());
            } catch (ExecutionTimeoutException e) {
                throw e;
            } catch (CollectionException | RestClientException | UncheckedIOException e) {
                deadline.checkpoint();
                failed++;
                failureSink.run();
                log.warn("Instance {} of report {} failed: {}", instance.getId(), reportId, e.getMessage());
            }
        }
        if (failed > 0) {
            log.warn("Report {}: {} of {} instances failed", reportId, failed, instances.size());
        }
        return true;
    }

    private List<AnalyticsApiResource> getAll(URI first, ExecutionDeadline deadline) {
        List<AnalyticsApiResource> all = new ArrayList<>();
        URI next = first;
        while (next != null) {
            URI uri = next;
            log.debug("GET {}", uri);
            AnalyticsApiPage page = call("reportApi", deadline,
                    () -> restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers()),
                            AnalyticsApiPage.class).getBody());
            if (page == null) {
                break;
            }
            all.addAll(page.getData());
            next = page.nextLink() != null ? URI.create(page.nextLink()) : null;
        }
        return all;
    }

    /**
     * Runs one request under the retry policy, turning error responses into
     * {@link VendorApiException} with the vendor's own detail text.
     */
    private <T> T call(String name, ExecutionDeadline deadline, Supplier<T> request) {
        return retryableHttp.execute(name, deadline, () -> {
            try {
                return request.get();
            } catch (RestClientResponseException e) {
                throw new VendorApiException(e.getStatusCode().value(), errorDetail(e), e);
            }
        });
    }

    private String errorDetail(RestClientResponseException e) {
        String body = e.getResponseBodyAsString();
        try {
            AnalyticsApiErrors errors = objectMapper.readValue(body, AnalyticsApiErrors.class);
            String detail = errors.firstDetail();
            if (detail != null) {
                return detail;
            }
        } catch (Exception parseError) {
            log.debug("Error body is not a JSON:API document: {}", parseError.getMessage());
        }
        return body == null || body.isBlank() ? e.getStatusText() : body;
    }

    private HttpHeaders headers() {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(tokenProvider.currentToken());
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return headers;
    }

    private UriComponentsBuilder endpoint(String path) {
        String base = settings.getBaseUrl().replaceAll("/+$", "");
        return UriComponentsBuilder.fromHttpUrl(base + "/" + path);
    }

    private void pace(ExecutionDeadline deadline) {
        long jitter = settings.getInstanceJitter().toMillis();
        long extra = jitter > 0 ? ThreadLocalRandom.current().nextLong(jitter + 1) : 0;
        deadline.sleep(settings.getInstanceDelay().plus(Duration.ofMillis(extra)));
    }
}
