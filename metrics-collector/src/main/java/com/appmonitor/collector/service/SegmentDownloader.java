package com.appmonitor.collector.service;

import com.appmonitor.collector.config.AppMonitorProperties;
import com.appmonitor.collector.exception.ExecutionTimeoutException;
import com.appmonitor.collector.exception.VendorApiException;
import com.appmonitor.collector.scheduler.ExecutionDeadline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.zip.GZIPInputStream;

/**
 * Downloads a report segment from its pre-signed URL and parses it. Segments are normally
 * gzip-compressed; plain bodies are read as-is.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SegmentDownloader {

    private final HttpClient httpClient;
    private final ReportCsvParser parser;
    private final AppMonitorProperties properties;

    public List<ReportRow> download(String url, ExecutionDeadline deadline) {
        deadline.checkpoint();
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(deadline.capTimeout(properties.getReportApi().getSegmentTimeout()))
                .GET()
                .build();

        try {
            HttpResponse<InputStream> response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
            try (InputStream body = response.body()) {
                if (response.statusCode() != 200) {
                    throw new VendorApiException(response.statusCode(), "Segment download failed");
                }
                List<ReportRow> rows = parser.parse(new InputStreamReader(decompress(body), StandardCharsets.UTF_8));
                log.debug("Segment returned {} rows", rows.size());
                return rows;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExecutionTimeoutException("Interrupted while downloading report segment");
        } catch (IOException e) {
            throw new UncheckedIOException("Segment download failed: " + e.getMessage(), e);
        }
    }

    private InputStream decompress(InputStream body) throws IOException {
        BufferedInputStream buffered = new BufferedInputStream(body, 65536);
        buffered.mark(2);
        int first = buffered.read();
        int second = buffered.read();
        buffered.reset();
        if (first == 0x1f && second == 0x8b) {
            return new GZIPInputStream(buffered, 65536);
        }
        return buffered;
    }
}
