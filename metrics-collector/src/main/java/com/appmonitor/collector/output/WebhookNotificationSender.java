package com.appmonitor.collector.output;

import com.appmonitor.collector.model.Anomaly;
import com.appmonitor.collector.model.DailyReport;
import com.appmonitor.collector.model.DeliveryCheck;
import com.appmonitor.collector.model.DownloadChannel;
import com.appmonitor.collector.model.Severity;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Posts interactive cards to chat webhooks (Lark-style {@code msg_type}/{@code card} payloads).
 * A webhook that answers with a JSON {@code code} counts as delivered only when it is 0.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class WebhookNotificationSender implements NotificationSender {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final RestTemplate restTemplate;
    private final Clock clock;

    // ── NotificationSender ────────────────────────────────────────────────────

    @Override
    public boolean sendDailyReport(String target, DailyReport report) {
        List<Map<String, Object>> elements = new ArrayList<>();
        elements.add(markdown("**" + report.getSummary() + "**"));

        StringBuilder metrics = new StringBuilder();
        report.getMetrics().forEach((metric, line) -> metrics
                .append("**").append(metric.getDisplayName()).append("**: ")
                .append(String.format(Locale.ROOT, "%,.0f", line.value()))
                .append(" | DoD ").append(change(line.dayOverDay()))
                .append(" | WoW ").append(change(line.weekOverWeek()))
                .append('\n'));
        elements.add(markdown(metrics.toString().trim()));

        StringBuilder channels = new StringBuilder("**Download channels**\n");
        for (Map.Entry<DownloadChannel, Long> entry : report.getChannelBreakdown().entrySet()) {
            channels.append(entry.getKey().getMetric().getDisplayName()).append(": ")
                    .append(String.format(Locale.ROOT, "%,d", entry.getValue())).append('\n');
        }
        elements.add(markdown(channels.toString().trim()));

        if (!report.getInsights().isEmpty()) {
            elements.add(markdown("**Insights**\n- " + String.join("\n- ", report.getInsights())));
        }
        elements.add(note("Report date: " + report.getDate()));

        return post(target, card("blue", report.getAppName() + " daily report", elements));
    }

    @Override
    public boolean sendAlert(String target, Anomaly anomaly) {
        String title = anomaly.getAppName() + " " + anomaly.getMetric().getDisplayName() + " "
                + anomaly.getDirection().getLabel();
        List<Map<String, Object>> elements = List.of(
                markdown(anomaly.getMessage()),
                markdown("**Severity**: " + anomaly.getSeverity().getDescription()),
                note("Data date: " + anomaly.getDate()));
        return post(target, card(colour(anomaly.getSeverity()), title, elements));
    }

    @Override
    public boolean sendSystemNotification(String target, String title, String body, String level) {
        String template = switch (level == null ? "info" : level) {
            case "error" -> "red";
            case "warning" -> "orange";
            default -> "blue";
        };
        return post(target, card(template, title, List.of(
                markdown(body != null ? body : ""),
                note("Sent at " + LocalDateTime.now(clock).format(TIMESTAMP)))));
    }

    @Override
    public DeliveryCheck testTarget(String target) {
        Map<String, Object> message = Map.of(
                "msg_type", "text",
                "content", Map.of("text", "App monitor connection test\nTime: " + LocalDateTime.now(clock).format(TIMESTAMP)));
        boolean delivered = post(target, message);
        return new DeliveryCheck(delivered, delivered ? "Test message delivered" : "Test message was not delivered");
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private boolean post(String target, Map<String, Object> payload) {
        if (target == null || target.isBlank()) {
            return false;
        }
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        try {
            JsonNode response = restTemplate.postForObject(target, new HttpEntity<>(payload, headers), JsonNode.class);
            if (response != null && response.has("code") && response.get("code").asInt() != 0) {
                log.error("Webhook rejected message: {}", response);
                return false;
            }
            log.info("Notification delivered to {}", target);
            return true;
        } catch (RestClientException e) {
            log.error("Notification to {} failed: {}", target, e.getMessage());
            return false;
        }
    }

    private static Map<String, Object> card(String template, String title, List<Map<String, Object>> elements) {
        Map<String, Object> header = new LinkedHashMap<>();
        header.put("template", template);
        header.put("title", Map.of("tag", "plain_text", "content", title));

        Map<String, Object> card = new LinkedHashMap<>();
        card.put("config", Map.of("wide_screen_mode", true));
        card.put("header", header);
        card.put("elements", elements);

        Map<String, Object> message = new LinkedHashMap<>();
        message.put("msg_type", "interactive");
        message.put("card", card);
        return message;
    }

    private static Map<String, Object> markdown(String content) {
        return Map.of("tag", "div", "text", Map.of("tag", "lark_md", "content", content));
    }

    private static Map<String, Object> note(String content) {
        return Map.of("tag", "note", "elements", List.of(Map.of("tag", "plain_text", "content", content)));
    }

    private static String change(double percent) {
        return percent == 0 ? "0%" : String.format(Locale.ROOT, "%+.1f%%", percent);
    }

    static String colour(Severity severity) {
        return switch (severity) {
            case CRITICAL -> "red";
            case HIGH -> "orange";
            case MEDIUM -> "yellow";
            case LOW -> "grey";
        };
    }
}
