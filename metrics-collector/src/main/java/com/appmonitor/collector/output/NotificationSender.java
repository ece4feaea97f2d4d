package com.appmonitor.collector.output;

import com.appmonitor.collector.model.Anomaly;
import com.appmonitor.collector.model.DailyReport;
import com.appmonitor.collector.model.DeliveryCheck;

/**
 * Outbound delivery to chat webhooks. Every method reports success instead of throwing;
 * delivery is best-effort.
 */
public interface NotificationSender {

    boolean sendDailyReport(String target, DailyReport report);

    boolean sendAlert(String target, Anomaly anomaly);

    boolean sendSystemNotification(String target, String title, String body, String level);

    DeliveryCheck testTarget(String target);
}
