package com.example.webhookpipeline.delivery;

import com.example.webhookpipeline.config.PipelineProperties;
import com.example.webhookpipeline.notification.MetricNotification;
import com.example.webhookpipeline.notification.NotificationSource;
import com.example.webhookpipeline.notification.NotificationTriggerService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 把触发的通知转发到订阅的出站端点。
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class NotificationForwarder {

    public static final String EVENT_THRESHOLD_EXCEEDED = "metric.threshold_exceeded";
    public static final String EVENT_ANOMALY_DETECTED = "anomaly.detected";

    private final NotificationTriggerService notificationService;
    private final OutboundDeliveryService deliveryService;
    private final PipelineProperties properties;
    private Runnable unregister;

    @PostConstruct
    public void init() {
        if (!properties.getNotifications().isForwardToEndpoints()) {
            log.info("[Notify] Forwarding to outbound endpoints disabled");
            return;
        }
        unregister = notificationService.onNotification(this::forward);
    }

    @PreDestroy
    public void shutdown() {
        if (unregister != null) {
            unregister.run();
        }
    }

    void forward(MetricNotification notification) {
        String eventType = notification.getSource() == NotificationSource.ANOMALY
                ? EVENT_ANOMALY_DETECTED
                : EVENT_THRESHOLD_EXCEEDED;
        int created = deliveryService.dispatch(notification.getWorkspaceId(), eventType, toData(notification)).size();
        log.debug("[Notify] Notification {} forwarded as {} to {} endpoint(s)", notification.getId(), eventType,
                created);
    }

    static Map<String, Object> toData(MetricNotification notification) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("notificationId", notification.getId());
        data.put("type", notification.getType().name().toLowerCase(Locale.ROOT));
        data.put("title", notification.getTitle());
        data.put("message", notification.getMessage());
        data.put("metricName", notification.getMetricName());
        data.put("currentValue", notification.getCurrentValue());
        data.put("previousValue", notification.getPreviousValue());
        data.put("changePercent", notification.getChangePercent());
        if (notification.getThreshold() != null) {
            data.put("warningThreshold", notification.getThreshold().getWarningThreshold());
            data.put("criticalThreshold", notification.getThreshold().getCriticalThreshold());
        }
        data.put("timestamp", notification.getTimestamp() == null ? null : notification.getTimestamp().toString());
        return data;
    }
}
