package com.example.webhookpipeline.notification;

import com.example.webhookpipeline.realtime.EventSubscription;
import com.example.webhookpipeline.realtime.RealtimeEvent;
import com.example.webhookpipeline.realtime.RealtimeEventEmitter;
import com.example.webhookpipeline.realtime.RealtimeEventType;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 通知触发服务：订阅 metrics.updated 与 anomaly.detected，按阈值生成通知并依次调用已注册的回调。
 */
@Service
@Slf4j
public class NotificationTriggerService {

    public static final List<NotificationThreshold> DEFAULT_THRESHOLDS = List.of(
            new NotificationThreshold("revenue", -10, -25, NotificationDirection.BELOW, NotificationPeriod.DAILY),
            new NotificationThreshold("orders", -15, -30, NotificationDirection.BELOW, NotificationPeriod.DAILY),
            new NotificationThreshold("aov", -5, -15, NotificationDirection.BELOW, NotificationPeriod.DAILY),
            new NotificationThreshold("conversion_rate", -10, -20, NotificationDirection.BELOW,
                    NotificationPeriod.DAILY),
            new NotificationThreshold("churn_rate", 10, 25, NotificationDirection.ABOVE, NotificationPeriod.WEEKLY),
            new NotificationThreshold("mrr", -5, -15, NotificationDirection.BELOW, NotificationPeriod.WEEKLY));

    private final List<NotificationCallback> callbacks = new CopyOnWriteArrayList<>();
    private final Map<String, List<NotificationThreshold>> workspaceThresholds = new ConcurrentHashMap<>();
    private final List<NotificationThreshold> defaultThresholds;
    private final RealtimeEventEmitter emitter;
    private final List<EventSubscription> subscriptions = new ArrayList<>();

    public NotificationTriggerService(RealtimeEventEmitter emitter) {
        this.emitter = emitter;
        this.defaultThresholds = DEFAULT_THRESHOLDS;
    }

    @PostConstruct
    public void init() {
        subscriptions.add(emitter.subscribe(RealtimeEventType.METRICS_UPDATED, this::processEvent));
        subscriptions.add(emitter.subscribe(RealtimeEventType.ANOMALY_DETECTED, this::processEvent));
        log.info("[Notification] Subscribed to metric updates and anomalies");
    }

    @PreDestroy
    public void shutdown() {
        subscriptions.forEach(EventSubscription::unsubscribe);
        subscriptions.clear();
    }

    public void setWorkspaceThresholds(String workspaceId, List<NotificationThreshold> thresholds) {
        workspaceThresholds.put(workspaceId, List.copyOf(thresholds));
        log.info("[Notification] Custom thresholds set for workspace {} ({} thresholds)",
                workspaceId, thresholds.size());
    }

    /**
     * 获取工作区阈值，未自定义时返回默认阈值。
     */
    public List<NotificationThreshold> getThresholds(String workspaceId) {
        if (workspaceId != null) {
            List<NotificationThreshold> custom = workspaceThresholds.get(workspaceId);
            if (custom != null) {
                return custom;
            }
        }
        return defaultThresholds;
    }

    /**
     * 注册回调。
     *
     * @return 调用后取消注册
     */
    public Runnable onNotification(NotificationCallback callback) {
        callbacks.add(callback);
        return () -> callbacks.remove(callback);
    }

    public Optional<MetricNotification> processEvent(RealtimeEvent event) {
        if (event.getType() == RealtimeEventType.METRICS_UPDATED) {
            return processMetricUpdate(event);
        }
        if (event.getType() == RealtimeEventType.ANOMALY_DETECTED) {
            return processAnomaly(event);
        }
        return Optional.empty();
    }

    /**
     * 判断变化是否越过阈值。
     *
     * @return CRITICAL / WARNING；未越过返回 null
     */
    static NotificationType checkThresholdBreach(double changePercent, NotificationThreshold threshold) {
        boolean breached;
        boolean critical;
        switch (threshold.getDirection()) {
            case BELOW:
                breached = changePercent <= threshold.getWarningThreshold();
                critical = changePercent <= threshold.getCriticalThreshold();
                break;
            case ABOVE:
                breached = changePercent >= threshold.getWarningThreshold();
                critical = changePercent >= threshold.getCriticalThreshold();
                break;
            default:
                breached = Math.abs(changePercent) >= Math.abs(threshold.getWarningThreshold());
                critical = Math.abs(changePercent) >= Math.abs(threshold.getCriticalThreshold());
        }
        if (critical) {
            return NotificationType.CRITICAL;
        }
        return breached ? NotificationType.WARNING : null;
    }

    private Optional<MetricNotification> processMetricUpdate(RealtimeEvent event) {
        String metricName = event.string("metricName");
        if (metricName == null) {
            return Optional.empty();
        }
        double changePercent = event.number("changePercent");
        // "current" 等非周期值匹配该指标的任意阈值
        Optional<NotificationPeriod> period = NotificationPeriod.fromWireName(event.string("period"));

        NotificationThreshold threshold = getThresholds(event.getWorkspaceId()).stream()
                .filter(t -> t.getMetricName().equals(metricName))
                .filter(t -> period.isEmpty() || t.getPeriod() == period.get())
                .findFirst()
                .orElse(null);
        if (threshold == null) {
            return Optional.empty();
        }

        NotificationType type = checkThresholdBreach(changePercent, threshold);
        if (type == null) {
            return Optional.empty();
        }

        MetricNotification notification = MetricNotification.builder()
                .id(UUID.randomUUID().toString())
                .workspaceId(event.getWorkspaceId())
                .type(type)
                .source(NotificationSource.METRIC_CHANGE)
                .title(metricName + (type == NotificationType.CRITICAL ? " Alert" : " Warning"))
                .message(metricMessage(metricName, changePercent, threshold, type))
                .metricName(metricName)
                .currentValue(event.number("currentValue"))
                .previousValue(event.number("previousValue"))
                .changePercent(changePercent)
                .threshold(threshold)
                .timestamp(event.getTimestamp())
                .build();
        notifyCallbacks(notification);
        return Optional.of(notification);
    }

    private Optional<MetricNotification> processAnomaly(RealtimeEvent event) {
        String severity = Optional.ofNullable(event.string("severity")).orElse("medium");
        NotificationType type = "critical".equals(severity) || "high".equals(severity)
                ? NotificationType.CRITICAL
                : NotificationType.WARNING;

        MetricNotification notification = MetricNotification.builder()
                .id(UUID.randomUUID().toString())
                .workspaceId(event.getWorkspaceId())
                .type(type)
                .source(NotificationSource.ANOMALY)
                .title(Optional.ofNullable(event.string("title")).orElse("Anomaly Detected"))
                .message(Optional.ofNullable(event.string("description")).orElse("An anomaly was detected"))
                .metricName(Optional.ofNullable(event.string("metricName")).orElse("unknown"))
                .currentValue(event.number("currentValue"))
                .previousValue(event.number("previousValue"))
                .changePercent(event.number("changePercent"))
                .timestamp(event.getTimestamp())
                .data(Map.of("anomalyId", Optional.ofNullable(event.string("anomalyId")).orElse(""),
                        "severity", severity))
                .build();
        notifyCallbacks(notification);
        return Optional.of(notification);
    }

    private void notifyCallbacks(MetricNotification notification) {
        log.info("[Notification] Triggered {} {} notification for {} in workspace {}",
                notification.getType(), notification.getSource(), notification.getMetricName(),
                notification.getWorkspaceId());
        for (NotificationCallback callback : callbacks) {
            try {
                callback.onNotification(notification);
            } catch (Exception e) {
                log.error("[Notification] Callback failed for notification {}: {}",
                        notification.getId(), e.getMessage(), e);
            }
        }
    }

    private static String metricMessage(String metricName, double changePercent, NotificationThreshold threshold,
            NotificationType type) {
        String direction = changePercent > 0 ? "increased" : "decreased";
        String severity = type == NotificationType.CRITICAL ? "significantly " : "";
        double limit = type == NotificationType.CRITICAL
                ? threshold.getCriticalThreshold()
                : threshold.getWarningThreshold();
        return String.format(Locale.ROOT, "%s has %s%s by %.1f%% in the %s period. Threshold: %s%%",
                metricName, severity, direction, Math.abs(changePercent), threshold.getPeriod().wireName(),
                formatThreshold(limit));
    }

    private static String formatThreshold(double value) {
        return value == Math.rint(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
