package com.example.webhookpipeline.anomaly;

import com.example.webhookpipeline.config.PipelineProperties;
import com.example.webhookpipeline.metrics.MetricNames;
import com.example.webhookpipeline.model.AnomalyRecord;
import com.example.webhookpipeline.model.AnomalySeverity;
import com.example.webhookpipeline.realtime.EventSubscription;
import com.example.webhookpipeline.realtime.RealtimeEvent;
import com.example.webhookpipeline.realtime.RealtimeEventEmitter;
import com.example.webhookpipeline.realtime.RealtimeEventType;
import com.example.webhookpipeline.repository.AnomalyRecordRepository;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 实时异常检测：订阅 metrics.updated，按阈值判定严重级别，同一 (工作区, 指标) 在冷却期内只告警一次。
 */
@Service
@Slf4j
public class AnomalyDetector {

    private static final Map<String, MetricThreshold> DEFAULT_THRESHOLDS = Map.of(
            MetricNames.REVENUE, new MetricThreshold("Revenue", 20, 40, ThresholdDirection.BOTH),
            MetricNames.ORDERS, new MetricThreshold("Orders", 25, 50, ThresholdDirection.BOTH),
            MetricNames.AOV, new MetricThreshold("Average Order Value", 15, 30, ThresholdDirection.BOTH),
            MetricNames.CUSTOMERS, new MetricThreshold("Customers", 20, 40, ThresholdDirection.INCREASE),
            MetricNames.MRR, new MetricThreshold("Monthly Recurring Revenue", 10, 20, ThresholdDirection.BOTH),
            MetricNames.ACTIVE_SUBSCRIPTIONS,
            new MetricThreshold("Active Subscriptions", 15, 30, ThresholdDirection.BOTH),
            "churn", new MetricThreshold("Churn Rate", 10, 25, ThresholdDirection.INCREASE));

    private final Map<String, MetricThreshold> thresholds = new ConcurrentHashMap<>(DEFAULT_THRESHOLDS);
    private final Map<CooldownKey, Instant> lastAlerts = new ConcurrentHashMap<>();

    private final AnomalyRecordRepository anomalyRepository;
    private final RealtimeEventEmitter emitter;
    private final Clock clock;
    private final long alertCooldownMs;
    private EventSubscription subscription;

    public AnomalyDetector(AnomalyRecordRepository anomalyRepository, RealtimeEventEmitter emitter,
            PipelineProperties properties, Clock clock) {
        this.anomalyRepository = anomalyRepository;
        this.emitter = emitter;
        this.clock = clock;
        this.alertCooldownMs = properties.getAnomaly().getAlertCooldownMs();
        properties.getAnomaly().getThresholds().forEach((metric, override) -> thresholds.put(metric,
                new MetricThreshold(override.getDisplayName() == null ? metric : override.getDisplayName(),
                        override.getWarningThreshold(), override.getCriticalThreshold(),
                        ThresholdDirection.parse(override.getDirection()))));
    }

    @PostConstruct
    public void init() {
        subscription = emitter.subscribe(RealtimeEventType.METRICS_UPDATED, event -> checkForAnomaly(
                event.getWorkspaceId(), event.string("metricName"), event.number("previousValue"),
                event.number("currentValue"), event.number("changePercent")));
        log.info("[Anomaly] Subscribed to metric updates ({} thresholds, cooldown {}ms)",
                thresholds.size(), alertCooldownMs);
    }

    @PreDestroy
    public void shutdown() {
        if (subscription != null) {
            subscription.unsubscribe();
        }
    }

    /**
     * 判定一次指标变化是否构成异常。
     *
     * @return 已落库的异常记录；无阈值、方向不符、未达阈值或处于冷却期时为空
     */
    public Optional<AnomalyRecord> checkForAnomaly(String workspaceId, String metricName, double previousValue,
            double currentValue, double changePercent) {
        MetricThreshold threshold = metricName == null ? null : thresholds.get(metricName);
        if (threshold == null) {
            log.debug("[Anomaly] No threshold configured for metric {}", metricName);
            return Optional.empty();
        }
        if (!threshold.getDirection().accepts(changePercent)) {
            return Optional.empty();
        }

        AnomalySeverity severity = severityFor(Math.abs(changePercent), threshold);
        if (severity == null) {
            return Optional.empty();
        }

        Instant now = clock.instant();
        CooldownKey key = new CooldownKey(workspaceId, metricName);
        boolean[] allowed = new boolean[1];
        lastAlerts.compute(key, (k, lastAlert) -> {
            if (lastAlert != null && now.toEpochMilli() - lastAlert.toEpochMilli() < alertCooldownMs) {
                return lastAlert;
            }
            allowed[0] = true;
            return now;
        });
        if (!allowed[0]) {
            log.debug("[Anomaly] {} in workspace {} is in cooldown, {} suppressed", metricName, workspaceId, severity);
            return Optional.empty();
        }

        AnomalyRecord anomaly = createAnomaly(workspaceId, metricName, threshold, severity,
                previousValue, currentValue, changePercent);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("anomalyId", anomaly.getId());
        data.put("metricName", metricName);
        data.put("displayName", threshold.getDisplayName());
        data.put("severity", severity.wireName());
        data.put("title", anomaly.getTitle());
        data.put("description", anomaly.getDescription());
        data.put("currentValue", currentValue);
        data.put("previousValue", previousValue);
        data.put("changePercent", changePercent);
        emitter.publish(RealtimeEvent.builder()
                .type(RealtimeEventType.ANOMALY_DETECTED)
                .workspaceId(workspaceId)
                .data(data)
                .timestamp(now)
                .build());

        log.info("[Anomaly] {} anomaly on {} in workspace {} ({}%)", severity, metricName, workspaceId,
                String.format(Locale.ROOT, "%.2f", changePercent));
        return Optional.of(anomaly);
    }

    public void updateThreshold(String metricName, MetricThreshold threshold) {
        thresholds.put(metricName, threshold);
        log.info("[Anomaly] Threshold updated for {}: {}", metricName, threshold);
    }

    public Map<String, MetricThreshold> getThresholds() {
        return Map.copyOf(thresholds);
    }

    public void clearCooldowns() {
        lastAlerts.clear();
        log.debug("[Anomaly] Cooldowns cleared");
    }

    static AnomalySeverity severityFor(double absChange, MetricThreshold threshold) {
        double warning = Math.abs(threshold.getWarningThreshold());
        double critical = Math.abs(threshold.getCriticalThreshold());
        if (absChange >= critical) {
            return AnomalySeverity.CRITICAL;
        }
        if (absChange >= warning) {
            return AnomalySeverity.HIGH;
        }
        if (absChange >= warning * 0.7) {
            return AnomalySeverity.MEDIUM;
        }
        return null;
    }

    private AnomalyRecord createAnomaly(String workspaceId, String metricName, MetricThreshold threshold,
            AnomalySeverity severity, double previousValue, double currentValue, double changePercent) {
        String direction = changePercent > 0 ? "increased" : "decreased";
        String title = threshold.getDisplayName() + " " + direction + " significantly";
        String description = String.format(Locale.ROOT, "%s %s by %.1f%% from %s to %s.",
                threshold.getDisplayName(), direction, Math.abs(changePercent),
                formatValue(previousValue, metricName), formatValue(currentValue, metricName));

        AnomalyRecord anomaly = AnomalyRecord.builder()
                .workspaceId(workspaceId)
                .metricName(metricName)
                .severity(severity)
                .title(title)
                .description(description)
                .currentValue(currentValue)
                .previousValue(previousValue)
                .changePercent(changePercent)
                .detectedAt(LocalDateTime.now(clock))
                .build();
        try {
            return anomalyRepository.save(anomaly);
        } catch (Exception e) {
            // 落库失败不影响告警事件
            log.error("[Anomaly] Failed to save anomaly for {} in workspace {}", metricName, workspaceId, e);
            return anomaly;
        }
    }

    private static String formatValue(double value, String metricName) {
        if (metricName.toLowerCase(Locale.ROOT).contains("revenue") || MetricNames.MRR.equals(metricName)
                || MetricNames.AOV.equals(metricName)) {
            return String.format(Locale.US, "$%,.2f", value);
        }
        return String.format(Locale.US, "%,.0f", value);
    }

    @Value
    private static class CooldownKey {
        String workspaceId;
        String metricName;
    }
}
