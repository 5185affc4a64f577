package com.example.webhookpipeline.controller;

import com.example.webhookpipeline.metrics.MetricRecalculationService;
import com.example.webhookpipeline.model.DeliveryStatus;
import com.example.webhookpipeline.model.WebhookEventStatus;
import com.example.webhookpipeline.realtime.EventBatchProcessor;
import com.example.webhookpipeline.realtime.RealtimeEventEmitter;
import com.example.webhookpipeline.repository.WebhookDeliveryRepository;
import com.example.webhookpipeline.repository.WebhookEventRepository;
import com.example.webhookpipeline.service.DeadLetterService;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.HealthEndpoint;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * 监控数据 API
 */
@RestController
@RequestMapping("/api/monitoring")
@RequiredArgsConstructor
public class MonitoringApiController {

    private final HealthEndpoint healthEndpoint;
    private final WebhookEventRepository eventRepository;
    private final WebhookDeliveryRepository deliveryRepository;
    private final RealtimeEventEmitter emitter;
    private final EventBatchProcessor batchProcessor;
    private final MetricRecalculationService metricService;
    private final DeadLetterService deadLetterService;

    /**
     * 获取管道概览数据
     */
    @GetMapping("/overview")
    public Map<String, Object> getOverview() {
        Map<String, Object> overview = new HashMap<>();

        // 健康状态
        overview.put("status", healthEndpoint.health().getStatus().getCode());

        long uptime = ManagementFactory.getRuntimeMXBean().getUptime();
        overview.put("uptimeMs", uptime);
        overview.put("uptimeFormatted", formatUptime(uptime));

        // 入站事件
        Map<String, Long> events = new LinkedHashMap<>();
        for (WebhookEventStatus status : WebhookEventStatus.values()) {
            events.put(status.name().toLowerCase(Locale.ROOT), eventRepository.countByStatus(status));
        }
        overview.put("webhookEvents", events);

        // 出站投递
        Map<String, Long> deliveries = new LinkedHashMap<>();
        for (DeliveryStatus status : DeliveryStatus.values()) {
            deliveries.put(status.name().toLowerCase(Locale.ROOT), deliveryRepository.countByStatus(status));
        }
        overview.put("deliveries", deliveries);
        long attempted = deliveries.get("success") + deliveries.get("failed");
        double successRate = attempted > 0 ? (deliveries.get("success") * 100.0 / attempted) : 0;
        overview.put("deliverySuccessRate", String.format("%.1f", successRate));

        // 管道内部状态
        overview.put("subscribers", emitter.getTotalSubscriberCount());
        overview.put("pendingBatches", batchProcessor.getPendingBatchCount());
        overview.put("pendingBatchEvents", batchProcessor.getPendingEventCount());
        overview.put("pendingRecalculations", metricService.getPendingRecalculationCount());
        overview.put("deadLetters", deadLetterService.getDeadLetterCount());

        return overview;
    }

    /**
     * 格式化运行时间
     */
    private String formatUptime(long uptimeMs) {
        long seconds = uptimeMs / 1000;
        long days = seconds / 86400;
        long hours = (seconds % 86400) / 3600;
        long minutes = (seconds % 3600) / 60;
        long secs = seconds % 60;

        if (days > 0) {
            return String.format("%dd %dh %dm", days, hours, minutes);
        } else if (hours > 0) {
            return String.format("%dh %dm", hours, minutes);
        } else if (minutes > 0) {
            return String.format("%dm %ds", minutes, secs);
        } else {
            return String.format("%ds", secs);
        }
    }
}
