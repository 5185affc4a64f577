package com.example.webhookpipeline.notification;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder
public class MetricNotification {
    String id;
    String workspaceId;
    NotificationType type;
    NotificationSource source;
    String title;
    String message;
    String metricName;
    double currentValue;
    double previousValue;
    double changePercent;
    NotificationThreshold threshold;
    Instant timestamp;
    @Builder.Default
    Map<String, Object> data = Map.of();
}
