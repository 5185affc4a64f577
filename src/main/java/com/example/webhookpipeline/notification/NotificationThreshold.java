package com.example.webhookpipeline.notification;

import lombok.Value;

/**
 * 通知阈值（百分比变化）。BELOW 的阈值通常为负数。
 */
@Value
public class NotificationThreshold {
    String metricName;
    double warningThreshold;
    double criticalThreshold;
    NotificationDirection direction;
    NotificationPeriod period;
}
