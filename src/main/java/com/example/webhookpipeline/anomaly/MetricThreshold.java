package com.example.webhookpipeline.anomaly;

import lombok.Value;

/**
 * 异常检测阈值，百分比变化量，比较时取绝对值。
 */
@Value
public class MetricThreshold {
    String displayName;
    double warningThreshold;
    double criticalThreshold;
    ThresholdDirection direction;
}
