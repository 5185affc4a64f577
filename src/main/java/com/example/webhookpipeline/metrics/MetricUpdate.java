package com.example.webhookpipeline.metrics;

import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * metrics.updated 事件的数据部分。
 */
@Value
public class MetricUpdate {
    public static final String PERIOD_CURRENT = "current";

    String metricName;
    double previousValue;
    double currentValue;
    double changePercent;
    String period;

    public static MetricUpdate of(String metricName, double previousValue, double currentValue) {
        return new MetricUpdate(metricName, previousValue, currentValue,
                changePercent(previousValue, currentValue), PERIOD_CURRENT);
    }

    /**
     * 上期为 0 时：本期大于 0 记为 100%，否则为 0。
     */
    public static double changePercent(double previousValue, double currentValue) {
        if (previousValue == 0) {
            return currentValue > 0 ? 100 : 0;
        }
        return (currentValue - previousValue) / previousValue * 100;
    }

    public Map<String, Object> toData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("metricName", metricName);
        data.put("previousValue", previousValue);
        data.put("currentValue", currentValue);
        data.put("changePercent", changePercent);
        data.put("period", period);
        return data;
    }
}
