package com.example.webhookpipeline.metrics;

import lombok.Builder;
import lombok.Value;

import java.util.Set;
import java.util.TreeSet;

/**
 * 指标重算请求。metricNames 为空表示全部指标。
 */
@Value
@Builder
public class MetricRecalculationRequest {
    String workspaceId;
    Set<String> metricNames;
    @Builder.Default
    RecalculationTrigger triggeredBy = RecalculationTrigger.MANUAL;
    String sourceEventId;
    @Builder.Default
    RecalculationPriority priority = RecalculationPriority.NORMAL;

    /**
     * 防抖键：工作区 + 排序后的指标名。
     */
    public String debounceKey() {
        String names = metricNames == null || metricNames.isEmpty()
                ? "all"
                : String.join(",", new TreeSet<>(metricNames));
        return workspaceId + ":" + names;
    }
}
