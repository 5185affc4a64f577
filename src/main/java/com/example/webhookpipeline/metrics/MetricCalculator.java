package com.example.webhookpipeline.metrics;

import java.util.Map;

/**
 * 按工作区计算全部指标。
 */
public interface MetricCalculator {

    Map<String, Double> calculate(String workspaceId);
}
