package com.example.webhookpipeline.controller;

import com.example.webhookpipeline.metrics.CachedMetrics;
import com.example.webhookpipeline.metrics.MetricRecalculationService;
import com.example.webhookpipeline.model.AnomalyRecord;
import com.example.webhookpipeline.repository.AnomalyRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 工作区指标与异常查询
 */
@RestController
@RequestMapping("/api/workspaces/{workspaceId}")
@RequiredArgsConstructor
public class WorkspaceMetricsController {

    private final MetricRecalculationService metricService;
    private final AnomalyRecordRepository anomalyRepository;

    /**
     * 缓存命中时直接返回，否则触发一次重算并等待结果。
     */
    @GetMapping("/metrics")
    public Map<String, Object> metrics(@PathVariable String workspaceId) {
        Optional<CachedMetrics> cached = metricService.getCachedMetrics(workspaceId);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("workspaceId", workspaceId);
        body.put("cached", cached.isPresent());
        body.put("metrics", cached.map(CachedMetrics::getMetrics).orElseGet(() -> metricService.getMetrics(workspaceId)));
        return body;
    }

    @GetMapping("/anomalies")
    public List<AnomalyRecord> anomalies(@PathVariable String workspaceId) {
        return anomalyRepository.findTop100ByWorkspaceIdOrderByDetectedAtDesc(workspaceId);
    }
}
