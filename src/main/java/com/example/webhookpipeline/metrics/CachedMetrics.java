package com.example.webhookpipeline.metrics;

import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
public class CachedMetrics {
    String workspaceId;
    Map<String, Double> metrics;
    Instant lastUpdated;
    long ttlMs;

    public boolean isExpired(Instant now) {
        return now.toEpochMilli() - lastUpdated.toEpochMilli() > ttlMs;
    }
}
