package com.example.webhookpipeline.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

/**
 * 管道业务指标（Micrometer），通过 /actuator/metrics 暴露。
 */
@Component
public class PipelineMetrics {

    private final MeterRegistry meterRegistry;
    private final DistributionSummary batchSize;

    public PipelineMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.batchSize = DistributionSummary.builder("pipeline.batch.size")
                .description("Events per flushed batch")
                .register(meterRegistry);
    }

    public void webhookReceived(String provider, String outcome) {
        Counter.builder("pipeline.webhooks.received")
                .tag("provider", provider)
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    public void batchFlushed(int events) {
        batchSize.record(events);
    }

    public void deliveryAttempted(String status) {
        Counter.builder("pipeline.deliveries.attempted")
                .tag("status", status)
                .register(meterRegistry)
                .increment();
    }
}
