package com.example.webhookpipeline.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.HashMap;
import java.util.Map;

/**
 * 管道配置（前缀 app.pipeline）。
 * <p>
 * 各子模块的默认值与 application.yml 保持一致，单元测试可直接 new 出来使用。
 */
@Configuration
@ConfigurationProperties(prefix = "app.pipeline")
@Data
public class PipelineProperties {

    private Webhooks webhooks = new Webhooks();
    private Batch batch = new Batch();
    private Metrics metrics = new Metrics();
    private Anomaly anomaly = new Anomaly();
    private Notifications notifications = new Notifications();
    private Delivery delivery = new Delivery();

    @Data
    public static class Webhooks {
        /**
         * Signing secret per provider id; blank entries are treated as absent.
         */
        private Map<String, String> secrets = new HashMap<>();
    }

    @Data
    public static class Batch {
        private int maxBatchSize = 100;
        private long maxWaitTimeMs = 5000;
        private boolean flushOnSize = true;
        private boolean flushOnTime = true;
    }

    @Data
    public static class Metrics {
        private long cacheTtlMs = 30_000;
        private long debounceMs = 1_000;
        /**
         * Upper bound for a blocking getMetrics call.
         */
        private long computeTimeoutMs = 10_000;
    }

    @Data
    public static class Anomaly {
        private long alertCooldownMs = 3_600_000;
        /**
         * Overrides keyed by metric name, merged over the built-in defaults.
         */
        private Map<String, ThresholdOverride> thresholds = new HashMap<>();
    }

    @Data
    public static class ThresholdOverride {
        private String displayName;
        private double warningThreshold;
        private double criticalThreshold;
        private String direction = "both";
    }

    @Data
    public static class Notifications {
        /**
         * Forward triggered notifications to subscribed outbound endpoints.
         */
        private boolean forwardToEndpoints = true;
    }

    @Data
    public static class Delivery {
        private int requestTimeoutSeconds = 30;
        private long signatureToleranceSeconds = 300;
        private String userAgent = "WebhookPipeline/1.0";
        private long retrySweepMs = 30_000;
        private boolean ssrfCheckEnabled = true;
    }
}
