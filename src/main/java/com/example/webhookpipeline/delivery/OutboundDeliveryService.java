package com.example.webhookpipeline.delivery;

import com.example.webhookpipeline.config.PipelineProperties;
import com.example.webhookpipeline.exception.ResourceNotFoundException;
import com.example.webhookpipeline.model.DeliveryStatus;
import com.example.webhookpipeline.model.WebhookDelivery;
import com.example.webhookpipeline.model.WebhookEndpoint;
import com.example.webhookpipeline.repository.WebhookDeliveryRepository;
import com.example.webhookpipeline.repository.WebhookEndpointRepository;
import com.example.webhookpipeline.service.PipelineMetrics;
import com.example.webhookpipeline.utils.UrlValidator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;

/**
 * 出站 Webhook 投递：签名、POST（30 秒超时）、失败后按指数退避重试，直到 maxRetries 次后终止为 failed。
 */
@Service
@Slf4j
public class OutboundDeliveryService {

    public static final int MAX_RESPONSE_BODY_LENGTH = 1000;
    public static final String TEST_EVENT = "test.ping";
    // PENDING deliveries older than this were lost before their first attempt
    private static final long STALE_PENDING_MINUTES = 5;

    private final HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();

    private final WebhookEndpointRepository endpointRepository;
    private final WebhookDeliveryRepository deliveryRepository;
    private final UrlValidator urlValidator;
    private final ObjectMapper objectMapper;
    private final PipelineProperties.Delivery config;
    private final PipelineMetrics metrics;
    private final Executor executor;
    private final Clock clock;
    private final Set<Long> inFlight = ConcurrentHashMap.newKeySet();

    public OutboundDeliveryService(WebhookEndpointRepository endpointRepository,
            WebhookDeliveryRepository deliveryRepository, UrlValidator urlValidator, ObjectMapper objectMapper,
            PipelineProperties properties, PipelineMetrics metrics, @Qualifier("deliveryExecutor") Executor executor,
            Clock clock) {
        this.endpointRepository = endpointRepository;
        this.deliveryRepository = deliveryRepository;
        this.urlValidator = urlValidator;
        this.objectMapper = objectMapper;
        this.config = properties.getDelivery();
        this.metrics = metrics;
        this.executor = executor;
        this.clock = clock;
    }

    /**
     * 签名并 POST 一次，不做重试。
     *
     * @param endpoint  目标端点
     * @param payload   已序列化的 JSON 请求体（签名即针对此字符串）
     * @param webhookId X-Webhook-ID
     * @return 投递结果
     */
    public DeliveryResult deliver(WebhookEndpoint endpoint, String payload, String webhookId) {
        long startTime = System.currentTimeMillis();
        URI target;
        try {
            target = config.isSsrfCheckEnabled() ? urlValidator.validate(endpoint.getUrl()) : URI.create(endpoint.getUrl());
        } catch (IllegalArgumentException e) {
            return DeliveryResult.builder()
                    .success(false)
                    .responseTimeMs(0)
                    .error("Blocked endpoint URL: " + e.getMessage())
                    .build();
        }

        long timestamp = clock.instant().getEpochSecond();
        String signature = WebhookSigner.sign(payload, endpoint.getSecret(), timestamp);
        HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
                .uri(target)
                .timeout(Duration.ofSeconds(config.getRequestTimeoutSeconds()))
                .POST(HttpRequest.BodyPublishers.ofString(payload));
        WebhookSigner.buildHeaders(webhookId, signature, timestamp, config.getUserAgent())
                .forEach(requestBuilder::header);

        try {
            HttpResponse<String> response = httpClient.send(requestBuilder.build(),
                    HttpResponse.BodyHandlers.ofString());
            long responseTimeMs = System.currentTimeMillis() - startTime;
            boolean success = response.statusCode() >= 200 && response.statusCode() < 300;
            return DeliveryResult.builder()
                    .success(success)
                    .statusCode(response.statusCode())
                    .responseBody(truncate(response.body()))
                    .responseTimeMs(responseTimeMs)
                    .error(success ? null : "HTTP " + response.statusCode())
                    .build();
        } catch (HttpTimeoutException e) {
            return failure(startTime, "Request timeout (" + config.getRequestTimeoutSeconds() + "s)");
        } catch (IOException e) {
            return failure(startTime, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return failure(startTime, "Interrupted");
        }
    }

    /**
     * 执行一次投递并推进状态机，每次状态变化通过 onUpdate 回写。
     *
     * @return 投递成功返回 true
     */
    public boolean processDelivery(WebhookEndpoint endpoint, WebhookDelivery delivery,
            Consumer<WebhookDelivery> onUpdate) {
        if (!endpoint.isActive()) {
            delivery.setStatus(DeliveryStatus.FAILED);
            delivery.setNextRetryAt(null);
            delivery.setErrorMessage("Endpoint is inactive");
            onUpdate.accept(delivery);
            return false;
        }

        int attempts = delivery.getAttempts() == null ? 0 : delivery.getAttempts();
        if (attempts >= endpoint.getMaxRetries()) {
            delivery.setStatus(DeliveryStatus.FAILED);
            delivery.setNextRetryAt(null);
            delivery.setErrorMessage("Max retries (" + endpoint.getMaxRetries() + ") exceeded");
            onUpdate.accept(delivery);
            return false;
        }

        DeliveryResult result = deliver(endpoint, delivery.getPayload(), delivery.getEventId());
        LocalDateTime now = LocalDateTime.now(clock);
        int newAttempts = attempts + 1;
        delivery.setAttempts(newAttempts);
        delivery.setLastAttemptAt(now);
        delivery.setResponseStatusCode(result.getStatusCode());
        delivery.setResponseBody(result.getResponseBody());
        delivery.setResponseTimeMs(result.getResponseTimeMs());

        if (result.isSuccess()) {
            delivery.setStatus(DeliveryStatus.SUCCESS);
            delivery.setNextRetryAt(null);
            delivery.setErrorMessage(null);
            delivery.setDeliveredAt(now);
        } else if (newAttempts < endpoint.getMaxRetries()) {
            long delayMs = WebhookSigner.calculateRetryDelay(newAttempts, endpoint.getRetryDelaySeconds());
            delivery.setStatus(DeliveryStatus.RETRYING);
            delivery.setNextRetryAt(now.plus(Duration.ofMillis(delayMs)));
            delivery.setErrorMessage(result.getError());
        } else {
            delivery.setStatus(DeliveryStatus.FAILED);
            delivery.setNextRetryAt(null);
            delivery.setErrorMessage(result.getError());
        }

        metrics.deliveryAttempted(delivery.getStatus().name().toLowerCase(Locale.ROOT));
        log.info("[Delivery] {} to endpoint {} attempt {}/{} -> {} ({})", delivery.getEventType(),
                endpoint.getId(), newAttempts, endpoint.getMaxRetries(), delivery.getStatus(),
                result.isSuccess() ? "HTTP " + result.getStatusCode() : result.getError());
        onUpdate.accept(delivery);
        return result.isSuccess();
    }

    /**
     * 将事件分发给工作区内订阅了该类型的所有启用端点：每个端点落一条 pending 记录并异步尝试首投。
     */
    public List<WebhookDelivery> dispatch(String workspaceId, String eventType, Map<String, Object> data) {
        List<WebhookEndpoint> endpoints = endpointRepository.findByWorkspaceIdAndActiveTrue(workspaceId);
        List<WebhookDelivery> created = new ArrayList<>();
        for (WebhookEndpoint endpoint : endpoints) {
            if (!endpoint.subscribesTo(eventType)) {
                continue;
            }
            created.add(createDelivery(endpoint, eventType, data));
        }
        for (WebhookDelivery delivery : created) {
            attemptAsync(delivery.getId());
        }
        if (!created.isEmpty()) {
            log.debug("[Delivery] Dispatched {} for workspace {} to {} endpoint(s)", eventType, workspaceId,
                    created.size());
        }
        return created;
    }

    /**
     * 发送一条签名的 test.ping 到指定端点（同步，不重试）。
     */
    public DeliveryResult sendTest(Long endpointId) {
        WebhookEndpoint endpoint = endpointRepository.findById(endpointId)
                .orElseThrow(() -> new ResourceNotFoundException("Webhook endpoint not found: " + endpointId));
        String payload = serialize(new OutboundPayload(TEST_EVENT, clock.instant().toString(),
                endpoint.getWorkspaceId(), Map.of("message", "This is a test webhook")));
        return deliver(endpoint, payload, UUID.randomUUID().toString());
    }

    /**
     * 定时扫描：到期的 retrying 记录，以及首投前丢失的 pending 记录。
     */
    @Scheduled(fixedDelayString = "${app.pipeline.delivery.retry-sweep-ms:30000}",
            initialDelayString = "${app.pipeline.delivery.retry-sweep-ms:30000}")
    public int retryDueDeliveries() {
        LocalDateTime now = LocalDateTime.now(clock);
        List<WebhookDelivery> due = new ArrayList<>(deliveryRepository
                .findByStatusAndNextRetryAtLessThanEqualOrderByNextRetryAtAsc(DeliveryStatus.RETRYING, now));
        due.addAll(deliveryRepository.findByStatusAndCreatedAtBefore(DeliveryStatus.PENDING,
                now.minusMinutes(STALE_PENDING_MINUTES)));
        int submitted = 0;
        for (WebhookDelivery delivery : due) {
            if (attemptAsync(delivery.getId())) {
                submitted++;
            }
        }
        if (submitted > 0) {
            log.info("[Delivery] Retry sweep submitted {} delivery(ies)", submitted);
        }
        return submitted;
    }

    /**
     * 加载记录并执行一次投递。同一记录同时只会有一个尝试在进行。
     */
    public void attempt(Long deliveryId) {
        WebhookDelivery delivery = deliveryRepository.findById(deliveryId).orElse(null);
        if (delivery == null || delivery.getStatus() == DeliveryStatus.SUCCESS
                || delivery.getStatus() == DeliveryStatus.FAILED) {
            return;
        }
        WebhookEndpoint endpoint = endpointRepository.findById(delivery.getEndpointId()).orElse(null);
        if (endpoint == null) {
            delivery.setStatus(DeliveryStatus.FAILED);
            delivery.setErrorMessage("Endpoint no longer exists");
            deliveryRepository.save(delivery);
            return;
        }
        processDelivery(endpoint, delivery, deliveryRepository::save);
    }

    private boolean attemptAsync(Long deliveryId) {
        if (!inFlight.add(deliveryId)) {
            return false;
        }
        try {
            executor.execute(() -> {
                try {
                    attempt(deliveryId);
                } catch (Exception e) {
                    log.error("[Delivery] Attempt for delivery {} failed unexpectedly", deliveryId, e);
                } finally {
                    inFlight.remove(deliveryId);
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            inFlight.remove(deliveryId);
            log.warn("[Delivery] Delivery executor saturated, delivery {} left for the retry sweep", deliveryId);
            return false;
        }
    }

    private WebhookDelivery createDelivery(WebhookEndpoint endpoint, String eventType, Map<String, Object> data) {
        String payload = serialize(new OutboundPayload(eventType, clock.instant().toString(),
                endpoint.getWorkspaceId(), data));
        WebhookDelivery delivery = WebhookDelivery.builder()
                .endpointId(endpoint.getId())
                .workspaceId(endpoint.getWorkspaceId())
                .eventType(eventType)
                .eventId(UUID.randomUUID().toString())
                .payload(payload)
                .status(DeliveryStatus.PENDING)
                .attempts(0)
                .build();
        return deliveryRepository.save(delivery);
    }

    private String serialize(OutboundPayload payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize webhook payload for " + payload.getEvent(), e);
        }
    }

    private static DeliveryResult failure(long startTime, String error) {
        return DeliveryResult.builder()
                .success(false)
                .responseTimeMs(System.currentTimeMillis() - startTime)
                .error(error)
                .build();
    }

    private static String truncate(String body) {
        if (body == null) {
            return null;
        }
        return body.length() > MAX_RESPONSE_BODY_LENGTH ? body.substring(0, MAX_RESPONSE_BODY_LENGTH) : body;
    }
}
