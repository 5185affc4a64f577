package com.example.webhookpipeline.gateway;

import com.example.webhookpipeline.model.Connector;
import com.example.webhookpipeline.model.WebhookEvent;
import com.example.webhookpipeline.model.WebhookEventStatus;
import com.example.webhookpipeline.model.WebhookProvider;
import com.example.webhookpipeline.processor.EventProcessorRegistry;
import com.example.webhookpipeline.processor.ProcessingResult;
import com.example.webhookpipeline.processor.WebhookEventProcessor;
import com.example.webhookpipeline.repository.ConnectorRepository;
import com.example.webhookpipeline.repository.WebhookEventRepository;
import com.example.webhookpipeline.security.ParsedWebhookEvent;
import com.example.webhookpipeline.security.SignatureVerifier;
import com.example.webhookpipeline.security.VerificationResult;
import com.example.webhookpipeline.security.VerifierRegistry;
import com.example.webhookpipeline.service.PipelineMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 入站 Webhook 统一入口：验签、幂等、连接器匹配、落库与分发到提供方处理器。
 * <p>
 * 处理器内部以 fire-and-forget 方式发布实时事件，下游反应不会影响这里的返回状态。
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WebhookGateway {

    private final VerifierRegistry verifierRegistry;
    private final EventProcessorRegistry processorRegistry;
    private final WebhookEventRepository eventRepository;
    private final ConnectorRepository connectorRepository;
    private final PipelineMetrics metrics;
    private final Clock clock;

    /**
     * @param providerId    路径中的提供方标识
     * @param rawBody       原始请求体（验签对象）
     * @param headers       请求头，名称小写
     * @param signingSecret 该提供方的签名密钥
     * @return 处理结果
     */
    public GatewayResult handle(String providerId, String rawBody, Map<String, String> headers,
            String signingSecret) {
        LocalDateTime receivedAt = LocalDateTime.now(clock);

        Optional<WebhookProvider> resolved = WebhookProvider.fromId(providerId);
        if (resolved.isEmpty()) {
            log.warn("Unsupported webhook provider: {}", providerId);
            return GatewayResult.failure(400, "Unsupported provider: " + providerId);
        }
        WebhookProvider provider = resolved.get();

        Optional<SignatureVerifier> verifier = verifierRegistry.getVerifier(provider);
        if (verifier.isEmpty()) {
            log.error("No verifier registered for provider {}", provider);
            return GatewayResult.failure(500, "Internal configuration error");
        }

        String signature = verifier.get().getSignatureHeader(headers);
        VerificationResult verification = verifier.get().verifyAndParse(rawBody, signature, signingSecret, headers);
        if (!verification.isValid() || verification.getEvent() == null) {
            log.warn("Webhook verification failed: provider={}, error={}", provider.getId(), verification.getError());
            metrics.webhookReceived(provider.getId(), "rejected");
            return GatewayResult.failure(401,
                    verification.getError() != null ? verification.getError() : "Verification failed");
        }
        ParsedWebhookEvent event = verification.getEvent();

        Optional<WebhookEvent> existing = eventRepository.findByProviderAndExternalEventId(provider, event.getId());
        if (existing.isPresent()) {
            log.info("Duplicate webhook event skipped: provider={}, externalId={}, existingId={}",
                    provider.getId(), event.getId(), existing.get().getId());
            metrics.webhookReceived(provider.getId(), "duplicate");
            return GatewayResult.skipped(existing.get().getId(), "Duplicate event");
        }

        Optional<Connector> connector = findConnector(provider, event);
        if (connector.isEmpty()) {
            log.warn("No connector found for webhook event: provider={}, type={}", provider.getId(), event.getType());
            Optional<WebhookEvent> logged = insert(provider, event, rawBody, receivedAt, WebhookEventStatus.SKIPPED,
                    null, null);
            metrics.webhookReceived(provider.getId(), "skipped");
            return logged.map(e -> GatewayResult.skipped(e.getId(), "No connector found"))
                    .orElseGet(() -> GatewayResult.skipped(null, "Duplicate event"));
        }

        Connector bound = connector.get();
        Optional<WebhookEvent> inserted = insert(provider, event, rawBody, receivedAt, WebhookEventStatus.PROCESSING,
                bound.getWorkspaceId(), bound.getId());
        if (inserted.isEmpty()) {
            // 并发重复投递，另一请求已落库
            metrics.webhookReceived(provider.getId(), "duplicate");
            return GatewayResult.skipped(null, "Duplicate event");
        }
        WebhookEvent record = inserted.get();

        ProcessingResult result = process(provider, event, bound);
        complete(record, result);

        if (result.isSuccess()) {
            log.info("Webhook processed: provider={}, type={}, eventId={}, objectId={}, action={}",
                    provider.getId(), event.getType(), record.getId(), result.getObjectId(), result.getAction());
            metrics.webhookReceived(provider.getId(), "processed");
            return GatewayResult.builder()
                    .success(true)
                    .status(200)
                    .eventId(String.valueOf(record.getId()))
                    .action(result.getAction())
                    .objectId(result.getObjectId())
                    .message(result.getMessage())
                    .build();
        }

        log.error("Webhook processing failed: provider={}, type={}, eventId={}, error={}",
                provider.getId(), event.getType(), record.getId(), result.getError());
        metrics.webhookReceived(provider.getId(), "failed");
        return GatewayResult.builder()
                .success(false)
                .status(500)
                .eventId(String.valueOf(record.getId()))
                .error(result.getError())
                .build();
    }

    /**
     * 事件携带账户 ID 时优先匹配绑定该账户的连接器，否则取第一个启用连接器。
     */
    Optional<Connector> findConnector(WebhookProvider provider, ParsedWebhookEvent event) {
        if (event.getAccountId() != null && !event.getAccountId().isBlank()) {
            Optional<Connector> matched = connectorRepository
                    .findFirstByProviderAndAccountIdAndActiveTrue(provider, event.getAccountId());
            if (matched.isPresent()) {
                return matched;
            }
        }
        List<Connector> active = connectorRepository.findByProviderAndActiveTrueOrderByIdAsc(provider);
        return active.isEmpty() ? Optional.empty() : Optional.of(active.get(0));
    }

    /**
     * 插入事件记录；唯一约束冲突（并发重复）时返回 empty。
     */
    private Optional<WebhookEvent> insert(WebhookProvider provider, ParsedWebhookEvent event, String rawBody,
            LocalDateTime receivedAt, WebhookEventStatus status, String workspaceId, Long connectorId) {
        WebhookEvent record = WebhookEvent.builder()
                .provider(provider)
                .externalEventId(event.getId())
                .eventType(event.getType())
                .workspaceId(workspaceId)
                .connectorId(connectorId)
                .payload(rawBody)
                .status(status)
                .receivedAt(receivedAt)
                .attempts(status == WebhookEventStatus.PROCESSING ? 1 : 0)
                .build();
        try {
            return Optional.of(eventRepository.saveAndFlush(record));
        } catch (DataIntegrityViolationException e) {
            log.info("Concurrent duplicate webhook event: provider={}, externalId={}", provider.getId(),
                    event.getId());
            return Optional.empty();
        }
    }

    private ProcessingResult process(WebhookProvider provider, ParsedWebhookEvent event, Connector connector) {
        Optional<WebhookEventProcessor> processor = processorRegistry.getProcessor(provider);
        if (processor.isEmpty()) {
            return ProcessingResult.ok(event.getType(), "unknown", "acknowledged",
                    "No processor configured for this provider");
        }
        try {
            return processor.get().processEvent(event, connector.getWorkspaceId(), connector.getId());
        } catch (Exception e) {
            log.error("Processor threw for {} event {}", provider.getId(), event.getId(), e);
            return ProcessingResult.failed(event.getType(), e.getMessage());
        }
    }

    private void complete(WebhookEvent record, ProcessingResult result) {
        record.setStatus(result.isSuccess() ? WebhookEventStatus.COMPLETED : WebhookEventStatus.FAILED);
        record.setProcessedAt(LocalDateTime.now(clock));
        record.setLastError(result.getError());
        record.setProcessingAction(result.getAction());
        record.setObjectId(result.getObjectId());
        try {
            eventRepository.save(record);
        } catch (RuntimeException e) {
            log.error("Failed to update webhook event {} status to {}", record.getId(), record.getStatus(), e);
        }
    }
}
