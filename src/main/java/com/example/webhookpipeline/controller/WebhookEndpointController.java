package com.example.webhookpipeline.controller;

import com.example.webhookpipeline.config.PipelineProperties;
import com.example.webhookpipeline.delivery.DeliveryResult;
import com.example.webhookpipeline.delivery.OutboundDeliveryService;
import com.example.webhookpipeline.exception.ResourceNotFoundException;
import com.example.webhookpipeline.model.WebhookDelivery;
import com.example.webhookpipeline.model.WebhookEndpoint;
import com.example.webhookpipeline.repository.WebhookDeliveryRepository;
import com.example.webhookpipeline.repository.WebhookEndpointRepository;
import com.example.webhookpipeline.security.HmacSigner;
import com.example.webhookpipeline.utils.UrlValidator;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.security.SecureRandom;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 出站 Webhook 端点管理。
 */
@RestController
@RequestMapping("/api/endpoints")
@RequiredArgsConstructor
@Slf4j
public class WebhookEndpointController {

    private static final SecureRandom RANDOM = new SecureRandom();

    private final WebhookEndpointRepository endpointRepository;
    private final WebhookDeliveryRepository deliveryRepository;
    private final OutboundDeliveryService deliveryService;
    private final UrlValidator urlValidator;
    private final PipelineProperties properties;

    /**
     * 注册端点。未提供密钥时自动生成；密钥只在创建响应中返回一次。
     */
    @PostMapping
    public ResponseEntity<Map<String, Object>> create(@RequestBody CreateEndpointRequest request) {
        if (request.getWorkspaceId() == null || request.getWorkspaceId().isBlank()) {
            throw new IllegalArgumentException("workspaceId is required");
        }
        if (request.getUrl() == null || request.getUrl().isBlank()) {
            throw new IllegalArgumentException("url is required");
        }
        if (properties.getDelivery().isSsrfCheckEnabled()) {
            urlValidator.validate(request.getUrl());
        }
        Set<String> events = request.getEvents() == null || request.getEvents().isEmpty()
                ? Set.of(WebhookEndpoint.ALL_EVENTS)
                : request.getEvents();
        String secret = request.getSecret() == null || request.getSecret().isBlank()
                ? generateSecret()
                : request.getSecret();

        WebhookEndpoint endpoint = WebhookEndpoint.builder()
                .workspaceId(request.getWorkspaceId())
                .url(request.getUrl())
                .secret(secret)
                .events(new HashSet<>(events))
                .maxRetries(request.getMaxRetries() != null ? request.getMaxRetries() : 3)
                .retryDelaySeconds(request.getRetryDelaySeconds() != null ? request.getRetryDelaySeconds() : 60)
                .build();
        if (endpoint.getMaxRetries() < 1 || endpoint.getRetryDelaySeconds() < 1) {
            throw new IllegalArgumentException("maxRetries and retryDelaySeconds must be positive");
        }
        WebhookEndpoint saved = endpointRepository.save(endpoint);
        log.info("Webhook endpoint {} registered for workspace {}: {}", saved.getId(), saved.getWorkspaceId(),
                saved.getEvents());

        Map<String, Object> body = toView(saved);
        body.put("secret", saved.getSecret());
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    @GetMapping
    public List<Map<String, Object>> list(@RequestParam String workspaceId) {
        return endpointRepository.findByWorkspaceIdOrderByIdAsc(workspaceId).stream()
                .map(WebhookEndpointController::toView)
                .collect(Collectors.toList());
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        if (!endpointRepository.existsById(id)) {
            throw new ResourceNotFoundException("Webhook endpoint not found: " + id);
        }
        endpointRepository.deleteById(id);
        return ResponseEntity.noContent().build();
    }

    /**
     * 发送一条签名的 test.ping。
     */
    @PostMapping("/{id}/test")
    public DeliveryResult test(@PathVariable Long id) {
        return deliveryService.sendTest(id);
    }

    @GetMapping("/{id}/deliveries")
    public List<WebhookDelivery> deliveries(@PathVariable Long id) {
        if (!endpointRepository.existsById(id)) {
            throw new ResourceNotFoundException("Webhook endpoint not found: " + id);
        }
        return deliveryRepository.findTop50ByEndpointIdOrderByIdDesc(id);
    }

    private static Map<String, Object> toView(WebhookEndpoint endpoint) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", endpoint.getId());
        view.put("workspaceId", endpoint.getWorkspaceId());
        view.put("url", endpoint.getUrl());
        view.put("events", endpoint.getEvents());
        view.put("active", endpoint.isActive());
        view.put("maxRetries", endpoint.getMaxRetries());
        view.put("retryDelaySeconds", endpoint.getRetryDelaySeconds());
        LocalDateTime createdAt = endpoint.getCreatedAt();
        view.put("createdAt", createdAt == null ? null : createdAt.toString());
        return view;
    }

    private static String generateSecret() {
        byte[] bytes = new byte[24];
        RANDOM.nextBytes(bytes);
        return "whsec_" + HmacSigner.bytesToHex(bytes);
    }

    @Data
    public static class CreateEndpointRequest {
        private String workspaceId;
        private String url;
        private String secret;
        private Set<String> events;
        private Integer maxRetries;
        private Integer retryDelaySeconds;
    }
}
