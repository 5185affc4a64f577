package com.example.webhookpipeline.controller;

import com.example.webhookpipeline.gateway.GatewayResult;
import com.example.webhookpipeline.gateway.SigningSecretResolver;
import com.example.webhookpipeline.gateway.WebhookGateway;
import com.example.webhookpipeline.model.WebhookProvider;
import com.example.webhookpipeline.processor.EventProcessorRegistry;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.Enumeration;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * 统一的入站 Webhook 入口：POST /api/webhooks/{provider}。
 */
@RestController
@RequestMapping("/api/webhooks")
@RequiredArgsConstructor
@Slf4j
public class WebhookIngestController {

    private final WebhookGateway gateway;
    private final SigningSecretResolver secretResolver;
    private final EventProcessorRegistry processorRegistry;

    @PostMapping("/{provider}")
    public ResponseEntity<Map<String, Object>> receive(@PathVariable String provider, HttpServletRequest request,
            @RequestBody(required = false) String body) {
        Optional<WebhookProvider> resolved = WebhookProvider.fromId(provider);
        if (resolved.isEmpty()) {
            log.warn("Unsupported webhook provider: {}", provider);
            return ResponseEntity.badRequest().body(unsupported());
        }

        Optional<String> secret = secretResolver.resolve(resolved.get());
        if (secret.isEmpty()) {
            log.error("No signing secret configured for {}", provider);
            Map<String, Object> error = new HashMap<>();
            error.put("error", "Webhook not configured");
            return ResponseEntity.internalServerError().body(error);
        }

        GatewayResult result = gateway.handle(provider, body == null ? "" : body, lowercaseHeaders(request),
                secret.get());

        Map<String, Object> response = new LinkedHashMap<>();
        if (result.isSuccess()) {
            response.put("received", true);
            response.put("eventId", result.getEventId());
            response.put("action", result.getAction());
            response.put("objectId", result.getObjectId());
            response.put("message", result.getMessage());
        } else {
            response.put("error", result.getError());
            response.put("eventId", result.getEventId());
        }
        return ResponseEntity.status(result.getStatus()).body(response);
    }

    /**
     * 查询提供方的接入信息：配置状态、支持的事件类型与入口路径。
     */
    @GetMapping("/{provider}")
    public ResponseEntity<Map<String, Object>> info(@PathVariable String provider) {
        Optional<WebhookProvider> resolved = WebhookProvider.fromId(provider);
        if (resolved.isEmpty()) {
            return ResponseEntity.badRequest().body(unsupported());
        }
        WebhookProvider webhookProvider = resolved.get();
        Map<String, Object> info = new LinkedHashMap<>();
        info.put("provider", webhookProvider.getId());
        info.put("status", secretResolver.resolve(webhookProvider).isPresent() ? "configured" : "not_configured");
        info.put("supportedEvents", processorRegistry.getSupportedEvents(webhookProvider));
        info.put("webhookPath", "/api/webhooks/" + webhookProvider.getId());
        return ResponseEntity.ok(info);
    }

    private static Map<String, Object> unsupported() {
        Map<String, Object> error = new LinkedHashMap<>();
        error.put("error", "Unsupported provider");
        List<String> supported = Arrays.stream(WebhookProvider.values())
                .map(WebhookProvider::getId)
                .collect(Collectors.toList());
        error.put("supportedProviders", supported);
        return error;
    }

    private static Map<String, String> lowercaseHeaders(HttpServletRequest request) {
        Map<String, String> headers = new HashMap<>();
        Enumeration<String> names = request.getHeaderNames();
        while (names.hasMoreElements()) {
            String name = names.nextElement();
            headers.put(name.toLowerCase(Locale.ROOT), request.getHeader(name));
        }
        return headers;
    }
}
