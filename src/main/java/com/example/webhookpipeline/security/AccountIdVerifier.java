package com.example.webhookpipeline.security;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

/**
 * 无签名机制的提供方：以请求体中的账户 ID 与配置值（secret）比对作为校验。
 * 配置值或请求体中的账户 ID 缺失时不做比对。
 */
@Slf4j
public abstract class AccountIdVerifier implements SignatureVerifier {

    protected final ObjectMapper objectMapper;
    protected final Clock clock;

    protected AccountIdVerifier(ObjectMapper objectMapper, Clock clock) {
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /** Body field carrying the account id. */
    protected abstract String accountField();

    protected abstract String mismatchError();

    protected abstract String eventType(JsonNode payload);

    protected abstract String eventId(JsonNode payload);

    protected Instant occurredAt(JsonNode payload) {
        return clock.instant();
    }

    @Override
    public String getSignatureHeader(Map<String, String> headers) {
        return null;
    }

    @Override
    public VerificationResult verifyAndParse(String rawBody, String signature, String secret,
            Map<String, String> headers) {
        JsonNode payload;
        try {
            payload = objectMapper.readTree(rawBody == null ? "" : rawBody);
        } catch (JsonProcessingException e) {
            return VerificationResult.failure(
                    "Failed to parse " + provider().getDisplayName() + " webhook: " + e.getOriginalMessage());
        }
        if (payload == null || !payload.isObject()) {
            return VerificationResult.failure(
                    "Failed to parse " + provider().getDisplayName() + " webhook: body is not a JSON object");
        }

        String accountId = payload.hasNonNull(accountField()) ? payload.get(accountField()).asText() : null;
        if (secret != null && !secret.isBlank() && accountId != null && !accountId.equals(secret.trim())) {
            log.warn("{} account mismatch: expected={}, actual={}", provider().getDisplayName(), secret, accountId);
            return VerificationResult.failure(mismatchError());
        }

        String id = eventId(payload);
        if (id == null) {
            return VerificationResult.failure(provider().getDisplayName() + " webhook is missing an event id");
        }

        return VerificationResult.ok(ParsedWebhookEvent.builder()
                .id(id)
                .type(eventType(payload))
                .accountId(accountId)
                .occurredAt(occurredAt(payload))
                .data(payload)
                .rawPayload(payload)
                .build());
    }
}
