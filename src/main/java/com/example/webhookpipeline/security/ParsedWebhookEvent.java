package com.example.webhookpipeline.security;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * 验签通过后的统一事件信封。
 */
@Value
@Builder
public class ParsedWebhookEvent {
    /** Provider-assigned id; together with the provider it forms the idempotency key. */
    String id;
    String type;
    /** Shop domain / store id / user id when the provider sends one. */
    String accountId;
    Instant occurredAt;
    /** The business object the event is about. */
    JsonNode data;
    JsonNode rawPayload;

    public String text(String field) {
        JsonNode node = data == null ? null : data.get(field);
        return node == null || node.isNull() ? null : node.asText();
    }
}
