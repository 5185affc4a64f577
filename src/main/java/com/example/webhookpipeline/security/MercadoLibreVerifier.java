package com.example.webhookpipeline.security;

import com.example.webhookpipeline.model.WebhookProvider;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * MercadoLibre：user_id 必须与配置的用户 ID 一致。
 */
@Component
@Slf4j
public class MercadoLibreVerifier extends AccountIdVerifier {

    public MercadoLibreVerifier(ObjectMapper objectMapper, Clock clock) {
        super(objectMapper, clock);
    }

    @Override
    public WebhookProvider provider() {
        return WebhookProvider.MERCADOLIBRE;
    }

    @Override
    protected String accountField() {
        return "user_id";
    }

    @Override
    protected String mismatchError() {
        return "User ID mismatch";
    }

    @Override
    protected String eventType(JsonNode payload) {
        return payload.hasNonNull("topic") ? payload.get("topic").asText() : "unknown";
    }

    @Override
    protected String eventId(JsonNode payload) {
        return payload.hasNonNull("_id") ? payload.get("_id").asText() : null;
    }

    @Override
    protected Instant occurredAt(JsonNode payload) {
        if (payload.hasNonNull("sent")) {
            try {
                return Instant.parse(payload.get("sent").asText());
            } catch (DateTimeParseException e) {
                log.debug("Unparsable MercadoLibre 'sent' timestamp {}, using receipt time", payload.get("sent"));
            }
        }
        return clock.instant();
    }
}
