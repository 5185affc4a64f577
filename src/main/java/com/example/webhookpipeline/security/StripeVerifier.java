package com.example.webhookpipeline.security;

import com.example.webhookpipeline.model.WebhookProvider;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Stripe 验签：stripe-signature 头格式为 "t=时间戳,v1=签名[,v1=...]"，
 * 签名为 HMAC_SHA256(secret, "{t}.{body}") 的十六进制。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StripeVerifier implements SignatureVerifier {

    public static final String SIGNATURE_HEADER = "stripe-signature";
    public static final long TIMESTAMP_TOLERANCE_SECONDS = 300;

    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public WebhookProvider provider() {
        return WebhookProvider.STRIPE;
    }

    @Override
    public String getSignatureHeader(Map<String, String> headers) {
        return SignatureVerifier.header(headers, SIGNATURE_HEADER);
    }

    @Override
    public VerificationResult verifyAndParse(String rawBody, String signature, String secret,
            Map<String, String> headers) {
        if (signature == null || signature.isBlank()) {
            return VerificationResult.failure("Missing Stripe signature header");
        }
        if (secret == null || secret.isBlank()) {
            return VerificationResult.failure("Stripe webhook secret not configured");
        }

        Long timestamp = null;
        List<String> candidates = new ArrayList<>();
        for (String part : signature.split(",")) {
            String[] keyValue = part.trim().split("=", 2);
            if (keyValue.length != 2)
                continue;
            if ("t".equals(keyValue[0])) {
                try {
                    timestamp = Long.parseLong(keyValue[1]);
                } catch (NumberFormatException e) {
                    return VerificationResult.failure("Invalid Stripe signature timestamp");
                }
            } else if ("v1".equals(keyValue[0])) {
                candidates.add(keyValue[1]);
            }
        }

        if (timestamp == null || candidates.isEmpty()) {
            return VerificationResult.failure("Malformed Stripe signature header");
        }

        long now = clock.instant().getEpochSecond();
        if (Math.abs(now - timestamp) > TIMESTAMP_TOLERANCE_SECONDS) {
            log.warn("Stripe signature timestamp outside tolerance: timestamp={}, now={}", timestamp, now);
            return VerificationResult.failure("Stripe signature timestamp outside tolerance");
        }

        String body = rawBody == null ? "" : rawBody;
        String expected = HmacSigner.hmacSha256Hex(secret, timestamp + "." + body);
        boolean matched = false;
        for (String candidate : candidates) {
            // 不提前 break，保证比较耗时与候选位置无关
            matched |= HmacSigner.constantTimeEquals(expected, candidate);
        }
        if (!matched) {
            return VerificationResult.failure("Stripe webhook signature verification failed");
        }

        JsonNode payload;
        try {
            payload = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return VerificationResult.failure("Stripe webhook payload is not valid JSON: " + e.getOriginalMessage());
        }
        if (payload == null || !payload.isObject() || !payload.hasNonNull("id") || !payload.hasNonNull("type")) {
            return VerificationResult.failure("Stripe webhook payload is missing id or type");
        }

        Instant occurredAt = payload.hasNonNull("created")
                ? Instant.ofEpochSecond(payload.get("created").asLong())
                : clock.instant();

        return VerificationResult.ok(ParsedWebhookEvent.builder()
                .id(payload.get("id").asText())
                .type(payload.get("type").asText())
                .accountId(payload.hasNonNull("account") ? payload.get("account").asText() : null)
                .occurredAt(occurredAt)
                .data(payload.path("data").path("object"))
                .rawPayload(payload)
                .build());
    }
}
