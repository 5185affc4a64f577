package com.example.webhookpipeline.security;

import com.example.webhookpipeline.model.WebhookProvider;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.util.Map;

/**
 * Shopify 验签：x-shopify-hmac-sha256 为原始请求体 HMAC-SHA256 的 Base64。
 */
@Component
@RequiredArgsConstructor
public class ShopifyVerifier implements SignatureVerifier {

    public static final String SIGNATURE_HEADER = "x-shopify-hmac-sha256";
    public static final String TOPIC_HEADER = "x-shopify-topic";
    public static final String WEBHOOK_ID_HEADER = "x-shopify-webhook-id";
    public static final String SHOP_DOMAIN_HEADER = "x-shopify-shop-domain";

    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    public WebhookProvider provider() {
        return WebhookProvider.SHOPIFY;
    }

    @Override
    public String getSignatureHeader(Map<String, String> headers) {
        return SignatureVerifier.header(headers, SIGNATURE_HEADER);
    }

    @Override
    public VerificationResult verifyAndParse(String rawBody, String signature, String secret,
            Map<String, String> headers) {
        if (signature == null || signature.isBlank()) {
            return VerificationResult.failure("Missing Shopify HMAC signature header");
        }
        if (secret == null || secret.isBlank()) {
            return VerificationResult.failure("Shopify webhook secret not configured");
        }

        String body = rawBody == null ? "" : rawBody;
        String expected = HmacSigner.hmacSha256Base64(secret, body);
        if (!HmacSigner.constantTimeEquals(expected, signature)) {
            return VerificationResult.failure("Shopify HMAC signature verification failed");
        }

        JsonNode payload;
        try {
            payload = objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return VerificationResult.failure("Shopify webhook payload is not valid JSON: " + e.getOriginalMessage());
        }
        if (payload == null || !payload.isObject()) {
            return VerificationResult.failure("Shopify webhook payload is not a JSON object");
        }

        String topic = SignatureVerifier.header(headers, TOPIC_HEADER);
        String eventId = SignatureVerifier.header(headers, WEBHOOK_ID_HEADER);
        if (eventId == null) {
            // 无 webhook id 时用请求体摘要代替，重复投递仍能命中幂等键
            eventId = "shopify-" + sha256Hex(body);
        }

        return VerificationResult.ok(ParsedWebhookEvent.builder()
                .id(eventId)
                .type(topic == null ? "unknown" : topic)
                .accountId(SignatureVerifier.header(headers, SHOP_DOMAIN_HEADER))
                .occurredAt(clock.instant())
                .data(payload)
                .rawPayload(payload)
                .build());
    }

    private static String sha256Hex(String body) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(body.getBytes(StandardCharsets.UTF_8));
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < 16; i++) {
                sb.append(String.format("%02x", digest[i]));
            }
            return sb.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
