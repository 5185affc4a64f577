package com.example.webhookpipeline.delivery;

import com.example.webhookpipeline.security.HmacSigner;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 出站签名：X-Webhook-Signature: t={unix 秒},v1=HMAC_SHA256(secret, "{t}.{body}")。
 */
public final class WebhookSigner {

    public static final String SIGNATURE_HEADER = "X-Webhook-Signature";
    public static final String ID_HEADER = "X-Webhook-ID";
    public static final String TIMESTAMP_HEADER = "X-Webhook-Timestamp";
    public static final long DEFAULT_TOLERANCE_SECONDS = 300;
    public static final int MAX_BACKOFF_MULTIPLIER = 16;

    private WebhookSigner() {
    }

    public static String sign(String payload, String secret, long timestamp) {
        return HmacSigner.hmacSha256Hex(secret, timestamp + "." + payload);
    }

    public static Map<String, String> buildHeaders(String webhookId, String signature, long timestamp,
            String userAgent) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Content-Type", "application/json");
        headers.put(SIGNATURE_HEADER, "t=" + timestamp + ",v1=" + signature);
        headers.put(ID_HEADER, webhookId);
        headers.put(TIMESTAMP_HEADER, Long.toString(timestamp));
        headers.put("User-Agent", userAgent);
        return headers;
    }

    /**
     * 接收方校验签名。
     *
     * @param payload          原始请求体
     * @param signatureHeader  X-Webhook-Signature 的值
     * @param secret           端点密钥
     * @param toleranceSeconds 时间戳容差
     * @param nowEpochSeconds  当前时间（秒）
     * @return 签名有效且时间戳在容差内
     */
    public static boolean verifySignature(String payload, String signatureHeader, String secret,
            long toleranceSeconds, long nowEpochSeconds) {
        if (payload == null || signatureHeader == null || secret == null) {
            return false;
        }
        long timestamp = 0;
        String signature = null;
        for (String part : signatureHeader.split(",")) {
            String trimmed = part.trim();
            if (trimmed.startsWith("t=")) {
                try {
                    timestamp = Long.parseLong(trimmed.substring(2));
                } catch (NumberFormatException e) {
                    return false;
                }
            } else if (trimmed.startsWith("v1=")) {
                signature = trimmed.substring(3);
            }
        }
        if (timestamp == 0 || signature == null) {
            return false;
        }
        if (Math.abs(nowEpochSeconds - timestamp) > toleranceSeconds) {
            return false;
        }
        return HmacSigner.constantTimeEquals(sign(payload, secret, timestamp), signature);
    }

    /**
     * 指数退避：base × min(2^(attempt-1), 16) 秒，返回毫秒。attempt 小于 1 按 1 处理。
     */
    public static long calculateRetryDelay(int attempt, int baseDelaySeconds) {
        int exponent = Math.max(attempt, 1) - 1;
        long multiplier = Math.min(1L << Math.min(exponent, 4), MAX_BACKOFF_MULTIPLIER);
        return baseDelaySeconds * multiplier * 1000L;
    }
}
