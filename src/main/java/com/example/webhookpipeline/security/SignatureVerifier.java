package com.example.webhookpipeline.security;

import com.example.webhookpipeline.model.WebhookProvider;

import java.util.Map;

/**
 * 入站验签策略：每个提供方一个实现。实现类不得向外抛出异常，失败统一以 {@link VerificationResult#failure} 返回。
 */
public interface SignatureVerifier {

    WebhookProvider provider();

    /**
     * 从请求头中提取签名；无签名机制的提供方返回 null。
     *
     * @param headers 小写请求头
     * @return 签名值
     */
    String getSignatureHeader(Map<String, String> headers);

    /**
     * 校验并解析请求体。
     *
     * @param rawBody   原始请求体
     * @param signature 签名（可为 null）
     * @param secret    签名密钥或账户 ID
     * @param headers   小写请求头
     * @return 校验结果
     */
    VerificationResult verifyAndParse(String rawBody, String signature, String secret, Map<String, String> headers);

    static String header(Map<String, String> headers, String name) {
        if (headers == null) {
            return null;
        }
        String value = headers.get(name);
        if (value == null) {
            for (Map.Entry<String, String> entry : headers.entrySet()) {
                if (entry.getKey() != null && entry.getKey().equalsIgnoreCase(name)) {
                    value = entry.getValue();
                    break;
                }
            }
        }
        return value == null || value.isBlank() ? null : value.trim();
    }
}
