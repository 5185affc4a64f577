package com.example.webhookpipeline.security;

import com.example.webhookpipeline.model.WebhookProvider;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 验签策略注册表：按提供方查找实现，新增提供方只需新增一个 {@link SignatureVerifier} Bean。
 */
@Component
public class VerifierRegistry {

    private final Map<WebhookProvider, SignatureVerifier> verifiers;

    public VerifierRegistry(List<SignatureVerifier> verifiers) {
        Map<WebhookProvider, SignatureVerifier> map = new EnumMap<>(WebhookProvider.class);
        for (SignatureVerifier verifier : verifiers) {
            SignatureVerifier previous = map.put(verifier.provider(), verifier);
            if (previous != null) {
                throw new IllegalStateException("Duplicate verifier for provider " + verifier.provider());
            }
        }
        this.verifiers = Collections.unmodifiableMap(map);
    }

    public Optional<SignatureVerifier> getVerifier(WebhookProvider provider) {
        return Optional.ofNullable(verifiers.get(provider));
    }
}
