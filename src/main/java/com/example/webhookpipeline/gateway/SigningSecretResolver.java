package com.example.webhookpipeline.gateway;

import com.example.webhookpipeline.config.PipelineProperties;
import com.example.webhookpipeline.model.Connector;
import com.example.webhookpipeline.model.WebhookProvider;
import com.example.webhookpipeline.repository.ConnectorRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * 签名密钥解析：优先读取配置 app.pipeline.webhooks.secrets.&lt;provider&gt;，其次取该提供方第一个启用连接器上的密钥。
 * 对 Tiendanube / MercadoLibre 而言，“密钥”即店铺 ID / 用户 ID。
 */
@Component
@RequiredArgsConstructor
public class SigningSecretResolver {

    private final PipelineProperties properties;
    private final ConnectorRepository connectorRepository;

    public Optional<String> resolve(WebhookProvider provider) {
        String configured = properties.getWebhooks().getSecrets().get(provider.getId());
        if (configured != null && !configured.isBlank()) {
            return Optional.of(configured);
        }
        return connectorRepository.findByProviderAndActiveTrueOrderByIdAsc(provider).stream()
                .findFirst()
                .map(Connector::getSigningSecret)
                .filter(secret -> !secret.isBlank());
    }
}
