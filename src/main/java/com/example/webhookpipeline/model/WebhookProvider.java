package com.example.webhookpipeline.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * 支持的入站 Webhook 提供方。
 */
public enum WebhookProvider {
    STRIPE("stripe", "Stripe"),
    SHOPIFY("shopify", "Shopify"),
    TIENDANUBE("tiendanube", "Tiendanube"),
    MERCADOLIBRE("mercadolibre", "MercadoLibre");

    private final String id;
    private final String displayName;

    WebhookProvider(String id, String displayName) {
        this.id = id;
        this.displayName = displayName;
    }

    public String getId() {
        return id;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * 按路径中的 provider 标识查找（忽略大小写）。
     */
    public static Optional<WebhookProvider> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(p -> p.id.equalsIgnoreCase(id.trim()))
                .findFirst();
    }
}
