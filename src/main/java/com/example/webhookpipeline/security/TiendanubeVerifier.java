package com.example.webhookpipeline.security;

import com.example.webhookpipeline.model.WebhookProvider;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.time.Clock;

/**
 * Tiendanube：store_id 必须与配置的店铺 ID 一致。
 */
@Component
public class TiendanubeVerifier extends AccountIdVerifier {

    public TiendanubeVerifier(ObjectMapper objectMapper, Clock clock) {
        super(objectMapper, clock);
    }

    @Override
    public WebhookProvider provider() {
        return WebhookProvider.TIENDANUBE;
    }

    @Override
    protected String accountField() {
        return "store_id";
    }

    @Override
    protected String mismatchError() {
        return "Store ID mismatch";
    }

    @Override
    protected String eventType(JsonNode payload) {
        return payload.hasNonNull("event") ? payload.get("event").asText() : "unknown";
    }

    /**
     * 幂等键：事件名 + 对象 ID，通知体带 updated_at 时一并拼入。
     * <p>
     * Tiendanube 通知本身只有 store_id、event、id 三个字段，不带时间戳时同一对象的第二次
     * order/updated 会与第一次得到相同的键，被网关当作重复投递跳过；依赖这类事件的数据需靠全量同步补齐。
     */
    @Override
    protected String eventId(JsonNode payload) {
        if (!payload.hasNonNull("id")) {
            return null;
        }
        // 同一对象的 created/updated 共享 id，需带上事件名
        String key = "tiendanube-" + eventType(payload) + "-" + payload.get("id").asText();
        if (payload.hasNonNull("updated_at")) {
            key += "-" + payload.get("updated_at").asText();
        }
        return key;
    }
}
