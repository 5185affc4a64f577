package com.example.webhookpipeline.realtime;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

/**
 * 进程内实时事件，不落库。
 */
@Value
@Builder(toBuilder = true)
public class RealtimeEvent {
    @Builder.Default
    String id = UUID.randomUUID().toString();
    RealtimeEventType type;
    String workspaceId;
    Long connectorId;
    @Builder.Default
    Map<String, Object> data = Map.of();
    @Builder.Default
    Instant timestamp = Instant.now();

    public String string(String key) {
        Object value = data.get(key);
        return value == null ? null : String.valueOf(value);
    }

    /**
     * 读取数值字段，缺失或无法解析时返回 0。
     */
    public double number(String key) {
        Object value = data.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        if (value != null) {
            try {
                return Double.parseDouble(value.toString());
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }
}
