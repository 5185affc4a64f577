package com.example.webhookpipeline.processor;

import com.example.webhookpipeline.model.SyncedObjectType;
import com.example.webhookpipeline.realtime.RealtimeEvent;
import com.example.webhookpipeline.realtime.RealtimeEventEmitter;
import com.example.webhookpipeline.realtime.RealtimeEventType;
import com.example.webhookpipeline.repository.ConnectorRepository;
import com.example.webhookpipeline.security.ParsedWebhookEvent;
import com.example.webhookpipeline.sync.SyncCommand;
import com.example.webhookpipeline.sync.SyncService;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 处理器公共骨架：异常兜底为失败结果，以及同步、实时事件发布与 JSON 取值的辅助方法。
 * 实时事件以 fire-and-forget 方式发布，下游（批处理、指标重算）经由事件总线订阅。
 */
@Slf4j
public abstract class AbstractEventProcessor implements WebhookEventProcessor {

    private final RealtimeEventEmitter emitter;
    private final SyncService syncService;
    private final ConnectorRepository connectorRepository;
    protected final Clock clock;

    protected AbstractEventProcessor(RealtimeEventEmitter emitter, SyncService syncService,
            ConnectorRepository connectorRepository, Clock clock) {
        this.emitter = emitter;
        this.syncService = syncService;
        this.connectorRepository = connectorRepository;
        this.clock = clock;
    }

    @Override
    public final ProcessingResult processEvent(ParsedWebhookEvent event, String workspaceId, Long connectorId) {
        log.debug("Processing {} event: type={}, id={}", provider().getDisplayName(), event.getType(), event.getId());
        try {
            return handle(event, workspaceId, connectorId);
        } catch (Exception e) {
            log.error("Failed to process {} event {} ({})", provider().getDisplayName(), event.getId(),
                    event.getType(), e);
            return ProcessingResult.failed(event.getType(), e.getMessage());
        }
    }

    protected abstract ProcessingResult handle(ParsedWebhookEvent event, String workspaceId, Long connectorId)
            throws Exception;

    /**
     * 发布实时事件，附带来源事件 ID 与类型。值为 null 的字段会被忽略。
     */
    protected void emit(RealtimeEventType type, ParsedWebhookEvent source, String workspaceId, Long connectorId,
            Map<String, Object> data) {
        Map<String, Object> payload = new LinkedHashMap<>();
        data.forEach((key, value) -> {
            if (value != null) {
                payload.put(key, value);
            }
        });
        payload.put("sourceEventId", source.getId());
        payload.put("sourceEventType", source.getType());
        emitter.publish(RealtimeEvent.builder()
                .type(type)
                .workspaceId(workspaceId)
                .connectorId(connectorId)
                .data(Collections.unmodifiableMap(payload))
                .timestamp(clock.instant())
                .build());
    }

    protected SyncCommand.SyncCommandBuilder record(String workspaceId, SyncedObjectType objectType,
            String externalId) {
        return SyncCommand.builder()
                .workspaceId(workspaceId)
                .provider(provider())
                .objectType(objectType)
                .externalId(externalId);
    }

    protected void sync(SyncCommand.SyncCommandBuilder command) {
        syncService.upsert(command.build());
    }

    protected boolean remove(String workspaceId, SyncedObjectType objectType, String externalId) {
        return externalId != null && syncService.delete(workspaceId, provider(), objectType, externalId);
    }

    /**
     * 应用被卸载后停用对应连接器，后续 Webhook 将按无连接器处理。
     */
    protected void deactivateConnector(Long connectorId) {
        if (connectorId == null) {
            return;
        }
        connectorRepository.findById(connectorId).ifPresent(connector -> {
            connector.setActive(false);
            connectorRepository.save(connector);
            log.warn("{} app uninstalled, connector {} deactivated", provider().getDisplayName(), connectorId);
        });
    }

    protected static Map<String, Object> fields(Object... keyValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            map.put(String.valueOf(keyValues[i]), keyValues[i + 1]);
        }
        return map;
    }

    protected static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        return value == null || value.isNull() || value.isContainerNode() ? null : value.asText();
    }

    protected static String textOr(JsonNode node, String field, String fallback) {
        String value = text(node, field);
        return value == null || value.isEmpty() ? fallback : value;
    }

    /**
     * 读取十进制金额（主币种单位），支持字符串或数值。
     */
    protected static BigDecimal decimal(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            log.debug("Ignoring non-numeric amount {}={}", field, value);
            return null;
        }
    }

    /**
     * 读取以最小货币单位（分）表示的整数金额并换算为主币种单位。
     */
    protected static BigDecimal minorUnits(JsonNode node, String field) {
        if (node == null || !node.hasNonNull(field) || !node.get(field).canConvertToLong()) {
            return null;
        }
        return BigDecimal.valueOf(node.get(field).asLong()).movePointLeft(2);
    }

    protected static BigDecimal divide(BigDecimal amount, int divisor) {
        return amount.divide(BigDecimal.valueOf(divisor), 4, RoundingMode.HALF_UP);
    }

    protected static LocalDateTime utc(Instant instant) {
        return instant == null ? null : LocalDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    protected static LocalDateTime epochSeconds(JsonNode node, String field) {
        if (node == null || !node.hasNonNull(field) || !node.get(field).canConvertToLong()) {
            return null;
        }
        return utc(Instant.ofEpochSecond(node.get(field).asLong()));
    }

    /**
     * 解析带时区偏移的 ISO-8601 时间，失败时返回 null。
     */
    protected static LocalDateTime isoTimestamp(JsonNode node, String field) {
        String value = text(node, field);
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return utc(OffsetDateTime.parse(value).toInstant());
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparsable timestamp {}={}", field, value);
            return null;
        }
    }
}
