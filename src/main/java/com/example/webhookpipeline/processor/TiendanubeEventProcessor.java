package com.example.webhookpipeline.processor;

import com.example.webhookpipeline.model.SyncedObjectType;
import com.example.webhookpipeline.model.WebhookProvider;
import com.example.webhookpipeline.realtime.RealtimeEventEmitter;
import com.example.webhookpipeline.realtime.RealtimeEventType;
import com.example.webhookpipeline.repository.ConnectorRepository;
import com.example.webhookpipeline.security.ParsedWebhookEvent;
import com.example.webhookpipeline.sync.SyncService;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Tiendanube 事件处理。通知只携带对象 ID，金额等明细需通过全量同步补齐。
 */
@Component
@Slf4j
public class TiendanubeEventProcessor extends AbstractEventProcessor {

    public static final List<String> SUPPORTED_EVENTS = List.of(
            "order/created",
            "order/updated",
            "order/paid",
            "order/packed",
            "order/fulfilled",
            "order/cancelled",
            "product/created",
            "product/updated",
            "product/deleted",
            "category/created",
            "category/updated",
            "category/deleted",
            "app/uninstalled");

    public TiendanubeEventProcessor(RealtimeEventEmitter emitter, SyncService syncService,
            ConnectorRepository connectorRepository, Clock clock) {
        super(emitter, syncService, connectorRepository, clock);
    }

    @Override
    public WebhookProvider provider() {
        return WebhookProvider.TIENDANUBE;
    }

    @Override
    public List<String> getSupportedEventTypes() {
        return SUPPORTED_EVENTS;
    }

    @Override
    protected ProcessingResult handle(ParsedWebhookEvent event, String workspaceId, Long connectorId) {
        String eventType = event.getType();
        JsonNode data = event.getData();
        String objectId = textOr(data, "id", "unknown");

        if (eventType.startsWith("order/")) {
            return processOrder(event, eventType, objectId, workspaceId, connectorId);
        }
        if (eventType.startsWith("product/")) {
            return processProduct(event, eventType, objectId, workspaceId, connectorId);
        }
        if (eventType.startsWith("category/")) {
            return ProcessingResult.ok(eventType, objectId, "acknowledged", "Category events are not tracked");
        }
        if (eventType.equals("app/uninstalled")) {
            deactivateConnector(connectorId);
            return ProcessingResult.ok(eventType, workspaceId, "uninstalled", "Connector deactivated");
        }
        log.debug("Unhandled Tiendanube event type: {}", eventType);
        return ProcessingResult.ignored(eventType, null);
    }

    private ProcessingResult processOrder(ParsedWebhookEvent event, String eventType, String orderId,
            String workspaceId, Long connectorId) {
        String action = eventType.substring("order/".length());
        switch (action) {
            case "created":
            case "updated":
            case "paid":
            case "packed":
            case "fulfilled":
            case "cancelled": {
                if (!"unknown".equals(orderId)) {
                    sync(record(workspaceId, SyncedObjectType.ORDER, orderId)
                            .status(orderStatus(action))
                            .occurredAt(action.equals("created") ? utc(event.getOccurredAt()) : null));
                }
                emit(action.equals("created") ? RealtimeEventType.ORDER_CREATED : RealtimeEventType.ORDER_UPDATED,
                        event, workspaceId, connectorId,
                        fields("orderId", orderId, "status", orderStatus(action),
                                "cancelReason", text(event.getData(), "cancel_reason")));
                return action.equals("cancelled")
                        ? ProcessingResult.ok(eventType, orderId, action)
                        : ProcessingResult.ok(eventType, orderId, action, "Order event received, full sync recommended");
            }
            default:
                return ProcessingResult.ok(eventType, orderId, ProcessingResult.ACTION_IGNORED);
        }
    }

    private ProcessingResult processProduct(ParsedWebhookEvent event, String eventType, String productId,
            String workspaceId, Long connectorId) {
        switch (eventType) {
            case "product/created":
            case "product/updated": {
                boolean created = eventType.equals("product/created");
                if (!"unknown".equals(productId)) {
                    sync(record(workspaceId, SyncedObjectType.PRODUCT, productId)
                            .occurredAt(created ? utc(event.getOccurredAt()) : null));
                }
                emit(created ? RealtimeEventType.PRODUCT_CREATED : RealtimeEventType.PRODUCT_UPDATED,
                        event, workspaceId, connectorId, fields("productId", productId));
                return ProcessingResult.ok(eventType, productId, created ? "created" : "updated",
                        "Product event received, full sync recommended");
            }
            case "product/deleted":
                remove(workspaceId, SyncedObjectType.PRODUCT, productId);
                return ProcessingResult.ok(eventType, productId, "deleted");
            default:
                return ProcessingResult.ok(eventType, productId, ProcessingResult.ACTION_IGNORED);
        }
    }

    // packed/fulfilled 不改变支付状态
    private static String orderStatus(String action) {
        switch (action) {
            case "created":
                return "open";
            case "paid":
                return "paid";
            case "cancelled":
                return "cancelled";
            default:
                return null;
        }
    }
}
