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
import java.time.LocalDateTime;
import java.util.List;

/**
 * Shopify 事件处理：订单、客户、商品、库存与应用卸载。
 */
@Component
@Slf4j
public class ShopifyEventProcessor extends AbstractEventProcessor {

    public static final List<String> SUPPORTED_EVENTS = List.of(
            "orders/create",
            "orders/updated",
            "orders/paid",
            "orders/cancelled",
            "orders/fulfilled",
            "customers/create",
            "customers/update",
            "customers/delete",
            "products/create",
            "products/update",
            "products/delete",
            "inventory_levels/update",
            "app/uninstalled");

    public ShopifyEventProcessor(RealtimeEventEmitter emitter, SyncService syncService,
            ConnectorRepository connectorRepository, Clock clock) {
        super(emitter, syncService, connectorRepository, clock);
    }

    @Override
    public WebhookProvider provider() {
        return WebhookProvider.SHOPIFY;
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

        switch (eventType) {
            case "orders/create":
            case "orders/updated":
            case "orders/paid":
            case "orders/fulfilled":
            case "orders/cancelled": {
                boolean created = eventType.equals("orders/create");
                String status = orderStatus(eventType, data);
                sync(record(workspaceId, SyncedObjectType.ORDER, objectId)
                        .amount(decimal(data, "total_price"))
                        .status(status)
                        .customerRef(text(data.path("customer"), "id"))
                        .occurredAt(occurredAt(data, "created_at", event)));
                emit(created ? RealtimeEventType.ORDER_CREATED : RealtimeEventType.ORDER_UPDATED,
                        event, workspaceId, connectorId,
                        fields("orderId", objectId,
                                "orderNumber", text(data, "name"),
                                "totalPrice", decimal(data, "total_price"),
                                "currency", text(data, "currency"),
                                "status", status));
                log.info("Shopify order {} {} for workspace {}", objectId, actionFor(eventType), workspaceId);
                return ProcessingResult.ok(eventType, objectId, actionFor(eventType));
            }

            case "customers/create":
            case "customers/update": {
                boolean created = eventType.equals("customers/create");
                sync(record(workspaceId, SyncedObjectType.CUSTOMER, objectId)
                        .customerRef(text(data, "email"))
                        .status(text(data, "state"))
                        .occurredAt(occurredAt(data, "created_at", event)));
                emit(created ? RealtimeEventType.CUSTOMER_CREATED : RealtimeEventType.CUSTOMER_UPDATED,
                        event, workspaceId, connectorId,
                        fields("customerId", objectId, "email", text(data, "email")));
                return ProcessingResult.ok(eventType, objectId, created ? "created" : "updated");
            }

            case "customers/delete":
                remove(workspaceId, SyncedObjectType.CUSTOMER, objectId);
                return ProcessingResult.ok(eventType, objectId, "deleted");

            case "products/create":
            case "products/update": {
                boolean created = eventType.equals("products/create");
                sync(record(workspaceId, SyncedObjectType.PRODUCT, objectId)
                        .status(text(data, "status"))
                        .occurredAt(occurredAt(data, "created_at", event)));
                emit(created ? RealtimeEventType.PRODUCT_CREATED : RealtimeEventType.PRODUCT_UPDATED,
                        event, workspaceId, connectorId, fields("productId", objectId, "name", text(data, "title")));
                return ProcessingResult.ok(eventType, objectId, created ? "created" : "updated");
            }

            case "products/delete":
                remove(workspaceId, SyncedObjectType.PRODUCT, objectId);
                return ProcessingResult.ok(eventType, objectId, "deleted");

            case "inventory_levels/update":
                return ProcessingResult.ok(eventType, textOr(data, "inventory_item_id", "unknown"), "acknowledged",
                        "Inventory levels are not tracked");

            case "app/uninstalled":
                deactivateConnector(connectorId);
                return ProcessingResult.ok(eventType, workspaceId, "uninstalled", "Connector deactivated");

            default:
                log.debug("Unhandled Shopify event type: {}", eventType);
                return ProcessingResult.ignored(eventType, null);
        }
    }

    private static String orderStatus(String eventType, JsonNode order) {
        if (eventType.equals("orders/cancelled") || order.hasNonNull("cancelled_at")) {
            return "cancelled";
        }
        String financial = text(order, "financial_status");
        if (financial != null) {
            return financial;
        }
        return eventType.equals("orders/paid") ? "paid" : null;
    }

    private static String actionFor(String eventType) {
        switch (eventType) {
            case "orders/create":
                return "created";
            case "orders/cancelled":
                return "cancelled";
            default:
                return eventType.substring("orders/".length());
        }
    }

    private LocalDateTime occurredAt(JsonNode data, String field, ParsedWebhookEvent event) {
        LocalDateTime parsed = isoTimestamp(data, field);
        return parsed != null ? parsed : utc(event.getOccurredAt() != null ? event.getOccurredAt() : clock.instant());
    }
}
