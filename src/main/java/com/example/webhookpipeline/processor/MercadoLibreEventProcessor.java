package com.example.webhookpipeline.processor;

import com.example.webhookpipeline.model.SyncedObjectType;
import com.example.webhookpipeline.model.WebhookProvider;
import com.example.webhookpipeline.realtime.RealtimeEventEmitter;
import com.example.webhookpipeline.realtime.RealtimeEventType;
import com.example.webhookpipeline.repository.ConnectorRepository;
import com.example.webhookpipeline.security.ParsedWebhookEvent;
import com.example.webhookpipeline.sync.SyncService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * MercadoLibre 通知处理。通知只包含资源路径（如 /orders/123），按 topic 分类。
 */
@Component
@Slf4j
public class MercadoLibreEventProcessor extends AbstractEventProcessor {

    public static final List<String> SUPPORTED_EVENTS = List.of(
            "orders_v2",
            "items",
            "items_prices",
            "questions",
            "shipments",
            "messages",
            "claims",
            "payments");

    public MercadoLibreEventProcessor(RealtimeEventEmitter emitter, SyncService syncService,
            ConnectorRepository connectorRepository, Clock clock) {
        super(emitter, syncService, connectorRepository, clock);
    }

    @Override
    public WebhookProvider provider() {
        return WebhookProvider.MERCADOLIBRE;
    }

    @Override
    public List<String> getSupportedEventTypes() {
        return SUPPORTED_EVENTS;
    }

    @Override
    protected ProcessingResult handle(ParsedWebhookEvent event, String workspaceId, Long connectorId) {
        String topic = event.getType();
        String resource = text(event.getData(), "resource");
        String resourceId = extractResourceId(resource);

        switch (topic) {
            case "orders_v2":
                if (!"unknown".equals(resourceId)) {
                    sync(record(workspaceId, SyncedObjectType.ORDER, resourceId)
                            .occurredAt(utc(event.getOccurredAt())));
                }
                emit(RealtimeEventType.ORDER_UPDATED, event, workspaceId, connectorId,
                        fields("orderId", resourceId, "resource", resource));
                return ProcessingResult.ok(topic, resourceId, "updated",
                        "Order notification received, fetch order details from API");
            case "items":
            case "items_prices":
                if (!"unknown".equals(resourceId)) {
                    sync(record(workspaceId, SyncedObjectType.PRODUCT, resourceId)
                            .occurredAt(utc(event.getOccurredAt())));
                }
                emit(RealtimeEventType.PRODUCT_UPDATED, event, workspaceId, connectorId,
                        fields("productId", resourceId, "resource", resource));
                return ProcessingResult.ok(topic, resourceId, "updated",
                        "Item notification received, fetch item details from API");
            case "questions":
            case "messages":
            case "claims":
                return ProcessingResult.ok(topic, resourceId, "received");
            case "shipments":
            case "payments":
                return ProcessingResult.ok(topic, resourceId, "updated");
            default:
                log.debug("Unhandled MercadoLibre topic: {}", topic);
                return ProcessingResult.ignored(topic, resourceId);
        }
    }

    /**
     * "/orders/12345" -> "12345"
     */
    static String extractResourceId(String resource) {
        if (resource == null || resource.isBlank()) {
            return "unknown";
        }
        String[] parts = resource.split("/");
        String last = parts.length == 0 ? "" : parts[parts.length - 1];
        return last.isBlank() ? "unknown" : last;
    }
}
