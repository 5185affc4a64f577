package com.example.webhookpipeline.processor;

import com.example.webhookpipeline.model.SyncedObjectType;
import com.example.webhookpipeline.model.WebhookProvider;
import com.example.webhookpipeline.realtime.RealtimeEventEmitter;
import com.example.webhookpipeline.realtime.RealtimeEventType;
import com.example.webhookpipeline.repository.ConnectorRepository;
import com.example.webhookpipeline.security.ParsedWebhookEvent;
import com.example.webhookpipeline.sync.SyncCommand;
import com.example.webhookpipeline.sync.SyncService;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Stripe 事件处理：客户、产品、价格、订阅与发票。
 */
@Component
@Slf4j
public class StripeEventProcessor extends AbstractEventProcessor {

    public static final List<String> SUPPORTED_EVENTS = List.of(
            "customer.created",
            "customer.updated",
            "customer.deleted",
            "product.created",
            "product.updated",
            "product.deleted",
            "price.created",
            "price.updated",
            "price.deleted",
            "customer.subscription.created",
            "customer.subscription.updated",
            "customer.subscription.deleted",
            "invoice.created",
            "invoice.updated",
            "invoice.finalized",
            "invoice.paid",
            "invoice.payment_failed",
            "invoice.voided");

    public StripeEventProcessor(RealtimeEventEmitter emitter, SyncService syncService,
            ConnectorRepository connectorRepository, Clock clock) {
        super(emitter, syncService, connectorRepository, clock);
    }

    @Override
    public WebhookProvider provider() {
        return WebhookProvider.STRIPE;
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
            case "customer.created":
            case "customer.updated": {
                boolean created = eventType.equals("customer.created");
                sync(record(workspaceId, SyncedObjectType.CUSTOMER, objectId)
                        .customerRef(text(data, "email"))
                        .occurredAt(occurredAt(data, event)));
                emit(created ? RealtimeEventType.CUSTOMER_CREATED : RealtimeEventType.CUSTOMER_UPDATED,
                        event, workspaceId, connectorId,
                        fields("customerId", objectId, "email", text(data, "email"), "name", text(data, "name")));
                return ProcessingResult.ok(eventType, objectId, created ? "created" : "updated");
            }

            case "customer.deleted":
                remove(workspaceId, SyncedObjectType.CUSTOMER, objectId);
                return ProcessingResult.ok(eventType, objectId, "deleted");

            case "product.created":
            case "product.updated": {
                boolean created = eventType.equals("product.created");
                sync(record(workspaceId, SyncedObjectType.PRODUCT, objectId)
                        .status(Boolean.FALSE.equals(bool(data, "active")) ? "archived" : "active")
                        .occurredAt(occurredAt(data, event)));
                emit(created ? RealtimeEventType.PRODUCT_CREATED : RealtimeEventType.PRODUCT_UPDATED,
                        event, workspaceId, connectorId, fields("productId", objectId, "name", text(data, "name")));
                return ProcessingResult.ok(eventType, objectId, created ? "created" : "updated");
            }

            case "product.deleted":
                remove(workspaceId, SyncedObjectType.PRODUCT, objectId);
                return ProcessingResult.ok(eventType, objectId, "deleted");

            // 价格只影响订阅金额，订阅事件会携带最新价格
            case "price.created":
            case "price.updated":
                return ProcessingResult.ok(eventType, objectId,
                        eventType.equals("price.created") ? "created" : "updated",
                        "Prices are applied through subscription events");

            case "price.deleted":
                return ProcessingResult.ok(eventType, objectId, "deactivated");

            case "customer.subscription.created":
            case "customer.subscription.updated": {
                boolean created = eventType.equals("customer.subscription.created");
                String status = text(data, "status");
                String customerId = customerRef(data);
                sync(record(workspaceId, SyncedObjectType.SUBSCRIPTION, objectId)
                        .amount(monthlyAmount(data))
                        .status(status)
                        .customerRef(customerId)
                        .occurredAt(occurredAt(data, event)));
                emit(created ? RealtimeEventType.SUBSCRIPTION_CREATED : RealtimeEventType.SUBSCRIPTION_UPDATED,
                        event, workspaceId, connectorId,
                        fields("subscriptionId", objectId, "status", status, "customerId", customerId));
                return ProcessingResult.ok(eventType, objectId, created ? "created" : "updated");
            }

            case "customer.subscription.deleted":
                sync(record(workspaceId, SyncedObjectType.SUBSCRIPTION, objectId)
                        .status("canceled")
                        .customerRef(customerRef(data)));
                emit(RealtimeEventType.SUBSCRIPTION_CANCELED, event, workspaceId, connectorId,
                        fields("subscriptionId", objectId, "status", "canceled"));
                return ProcessingResult.ok(eventType, objectId, "canceled");

            case "invoice.created":
            case "invoice.updated":
            case "invoice.finalized":
                if (data != null && data.hasNonNull("id")) {
                    sync(invoice(workspaceId, data, event).amount(minorUnits(data, "amount_due")));
                }
                return ProcessingResult.ok(eventType, objectId, eventType.substring("invoice.".length()));

            case "invoice.paid": {
                if (data != null && data.hasNonNull("id")) {
                    LocalDateTime paidAt = epochSeconds(data.path("status_transitions"), "paid_at");
                    sync(invoice(workspaceId, data, event)
                            .amount(minorUnits(data, "amount_paid"))
                            .status("paid")
                            .occurredAt(paidAt != null ? paidAt : occurredAt(data, event)));
                }
                emit(RealtimeEventType.INVOICE_PAID, event, workspaceId, connectorId,
                        fields("invoiceId", objectId, "amountPaid", minorUnits(data, "amount_paid"),
                                "currency", text(data, "currency")));
                return ProcessingResult.ok(eventType, objectId, "paid");
            }

            case "invoice.voided":
                if (data != null && data.hasNonNull("id")) {
                    sync(record(workspaceId, SyncedObjectType.INVOICE, objectId).status("void"));
                }
                return ProcessingResult.ok(eventType, objectId, "voided");

            case "invoice.payment_failed":
                if (data != null && data.hasNonNull("id")) {
                    sync(invoice(workspaceId, data, event).amount(minorUnits(data, "amount_due")));
                }
                emit(RealtimeEventType.INVOICE_FAILED, event, workspaceId, connectorId,
                        fields("invoiceId", objectId, "amountDue", minorUnits(data, "amount_due")));
                return ProcessingResult.ok(eventType, objectId, "payment_failed");

            default:
                log.debug("Unhandled Stripe event type: {}", eventType);
                return ProcessingResult.ignored(eventType, null);
        }
    }

    private SyncCommand.SyncCommandBuilder invoice(String workspaceId,
            JsonNode data, ParsedWebhookEvent event) {
        return record(workspaceId, SyncedObjectType.INVOICE, text(data, "id"))
                .status(text(data, "status"))
                .customerRef(customerRef(data))
                .occurredAt(occurredAt(data, event));
    }

    private LocalDateTime occurredAt(JsonNode data, ParsedWebhookEvent event) {
        LocalDateTime created = epochSeconds(data, "created");
        return created != null ? created : utc(event.getOccurredAt() != null ? event.getOccurredAt() : clock.instant());
    }

    /**
     * customer 字段可能是 ID 字符串，也可能是展开后的对象。
     */
    private static String customerRef(JsonNode data) {
        JsonNode customer = data == null ? null : data.get("customer");
        if (customer == null || customer.isNull()) {
            return null;
        }
        return customer.isObject() ? text(customer, "id") : customer.asText();
    }

    private static Boolean bool(JsonNode data, String field) {
        return data != null && data.hasNonNull(field) ? data.get(field).asBoolean() : null;
    }

    /**
     * 订阅的月度金额：各订阅项 unit_amount × quantity 之和，年付按 12 折算；无订阅项时回退到 plan.amount。
     */
    static BigDecimal monthlyAmount(JsonNode subscription) {
        if (subscription == null) {
            return null;
        }
        JsonNode items = subscription.path("items").path("data");
        if (items.isArray() && items.size() > 0) {
            BigDecimal total = BigDecimal.ZERO;
            for (JsonNode item : items) {
                JsonNode price = item.has("price") ? item.get("price") : item.path("plan");
                BigDecimal unit = minorUnits(price, price.has("unit_amount") ? "unit_amount" : "amount");
                if (unit == null) {
                    continue;
                }
                long quantity = item.hasNonNull("quantity") ? item.get("quantity").asLong() : 1;
                total = total.add(toMonthly(unit.multiply(BigDecimal.valueOf(quantity)),
                        price.path("recurring").path("interval").asText(price.path("interval").asText("month"))));
            }
            return total;
        }
        JsonNode plan = subscription.path("plan");
        BigDecimal amount = minorUnits(plan, "amount");
        if (amount == null) {
            return null;
        }
        long quantity = subscription.hasNonNull("quantity") ? subscription.get("quantity").asLong() : 1;
        return toMonthly(amount.multiply(BigDecimal.valueOf(quantity)), plan.path("interval").asText("month"));
    }

    private static BigDecimal toMonthly(BigDecimal amount, String interval) {
        switch (interval) {
            case "year":
                return divide(amount, 12);
            case "week":
                return amount.multiply(BigDecimal.valueOf(52)).divide(BigDecimal.valueOf(12), 4,
                        RoundingMode.HALF_UP);
            case "day":
                return amount.multiply(BigDecimal.valueOf(365)).divide(BigDecimal.valueOf(12), 4,
                        RoundingMode.HALF_UP);
            default:
                return amount;
        }
    }
}
