package com.example.webhookpipeline.realtime;

import java.util.Arrays;
import java.util.Optional;

public enum RealtimeEventType {
    ORDER_CREATED("order.created"),
    ORDER_UPDATED("order.updated"),
    CUSTOMER_CREATED("customer.created"),
    CUSTOMER_UPDATED("customer.updated"),
    PRODUCT_CREATED("product.created"),
    PRODUCT_UPDATED("product.updated"),
    SUBSCRIPTION_CREATED("subscription.created"),
    SUBSCRIPTION_UPDATED("subscription.updated"),
    SUBSCRIPTION_CANCELED("subscription.canceled"),
    INVOICE_PAID("invoice.paid"),
    INVOICE_FAILED("invoice.failed"),
    METRICS_UPDATED("metrics.updated"),
    ANOMALY_DETECTED("anomaly.detected");

    private final String wireName;

    RealtimeEventType(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    /**
     * Domain events come from provider webhooks; the other two are produced inside the pipeline.
     */
    public boolean isDomainEvent() {
        return this != METRICS_UPDATED && this != ANOMALY_DETECTED;
    }

    public static Optional<RealtimeEventType> fromWireName(String wireName) {
        return Arrays.stream(values()).filter(t -> t.wireName.equals(wireName)).findFirst();
    }

    @Override
    public String toString() {
        return wireName;
    }
}
