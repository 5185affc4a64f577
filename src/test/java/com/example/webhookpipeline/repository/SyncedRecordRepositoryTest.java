package com.example.webhookpipeline.repository;

import com.example.webhookpipeline.model.SyncedObjectType;
import com.example.webhookpipeline.model.SyncedRecord;
import com.example.webhookpipeline.model.WebhookProvider;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class SyncedRecordRepositoryTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 3, 1, 12, 0);
    private static final List<String> EXCLUDED = List.of("cancelled", "refunded");

    @Autowired
    private SyncedRecordRepository repository;

    private void save(String workspaceId, SyncedObjectType type, String externalId, String amount, String status,
            LocalDateTime occurredAt) {
        repository.save(SyncedRecord.builder()
                .workspaceId(workspaceId)
                .provider(WebhookProvider.SHOPIFY)
                .objectType(type)
                .externalId(externalId)
                .amount(amount == null ? null : new BigDecimal(amount))
                .status(status)
                .occurredAt(occurredAt)
                .build());
    }

    @Test
    void testOrderAggregatesWithinWindow() {
        save("ws-1", SyncedObjectType.ORDER, "1", "100.00", "paid", NOW.minusDays(1));
        save("ws-1", SyncedObjectType.ORDER, "2", "50.00", null, NOW.minusDays(2));
        save("ws-1", SyncedObjectType.ORDER, "3", "999.00", "cancelled", NOW.minusDays(1));
        save("ws-1", SyncedObjectType.ORDER, "4", "70.00", "paid", NOW.minusDays(40));
        save("ws-2", SyncedObjectType.ORDER, "1", "10.00", "paid", NOW.minusDays(1));

        LocalDateTime from = NOW.minusDays(30);
        assertEquals(2, repository.countSince("ws-1", SyncedObjectType.ORDER, from, EXCLUDED));
        assertEquals(0, new BigDecimal("150.00").compareTo(
                repository.sumAmountSince("ws-1", SyncedObjectType.ORDER, from, EXCLUDED)));
        assertEquals(0, BigDecimal.ZERO.compareTo(
                repository.sumAmountSince("ws-3", SyncedObjectType.ORDER, from, EXCLUDED)));
    }

    @Test
    void testSubscriptionAndInvoiceAggregates() {
        save("ws-1", SyncedObjectType.SUBSCRIPTION, "sub_1", "20.00", "active", NOW);
        save("ws-1", SyncedObjectType.SUBSCRIPTION, "sub_2", "30.00", "active", NOW);
        save("ws-1", SyncedObjectType.SUBSCRIPTION, "sub_3", "15.00", "trialing", NOW);
        save("ws-1", SyncedObjectType.INVOICE, "in_1", "20.00", "paid", NOW.minusDays(3));
        save("ws-1", SyncedObjectType.INVOICE, "in_2", "20.00", "open", NOW.minusDays(3));

        assertEquals(0, new BigDecimal("50.00").compareTo(
                repository.sumAmountByStatus("ws-1", SyncedObjectType.SUBSCRIPTION, "active")));
        assertEquals(2, repository.countByWorkspaceIdAndObjectTypeAndStatus("ws-1", SyncedObjectType.SUBSCRIPTION,
                "active"));
        assertEquals(3, repository.countByWorkspaceIdAndObjectType("ws-1", SyncedObjectType.SUBSCRIPTION));
        assertEquals(0, new BigDecimal("20.00").compareTo(repository.sumAmountByStatusSince("ws-1",
                SyncedObjectType.INVOICE, "paid", NOW.minusDays(30))));
    }

    @Test
    void testLookupByNaturalKey() {
        save("ws-1", SyncedObjectType.CUSTOMER, "c-1", null, "enabled", NOW);

        assertTrue(repository.findByWorkspaceIdAndProviderAndObjectTypeAndExternalId("ws-1",
                WebhookProvider.SHOPIFY, SyncedObjectType.CUSTOMER, "c-1").isPresent());
        assertTrue(repository.findByWorkspaceIdAndProviderAndObjectTypeAndExternalId("ws-1",
                WebhookProvider.STRIPE, SyncedObjectType.CUSTOMER, "c-1").isEmpty());
    }
}
