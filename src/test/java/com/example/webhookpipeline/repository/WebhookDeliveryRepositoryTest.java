package com.example.webhookpipeline.repository;

import com.example.webhookpipeline.model.DeliveryStatus;
import com.example.webhookpipeline.model.WebhookDelivery;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DataJpaTest
class WebhookDeliveryRepositoryTest {

    @Autowired
    private WebhookDeliveryRepository repository;

    private WebhookDelivery save(DeliveryStatus status, LocalDateTime nextRetryAt) {
        return repository.save(WebhookDelivery.builder()
                .endpointId(1L)
                .workspaceId("ws-1")
                .eventType("order.created")
                .eventId("evt-" + System.nanoTime())
                .payload("{}")
                .status(status)
                .nextRetryAt(nextRetryAt)
                .build());
    }

    @Test
    void testDueRetriesOrderedByNextRetry() {
        LocalDateTime now = LocalDateTime.of(2024, 1, 1, 12, 0);
        WebhookDelivery later = save(DeliveryStatus.RETRYING, now.minusSeconds(10));
        WebhookDelivery earlier = save(DeliveryStatus.RETRYING, now.minusMinutes(5));
        save(DeliveryStatus.RETRYING, now.plusMinutes(1));
        save(DeliveryStatus.FAILED, now.minusMinutes(5));

        List<WebhookDelivery> due = repository.findByStatusAndNextRetryAtLessThanEqualOrderByNextRetryAtAsc(
                DeliveryStatus.RETRYING, now);

        assertEquals(2, due.size());
        assertEquals(earlier.getId(), due.get(0).getId());
        assertEquals(later.getId(), due.get(1).getId());
    }

    @Test
    void testStalePendingAndCounts() {
        save(DeliveryStatus.PENDING, null);
        save(DeliveryStatus.SUCCESS, null);
        save(DeliveryStatus.SUCCESS, null);

        assertEquals(1, repository.findByStatusAndCreatedAtBefore(DeliveryStatus.PENDING,
                LocalDateTime.now().plusMinutes(1)).size());
        assertTrue(repository.findByStatusAndCreatedAtBefore(DeliveryStatus.PENDING,
                LocalDateTime.now().minusHours(1)).isEmpty());
        assertEquals(2, repository.countByStatus(DeliveryStatus.SUCCESS));
        assertEquals(3, repository.findTop50ByEndpointIdOrderByIdDesc(1L).size());
    }
}
