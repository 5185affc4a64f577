package com.example.webhookpipeline.processor;

import com.example.webhookpipeline.model.WebhookProvider;
import com.example.webhookpipeline.realtime.RealtimeEventEmitter;
import com.example.webhookpipeline.repository.ConnectorRepository;
import com.example.webhookpipeline.sync.SyncService;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class EventProcessorRegistryTest {

    private final RealtimeEventEmitter emitter = mock(RealtimeEventEmitter.class);
    private final SyncService syncService = mock(SyncService.class);
    private final ConnectorRepository connectorRepository = mock(ConnectorRepository.class);

    @Test
    void testLookupByProvider() {
        EventProcessorRegistry registry = new EventProcessorRegistry(List.of(
                new ShopifyEventProcessor(emitter, syncService, connectorRepository, Clock.systemUTC()),
                new TiendanubeEventProcessor(emitter, syncService, connectorRepository, Clock.systemUTC())));

        assertTrue(registry.getProcessor(WebhookProvider.SHOPIFY).isPresent());
        assertTrue(registry.getProcessor(WebhookProvider.STRIPE).isEmpty());
        assertTrue(registry.getSupportedEvents(WebhookProvider.TIENDANUBE).contains("order/created"));
        assertTrue(registry.getSupportedEvents(WebhookProvider.STRIPE).isEmpty());
    }

    @Test
    void testDuplicateProviderRejected() {
        assertThrows(IllegalStateException.class, () -> new EventProcessorRegistry(List.of(
                new ShopifyEventProcessor(emitter, syncService, connectorRepository, Clock.systemUTC()),
                new ShopifyEventProcessor(emitter, syncService, connectorRepository, Clock.systemUTC()))));
    }
}
