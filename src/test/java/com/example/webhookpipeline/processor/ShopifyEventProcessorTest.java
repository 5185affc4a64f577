package com.example.webhookpipeline.processor;

import com.example.webhookpipeline.model.Connector;
import com.example.webhookpipeline.model.SyncedObjectType;
import com.example.webhookpipeline.model.WebhookProvider;
import com.example.webhookpipeline.realtime.RealtimeEvent;
import com.example.webhookpipeline.realtime.RealtimeEventEmitter;
import com.example.webhookpipeline.realtime.RealtimeEventType;
import com.example.webhookpipeline.repository.ConnectorRepository;
import com.example.webhookpipeline.security.ParsedWebhookEvent;
import com.example.webhookpipeline.sync.SyncCommand;
import com.example.webhookpipeline.sync.SyncService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ShopifyEventProcessorTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private RealtimeEventEmitter emitter;
    private SyncService syncService;
    private ConnectorRepository connectorRepository;
    private ShopifyEventProcessor processor;

    @BeforeEach
    void setUp() {
        emitter = mock(RealtimeEventEmitter.class);
        syncService = mock(SyncService.class);
        connectorRepository = mock(ConnectorRepository.class);
        processor = new ShopifyEventProcessor(emitter, syncService, connectorRepository,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private ParsedWebhookEvent event(String topic, String json) throws Exception {
        return ParsedWebhookEvent.builder()
                .id("wh-1")
                .type(topic)
                .accountId("demo.myshopify.com")
                .occurredAt(NOW)
                .data(objectMapper.readTree(json))
                .build();
    }

    @Test
    void testOrderCreateSyncsAndEmits() throws Exception {
        ProcessingResult result = processor.processEvent(event("orders/create",
                "{\"id\":1001,\"name\":\"#1001\",\"total_price\":\"150.50\",\"currency\":\"USD\","
                        + "\"financial_status\":\"paid\",\"created_at\":\"2024-02-29T10:00:00-03:00\","
                        + "\"customer\":{\"id\":77}}"),
                "ws-1", 5L);

        assertTrue(result.isSuccess());
        assertEquals("1001", result.getObjectId());
        assertEquals("created", result.getAction());

        ArgumentCaptor<SyncCommand> command = ArgumentCaptor.forClass(SyncCommand.class);
        verify(syncService).upsert(command.capture());
        assertEquals(SyncedObjectType.ORDER, command.getValue().getObjectType());
        assertEquals(WebhookProvider.SHOPIFY, command.getValue().getProvider());
        assertEquals(0, new BigDecimal("150.50").compareTo(command.getValue().getAmount()));
        assertEquals("paid", command.getValue().getStatus());
        assertEquals("77", command.getValue().getCustomerRef());
        assertEquals(LocalDateTime.of(2024, 2, 29, 13, 0), command.getValue().getOccurredAt());

        ArgumentCaptor<RealtimeEvent> emitted = ArgumentCaptor.forClass(RealtimeEvent.class);
        verify(emitter).publish(emitted.capture());
        RealtimeEvent realtime = emitted.getValue();
        assertEquals(RealtimeEventType.ORDER_CREATED, realtime.getType());
        assertEquals("ws-1", realtime.getWorkspaceId());
        assertEquals(5L, realtime.getConnectorId());
        assertEquals("1001", realtime.string("orderId"));
        assertEquals(150.5, realtime.number("totalPrice"), 0.0001);
        assertEquals("wh-1", realtime.string("sourceEventId"));
        assertEquals("orders/create", realtime.string("sourceEventType"));
    }

    @Test
    void testOrderCancelledEmitsUpdateWithoutNullFields() throws Exception {
        ProcessingResult result = processor.processEvent(event("orders/cancelled", "{\"id\":1002}"), "ws-1", 5L);

        assertEquals("cancelled", result.getAction());
        ArgumentCaptor<RealtimeEvent> emitted = ArgumentCaptor.forClass(RealtimeEvent.class);
        verify(emitter).publish(emitted.capture());
        assertEquals(RealtimeEventType.ORDER_UPDATED, emitted.getValue().getType());
        assertEquals("cancelled", emitted.getValue().string("status"));
        assertFalse(emitted.getValue().getData().containsKey("currency"));
    }

    @Test
    void testCustomerDeleteRemovesRecord() throws Exception {
        when(syncService.delete("ws-1", WebhookProvider.SHOPIFY, SyncedObjectType.CUSTOMER, "55")).thenReturn(true);

        ProcessingResult result = processor.processEvent(event("customers/delete", "{\"id\":55}"), "ws-1", 5L);

        assertEquals("deleted", result.getAction());
        verify(syncService).delete("ws-1", WebhookProvider.SHOPIFY, SyncedObjectType.CUSTOMER, "55");
        verifyNoInteractions(emitter);
    }

    @Test
    void testAppUninstalledDeactivatesConnector() throws Exception {
        Connector connector = Connector.builder().id(5L).provider(WebhookProvider.SHOPIFY).workspaceId("ws-1").build();
        when(connectorRepository.findById(5L)).thenReturn(Optional.of(connector));

        ProcessingResult result = processor.processEvent(event("app/uninstalled", "{}"), "ws-1", 5L);

        assertTrue(result.isSuccess());
        assertEquals("uninstalled", result.getAction());
        assertFalse(connector.isActive());
        verify(connectorRepository).save(connector);
    }

    @Test
    void testUnknownTopicIsIgnored() throws Exception {
        ProcessingResult result = processor.processEvent(event("carts/create", "{\"id\":1}"), "ws-1", 5L);

        assertTrue(result.isSuccess());
        assertEquals(ProcessingResult.ACTION_IGNORED, result.getAction());
        assertEquals("Event type carts/create not handled", result.getMessage());
        verifyNoInteractions(syncService, emitter);
    }

    @Test
    void testSyncFailureBecomesFailedResult() throws Exception {
        when(syncService.upsert(any())).thenThrow(new IllegalStateException("db down"));

        ProcessingResult result = processor.processEvent(event("orders/create", "{\"id\":1003}"), "ws-1", 5L);

        assertFalse(result.isSuccess());
        assertEquals(ProcessingResult.ACTION_ERROR, result.getAction());
        assertEquals("db down", result.getError());
        verifyNoInteractions(emitter);
    }
}
