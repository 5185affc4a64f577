package com.example.webhookpipeline.realtime;

import com.example.webhookpipeline.config.PipelineProperties;
import com.example.webhookpipeline.service.DeadLetterService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class EventBatchProcessorTest {

    private ThreadPoolTaskScheduler scheduler;
    private DeadLetterService deadLetterService;
    private PipelineProperties properties;
    private final List<EventBatch> handled = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.initialize();
        deadLetterService = mock(DeadLetterService.class);
        properties = new PipelineProperties();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    private EventBatchProcessor processor(BatchHandler handler) {
        return new EventBatchProcessor(scheduler, handler, properties, deadLetterService,
                mock(RealtimeEventEmitter.class), Clock.systemUTC());
    }

    private static RealtimeEvent event(String workspaceId) {
        return RealtimeEvent.builder().type(RealtimeEventType.ORDER_CREATED).workspaceId(workspaceId).build();
    }

    @Test
    void testFlushesWhenSizeLimitReached() {
        properties.getBatch().setMaxBatchSize(3);
        properties.getBatch().setFlushOnTime(false);
        EventBatchProcessor batches = processor(handled::add);

        batches.addEvent(event("ws-1"));
        batches.addEvent(event("ws-1"));
        batches.addEvent(event("ws-2"));
        assertTrue(handled.isEmpty());
        assertEquals(2, batches.getPendingBatchCount());
        assertEquals(3, batches.getPendingEventCount());

        batches.addEvent(event("ws-1"));

        assertEquals(1, handled.size());
        EventBatch flushed = handled.get(0);
        assertEquals("ws-1", flushed.getWorkspaceId());
        assertEquals(3, flushed.size());
        assertEquals(BatchStatus.COMPLETED, flushed.getStatus());
        assertNotNull(flushed.getProcessedAt());
        assertEquals(1, batches.getPendingBatchCount());
    }

    @Test
    void testFlushesAfterWaitTime() throws Exception {
        properties.getBatch().setMaxWaitTimeMs(50);
        CountDownLatch latch = new CountDownLatch(1);
        EventBatchProcessor batches = processor(batch -> {
            handled.add(batch);
            latch.countDown();
        });

        batches.addEvent(event("ws-1"));
        batches.addEvent(event("ws-1"));

        assertTrue(latch.await(2, TimeUnit.SECONDS));
        assertEquals(1, handled.size());
        assertEquals(2, handled.get(0).size());
        assertEquals(0, batches.getPendingBatchCount());
    }

    @Test
    void testManualFlush() {
        properties.getBatch().setFlushOnTime(false);
        EventBatchProcessor batches = processor(handled::add);

        assertTrue(batches.flushBatch("ws-1").isEmpty());
        batches.addEvent(event("ws-1"));

        assertTrue(batches.flushBatch("ws-1").isPresent());
        assertEquals(1, handled.size());
        assertTrue(batches.flushBatch("ws-1").isEmpty());
    }

    @Test
    void testShutdownDrainsAndDropsLateEvents() {
        properties.getBatch().setMaxWaitTimeMs(60_000);
        EventBatchProcessor batches = processor(handled::add);
        batches.addEvent(event("ws-1"));
        batches.addEvent(event("ws-2"));

        batches.shutdown();

        assertEquals(2, handled.size());
        assertTrue(batches.isShuttingDown());
        batches.addEvent(event("ws-1"));
        assertEquals(0, batches.getPendingBatchCount());
        assertEquals(2, handled.size());
    }

    @Test
    void testHandlerFailureGoesToDeadLetter() {
        properties.getBatch().setMaxBatchSize(1);
        properties.getBatch().setFlushOnTime(false);
        EventBatchProcessor batches = processor(batch -> {
            throw new IllegalStateException("downstream unavailable");
        });

        assertDoesNotThrow(() -> batches.addEvent(event("ws-1")));

        verify(deadLetterService).moveToDeadLetter(eq(DeadLetterService.SOURCE_BATCH), eq("batch"), eq("ws-1"),
                eq("downstream unavailable"), any());
    }

    @Test
    void testEventWithoutWorkspaceIsIgnored() {
        EventBatchProcessor batches = processor(handled::add);

        batches.addEvent(RealtimeEvent.builder().type(RealtimeEventType.ORDER_CREATED).build());

        assertEquals(0, batches.getPendingBatchCount());
    }

    private static RealtimeEvent event(String workspaceId, int seq) {
        return RealtimeEvent.builder().type(RealtimeEventType.ORDER_CREATED).workspaceId(workspaceId)
                .data(Map.of("seq", String.valueOf(seq))).build();
    }

    @Test
    void testEventsArrivingDuringFlushStartNewBatch() throws Exception {
        properties.getBatch().setMaxBatchSize(2);
        properties.getBatch().setFlushOnTime(false);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        List<String> seen = new CopyOnWriteArrayList<>();
        EventBatchProcessor batches = processor(batch -> {
            for (RealtimeEvent e : batch.getEvents()) {
                seen.add(e.string("seq"));
            }
            handled.add(batch);
            entered.countDown();
            release.await(5, TimeUnit.SECONDS);
        });

        Thread flusher = new Thread(() -> {
            batches.addEvent(event("ws-1", 1));
            batches.addEvent(event("ws-1", 2));
        });
        flusher.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        // 第一批仍在处理器中
        batches.addEvent(event("ws-1", 3));
        assertEquals(1, batches.getPendingBatchCount());
        assertEquals(1, batches.getPendingEventCount());
        assertEquals(1, handled.size());

        release.countDown();
        flusher.join(5000);
        assertFalse(flusher.isAlive());
        assertTrue(batches.flushBatch("ws-1").isPresent());

        assertEquals(2, handled.size());
        assertNotEquals(handled.get(0).getId(), handled.get(1).getId());
        assertEquals(List.of("1", "2", "3"), seen);
        assertEquals(0, batches.getPendingBatchCount());
    }
}
