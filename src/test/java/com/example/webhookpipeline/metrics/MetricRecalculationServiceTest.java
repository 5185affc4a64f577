package com.example.webhookpipeline.metrics;

import com.example.webhookpipeline.MutableClock;
import com.example.webhookpipeline.config.PipelineProperties;
import com.example.webhookpipeline.realtime.RealtimeEvent;
import com.example.webhookpipeline.realtime.RealtimeEventEmitter;
import com.example.webhookpipeline.realtime.RealtimeEventType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class MetricRecalculationServiceTest {

    private ThreadPoolTaskScheduler scheduler;
    private MetricCalculator calculator;
    private RealtimeEventEmitter emitter;
    private MutableClock clock;
    private MetricRecalculationService service;

    @BeforeEach
    void setUp() {
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.initialize();
        calculator = mock(MetricCalculator.class);
        emitter = mock(RealtimeEventEmitter.class);
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));

        PipelineProperties properties = new PipelineProperties();
        properties.getMetrics().setDebounceMs(50);
        properties.getMetrics().setCacheTtlMs(30_000);
        service = new MetricRecalculationService(calculator, emitter, scheduler, properties, clock);
    }

    @AfterEach
    void tearDown() {
        service.shutdown();
        scheduler.shutdown();
    }

    private static MetricRecalculationRequest request(String workspaceId, RecalculationPriority priority) {
        return MetricRecalculationRequest.builder()
                .workspaceId(workspaceId)
                .metricNames(Set.of(MetricNames.REVENUE, MetricNames.ORDERS))
                .triggeredBy(RecalculationTrigger.WEBHOOK)
                .priority(priority)
                .build();
    }

    @Test
    void testRequestsWithinWindowAreCoalesced() throws Exception {
        when(calculator.calculate("ws-1")).thenReturn(Map.of(MetricNames.REVENUE, 100.0));

        CompletableFuture<Map<String, Double>> first = service.requestRecalculation(
                request("ws-1", RecalculationPriority.LOW));
        CompletableFuture<Map<String, Double>> second = service.requestRecalculation(
                request("ws-1", RecalculationPriority.HIGH));
        CompletableFuture<Map<String, Double>> third = service.requestRecalculation(
                request("ws-1", RecalculationPriority.NORMAL));

        assertSame(first, second);
        assertSame(first, third);
        assertEquals(1, service.getPendingRecalculationCount());
        assertEquals(100.0, first.get(2, TimeUnit.SECONDS).get(MetricNames.REVENUE));
        verify(calculator, times(1)).calculate("ws-1");
        assertEquals(0, service.getPendingRecalculationCount());
    }

    @Test
    void testDifferentKeysAreIndependent() throws Exception {
        when(calculator.calculate(anyString())).thenReturn(Map.of(MetricNames.ORDERS, 1.0));

        CompletableFuture<Map<String, Double>> one = service.requestRecalculation(
                request("ws-1", RecalculationPriority.NORMAL));
        CompletableFuture<Map<String, Double>> other = service.requestRecalculation(
                request("ws-2", RecalculationPriority.NORMAL));

        assertNotSame(one, other);
        CompletableFuture.allOf(one, other).get(2, TimeUnit.SECONDS);
        verify(calculator).calculate("ws-1");
        verify(calculator).calculate("ws-2");
    }

    @Test
    void testPublishesOneUpdatePerChangedMetric() throws Exception {
        when(calculator.calculate("ws-1"))
                .thenReturn(Map.of(MetricNames.REVENUE, 100.0, MetricNames.ORDERS, 2.0))
                .thenReturn(Map.of(MetricNames.REVENUE, 70.0, MetricNames.ORDERS, 2.0));

        service.requestRecalculation(request("ws-1", RecalculationPriority.HIGH)).get(2, TimeUnit.SECONDS);
        verify(emitter, times(2)).publish(any(RealtimeEvent.class));

        reset(emitter);
        service.requestRecalculation(request("ws-1", RecalculationPriority.HIGH)).get(2, TimeUnit.SECONDS);

        ArgumentCaptor<RealtimeEvent> published = ArgumentCaptor.forClass(RealtimeEvent.class);
        verify(emitter, times(1)).publish(published.capture());
        RealtimeEvent update = published.getValue();
        assertEquals(RealtimeEventType.METRICS_UPDATED, update.getType());
        assertEquals("ws-1", update.getWorkspaceId());
        assertEquals(MetricNames.REVENUE, update.string("metricName"));
        assertEquals(100.0, update.number("previousValue"));
        assertEquals(70.0, update.number("currentValue"));
        assertEquals(-30.0, update.number("changePercent"), 0.0001);
        assertEquals(MetricUpdate.PERIOD_CURRENT, update.string("period"));
    }

    @Test
    void testCacheExpiresAfterTtl() throws Exception {
        when(calculator.calculate("ws-1")).thenReturn(Map.of(MetricNames.REVENUE, 10.0));

        assertEquals(10.0, service.getMetrics("ws-1").get(MetricNames.REVENUE));
        assertTrue(service.getCachedMetrics("ws-1").isPresent());

        assertEquals(10.0, service.getMetrics("ws-1").get(MetricNames.REVENUE));
        verify(calculator, times(1)).calculate("ws-1");

        clock.advance(Duration.ofSeconds(31));
        assertTrue(service.getCachedMetrics("ws-1").isEmpty());
    }

    @Test
    void testInvalidateCache() throws Exception {
        when(calculator.calculate("ws-1")).thenReturn(Map.of(MetricNames.REVENUE, 10.0));
        service.getMetrics("ws-1");

        service.invalidateCache("ws-1");
        assertTrue(service.getCachedMetrics("ws-1").isEmpty());

        service.getMetrics("ws-1");
        service.clearAllCaches();
        assertTrue(service.getCachedMetrics("ws-1").isEmpty());
    }

    @Test
    void testCalculatorFailureSurfacesToCaller() {
        when(calculator.calculate("ws-1")).thenThrow(new IllegalStateException("db down"));

        IllegalStateException error = assertThrows(IllegalStateException.class, () -> service.getMetrics("ws-1"));

        assertTrue(error.getMessage().contains("ws-1"));
        verifyNoInteractions(emitter);
    }

    @Test
    void testMetricsAffectedByEventType() {
        assertEquals(Set.of(MetricNames.REVENUE, MetricNames.ORDERS, MetricNames.AOV),
                MetricRecalculationService.metricsAffectedBy(RealtimeEventType.ORDER_CREATED));
        assertTrue(MetricRecalculationService.metricsAffectedBy(RealtimeEventType.SUBSCRIPTION_CANCELED)
                .contains(MetricNames.MRR));
        assertNull(MetricRecalculationService.metricsAffectedBy(RealtimeEventType.PRODUCT_UPDATED));
    }

    @Test
    void testDebounceKeyIgnoresMetricOrder() {
        MetricRecalculationRequest a = MetricRecalculationRequest.builder().workspaceId("ws")
                .metricNames(Set.of("b", "a")).build();
        MetricRecalculationRequest b = MetricRecalculationRequest.builder().workspaceId("ws")
                .metricNames(new LinkedHashSet<>(List.of("a", "b"))).build();

        assertEquals("ws:a,b", a.debounceKey());
        assertEquals(a.debounceKey(), b.debounceKey());
        assertEquals("ws:all", MetricRecalculationRequest.builder().workspaceId("ws").build().debounceKey());
    }

    @Test
    void testChangePercent() {
        assertEquals(-30.0, MetricUpdate.changePercent(100, 70), 0.0001);
        assertEquals(100.0, MetricUpdate.changePercent(0, 5));
        assertEquals(0.0, MetricUpdate.changePercent(0, 0));
    }
}
