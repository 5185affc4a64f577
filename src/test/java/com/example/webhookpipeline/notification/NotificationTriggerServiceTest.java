package com.example.webhookpipeline.notification;

import com.example.webhookpipeline.realtime.RealtimeEvent;
import com.example.webhookpipeline.realtime.RealtimeEventEmitter;
import com.example.webhookpipeline.realtime.RealtimeEventType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;

class NotificationTriggerServiceTest {

    private NotificationTriggerService service;
    private final List<MetricNotification> received = new ArrayList<>();

    @BeforeEach
    void setUp() {
        service = new NotificationTriggerService(mock(RealtimeEventEmitter.class));
        service.onNotification(received::add);
    }

    private static RealtimeEvent metricUpdate(String workspaceId, String metric, double previous, double current,
            double changePercent, String period) {
        return RealtimeEvent.builder()
                .type(RealtimeEventType.METRICS_UPDATED)
                .workspaceId(workspaceId)
                .data(Map.of("metricName", metric, "previousValue", previous, "currentValue", current,
                        "changePercent", changePercent, "period", period))
                .build();
    }

    @Test
    void testCheckThresholdBreach() {
        NotificationThreshold below = new NotificationThreshold("revenue", -10, -25, NotificationDirection.BELOW,
                NotificationPeriod.DAILY);
        NotificationThreshold above = new NotificationThreshold("churn_rate", 10, 25, NotificationDirection.ABOVE,
                NotificationPeriod.WEEKLY);
        NotificationThreshold any = new NotificationThreshold("orders", 10, 25, NotificationDirection.ANY,
                NotificationPeriod.DAILY);

        assertEquals(NotificationType.CRITICAL, NotificationTriggerService.checkThresholdBreach(-30, below));
        assertEquals(NotificationType.WARNING, NotificationTriggerService.checkThresholdBreach(-10, below));
        assertNull(NotificationTriggerService.checkThresholdBreach(-5, below));
        assertNull(NotificationTriggerService.checkThresholdBreach(40, below));
        assertEquals(NotificationType.WARNING, NotificationTriggerService.checkThresholdBreach(12, above));
        assertEquals(NotificationType.CRITICAL, NotificationTriggerService.checkThresholdBreach(-26, any));
        assertEquals(NotificationType.WARNING, NotificationTriggerService.checkThresholdBreach(11, any));
    }

    @Test
    void testMetricDropTriggersCriticalNotification() {
        Optional<MetricNotification> notification = service.processEvent(
                metricUpdate("ws-1", "revenue", 1000, 700, -30, "current"));

        assertTrue(notification.isPresent());
        MetricNotification n = notification.get();
        assertEquals(NotificationType.CRITICAL, n.getType());
        assertEquals(NotificationSource.METRIC_CHANGE, n.getSource());
        assertEquals("revenue Alert", n.getTitle());
        assertEquals("revenue has significantly decreased by 30.0% in the daily period. Threshold: -25%",
                n.getMessage());
        assertEquals(1, received.size());
    }

    @Test
    void testConcretePeriodMustMatch() {
        assertTrue(service.processEvent(metricUpdate("ws-1", "revenue", 1000, 700, -30, "weekly")).isEmpty());
        assertTrue(service.processEvent(metricUpdate("ws-1", "mrr", 1000, 700, -30, "weekly")).isPresent());
    }

    @Test
    void testWorkspaceThresholdsOverrideDefaults() {
        service.setWorkspaceThresholds("ws-1", List.of(new NotificationThreshold("revenue", -40, -60,
                NotificationDirection.BELOW, NotificationPeriod.DAILY)));

        assertTrue(service.processEvent(metricUpdate("ws-1", "revenue", 1000, 700, -30, "current")).isEmpty());
        assertTrue(service.processEvent(metricUpdate("ws-2", "revenue", 1000, 700, -30, "current")).isPresent());
        assertEquals(NotificationTriggerService.DEFAULT_THRESHOLDS, service.getThresholds("ws-2"));
    }

    @Test
    void testAnomalyBecomesNotification() {
        Optional<MetricNotification> notification = service.processEvent(RealtimeEvent.builder()
                .type(RealtimeEventType.ANOMALY_DETECTED)
                .workspaceId("ws-1")
                .data(Map.of("anomalyId", 7L, "metricName", "orders", "severity", "high",
                        "title", "Orders decreased significantly", "description", "Orders decreased by 60.0%",
                        "changePercent", -60.0))
                .build());

        assertTrue(notification.isPresent());
        assertEquals(NotificationType.CRITICAL, notification.get().getType());
        assertEquals(NotificationSource.ANOMALY, notification.get().getSource());
        assertEquals("Orders decreased significantly", notification.get().getTitle());
        assertEquals("7", notification.get().getData().get("anomalyId"));
    }

    @Test
    void testFailingCallbackDoesNotBlockOthers() {
        List<MetricNotification> later = new ArrayList<>();
        service.onNotification(n -> {
            throw new IllegalStateException("callback broke");
        });
        service.onNotification(later::add);

        service.processEvent(metricUpdate("ws-1", "orders", 100, 50, -50, "daily"));

        assertEquals(1, received.size());
        assertEquals(1, later.size());
    }

    @Test
    void testUnregisterCallback() {
        List<MetricNotification> temporary = new ArrayList<>();
        Runnable unregister = service.onNotification(temporary::add);

        unregister.run();
        service.processEvent(metricUpdate("ws-1", "orders", 100, 50, -50, "daily"));

        assertTrue(temporary.isEmpty());
        assertEquals(1, received.size());
    }
}
