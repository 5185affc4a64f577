package com.example.webhookpipeline.anomaly;

import com.example.webhookpipeline.MutableClock;
import com.example.webhookpipeline.config.PipelineProperties;
import com.example.webhookpipeline.metrics.MetricNames;
import com.example.webhookpipeline.model.AnomalyRecord;
import com.example.webhookpipeline.model.AnomalySeverity;
import com.example.webhookpipeline.realtime.RealtimeEvent;
import com.example.webhookpipeline.realtime.RealtimeEventEmitter;
import com.example.webhookpipeline.realtime.RealtimeEventType;
import com.example.webhookpipeline.repository.AnomalyRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class AnomalyDetectorTest {

    private AnomalyRecordRepository repository;
    private RealtimeEventEmitter emitter;
    private MutableClock clock;
    private PipelineProperties properties;
    private AnomalyDetector detector;

    @BeforeEach
    void setUp() {
        repository = mock(AnomalyRecordRepository.class);
        when(repository.save(any(AnomalyRecord.class))).thenAnswer(invocation -> {
            AnomalyRecord record = invocation.getArgument(0);
            record.setId(42L);
            return record;
        });
        emitter = mock(RealtimeEventEmitter.class);
        clock = new MutableClock(Instant.parse("2024-01-01T00:00:00Z"));
        properties = new PipelineProperties();
        detector = new AnomalyDetector(repository, emitter, properties, clock);
    }

    @Test
    void testSeverityBands() {
        MetricThreshold threshold = new MetricThreshold("Revenue", 20, 40, ThresholdDirection.BOTH);

        assertEquals(AnomalySeverity.CRITICAL, AnomalyDetector.severityFor(40, threshold));
        assertEquals(AnomalySeverity.HIGH, AnomalyDetector.severityFor(25, threshold));
        assertEquals(AnomalySeverity.MEDIUM, AnomalyDetector.severityFor(14, threshold));
        assertNull(AnomalyDetector.severityFor(13.9, threshold));
    }

    @Test
    void testNegativeThresholdsCompareByMagnitude() {
        MetricThreshold threshold = new MetricThreshold("Revenue", -10, -25, ThresholdDirection.BOTH);

        assertEquals(AnomalySeverity.CRITICAL, AnomalyDetector.severityFor(30, threshold));
        assertEquals(AnomalySeverity.HIGH, AnomalyDetector.severityFor(12, threshold));
    }

    @Test
    void testDetectsAndPublishesAnomaly() {
        Optional<AnomalyRecord> anomaly = detector.checkForAnomaly("ws-1", MetricNames.REVENUE, 1000, 500, -50);

        assertTrue(anomaly.isPresent());
        assertEquals(AnomalySeverity.CRITICAL, anomaly.get().getSeverity());
        assertEquals("Revenue decreased significantly", anomaly.get().getTitle());
        assertEquals("Revenue decreased by 50.0% from $1,000.00 to $500.00.", anomaly.get().getDescription());

        ArgumentCaptor<RealtimeEvent> published = ArgumentCaptor.forClass(RealtimeEvent.class);
        verify(emitter).publish(published.capture());
        RealtimeEvent event = published.getValue();
        assertEquals(RealtimeEventType.ANOMALY_DETECTED, event.getType());
        assertEquals("critical", event.string("severity"));
        assertEquals("42", event.string("anomalyId"));
        assertEquals(-50.0, event.number("changePercent"));
    }

    @Test
    void testDirectionFilter() {
        assertTrue(detector.checkForAnomaly("ws-1", MetricNames.CUSTOMERS, 100, 50, -50).isEmpty());
        assertTrue(detector.checkForAnomaly("ws-1", MetricNames.CUSTOMERS, 100, 150, 50).isPresent());
    }

    @Test
    void testUnknownMetricAndSmallChangeIgnored() {
        assertTrue(detector.checkForAnomaly("ws-1", "pageViews", 100, 10, -90).isEmpty());
        assertTrue(detector.checkForAnomaly("ws-1", MetricNames.REVENUE, 100, 95, -5).isEmpty());
        verifyNoInteractions(repository, emitter);
    }

    @Test
    void testCooldownSuppressesRepeatAlerts() {
        assertTrue(detector.checkForAnomaly("ws-1", MetricNames.ORDERS, 100, 40, -60).isPresent());

        clock.advance(Duration.ofMinutes(10));
        assertTrue(detector.checkForAnomaly("ws-1", MetricNames.ORDERS, 40, 10, -75).isEmpty());
        assertTrue(detector.checkForAnomaly("ws-2", MetricNames.ORDERS, 100, 40, -60).isPresent());

        clock.advance(Duration.ofMinutes(51));
        assertTrue(detector.checkForAnomaly("ws-1", MetricNames.ORDERS, 10, 2, -80).isPresent());
        verify(emitter, times(3)).publish(any(RealtimeEvent.class));
    }

    @Test
    void testClearCooldowns() {
        detector.checkForAnomaly("ws-1", MetricNames.ORDERS, 100, 40, -60);

        detector.clearCooldowns();

        assertTrue(detector.checkForAnomaly("ws-1", MetricNames.ORDERS, 40, 10, -75).isPresent());
    }

    @Test
    void testConfiguredOverrideAndRuntimeUpdate() {
        PipelineProperties.ThresholdOverride override = new PipelineProperties.ThresholdOverride();
        override.setWarningThreshold(5);
        override.setCriticalThreshold(10);
        override.setDirection("decrease");
        properties.getAnomaly().getThresholds().put("sessions", override);
        AnomalyDetector configured = new AnomalyDetector(repository, emitter, properties, clock);

        MetricThreshold sessions = configured.getThresholds().get("sessions");
        assertEquals("sessions", sessions.getDisplayName());
        assertEquals(ThresholdDirection.DECREASE, sessions.getDirection());

        configured.updateThreshold(MetricNames.REVENUE, new MetricThreshold("Revenue", 1, 2, ThresholdDirection.BOTH));
        assertEquals(AnomalySeverity.CRITICAL,
                configured.checkForAnomaly("ws-1", MetricNames.REVENUE, 100, 97, -3).get().getSeverity());
    }

    @Test
    void testSaveFailureStillPublishes() {
        when(repository.save(any(AnomalyRecord.class))).thenThrow(new IllegalStateException("db down"));

        Optional<AnomalyRecord> anomaly = detector.checkForAnomaly("ws-1", MetricNames.MRR, 100, 50, -50);

        assertTrue(anomaly.isPresent());
        assertNull(anomaly.get().getId());
        verify(emitter).publish(any(RealtimeEvent.class));
    }
}
