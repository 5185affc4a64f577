package com.example.webhookpipeline.anomaly;

import com.example.webhookpipeline.model.AnomalySeverity;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class ThresholdDirectionTest {

    private Locale previous;

    @BeforeEach
    void setUp() {
        previous = Locale.getDefault();
        // 土耳其语下 "i".toUpperCase() 为 "İ"
        Locale.setDefault(new Locale("tr", "TR"));
    }

    @AfterEach
    void tearDown() {
        Locale.setDefault(previous);
    }

    @Test
    void testParseIgnoresDefaultLocale() {
        assertEquals(ThresholdDirection.INCREASE, ThresholdDirection.parse("increase"));
        assertEquals(ThresholdDirection.DECREASE, ThresholdDirection.parse(" decrease "));
        assertEquals(ThresholdDirection.BOTH, ThresholdDirection.parse(null));
    }

    @Test
    void testWireNamesIgnoreDefaultLocale() {
        assertEquals("critical", AnomalySeverity.CRITICAL.wireName());
    }

    @Test
    void testUnknownDirectionRejected() {
        assertThrows(IllegalArgumentException.class, () -> ThresholdDirection.parse("sideways"));
    }
}
