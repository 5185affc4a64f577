package com.example.webhookpipeline.anomaly;

import java.util.Locale;

public enum ThresholdDirection {
    BOTH,
    INCREASE,
    DECREASE;

    public boolean accepts(double changePercent) {
        switch (this) {
            case INCREASE:
                return changePercent > 0;
            case DECREASE:
                return changePercent < 0;
            default:
                return true;
        }
    }

    public static ThresholdDirection parse(String value) {
        return value == null ? BOTH : valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
