package com.example.webhookpipeline.metrics;

public enum RecalculationPriority {
    HIGH,
    NORMAL,
    LOW;

    public boolean isHigherThan(RecalculationPriority other) {
        return ordinal() < other.ordinal();
    }
}
