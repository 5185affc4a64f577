package com.example.webhookpipeline.metrics;

public enum RecalculationTrigger {
    WEBHOOK,
    MANUAL,
    SCHEDULED
}
