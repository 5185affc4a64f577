package com.example.webhookpipeline.model;

public enum WebhookEventStatus {
    PENDING,
    PROCESSING,
    SKIPPED,
    COMPLETED,
    FAILED
}
