package com.example.webhookpipeline.realtime;

public enum BatchStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED
}
