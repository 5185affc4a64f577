package com.example.webhookpipeline.notification;

public enum NotificationSource {
    METRIC_CHANGE,
    ANOMALY
}
