package com.example.webhookpipeline.notification;

public enum NotificationType {
    INFO,
    WARNING,
    CRITICAL
}
