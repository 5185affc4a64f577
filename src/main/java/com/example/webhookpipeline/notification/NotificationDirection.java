package com.example.webhookpipeline.notification;

public enum NotificationDirection {
    ABOVE,
    BELOW,
    ANY
}
