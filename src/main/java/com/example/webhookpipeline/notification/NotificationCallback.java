package com.example.webhookpipeline.notification;

@FunctionalInterface
public interface NotificationCallback {

    void onNotification(MetricNotification notification) throws Exception;
}
