package com.example.webhookpipeline.model;

public enum DeliveryStatus {
    PENDING,
    RETRYING,
    SUCCESS,
    FAILED
}
