package com.example.webhookpipeline.model;

public enum SyncedObjectType {
    ORDER,
    CUSTOMER,
    PRODUCT,
    SUBSCRIPTION,
    INVOICE
}
