package com.example.webhookpipeline.processor;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ProcessingResult {
    public static final String ACTION_IGNORED = "ignored";
    public static final String ACTION_ERROR = "error";

    boolean success;
    String eventType;
    String objectId;
    String action;
    String message;
    String error;

    public static ProcessingResult ok(String eventType, String objectId, String action) {
        return ProcessingResult.builder()
                .success(true)
                .eventType(eventType)
                .objectId(objectId)
                .action(action)
                .build();
    }

    public static ProcessingResult ok(String eventType, String objectId, String action, String message) {
        return ProcessingResult.builder()
                .success(true)
                .eventType(eventType)
                .objectId(objectId)
                .action(action)
                .message(message)
                .build();
    }

    public static ProcessingResult ignored(String eventType, String objectId) {
        return ok(eventType, objectId == null ? "unknown" : objectId, ACTION_IGNORED,
                "Event type " + eventType + " not handled");
    }

    public static ProcessingResult failed(String eventType, String error) {
        return ProcessingResult.builder()
                .success(false)
                .eventType(eventType)
                .objectId("unknown")
                .action(ACTION_ERROR)
                .error(error)
                .build();
    }
}
