package com.example.webhookpipeline.security;

import lombok.Value;

@Value
public class VerificationResult {
    boolean valid;
    ParsedWebhookEvent event;
    String error;

    public static VerificationResult ok(ParsedWebhookEvent event) {
        return new VerificationResult(true, event, null);
    }

    public static VerificationResult failure(String error) {
        return new VerificationResult(false, null, error);
    }
}
