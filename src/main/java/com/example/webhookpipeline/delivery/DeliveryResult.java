package com.example.webhookpipeline.delivery;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DeliveryResult {
    boolean success;
    Integer statusCode;
    /** Truncated to {@link OutboundDeliveryService#MAX_RESPONSE_BODY_LENGTH} characters. */
    String responseBody;
    long responseTimeMs;
    String error;
}
