package com.example.webhookpipeline.gateway;

import lombok.Builder;
import lombok.Value;

/**
 * 网关处理结果，status 即 HTTP 状态码。
 */
@Value
@Builder
public class GatewayResult {
    boolean success;
    int status;
    String eventId;
    String action;
    String objectId;
    String message;
    String error;

    static GatewayResult failure(int status, String error) {
        return GatewayResult.builder().success(false).status(status).error(error).build();
    }

    static GatewayResult skipped(Long eventId, String message) {
        return GatewayResult.builder()
                .success(true)
                .status(200)
                .eventId(eventId == null ? null : String.valueOf(eventId))
                .action("skipped")
                .message(message)
                .build();
    }
}
