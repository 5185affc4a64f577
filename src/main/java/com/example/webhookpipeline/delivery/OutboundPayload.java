package com.example.webhookpipeline.delivery;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * 出站请求体。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class OutboundPayload {
    private String event;
    private String timestamp;
    private String workspaceId;
    private Map<String, Object> data;
}
