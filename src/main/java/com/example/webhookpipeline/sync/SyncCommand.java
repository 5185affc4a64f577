package com.example.webhookpipeline.sync;

import com.example.webhookpipeline.model.SyncedObjectType;
import com.example.webhookpipeline.model.WebhookProvider;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 一次同步写入。为 null 的字段不覆盖已有值。
 */
@Value
@Builder
public class SyncCommand {
    String workspaceId;
    WebhookProvider provider;
    SyncedObjectType objectType;
    String externalId;
    BigDecimal amount;
    String status;
    String customerRef;
    LocalDateTime occurredAt;
}
