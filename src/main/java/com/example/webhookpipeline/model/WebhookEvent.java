package com.example.webhookpipeline.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * 入站 Webhook 事件记录。(provider, externalEventId) 唯一，作为幂等键；记录永不删除。
 */
@Entity
@Table(name = "webhook_event",
        uniqueConstraints = @UniqueConstraint(name = "uk_webhook_event_provider_external_id",
                columnNames = {"provider", "external_event_id"}),
        indexes = @Index(name = "idx_webhook_event_status", columnList = "status"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookEvent {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private WebhookProvider provider;

    @Column(name = "external_event_id", nullable = false)
    private String externalEventId;

    @Column(nullable = false)
    private String eventType;

    private String workspaceId;

    private Long connectorId;

    @Column(columnDefinition = "TEXT")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private WebhookEventStatus status = WebhookEventStatus.PENDING;

    private LocalDateTime receivedAt;

    private LocalDateTime processedAt;

    @Builder.Default
    private Integer attempts = 0;

    @Column(columnDefinition = "TEXT")
    private String lastError;

    // processed / ignored / error ...
    private String processingAction;

    private String objectId;
}
