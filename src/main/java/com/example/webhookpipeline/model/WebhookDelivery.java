package com.example.webhookpipeline.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * 单次出站投递记录：pending -> (retrying)* -> success | failed。
 */
@Entity
@Table(name = "webhook_delivery", indexes = {
        @Index(name = "idx_delivery_endpoint", columnList = "endpointId"),
        @Index(name = "idx_delivery_status_next_retry", columnList = "status,nextRetryAt")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookDelivery {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private Long endpointId;

    private String workspaceId;

    private String eventType;

    // X-Webhook-ID, stable across retries
    @Column(nullable = false, length = 64)
    private String eventId;

    @Column(columnDefinition = "TEXT")
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    @Builder.Default
    private DeliveryStatus status = DeliveryStatus.PENDING;

    @Builder.Default
    private Integer attempts = 0;

    private LocalDateTime lastAttemptAt;

    private LocalDateTime nextRetryAt;

    private Integer responseStatusCode;

    @Column(columnDefinition = "TEXT")
    private String responseBody;

    private Long responseTimeMs;

    @Column(columnDefinition = "TEXT")
    private String errorMessage;

    @CreationTimestamp
    private LocalDateTime createdAt;

    private LocalDateTime deliveredAt;
}
