package com.example.webhookpipeline.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.Set;

/**
 * 客户配置的出站 Webhook 端点。
 */
@Entity
@Table(name = "webhook_endpoint", indexes = @Index(name = "idx_endpoint_workspace", columnList = "workspaceId"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WebhookEndpoint {

    public static final String ALL_EVENTS = "*";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String workspaceId;

    @Column(nullable = false, length = 2048)
    private String url;

    // HMAC 签名密钥
    @Column(nullable = false)
    @ToString.Exclude
    private String secret;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "webhook_endpoint_event", joinColumns = @JoinColumn(name = "endpoint_id"))
    @Column(name = "event_type")
    @Builder.Default
    private Set<String> events = new HashSet<>();

    @Builder.Default
    private boolean active = true;

    @Builder.Default
    private Integer maxRetries = 3;

    @Builder.Default
    private Integer retryDelaySeconds = 60;

    @CreationTimestamp
    private LocalDateTime createdAt;

    public boolean subscribesTo(String eventType) {
        return events.contains(ALL_EVENTS) || events.contains(eventType);
    }
}
