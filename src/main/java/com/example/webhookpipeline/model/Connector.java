package com.example.webhookpipeline.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * 提供方集成与工作区的绑定。
 */
@Entity
@Table(name = "connector")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Connector {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private WebhookProvider provider;

    @Column(nullable = false)
    private String workspaceId;

    private String accountId; // Shopify shop domain, Tiendanube store id, MercadoLibre user id

    @Column(columnDefinition = "TEXT")
    private String signingSecret;

    @Builder.Default
    private boolean active = true;

    @CreationTimestamp
    private LocalDateTime createdAt;
}
