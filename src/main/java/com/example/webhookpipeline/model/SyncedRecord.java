package com.example.webhookpipeline.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.UpdateTimestamp;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * 同步后的业务对象快照（订单、客户、订阅、发票等），供指标聚合使用。
 */
@Entity
@Table(name = "synced_record",
        uniqueConstraints = @UniqueConstraint(name = "uk_synced_record",
                columnNames = {"workspaceId", "provider", "objectType", "externalId"}),
        indexes = @Index(name = "idx_synced_record_ws_type", columnList = "workspaceId,objectType"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SyncedRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String workspaceId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private WebhookProvider provider;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    private SyncedObjectType objectType;

    @Column(nullable = false)
    private String externalId;

    @Column(precision = 19, scale = 4)
    private BigDecimal amount;

    private String status;

    private String customerRef;

    private LocalDateTime occurredAt;

    @UpdateTimestamp
    private LocalDateTime updatedAt;
}
