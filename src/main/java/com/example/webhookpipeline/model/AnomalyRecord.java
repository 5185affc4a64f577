package com.example.webhookpipeline.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "anomaly_record", indexes = @Index(name = "idx_anomaly_workspace", columnList = "workspaceId,detectedAt"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String workspaceId;

    @Column(nullable = false)
    private String metricName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AnomalySeverity severity;

    private String title;

    @Column(columnDefinition = "TEXT")
    private String description;

    private double currentValue;

    private double previousValue;

    private double changePercent;

    private LocalDateTime detectedAt;

    @Builder.Default
    private String status = "OPEN"; // OPEN, ACKNOWLEDGED, RESOLVED
}
