package com.example.webhookpipeline.model;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * 异步任务（事件发布、批处理）失败后的落库记录。
 */
@Entity
@Table(name = "dead_letter_entry")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DeadLetterEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 64)
    private String source; // emitter, batch ...

    private String eventType;

    private String workspaceId;

    @Column(columnDefinition = "TEXT")
    private String reason;

    @Column(columnDefinition = "TEXT")
    private String payload;

    @CreationTimestamp
    private LocalDateTime createdAt;
}
