package com.example.webhookpipeline.repository;

import com.example.webhookpipeline.model.SyncedObjectType;
import com.example.webhookpipeline.model.SyncedRecord;
import com.example.webhookpipeline.model.WebhookProvider;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Optional;

/**
 * 同步记录仓储接口，包含指标计算用的聚合查询。
 */
@Repository
public interface SyncedRecordRepository extends JpaRepository<SyncedRecord, Long> {

        Optional<SyncedRecord> findByWorkspaceIdAndProviderAndObjectTypeAndExternalId(String workspaceId,
                        WebhookProvider provider, SyncedObjectType objectType, String externalId);

        long countByWorkspaceIdAndObjectType(String workspaceId, SyncedObjectType objectType);

        long countByWorkspaceIdAndObjectTypeAndStatus(String workspaceId, SyncedObjectType objectType,
                        String status);

        /**
         * 统计时间窗口内的记录数，排除指定状态（excluded 不可为空集合）。
         */
        @Query("SELECT COUNT(r) FROM SyncedRecord r WHERE r.workspaceId = :workspaceId "
                        + "AND r.objectType = :objectType AND r.occurredAt >= :from "
                        + "AND (r.status IS NULL OR r.status NOT IN :excluded)")
        long countSince(@Param("workspaceId") String workspaceId,
                        @Param("objectType") SyncedObjectType objectType,
                        @Param("from") LocalDateTime from,
                        @Param("excluded") Collection<String> excluded);

        /**
         * 汇总时间窗口内的金额，排除指定状态（excluded 不可为空集合）。
         */
        @Query("SELECT COALESCE(SUM(r.amount), 0) FROM SyncedRecord r WHERE r.workspaceId = :workspaceId "
                        + "AND r.objectType = :objectType AND r.occurredAt >= :from "
                        + "AND (r.status IS NULL OR r.status NOT IN :excluded)")
        BigDecimal sumAmountSince(@Param("workspaceId") String workspaceId,
                        @Param("objectType") SyncedObjectType objectType,
                        @Param("from") LocalDateTime from,
                        @Param("excluded") Collection<String> excluded);

        @Query("SELECT COALESCE(SUM(r.amount), 0) FROM SyncedRecord r WHERE r.workspaceId = :workspaceId "
                        + "AND r.objectType = :objectType AND r.status = :status")
        BigDecimal sumAmountByStatus(@Param("workspaceId") String workspaceId,
                        @Param("objectType") SyncedObjectType objectType,
                        @Param("status") String status);

        @Query("SELECT COALESCE(SUM(r.amount), 0) FROM SyncedRecord r WHERE r.workspaceId = :workspaceId "
                        + "AND r.objectType = :objectType AND r.status = :status AND r.occurredAt >= :from")
        BigDecimal sumAmountByStatusSince(@Param("workspaceId") String workspaceId,
                        @Param("objectType") SyncedObjectType objectType,
                        @Param("status") String status,
                        @Param("from") LocalDateTime from);
}
