package com.example.webhookpipeline.repository;

import com.example.webhookpipeline.model.DeliveryStatus;
import com.example.webhookpipeline.model.WebhookDelivery;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 出站投递记录仓储接口。
 */
@Repository
public interface WebhookDeliveryRepository extends JpaRepository<WebhookDelivery, Long> {

    List<WebhookDelivery> findTop50ByEndpointIdOrderByIdDesc(Long endpointId);

    /**
     * 查询到期待重试的投递。
     *
     * @param status 通常为 RETRYING
     * @param now    当前时间
     * @return 到期记录
     */
    List<WebhookDelivery> findByStatusAndNextRetryAtLessThanEqualOrderByNextRetryAtAsc(DeliveryStatus status,
            LocalDateTime now);

    List<WebhookDelivery> findByStatusAndCreatedAtBefore(DeliveryStatus status, LocalDateTime cutoff);

    long countByStatus(DeliveryStatus status);
}
