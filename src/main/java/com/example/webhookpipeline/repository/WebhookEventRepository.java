package com.example.webhookpipeline.repository;

import com.example.webhookpipeline.model.WebhookEvent;
import com.example.webhookpipeline.model.WebhookEventStatus;
import com.example.webhookpipeline.model.WebhookProvider;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Webhook 事件仓储接口，同时承担幂等键查询。
 */
@Repository
public interface WebhookEventRepository extends JpaRepository<WebhookEvent, Long> {

        /**
         * 按幂等键查询事件。
         *
         * @param provider        提供方
         * @param externalEventId 提供方事件 ID
         * @return 已存在的事件
         */
        Optional<WebhookEvent> findByProviderAndExternalEventId(WebhookProvider provider, String externalEventId);

        /**
         * 按状态统计事件数
         *
         * @param status 目标状态
         * @return 指定状态的事件数量
         */
        long countByStatus(WebhookEventStatus status);
}
