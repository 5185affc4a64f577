package com.example.webhookpipeline.repository;

import com.example.webhookpipeline.model.Connector;
import com.example.webhookpipeline.model.WebhookProvider;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ConnectorRepository extends JpaRepository<Connector, Long> {

    /**
     * 查询指定提供方的启用连接器（按创建顺序）。
     */
    List<Connector> findByProviderAndActiveTrueOrderByIdAsc(WebhookProvider provider);

    Optional<Connector> findFirstByProviderAndAccountIdAndActiveTrue(WebhookProvider provider, String accountId);
}
