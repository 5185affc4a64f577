package com.example.webhookpipeline.repository;

import com.example.webhookpipeline.model.WebhookEndpoint;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface WebhookEndpointRepository extends JpaRepository<WebhookEndpoint, Long> {

    List<WebhookEndpoint> findByWorkspaceIdOrderByIdAsc(String workspaceId);

    List<WebhookEndpoint> findByWorkspaceIdAndActiveTrue(String workspaceId);
}
