package com.example.webhookpipeline.processor;

import com.example.webhookpipeline.model.WebhookProvider;
import com.example.webhookpipeline.security.ParsedWebhookEvent;

import java.util.List;

/**
 * 提供方事件处理器：把提供方的事件分类映射为同步操作与实时事件。
 */
public interface WebhookEventProcessor {

    WebhookProvider provider();

    /**
     * 处理一条已验签的事件。实现不应抛出异常，失败以 success=false 的结果返回。
     *
     * @param event       验签后的事件
     * @param workspaceId 连接器所属工作区
     * @param connectorId 连接器 ID
     * @return 处理结果
     */
    ProcessingResult processEvent(ParsedWebhookEvent event, String workspaceId, Long connectorId);

    List<String> getSupportedEventTypes();
}
