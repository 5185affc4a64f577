package com.example.webhookpipeline.sync;

import com.example.webhookpipeline.model.SyncedObjectType;
import com.example.webhookpipeline.model.SyncedRecord;
import com.example.webhookpipeline.model.WebhookProvider;

public interface SyncService {

    /**
     * 按 (workspace, provider, objectType, externalId) 插入或更新。
     */
    SyncedRecord upsert(SyncCommand command);

    /**
     * @return 记录存在并被删除时返回 true
     */
    boolean delete(String workspaceId, WebhookProvider provider, SyncedObjectType objectType, String externalId);
}
