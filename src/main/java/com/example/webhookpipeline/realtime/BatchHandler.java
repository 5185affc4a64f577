package com.example.webhookpipeline.realtime;

/**
 * 批次刷新后的处理回调。
 */
@FunctionalInterface
public interface BatchHandler {

    void handle(EventBatch batch) throws Exception;
}
