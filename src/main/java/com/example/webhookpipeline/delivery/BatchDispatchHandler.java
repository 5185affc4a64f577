package com.example.webhookpipeline.delivery;

import com.example.webhookpipeline.realtime.BatchHandler;
import com.example.webhookpipeline.realtime.EventBatch;
import com.example.webhookpipeline.realtime.RealtimeEvent;
import com.example.webhookpipeline.service.PipelineMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 批次处理器：记录批次指标，并把批内领域事件分发给订阅了对应类型的出站端点。
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class BatchDispatchHandler implements BatchHandler {

    private final OutboundDeliveryService deliveryService;
    private final PipelineMetrics metrics;

    @Override
    public void handle(EventBatch batch) {
        metrics.batchFlushed(batch.size());
        int deliveries = 0;
        for (RealtimeEvent event : batch.getEvents()) {
            deliveries += deliveryService.dispatch(batch.getWorkspaceId(), event.getType().getWireName(),
                    toPayloadData(event)).size();
        }
        log.debug("[Batch] Batch {} for workspace {}: {} event(s), {} delivery(ies) created",
                batch.getId(), batch.getWorkspaceId(), batch.size(), deliveries);
    }

    private static Map<String, Object> toPayloadData(RealtimeEvent event) {
        Map<String, Object> data = new LinkedHashMap<>(event.getData());
        data.put("eventId", event.getId());
        if (event.getConnectorId() != null) {
            data.put("connectorId", event.getConnectorId());
        }
        data.put("occurredAt", event.getTimestamp().toString());
        return data;
    }
}
