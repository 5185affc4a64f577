package com.example.webhookpipeline.service;

import com.example.webhookpipeline.model.DeadLetterEntry;
import com.example.webhookpipeline.repository.DeadLetterEntryRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 死信服务：异步发布、批处理等"发出即不管"的任务失败后写入死信表，供运维排查。
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DeadLetterService {

    public static final String SOURCE_EMITTER = "emitter";
    public static final String SOURCE_BATCH = "batch";

    private final DeadLetterEntryRepository deadLetterRepository;
    private final ObjectMapper objectMapper;

    /**
     * 记录一条死信。本方法自身不会抛出异常。
     *
     * @param source      失败来源
     * @param eventType   事件类型
     * @param workspaceId 工作区
     * @param reason      失败原因
     * @param payload     原始数据（序列化为 JSON）
     */
    public void moveToDeadLetter(String source, String eventType, String workspaceId, String reason,
            Object payload) {
        try {
            DeadLetterEntry entry = DeadLetterEntry.builder()
                    .source(source)
                    .eventType(eventType)
                    .workspaceId(workspaceId)
                    .reason(reason)
                    .payload(serialize(payload))
                    .build();
            DeadLetterEntry saved = deadLetterRepository.save(entry);
            log.warn("[DeadLetter] Recorded id={}, source={}, type={}, workspace={}, reason={}",
                    saved.getId(), source, eventType, workspaceId, reason);
        } catch (Exception e) {
            log.error("[DeadLetter] Failed to record dead letter: source={}, type={}, reason={}",
                    source, eventType, reason, e);
        }
    }

    /**
     * 获取死信数量
     */
    public long getDeadLetterCount() {
        return deadLetterRepository.count();
    }

    private String serialize(Object payload) {
        if (payload == null) {
            return null;
        }
        if (payload instanceof String) {
            return (String) payload;
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            return String.valueOf(payload);
        }
    }
}
