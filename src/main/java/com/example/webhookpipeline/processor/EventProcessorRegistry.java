package com.example.webhookpipeline.processor;

import com.example.webhookpipeline.model.WebhookProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 处理器注册表，由容器中所有 {@link WebhookEventProcessor} 构建。
 */
@Component
@Slf4j
public class EventProcessorRegistry {

    private final Map<WebhookProvider, WebhookEventProcessor> processors = new EnumMap<>(WebhookProvider.class);

    public EventProcessorRegistry(List<WebhookEventProcessor> processorList) {
        for (WebhookEventProcessor processor : processorList) {
            WebhookEventProcessor previous = processors.putIfAbsent(processor.provider(), processor);
            if (previous != null) {
                throw new IllegalStateException("Duplicate event processor for provider " + processor.provider());
            }
        }
        log.info("Registered event processors: {}", processors.keySet());
    }

    public Optional<WebhookEventProcessor> getProcessor(WebhookProvider provider) {
        return Optional.ofNullable(processors.get(provider));
    }

    public List<String> getSupportedEvents(WebhookProvider provider) {
        return getProcessor(provider).map(WebhookEventProcessor::getSupportedEventTypes)
                .orElse(Collections.emptyList());
    }
}
