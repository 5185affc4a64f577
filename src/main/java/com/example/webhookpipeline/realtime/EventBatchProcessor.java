package com.example.webhookpipeline.realtime;

import com.example.webhookpipeline.config.PipelineProperties;
import com.example.webhookpipeline.service.DeadLetterService;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 按工作区累积实时事件，达到数量上限或等待超时后整批交给 {@link BatchHandler}。
 * <p>
 * 每个工作区同一时刻只有一个未关闭批次；批次在交给处理器之前已从 pending 表中原子移除，
 * 刷新进行中到达的事件会进入新批次。
 */
@Component
@Slf4j
public class EventBatchProcessor {

    private final Map<String, EventBatch> pending = new ConcurrentHashMap<>();
    // serializes handler calls per workspace
    private final Map<String, Object> workspaceLocks = new ConcurrentHashMap<>();
    private final TaskScheduler scheduler;
    private final BatchHandler handler;
    private final PipelineProperties.Batch config;
    private final DeadLetterService deadLetterService;
    private final RealtimeEventEmitter emitter;
    private final Clock clock;
    private volatile boolean shuttingDown;
    private EventSubscription subscription;

    public EventBatchProcessor(@Qualifier("pipelineScheduler") TaskScheduler scheduler, BatchHandler handler,
            PipelineProperties properties, DeadLetterService deadLetterService, RealtimeEventEmitter emitter,
            Clock clock) {
        this.scheduler = scheduler;
        this.handler = handler;
        this.config = properties.getBatch();
        this.deadLetterService = deadLetterService;
        this.emitter = emitter;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        subscription = emitter.subscribeAll(event -> {
            if (event.getType().isDomainEvent()) {
                addEvent(event);
            }
        });
        log.info("[Batch] Initialized: maxBatchSize={}, maxWaitTimeMs={}, flushOnSize={}, flushOnTime={}",
                config.getMaxBatchSize(), config.getMaxWaitTimeMs(), config.isFlushOnSize(), config.isFlushOnTime());
    }

    /**
     * 追加事件。批次达到上限时在当前线程同步刷新。
     */
    public void addEvent(RealtimeEvent event) {
        if (shuttingDown) {
            log.warn("[Batch] Shutting down, dropping event {} ({}) for workspace {}",
                    event.getId(), event.getType(), event.getWorkspaceId());
            return;
        }

        String workspaceId = event.getWorkspaceId();
        if (workspaceId == null) {
            log.warn("[Batch] Event {} ({}) has no workspace, ignored", event.getId(), event.getType());
            return;
        }
        EventBatch[] full = new EventBatch[1];
        pending.compute(workspaceId, (key, batch) -> {
            if (batch == null) {
                batch = openBatch(workspaceId);
            }
            int size = batch.add(event);
            if (config.isFlushOnSize() && size >= config.getMaxBatchSize()) {
                full[0] = batch;
                return null;
            }
            return batch;
        });

        if (full[0] != null) {
            log.debug("[Batch] Size limit reached for workspace {} ({} events)", workspaceId, full[0].size());
            full[0].cancelTimer();
            process(full[0]);
        }
    }

    /**
     * 立即刷新指定工作区的批次。
     *
     * @return 被刷新的批次；没有未关闭批次时为空
     */
    public Optional<EventBatch> flushBatch(String workspaceId) {
        EventBatch batch = pending.remove(workspaceId);
        if (batch == null) {
            return Optional.empty();
        }
        batch.cancelTimer();
        process(batch);
        return Optional.of(batch);
    }

    public List<EventBatch> flushAll() {
        List<EventBatch> flushed = new ArrayList<>();
        for (String workspaceId : new ArrayList<>(pending.keySet())) {
            flushBatch(workspaceId).ifPresent(flushed::add);
        }
        return flushed;
    }

    /**
     * 取消所有计时器并刷新全部未关闭批次后返回；之后到达的事件被丢弃。
     */
    @PreDestroy
    public void shutdown() {
        shuttingDown = true;
        if (subscription != null) {
            subscription.unsubscribe();
        }
        pending.values().forEach(EventBatch::cancelTimer);
        List<EventBatch> drained = flushAll();
        log.info("[Batch] Shutdown complete, drained {} batch(es)", drained.size());
    }

    public int getPendingBatchCount() {
        return pending.size();
    }

    public int getPendingEventCount() {
        int total = 0;
        for (EventBatch batch : pending.values()) {
            total += batch.size();
        }
        return total;
    }

    public boolean isShuttingDown() {
        return shuttingDown;
    }

    private EventBatch openBatch(String workspaceId) {
        EventBatch batch = new EventBatch(UUID.randomUUID().toString(), workspaceId, clock.instant());
        if (config.isFlushOnTime()) {
            String batchId = batch.getId();
            batch.setTimer(scheduler.schedule(() -> onTimer(workspaceId, batchId),
                    scheduler.getClock().instant().plusMillis(config.getMaxWaitTimeMs())));
        }
        return batch;
    }

    private void onTimer(String workspaceId, String batchId) {
        EventBatch[] expired = new EventBatch[1];
        pending.computeIfPresent(workspaceId, (key, batch) -> {
            // 批次可能已因数量触发被刷新并由新批次替换
            if (batch.getId().equals(batchId)) {
                expired[0] = batch;
                return null;
            }
            return batch;
        });
        if (expired[0] != null) {
            log.debug("[Batch] Wait time elapsed for workspace {} ({} events)", workspaceId, expired[0].size());
            process(expired[0]);
        }
    }

    private void process(EventBatch batch) {
        Object lock = workspaceLocks.computeIfAbsent(batch.getWorkspaceId(), k -> new Object());
        synchronized (lock) {
            batch.markProcessing();
            try {
                handler.handle(batch);
                batch.markFinished(BatchStatus.COMPLETED, clock.instant());
                log.debug("[Batch] Processed batch {} for workspace {} ({} events)",
                        batch.getId(), batch.getWorkspaceId(), batch.size());
            } catch (Exception e) {
                batch.markFinished(BatchStatus.FAILED, clock.instant());
                log.error("[Batch] Batch {} for workspace {} failed: {}",
                        batch.getId(), batch.getWorkspaceId(), e.getMessage(), e);
                deadLetterService.moveToDeadLetter(DeadLetterService.SOURCE_BATCH, "batch",
                        batch.getWorkspaceId(), e.getMessage(), batchSummary(batch));
            }
        }
    }

    private Map<String, Object> batchSummary(EventBatch batch) {
        List<String> eventIds = new ArrayList<>();
        for (RealtimeEvent event : batch.getEvents()) {
            eventIds.add(event.getType().getWireName() + ":" + event.getId());
        }
        return Map.of("batchId", batch.getId(), "workspaceId", batch.getWorkspaceId(), "events", eventIds);
    }
}
