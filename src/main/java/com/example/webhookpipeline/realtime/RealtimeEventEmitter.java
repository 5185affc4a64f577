package com.example.webhookpipeline.realtime;

import com.example.webhookpipeline.service.DeadLetterService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;

/**
 * 进程内发布/订阅。
 * <p>
 * 同一事件的各订阅者并发执行，单个订阅者内部按 emit 顺序串行；任何回调异常只记录日志，
 * 不影响其他订阅者，也不会传播给调用方。
 */
@Component
@Slf4j
public class RealtimeEventEmitter {

    private final Map<RealtimeEventType, List<EventSubscription>> subscribers = new ConcurrentHashMap<>();
    private final List<EventSubscription> wildcardSubscribers = new CopyOnWriteArrayList<>();
    private final Executor executor;
    private final DeadLetterService deadLetterService;

    public RealtimeEventEmitter(@Qualifier("taskExecutor") Executor executor, DeadLetterService deadLetterService) {
        this.executor = executor;
        this.deadLetterService = deadLetterService;
    }

    public EventSubscription subscribe(RealtimeEventType type, EventCallback callback) {
        return subscribe(type, callback, null);
    }

    /**
     * 订阅指定类型的事件。
     *
     * @param type        事件类型
     * @param callback    回调
     * @param workspaceId 仅接收该工作区的事件；null 表示全部
     * @return 订阅句柄
     */
    public EventSubscription subscribe(RealtimeEventType type, EventCallback callback, String workspaceId) {
        List<EventSubscription> list = subscribers.computeIfAbsent(type, t -> new CopyOnWriteArrayList<>());
        EventSubscription[] holder = new EventSubscription[1];
        holder[0] = new EventSubscription(UUID.randomUUID().toString(), type, workspaceId, callback, executor,
                () -> list.remove(holder[0]));
        list.add(holder[0]);
        log.debug("[Emitter] Subscribed {} to {} (workspace={})", holder[0].getId(), type, workspaceId);
        return holder[0];
    }

    public EventSubscription subscribeAll(EventCallback callback) {
        return subscribeAll(callback, null);
    }

    /**
     * 通配订阅（'*'）：接收所有类型的事件。
     */
    public EventSubscription subscribeAll(EventCallback callback, String workspaceId) {
        EventSubscription[] holder = new EventSubscription[1];
        holder[0] = new EventSubscription(UUID.randomUUID().toString(), null, workspaceId, callback, executor,
                () -> wildcardSubscribers.remove(holder[0]));
        wildcardSubscribers.add(holder[0]);
        return holder[0];
    }

    /**
     * 通知所有匹配的订阅者。返回的 Future 在全部回调结束后完成，且始终正常完成。
     */
    public CompletableFuture<Void> emit(RealtimeEvent event) {
        return dispatch(event).thenApply(failures -> null);
    }

    /**
     * 发出即不管：调用方不等待结果，也不会在调用线程上执行回调；回调失败或线程池饱和被拒绝时写入死信。
     */
    public void publish(RealtimeEvent event) {
        try {
            dispatch(event).thenAccept(failures -> {
                for (String failure : failures) {
                    deadLetterService.moveToDeadLetter(DeadLetterService.SOURCE_EMITTER,
                            event.getType().getWireName(), event.getWorkspaceId(), failure, event);
                }
            });
        } catch (RuntimeException e) {
            log.error("[Emitter] Failed to dispatch {} for workspace {}", event.getType(), event.getWorkspaceId(), e);
            deadLetterService.moveToDeadLetter(DeadLetterService.SOURCE_EMITTER, event.getType().getWireName(),
                    event.getWorkspaceId(), "Dispatch failed: " + e.getMessage(), event);
        }
    }

    public int getSubscriberCount(RealtimeEventType type) {
        List<EventSubscription> list = subscribers.get(type);
        return list == null ? 0 : list.size();
    }

    public int getWildcardSubscriberCount() {
        return wildcardSubscribers.size();
    }

    public int getTotalSubscriberCount() {
        int total = wildcardSubscribers.size();
        for (List<EventSubscription> list : subscribers.values()) {
            total += list.size();
        }
        return total;
    }

    /**
     * 为每个匹配的订阅者排入一个任务，Future 的结果为失败描述列表（含被线程池拒绝的订阅者）。
     */
    private CompletableFuture<List<String>> dispatch(RealtimeEvent event) {
        List<EventSubscription> targets = new ArrayList<>();
        List<EventSubscription> typed = subscribers.get(event.getType());
        if (typed != null) {
            for (EventSubscription sub : typed) {
                if (sub.matches(event))
                    targets.add(sub);
            }
        }
        for (EventSubscription sub : wildcardSubscribers) {
            if (sub.matches(event))
                targets.add(sub);
        }

        if (targets.isEmpty()) {
            return CompletableFuture.completedFuture(List.of());
        }

        List<String> failures = new CopyOnWriteArrayList<>();
        CompletableFuture<?>[] futures = new CompletableFuture<?>[targets.size()];
        for (int i = 0; i < targets.size(); i++) {
            EventSubscription sub = targets.get(i);
            CompletableFuture<Void> future = new CompletableFuture<>();
            sub.getExecutor().execute(() -> {
                try {
                    if (sub.isActive()) {
                        sub.getCallback().onEvent(event);
                    }
                } catch (Exception e) {
                    log.error("[Emitter] Subscriber {} failed on {} (workspace={}): {}",
                            sub.getId(), event.getType(), event.getWorkspaceId(), e.getMessage(), e);
                    failures.add("Subscriber " + sub.getId() + " failed: " + e.getMessage());
                } finally {
                    future.complete(null);
                }
            }, rejected -> {
                log.warn("[Emitter] Executor saturated, dropped {} for subscriber {} (workspace={})",
                        event.getType(), sub.getId(), event.getWorkspaceId());
                failures.add("Subscriber " + sub.getId() + " rejected: " + rejected.getMessage());
                future.complete(null);
            });
            futures[i] = future;
        }
        return CompletableFuture.allOf(futures).thenApply(v -> List.copyOf(failures));
    }
}
