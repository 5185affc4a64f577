package com.example.webhookpipeline.realtime;

import lombok.Getter;

import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 订阅句柄。每个订阅持有一个串行执行器，保证同一订阅者按 emit 顺序收到事件。
 */
@Getter
public class EventSubscription {

    private final String id;
    /** null for wildcard subscriptions. */
    private final RealtimeEventType type;
    /** null means all workspaces. */
    private final String workspaceId;
    private final EventCallback callback;
    private final SerialExecutor executor;
    private final AtomicBoolean active = new AtomicBoolean(true);
    private final Runnable remover;

    EventSubscription(String id, RealtimeEventType type, String workspaceId, EventCallback callback,
            Executor sharedExecutor, Runnable remover) {
        this.id = id;
        this.type = type;
        this.workspaceId = workspaceId;
        this.callback = callback;
        this.executor = new SerialExecutor(sharedExecutor);
        this.remover = remover;
    }

    public boolean matches(RealtimeEvent event) {
        return active.get() && (workspaceId == null || workspaceId.equals(event.getWorkspaceId()));
    }

    public boolean isActive() {
        return active.get();
    }

    public void unsubscribe() {
        if (active.compareAndSet(true, false)) {
            remover.run();
        }
    }
}
