package com.example.webhookpipeline.realtime;

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * 某个工作区正在累积的一批事件。追加只发生在 {@link EventBatchProcessor} 的 compute 内部。
 */
@Getter
public class EventBatch {

    private final String id;
    private final String workspaceId;
    private final Instant createdAt;
    private final List<RealtimeEvent> events = new ArrayList<>();
    private volatile BatchStatus status = BatchStatus.PENDING;
    private volatile Instant processedAt;

    // flush timer, null when time-based flushing is off
    private ScheduledFuture<?> timer;

    EventBatch(String id, String workspaceId, Instant createdAt) {
        this.id = id;
        this.workspaceId = workspaceId;
        this.createdAt = createdAt;
    }

    synchronized int add(RealtimeEvent event) {
        events.add(event);
        return events.size();
    }

    public synchronized int size() {
        return events.size();
    }

    public synchronized List<RealtimeEvent> getEvents() {
        return List.copyOf(events);
    }

    void setTimer(ScheduledFuture<?> timer) {
        this.timer = timer;
    }

    void cancelTimer() {
        ScheduledFuture<?> t = timer;
        if (t != null) {
            t.cancel(false);
        }
    }

    void markProcessing() {
        status = BatchStatus.PROCESSING;
    }

    void markFinished(BatchStatus finalStatus, Instant at) {
        status = finalStatus;
        processedAt = at;
    }
}
