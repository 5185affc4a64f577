package com.example.webhookpipeline.metrics;

import com.example.webhookpipeline.config.PipelineProperties;
import com.example.webhookpipeline.realtime.EventSubscription;
import com.example.webhookpipeline.realtime.RealtimeEvent;
import com.example.webhookpipeline.realtime.RealtimeEventEmitter;
import com.example.webhookpipeline.realtime.RealtimeEventType;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 指标重算服务。
 * <p>
 * 请求按 (workspaceId, metricNames) 防抖：窗口内的后续请求并入第一个请求（可提升优先级），不重置计时器。
 * 窗口结束后计算工作区全部指标，与上一次计算结果比较，每个变化的指标发布一条 metrics.updated，
 * 并写入带 TTL 的缓存。
 */
@Service
@Slf4j
public class MetricRecalculationService {

    private final Map<String, PendingRecalculation> pending = new ConcurrentHashMap<>();
    private final Map<String, CachedMetrics> cache = new ConcurrentHashMap<>();
    // 变化比较的基准，独立于 TTL 缓存
    private final Map<String, Map<String, Double>> lastComputed = new ConcurrentHashMap<>();
    private final Map<String, Object> workspaceLocks = new ConcurrentHashMap<>();

    private final MetricCalculator calculator;
    private final RealtimeEventEmitter emitter;
    private final TaskScheduler scheduler;
    private final PipelineProperties.Metrics config;
    private final Clock clock;
    private EventSubscription subscription;

    public MetricRecalculationService(MetricCalculator calculator, RealtimeEventEmitter emitter,
            @Qualifier("pipelineScheduler") TaskScheduler scheduler, PipelineProperties properties, Clock clock) {
        this.calculator = calculator;
        this.emitter = emitter;
        this.scheduler = scheduler;
        this.config = properties.getMetrics();
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        subscription = emitter.subscribeAll(event -> {
            if (event.getType().isDomainEvent() && event.getWorkspaceId() != null) {
                triggerRecalculation(event.getWorkspaceId(), event.getType(), event.getId());
            }
        });
        log.info("[Metrics] Initialized: debounceMs={}, cacheTtlMs={}", config.getDebounceMs(), config.getCacheTtlMs());
    }

    @PreDestroy
    public void shutdown() {
        if (subscription != null) {
            subscription.unsubscribe();
        }
        pending.values().forEach(p -> {
            p.cancel();
            p.future.cancel(false);
        });
        pending.clear();
    }

    /**
     * 提交重算请求。
     *
     * @return 本次防抖周期计算完成后得到全部指标
     */
    public CompletableFuture<Map<String, Double>> requestRecalculation(MetricRecalculationRequest request) {
        String key = request.debounceKey();
        PendingRecalculation entry = pending.compute(key, (k, existing) -> {
            if (existing != null) {
                existing.absorb(request);
                return existing;
            }
            PendingRecalculation created = new PendingRecalculation(request);
            created.timer = scheduler.schedule(() -> fire(k, created),
                    scheduler.getClock().instant().plusMillis(config.getDebounceMs()));
            log.debug("[Metrics] Recalculation scheduled: key={}, trigger={}, priority={}",
                    k, request.getTriggeredBy(), request.getPriority());
            return created;
        });
        return entry.future;
    }

    /**
     * 根据实时事件类型推导需要重算的指标并提交请求。
     */
    public CompletableFuture<Map<String, Double>> triggerRecalculation(String workspaceId, RealtimeEventType eventType,
            String sourceEventId) {
        return requestRecalculation(MetricRecalculationRequest.builder()
                .workspaceId(workspaceId)
                .metricNames(metricsAffectedBy(eventType))
                .triggeredBy(RecalculationTrigger.WEBHOOK)
                .sourceEventId(sourceEventId)
                .priority(RecalculationPriority.HIGH)
                .build());
    }

    /**
     * 仅在 TTL 内返回缓存；过期的条目会被移除。
     */
    public Optional<CachedMetrics> getCachedMetrics(String workspaceId) {
        CachedMetrics cached = cache.get(workspaceId);
        if (cached == null) {
            return Optional.empty();
        }
        if (cached.isExpired(clock.instant())) {
            cache.remove(workspaceId, cached);
            return Optional.empty();
        }
        return Optional.of(cached);
    }

    /**
     * 读取指标：缓存命中直接返回，否则发起高优先级重算并等待本周期完成。
     */
    public Map<String, Double> getMetrics(String workspaceId) {
        Optional<CachedMetrics> cached = getCachedMetrics(workspaceId);
        if (cached.isPresent()) {
            return cached.get().getMetrics();
        }
        CompletableFuture<Map<String, Double>> future = requestRecalculation(MetricRecalculationRequest.builder()
                .workspaceId(workspaceId)
                .triggeredBy(RecalculationTrigger.MANUAL)
                .priority(RecalculationPriority.HIGH)
                .build());
        try {
            return future.get(config.getDebounceMs() + config.getComputeTimeoutMs(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for metrics of workspace " + workspaceId, e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Metric recalculation failed for workspace " + workspaceId,
                    e.getCause());
        } catch (TimeoutException e) {
            throw new IllegalStateException("Metric recalculation timed out for workspace " + workspaceId, e);
        }
    }

    public void invalidateCache(String workspaceId) {
        cache.remove(workspaceId);
        log.debug("[Metrics] Cache invalidated for workspace {}", workspaceId);
    }

    public void clearAllCaches() {
        cache.clear();
        log.info("[Metrics] All metric caches cleared");
    }

    public int getPendingRecalculationCount() {
        return pending.size();
    }

    static Set<String> metricsAffectedBy(RealtimeEventType eventType) {
        switch (eventType) {
            case ORDER_CREATED:
            case ORDER_UPDATED:
                return Set.of(MetricNames.REVENUE, MetricNames.ORDERS, MetricNames.AOV);
            case CUSTOMER_CREATED:
            case CUSTOMER_UPDATED:
                return Set.of(MetricNames.CUSTOMERS);
            case SUBSCRIPTION_CREATED:
            case SUBSCRIPTION_UPDATED:
            case SUBSCRIPTION_CANCELED:
                return Set.of(MetricNames.MRR, MetricNames.ACTIVE_SUBSCRIPTIONS,
                        MetricNames.TRIALING_SUBSCRIPTIONS, MetricNames.CANCELED_SUBSCRIPTIONS);
            case INVOICE_PAID:
            case INVOICE_FAILED:
                return Set.of(MetricNames.MRR, MetricNames.REVENUE_LAST_MONTH);
            default:
                return null;
        }
    }

    private void fire(String key, PendingRecalculation entry) {
        pending.remove(key, entry);
        MetricRecalculationRequest request = entry.snapshot();
        if (entry.getAbsorbed() > 0) {
            log.debug("[Metrics] {} request(s) absorbed into {}", entry.getAbsorbed(), key);
        }
        try {
            entry.future.complete(recalculate(request));
        } catch (Exception e) {
            log.error("[Metrics] Recalculation failed for workspace {}: {}", request.getWorkspaceId(), e.getMessage(), e);
            entry.future.completeExceptionally(e);
        }
    }

    private Map<String, Double> recalculate(MetricRecalculationRequest request) {
        String workspaceId = request.getWorkspaceId();
        log.info("[Metrics] Recalculating workspace {} (trigger={}, priority={}, source={})",
                workspaceId, request.getTriggeredBy(), request.getPriority(), request.getSourceEventId());

        Object lock = workspaceLocks.computeIfAbsent(workspaceId, k -> new Object());
        List<MetricUpdate> changes = new ArrayList<>();
        Map<String, Double> current;
        synchronized (lock) {
            Map<String, Double> previous = lastComputed.getOrDefault(workspaceId, Map.of());
            current = Map.copyOf(calculator.calculate(workspaceId));
            Instant now = clock.instant();
            cache.put(workspaceId, new CachedMetrics(workspaceId, current, now, config.getCacheTtlMs()));
            lastComputed.put(workspaceId, current);

            for (Map.Entry<String, Double> metric : current.entrySet()) {
                double previousValue = previous.getOrDefault(metric.getKey(), 0.0);
                double currentValue = metric.getValue() == null ? 0 : metric.getValue();
                if (Double.compare(previousValue, currentValue) != 0) {
                    changes.add(MetricUpdate.of(metric.getKey(), previousValue, currentValue));
                }
            }
        }

        for (MetricUpdate change : changes) {
            emitter.publish(RealtimeEvent.builder()
                    .type(RealtimeEventType.METRICS_UPDATED)
                    .workspaceId(workspaceId)
                    .data(change.toData())
                    .timestamp(clock.instant())
                    .build());
            log.debug("[Metrics] {} changed {} -> {} ({}%) in workspace {}", change.getMetricName(),
                    change.getPreviousValue(), change.getCurrentValue(),
                    String.format("%.2f", change.getChangePercent()), workspaceId);
        }
        log.info("[Metrics] Recalculation complete for workspace {}: {} metric(s), {} changed",
                workspaceId, current.size(), changes.size());
        return current;
    }

    /**
     * 防抖窗口内的待执行请求。
     */
    private static final class PendingRecalculation {
        private final CompletableFuture<Map<String, Double>> future = new CompletableFuture<>();
        private MetricRecalculationRequest request;
        private int absorbed;
        private volatile ScheduledFuture<?> timer;

        PendingRecalculation(MetricRecalculationRequest request) {
            this.request = request;
        }

        synchronized void absorb(MetricRecalculationRequest other) {
            absorbed++;
            if (other.getPriority().isHigherThan(request.getPriority())) {
                request = MetricRecalculationRequest.builder()
                        .workspaceId(request.getWorkspaceId())
                        .metricNames(request.getMetricNames())
                        .triggeredBy(request.getTriggeredBy())
                        .sourceEventId(request.getSourceEventId())
                        .priority(other.getPriority())
                        .build();
            }
        }

        synchronized MetricRecalculationRequest snapshot() {
            return request;
        }

        synchronized int getAbsorbed() {
            return absorbed;
        }

        void cancel() {
            ScheduledFuture<?> t = timer;
            if (t != null) {
                t.cancel(false);
            }
        }
    }
}
