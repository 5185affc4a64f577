package com.example.webhookpipeline.metrics;

import com.example.webhookpipeline.model.SyncedObjectType;
import com.example.webhookpipeline.repository.SyncedRecordRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 基于同步记录表的指标计算。电商指标统计近 30 天订单，SaaS 指标统计当前订阅与近 30 天已付发票。
 */
@Component
@RequiredArgsConstructor
public class SyncedRecordMetricCalculator implements MetricCalculator {

    static final int WINDOW_DAYS = 30;
    static final List<String> EXCLUDED_ORDER_STATUSES = List.of("cancelled", "refunded");

    private final SyncedRecordRepository recordRepository;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Map<String, Double> calculate(String workspaceId) {
        LocalDateTime windowStart = LocalDateTime.now(clock).minusDays(WINDOW_DAYS);
        Map<String, Double> metrics = new LinkedHashMap<>();

        double revenue = toDouble(recordRepository.sumAmountSince(workspaceId, SyncedObjectType.ORDER,
                windowStart, EXCLUDED_ORDER_STATUSES));
        long orders = recordRepository.countSince(workspaceId, SyncedObjectType.ORDER, windowStart,
                EXCLUDED_ORDER_STATUSES);
        metrics.put(MetricNames.REVENUE, revenue);
        metrics.put(MetricNames.ORDERS, (double) orders);
        metrics.put(MetricNames.CUSTOMERS,
                (double) recordRepository.countByWorkspaceIdAndObjectType(workspaceId, SyncedObjectType.CUSTOMER));
        metrics.put(MetricNames.AOV, orders > 0 ? revenue / orders : 0);

        metrics.put(MetricNames.MRR, toDouble(
                recordRepository.sumAmountByStatus(workspaceId, SyncedObjectType.SUBSCRIPTION, "active")));
        metrics.put(MetricNames.ACTIVE_SUBSCRIPTIONS, (double) recordRepository
                .countByWorkspaceIdAndObjectTypeAndStatus(workspaceId, SyncedObjectType.SUBSCRIPTION, "active"));
        metrics.put(MetricNames.TRIALING_SUBSCRIPTIONS, (double) recordRepository
                .countByWorkspaceIdAndObjectTypeAndStatus(workspaceId, SyncedObjectType.SUBSCRIPTION, "trialing"));
        metrics.put(MetricNames.CANCELED_SUBSCRIPTIONS, (double) recordRepository
                .countByWorkspaceIdAndObjectTypeAndStatus(workspaceId, SyncedObjectType.SUBSCRIPTION, "canceled"));
        metrics.put(MetricNames.REVENUE_LAST_MONTH, toDouble(recordRepository
                .sumAmountByStatusSince(workspaceId, SyncedObjectType.INVOICE, "paid", windowStart)));
        return metrics;
    }

    private static double toDouble(BigDecimal value) {
        return value == null ? 0 : value.doubleValue();
    }
}
