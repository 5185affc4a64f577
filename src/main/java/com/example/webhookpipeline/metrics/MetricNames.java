package com.example.webhookpipeline.metrics;

public final class MetricNames {

    public static final String REVENUE = "revenue";
    public static final String ORDERS = "orders";
    public static final String AOV = "aov";
    public static final String CUSTOMERS = "customers";

    public static final String MRR = "mrr";
    public static final String ACTIVE_SUBSCRIPTIONS = "activeSubscriptions";
    public static final String TRIALING_SUBSCRIPTIONS = "trialingSubscriptions";
    public static final String CANCELED_SUBSCRIPTIONS = "canceledSubscriptions";
    public static final String REVENUE_LAST_MONTH = "revenueLastMonth";

    private MetricNames() {
    }
}
