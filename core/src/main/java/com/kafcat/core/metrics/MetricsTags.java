package com.kafcat.core.metrics;

public final class MetricsTags {
    private MetricsTags() {
    }

    public static final String TOPIC = "topic";
    public static final String OPERATION = "operation";
}
