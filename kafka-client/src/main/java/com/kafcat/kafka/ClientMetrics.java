package com.kafcat.kafka;

import com.kafcat.core.metrics.MetricsNames;
import com.kafcat.core.metrics.MetricsTags;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

/**
 * Message and error counters of one client, tagged with its topic.
 */
public class ClientMetrics {

    private final MeterRegistry registry;
    private final String topic;
    private final Counter received;
    private final Counter sent;

    public ClientMetrics(MeterRegistry registry, String topic) {
        this.registry = registry;
        this.topic = topic;

        received = Counter.builder(MetricsNames.CONSUMER_RECEIVED_TOTAL)
            .tag(MetricsTags.TOPIC, topic)
            .description("Messages handed out by consumers")
            .register(registry);

        sent = Counter.builder(MetricsNames.PRODUCER_SENT_TOTAL)
            .tag(MetricsTags.TOPIC, topic)
            .description("Messages acknowledged by the broker")
            .register(registry);
    }

    public void recordReceived() {
        received.increment();
    }

    public void recordSent() {
        sent.increment();
    }

    public void recordError(String operation) {
        Counter.builder(MetricsNames.CLIENT_ERRORS_TOTAL)
            .tag(MetricsTags.TOPIC, topic)
            .tag(MetricsTags.OPERATION, operation)
            .description("Failed client operations")
            .register(registry)
            .increment();
    }
}
