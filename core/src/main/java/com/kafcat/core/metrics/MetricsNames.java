package com.kafcat.core.metrics;

/**
 * Micrometer metric names used by kafcat clients.
 * <p>
 * <b>Naming convention:</b> {@code kafcat.<component>.<metric>}, counters end in {@code .total}.
 * </p>
 */
public final class MetricsNames {
    private MetricsNames() {
    }

    /**
     * Counter: messages handed out by consumers.
     * <p>
     * Tags: topic
     * </p>
     */
    public static final String CONSUMER_RECEIVED_TOTAL = "kafcat.consumer.received.total";

    /**
     * Counter: messages acknowledged by the broker.
     * <p>
     * Tags: topic
     * </p>
     */
    public static final String PRODUCER_SENT_TOTAL = "kafcat.producer.sent.total";

    /**
     * Counter: failed client operations.
     * <p>
     * Tags: topic, operation
     * </p>
     */
    public static final String CLIENT_ERRORS_TOTAL = "kafcat.client.errors.total";
}
