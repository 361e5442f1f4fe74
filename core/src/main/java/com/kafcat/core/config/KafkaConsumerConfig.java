package com.kafcat.core.config;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Configuration for a single-partition, manually assigned consumer.
 */
@Value
@Builder(toBuilder = true)
public class KafkaConsumerConfig {
    /**
     * Idle timeout when the consumer should stop once it has caught up.
     */
    public static final Duration EXIT_ON_DONE_IDLE_TIMEOUT = Duration.ofSeconds(3);

    /**
     * Idle timeout when tailing; long enough that idleness never ends the stream in practice.
     */
    public static final Duration TAILING_IDLE_TIMEOUT = Duration.ofHours(1);

    public static final int DEFAULT_PARTITION = 0;

    String groupId;
    String topic;

    /**
     * Partition to read; {@code null} means {@link #DEFAULT_PARTITION}.
     */
    Integer partition;

    boolean exitOnDone;
    KafkaAuthConfig auth;

    public int partitionOrDefault() {
        return partition != null ? partition : DEFAULT_PARTITION;
    }

    public Duration idleTimeout() {
        return exitOnDone ? EXIT_ON_DONE_IDLE_TIMEOUT : TAILING_IDLE_TIMEOUT;
    }
}
