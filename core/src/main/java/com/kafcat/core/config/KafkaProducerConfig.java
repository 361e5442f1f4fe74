package com.kafcat.core.config;

import lombok.Builder;
import lombok.Value;

/**
 * Configuration for a producer bound to one destination topic.
 */
@Value
@Builder(toBuilder = true)
public class KafkaProducerConfig {
    String topic;
    KafkaAuthConfig auth;
}
