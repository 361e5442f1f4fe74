package com.kafcat.core.client;

import com.kafcat.core.config.KafkaAuthConfig;
import com.kafcat.core.config.KafkaConsumerConfig;
import com.kafcat.core.config.KafkaProducerConfig;

/**
 * Capability set of a Kafka client implementation.
 * <p>
 * Business logic depends on this interface only, so a new client library can be plugged in
 * by adding one implementation.
 * </p>
 * <p>
 * Factory methods fail fast: invalid configuration raises
 * {@link com.kafcat.core.error.ConfigurationException}, a client that cannot be created raises
 * {@link com.kafcat.core.error.ConnectionException}.
 * </p>
 */
public interface IKafkaEngine {

    IKafkaConsumer consumer(KafkaConsumerConfig config);

    IKafkaProducer producer(KafkaProducerConfig config);

    IKafkaAdmin admin(KafkaAuthConfig auth);
}
