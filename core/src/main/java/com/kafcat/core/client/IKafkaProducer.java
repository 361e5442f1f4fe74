package com.kafcat.core.client;

import com.kafcat.core.model.KafkaMessage;
import reactor.core.publisher.Mono;

/**
 * Producer bound to one destination topic.
 */
public interface IKafkaProducer extends AutoCloseable {

    /**
     * Sends one message and completes once the broker acknowledged it.
     * An empty key or payload is sent as absent.
     */
    Mono<Void> writeOne(KafkaMessage message);

    @Override
    void close();
}
