package com.kafcat.core.client;

import reactor.core.publisher.Mono;

/**
 * Topic administration.
 */
public interface IKafkaAdmin extends AutoCloseable {

    /**
     * Creates a topic with replication factor 1. Completes normally if it already exists.
     */
    Mono<Void> createTopic(String name, int partitions);

    @Override
    void close();
}
