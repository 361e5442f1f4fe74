package com.kafcat.kafka;

import com.kafcat.core.client.IKafkaAdmin;
import org.apache.kafka.clients.admin.Admin;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.common.errors.TopicExistsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Collections;

public class ApacheKafkaAdmin implements IKafkaAdmin {
    private static final Logger log = LoggerFactory.getLogger(ApacheKafkaAdmin.class);

    static final short REPLICATION_FACTOR = 1;
    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);

    private final Admin adminClient;

    public ApacheKafkaAdmin(Admin adminClient) {
        this.adminClient = adminClient;
    }

    @Override
    public Mono<Void> createTopic(String name, int partitions) {
        return Mono.fromFuture(() -> {
                NewTopic newTopic = new NewTopic(name, partitions, REPLICATION_FACTOR);

                log.info("Creating Kafka topic: {} (partitions={}, replication={})",
                    name, partitions, REPLICATION_FACTOR);

                return adminClient.createTopics(Collections.singleton(newTopic))
                    .all()
                    .toCompletionStage()
                    .toCompletableFuture();
            })
            .doOnSuccess(v -> log.info("Kafka topic created: {}", name))
            .onErrorResume(error -> {
                if (KafkaErrors.unwrap(error) instanceof TopicExistsException) {
                    log.info("Kafka topic already exists: {}", name);
                    return Mono.empty();
                }
                log.error("Failed to create Kafka topic {}: {}", name, error.getMessage());
                return Mono.error(KafkaErrors.wrap("create topic " + name, error));
            })
            .then();
    }

    @Override
    public void close() {
        adminClient.close(CLOSE_TIMEOUT);
        log.info("Admin client closed");
    }
}
