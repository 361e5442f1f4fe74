package com.kafcat.kafka;

import com.kafcat.core.client.IKafkaAdmin;
import com.kafcat.core.client.IKafkaConsumer;
import com.kafcat.core.client.IKafkaEngine;
import com.kafcat.core.client.IKafkaProducer;
import com.kafcat.core.config.KafkaAuthConfig;
import com.kafcat.core.config.KafkaConsumerConfig;
import com.kafcat.core.config.KafkaProducerConfig;
import com.kafcat.core.error.ConnectionException;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.KafkaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.kafka.sender.KafkaSender;
import reactor.kafka.sender.SenderOptions;

import java.util.Map;

/**
 * {@link IKafkaEngine} backed by the Apache Kafka Java client.
 * <p>
 * Consumers use the plain {@link KafkaConsumer} with manual assignment; producers go through
 * reactor-kafka. Client creation does not contact the brokers, so a reachable cluster is first
 * observed by the first operation.
 * </p>
 */
public class ApacheKafkaEngine implements IKafkaEngine {
    private static final Logger log = LoggerFactory.getLogger(ApacheKafkaEngine.class);

    private final ClientParamsBuilder params;
    private final MeterRegistry registry;

    public ApacheKafkaEngine(MeterRegistry registry) {
        this(new ClientParamsBuilder(), registry);
    }

    public ApacheKafkaEngine(ClientParamsBuilder params, MeterRegistry registry) {
        this.params = params;
        this.registry = registry;
    }

    @Override
    public IKafkaConsumer consumer(KafkaConsumerConfig config) {
        Map<String, Object> props = params.consumer(config);
        try {
            KafkaConsumer<byte[], byte[]> consumer = new KafkaConsumer<>(props);
            log.info("Consumer created: brokers={}, topic={}, partition={}",
                config.getAuth().bootstrapServers(), config.getTopic(), config.partitionOrDefault());
            return new ApacheKafkaConsumer(config, consumer, registry);
        } catch (KafkaException e) {
            throw new ConnectionException("Consumer creation failed: " + e.getMessage(), e);
        }
    }

    @Override
    public IKafkaProducer producer(KafkaProducerConfig config) {
        Map<String, Object> props = params.producer(config);
        try {
            // KafkaSender creates its producer lazily, validate the settings now
            new ProducerConfig(props);
            KafkaSender<byte[], byte[]> sender = KafkaSender.create(SenderOptions.create(props));
            log.info("Producer created: brokers={}, topic={}",
                config.getAuth().bootstrapServers(), config.getTopic());
            return new ReactorKafkaProducer(config, sender, registry);
        } catch (KafkaException e) {
            throw new ConnectionException("Producer creation failed: " + e.getMessage(), e);
        }
    }

    @Override
    public IKafkaAdmin admin(KafkaAuthConfig auth) {
        Map<String, Object> props = params.admin(auth);
        try {
            return new ApacheKafkaAdmin(AdminClient.create(props));
        } catch (KafkaException e) {
            throw new ConnectionException("Admin client creation failed: " + e.getMessage(), e);
        }
    }
}
