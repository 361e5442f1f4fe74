package com.kafcat.app.command;

import com.kafcat.app.config.AppConfig;
import com.kafcat.core.client.IKafkaConsumer;
import com.kafcat.core.client.IKafkaEngine;
import com.kafcat.core.client.IKafkaProducer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.BufferedReader;
import java.io.PrintStream;
import java.util.concurrent.atomic.AtomicLong;

/**
 * The consume, produce and copy modes of the executable.
 * <p>
 * Written against {@link IKafkaEngine} only. Each command owns the clients it creates and
 * closes them when it terminates or is cancelled.
 * </p>
 */
public class KafcatCommands {
    private static final Logger log = LoggerFactory.getLogger(KafcatCommands.class);

    private final IKafkaEngine engine;
    private final AppConfig config;
    private final MessageFormatter formatter;

    public KafcatCommands(IKafkaEngine engine, AppConfig config) {
        this.engine = engine;
        this.config = config;
        this.formatter = new MessageFormatter(config.getFormat(), config.getKeyDelimiter());
    }

    /**
     * Prints the configured partition to {@code out}, one message per line.
     */
    public Mono<Void> consume(PrintStream out) {
        AtomicLong printed = new AtomicLong();

        return Mono.using(
            () -> engine.consumer(config.consumerConfig()),
            consumer -> consumer.setOffsetAndSubscribe(config.getOffset())
                .then(reportEmptyPartition(consumer))
                .then(consumer.forEach(message -> Mono.fromRunnable(() -> {
                    out.println(formatter.format(message));
                    printed.incrementAndGet();
                })))
                .doOnSuccess(v -> {
                    out.flush();
                    log.info("Consumed {} message(s) from {}", printed.get(), config.getTopic());
                }),
            IKafkaConsumer::close
        );
    }

    /**
     * Publishes each line of {@code in} to the configured topic, in order.
     */
    public Mono<Void> produce(BufferedReader in) {
        AtomicLong written = new AtomicLong();

        return Mono.using(
            () -> engine.producer(config.producerConfig()),
            producer -> Flux.fromStream(in::lines)
                .subscribeOn(Schedulers.boundedElastic())
                .filter(line -> !line.isEmpty())
                .map(formatter::parse)
                .concatMap(message -> producer.writeOne(message).doOnSuccess(v -> written.incrementAndGet()))
                .then()
                .doOnSuccess(v -> log.info("Produced {} message(s) to {}", written.get(), config.getTopic())),
            IKafkaProducer::close
        );
    }

    /**
     * Republishes the configured partition to the target topic, keeping key, payload,
     * timestamp and headers.
     */
    public Mono<Void> copy() {
        AtomicLong copied = new AtomicLong();

        return Mono.using(
            () -> engine.producer(config.targetProducerConfig()),
            producer -> Mono.using(
                () -> engine.consumer(config.consumerConfig()),
                consumer -> consumer.setOffsetAndSubscribe(config.getOffset())
                    .then(consumer.forEach(message -> producer.writeOne(message)
                        .doOnSuccess(v -> copied.incrementAndGet())))
                    .doOnSuccess(v -> log.info("Copied {} message(s) from {} to {}",
                        copied.get(), config.getTopic(), config.getTargetTopic())),
                IKafkaConsumer::close
            ),
            IKafkaProducer::close
        );
    }

    private Mono<Void> reportEmptyPartition(IKafkaConsumer consumer) {
        if (!config.isExitOnDone()) {
            return Mono.empty();
        }
        return consumer.getWatermarks()
            .doOnNext(watermarks -> {
                if (watermarks.isEmpty()) {
                    log.info("Partition {}/{} is empty (low={}, high={})",
                        config.getTopic(), config.consumerConfig().partitionOrDefault(),
                        watermarks.low(), watermarks.high());
                }
            })
            .then();
    }
}
