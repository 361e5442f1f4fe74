package com.kafcat.kafka;

import com.kafcat.core.client.IKafkaConsumer;
import com.kafcat.core.config.KafkaConsumerConfig;
import com.kafcat.core.error.InvariantViolationException;
import com.kafcat.core.error.KafcatException;
import com.kafcat.core.lease.ExclusiveLease;
import com.kafcat.core.model.KafkaMessage;
import com.kafcat.core.model.KafkaOffset;
import com.kafcat.core.model.ResolvedOffset;
import com.kafcat.core.model.Watermarks;
import com.kafcat.core.offset.OffsetLookup;
import com.kafcat.core.offset.OffsetResolver;
import io.micrometer.core.instrument.MeterRegistry;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.consumer.OffsetAndTimestamp;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.InterruptException;
import org.apache.kafka.common.header.Header;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Function;

/**
 * {@link IKafkaConsumer} on top of the Apache Kafka Java consumer.
 * <p>
 * The Java consumer is not thread-safe and its calls block, so every call to it runs on a
 * dedicated single-thread {@code boundedElastic} scheduler owned by this instance. The
 * {@link ExclusiveLease} on top of that keeps a stream from interleaving with other operations.
 * </p>
 * <p>
 * Records returned by a poll but not yet handed out are buffered locally and handed out one
 * per request, so neither {@link #receiveOne()} nor a cancelled {@link #stream()} drops the
 * rest of a batch. The buffer is cleared on reassignment.
 * </p>
 */
public class ApacheKafkaConsumer implements IKafkaConsumer {
    private static final Logger log = LoggerFactory.getLogger(ApacheKafkaConsumer.class);

    public static final Duration WATERMARK_TIMEOUT = Duration.ofSeconds(3);

    static final Duration POLL_INTERVAL = Duration.ofMillis(100);
    private static final Duration CLOSE_TIMEOUT = Duration.ofSeconds(5);
    private static final byte[] EMPTY = new byte[0];

    private final KafkaConsumerConfig config;
    private final TopicPartition topicPartition;
    private final ExclusiveLease<Consumer<byte[], byte[]>> lease;
    private final Scheduler clientScheduler;
    private final ClientMetrics metrics;
    private final AtomicBoolean closed = new AtomicBoolean();

    // Only touched from clientScheduler
    private final Deque<ConsumerRecord<byte[], byte[]>> pending = new ArrayDeque<>();

    public ApacheKafkaConsumer(KafkaConsumerConfig config, Consumer<byte[], byte[]> consumer, MeterRegistry registry) {
        this.config = config;
        this.topicPartition = new TopicPartition(config.getTopic(), config.partitionOrDefault());
        this.lease = new ExclusiveLease<>("Consumer connection for " + topicPartition, consumer);
        this.clientScheduler = Schedulers.newBoundedElastic(
            1, Schedulers.DEFAULT_BOUNDED_ELASTIC_QUEUESIZE, "kafcat-consumer-" + topicPartition
        );
        this.metrics = new ClientMetrics(registry, config.getTopic());
    }

    @Override
    public Mono<Void> setOffsetAndSubscribe(KafkaOffset offset) {
        log.info("Setting offset {} on {}", offset, topicPartition);

        return lease.withLease(consumer ->
                new OffsetResolver(lookupFor(consumer))
                    .resolve(offset, topicPartition.topic(), topicPartition.partition())
                    .flatMap(resolved -> onClientThread(() -> {
                        assign(consumer, resolved);
                        return resolved;
                    }))
            )
            .doOnNext(resolved -> log.info("Assigned {} at {}", topicPartition, resolved))
            .onErrorMap(error -> failure("set offset", error))
            .then();
    }

    @Override
    public Mono<KafkaMessage> receiveOne() {
        return lease.withLease(consumer ->
                onClientThread(() -> nextRecord(consumer))
                    .repeatWhenEmpty(attempts -> attempts)
                    .map(this::toMessage)
            )
            .doOnNext(message -> metrics.recordReceived())
            .onErrorMap(error -> failure("receive", error));
    }

    @Override
    public Mono<Watermarks> getWatermarks() {
        return lease.withLease(consumer -> onClientThread(() -> {
                ensureOpen();
                ensureAssigned(consumer);
                return fetchWatermarks(consumer);
            }))
            .onErrorMap(error -> failure("fetch watermarks", error));
    }

    @Override
    public Flux<KafkaMessage> stream() {
        Duration idleTimeout = config.idleTimeout();

        return lease.withLeaseMany(consumer -> {
                AtomicBoolean cancelled = new AtomicBoolean();
                return Flux.<ConsumerRecord<byte[], byte[]>>generate(sink -> {
                        ConsumerRecord<byte[], byte[]> record = awaitRecord(consumer, idleTimeout, cancelled);
                        if (record != null) {
                            sink.next(record);
                        } else {
                            if (!cancelled.get()) {
                                log.info("No message on {} within {}, stream finished", topicPartition, idleTimeout);
                            }
                            sink.complete();
                        }
                    })
                    .subscribeOn(clientScheduler)
                    .doOnCancel(() -> cancelled.set(true))
                    .map(this::toMessage);
            })
            .doOnNext(message -> metrics.recordReceived())
            .onErrorResume(error -> closed.get(), error -> {
                log.debug("Stream on {} ended by close: {}", topicPartition, error.toString());
                return Flux.empty();
            })
            .onErrorMap(error -> failure("stream", error));
    }

    @Override
    public Mono<Void> forEach(Function<KafkaMessage, Mono<Void>> handler) {
        return stream()
            .concatMap(handler)
            .then();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        log.info("Closing consumer for {}", topicPartition);

        Consumer<byte[], byte[]> consumer = lease.unsafeResource();
        // wakeup is the one call the Java consumer allows from any thread
        consumer.wakeup();
        clientScheduler.schedule(() -> {
            try {
                consumer.close(CLOSE_TIMEOUT);
            } catch (KafkaException e) {
                log.warn("Error while closing consumer for {}", topicPartition, e);
            }
        });
        clientScheduler.disposeGracefully()
            .timeout(CLOSE_TIMEOUT)
            .doOnError(error -> clientScheduler.dispose())
            .onErrorComplete()
            .subscribe();
    }

    private <T> Mono<T> onClientThread(Callable<T> task) {
        return Mono.fromCallable(task).subscribeOn(clientScheduler);
    }

    private OffsetLookup lookupFor(Consumer<byte[], byte[]> consumer) {
        return (topic, partition, timestampMs, timeout) -> onClientThread(() -> {
            ensureOpen();
            TopicPartition requested = new TopicPartition(topic, partition);
            Map<TopicPartition, OffsetAndTimestamp> found =
                consumer.offsetsForTimes(Map.of(requested, timestampMs), timeout);

            Map<Integer, Long> offsets = new HashMap<>();
            found.forEach((tp, offsetAndTimestamp) -> {
                if (tp.topic().equals(topic)) {
                    offsets.put(tp.partition(),
                        offsetAndTimestamp == null ? OffsetLookup.NO_OFFSET : offsetAndTimestamp.offset());
                }
            });
            return offsets;
        });
    }

    private void assign(Consumer<byte[], byte[]> consumer, ResolvedOffset offset) {
        ensureOpen();
        List<TopicPartition> partitions = List.of(topicPartition);
        consumer.assign(partitions);
        pending.clear();

        switch (offset.getPosition()) {
            case BEGINNING:
                consumer.seekToBeginning(partitions);
                break;
            case END:
                consumer.seekToEnd(partitions);
                break;
            case STORED:
                seekToCommitted(consumer);
                break;
            case ABSOLUTE:
                consumer.seek(topicPartition, offset.getValue());
                break;
            case TAIL:
                Watermarks watermarks = fetchWatermarks(consumer);
                consumer.seek(topicPartition, Math.max(watermarks.low(), watermarks.high() - offset.getValue()));
                break;
            default:
                throw new IllegalArgumentException("Unsupported position: " + offset.getPosition());
        }
    }

    private void seekToCommitted(Consumer<byte[], byte[]> consumer) {
        if (config.getGroupId() == null || config.getGroupId().isBlank()) {
            log.info("No group id for {}, position follows auto.offset.reset", topicPartition);
            return;
        }
        OffsetAndMetadata committed = consumer.committed(Set.of(topicPartition), WATERMARK_TIMEOUT).get(topicPartition);
        if (committed != null) {
            consumer.seek(topicPartition, committed.offset());
        } else {
            log.info("No committed offset for {}, position follows auto.offset.reset", topicPartition);
        }
    }

    private void ensureAssigned(Consumer<byte[], byte[]> consumer) {
        if (consumer.assignment().isEmpty()) {
            log.info("{} was not assigned yet, using the stored offset", topicPartition);
            assign(consumer, ResolvedOffset.stored());
        }
    }

    private Watermarks fetchWatermarks(Consumer<byte[], byte[]> consumer) {
        List<TopicPartition> partitions = List.of(topicPartition);
        Long low = consumer.beginningOffsets(partitions, WATERMARK_TIMEOUT).get(topicPartition);
        Long high = consumer.endOffsets(partitions, WATERMARK_TIMEOUT).get(topicPartition);
        if (low == null || high == null) {
            throw new InvariantViolationException("Watermark response for " + topicPartition + " is incomplete");
        }
        return new Watermarks(low, high);
    }

    private ConsumerRecord<byte[], byte[]> nextRecord(Consumer<byte[], byte[]> consumer) {
        if (pending.isEmpty()) {
            pollInto(consumer);
        }
        return pending.poll();
    }

    /**
     * Next buffered record, polling until one arrives. Returns {@code null} once polls have come
     * back empty for the whole {@code idleTimeout}, or when the stream was cancelled. Time spent
     * waiting for downstream demand is not counted, as this only runs on request.
     */
    private ConsumerRecord<byte[], byte[]> awaitRecord(Consumer<byte[], byte[]> consumer, Duration idleTimeout,
                                                       AtomicBoolean cancelled) {
        long idleSince = System.nanoTime();
        while (pending.isEmpty()) {
            if (cancelled.get()) {
                return null;
            }
            try {
                pollInto(consumer);
            } catch (InterruptException e) {
                if (cancelled.get()) {
                    return null;
                }
                throw e;
            }
            if (pending.isEmpty() && System.nanoTime() - idleSince >= idleTimeout.toNanos()) {
                return null;
            }
        }
        return pending.poll();
    }

    private void pollInto(Consumer<byte[], byte[]> consumer) {
        ensureOpen();
        ensureAssigned(consumer);
        for (ConsumerRecord<byte[], byte[]> record : consumer.poll(POLL_INTERVAL)) {
            pending.add(record);
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new KafcatException("Consumer for " + topicPartition + " is closed");
        }
    }

    private KafkaMessage toMessage(ConsumerRecord<byte[], byte[]> record) {
        Map<String, byte[]> headers = new LinkedHashMap<>();
        for (Header header : record.headers()) {
            headers.put(header.key(), header.value() == null ? EMPTY : header.value());
        }
        return new KafkaMessage(record.key(), record.value(), record.timestamp(), headers);
    }

    private KafcatException failure(String operation, Throwable error) {
        metrics.recordError(operation);
        return KafkaErrors.wrap(operation + " on " + topicPartition, error);
    }
}
