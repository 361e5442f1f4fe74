package com.kafcat.core.client;

import com.kafcat.core.model.KafkaMessage;
import com.kafcat.core.model.KafkaOffset;
import com.kafcat.core.model.Watermarks;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.function.Function;

/**
 * Consumer bound to one topic/partition over a single connection.
 * <p>
 * The connection is used by at most one operation at a time. A stream holds it for its
 * whole lifetime; starting another operation meanwhile fails with
 * {@link com.kafcat.core.error.ConnectionBusyException}. Callers serialize their calls.
 * </p>
 * <p>
 * All errors are {@link com.kafcat.core.error.KafcatException}s.
 * </p>
 */
public interface IKafkaConsumer extends AutoCloseable {

    /**
     * Resolves the offset and (re)assigns the configured partition at that position,
     * replacing any previous assignment.
     */
    Mono<Void> setOffsetAndSubscribe(KafkaOffset offset);

    /**
     * Waits for the next message.
     */
    Mono<KafkaMessage> receiveOne();

    /**
     * Low/high watermarks of the assigned partition.
     */
    Mono<Watermarks> getWatermarks();

    /**
     * Messages in partition order. Completes when no message arrives within the idle timeout,
     * errors when the connection fails. Every subscription is a new stream over the same connection.
     */
    Flux<KafkaMessage> stream();

    /**
     * Drives {@link #stream()} to completion, handing each message to {@code handler} in order.
     * Stops at the first handler or stream error.
     */
    Mono<Void> forEach(Function<KafkaMessage, Mono<Void>> handler);

    /**
     * Releases the connection. An active stream completes.
     */
    @Override
    void close();
}
