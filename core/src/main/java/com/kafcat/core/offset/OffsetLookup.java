package com.kafcat.core.offset;

import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * Broker round trip translating a timestamp into an offset.
 * Implementations run the request where blocking is allowed.
 */
@FunctionalInterface
public interface OffsetLookup {

    /**
     * Sentinel for "no message at or after the timestamp".
     */
    long NO_OFFSET = -1L;

    /**
     * Looks up the earliest offset whose timestamp is at or after {@code timestampMs}.
     *
     * @return offsets keyed by partition, as reported by the broker; {@link #NO_OFFSET} when
     *     the partition has no such message
     */
    Mono<Map<Integer, Long>> offsetsForTimes(String topic, int partition, long timestampMs, Duration timeout);
}
