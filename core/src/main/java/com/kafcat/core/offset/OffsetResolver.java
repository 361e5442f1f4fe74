package com.kafcat.core.offset;

import com.kafcat.core.error.InvariantViolationException;
import com.kafcat.core.model.KafkaOffset;
import com.kafcat.core.model.ResolvedOffset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Translates a {@link KafkaOffset} into the position the engine assigns.
 * <p>
 * Only {@link KafkaOffset.Type#TIME_INTERVAL} needs the broker; everything else maps locally:
 * <ul>
 *   <li>{@code ABSOLUTE(n)} → offset {@code n}</li>
 *   <li>{@code FROM_TAIL(n)} → {@code -n-1} messages before the end, so {@code -1} is the end itself</li>
 *   <li>{@code OFFSET_INTERVAL(b, e)} → offset {@code b}</li>
 *   <li>{@code TIME_INTERVAL(b, e)} → first offset at or after timestamp {@code b}, or the end if none</li>
 * </ul>
 * </p>
 */
public class OffsetResolver {
    private static final Logger log = LoggerFactory.getLogger(OffsetResolver.class);

    public static final Duration OFFSET_FOR_TIME_TIMEOUT = Duration.ofSeconds(1);

    private final OffsetLookup lookup;

    public OffsetResolver(OffsetLookup lookup) {
        this.lookup = lookup;
    }

    public Mono<ResolvedOffset> resolve(KafkaOffset offset, String topic, int partition) {
        if (offset.hasEndBound()) {
            log.warn("End bound {} of {} is not supported yet and is ignored; consumption stops on idle timeout only",
                offset.getEnd(), offset.getType());
        }

        switch (offset.getType()) {
            case BEGINNING:
                return Mono.just(ResolvedOffset.beginning());
            case END:
                return Mono.just(ResolvedOffset.end());
            case STORED:
                return Mono.just(ResolvedOffset.stored());
            case ABSOLUTE:
            case OFFSET_INTERVAL:
                return Mono.just(ResolvedOffset.absolute(offset.getBegin()));
            case FROM_TAIL:
                return Mono.just(ResolvedOffset.tail(-offset.getBegin() - 1));
            case TIME_INTERVAL:
                return resolveTime(offset.getBegin(), topic, partition);
            default:
                return Mono.error(new IllegalArgumentException("Unsupported offset type: " + offset.getType()));
        }
    }

    private Mono<ResolvedOffset> resolveTime(long timestampMs, String topic, int partition) {
        return Mono.defer(() -> lookup.offsetsForTimes(topic, partition, timestampMs, OFFSET_FOR_TIME_TIMEOUT))
            .map(offsets -> {
                Long found = offsets.get(partition);
                if (found == null) {
                    throw new InvariantViolationException(
                        "Offset lookup for " + topic + "/" + partition + " returned no entry for that partition");
                }
                log.info("Timestamp {} on {}/{} resolved to offset {}", timestampMs, topic, partition, found);
                return found == OffsetLookup.NO_OFFSET ? ResolvedOffset.end() : ResolvedOffset.absolute(found);
            });
    }
}
