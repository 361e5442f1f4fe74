package com.kafcat.core.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Where a consumer should start reading, as the user states it.
 * <p>
 * The sign of a raw offset encodes its direction: {@code n >= 0} is an absolute offset,
 * {@code n < 0} counts from the tail, where {@code -1} is the tail itself.
 * </p>
 * <p>
 * Interval end bounds are carried but not acted upon yet; resolution only uses the begin bound.
 * </p>
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class KafkaOffset {
    /**
     * End bound used when an interval is open-ended.
     */
    public static final long OPEN_END = Long.MAX_VALUE;

    private static final KafkaOffset BEGINNING = new KafkaOffset(Type.BEGINNING, 0, OPEN_END);
    private static final KafkaOffset END = new KafkaOffset(Type.END, 0, OPEN_END);
    private static final KafkaOffset STORED = new KafkaOffset(Type.STORED, 0, OPEN_END);

    Type type;

    /**
     * Offset for ABSOLUTE/FROM_TAIL/OFFSET_INTERVAL, epoch millis for TIME_INTERVAL.
     */
    long begin;

    /**
     * Reserved end bound of an interval.
     */
    long end;

    public static KafkaOffset beginning() {
        return BEGINNING;
    }

    public static KafkaOffset end() {
        return END;
    }

    public static KafkaOffset stored() {
        return STORED;
    }

    /**
     * Raw numeric offset: absolute when non-negative, relative to the tail when negative.
     */
    public static KafkaOffset offset(long n) {
        return n >= 0 ? absolute(n) : fromTail(n);
    }

    public static KafkaOffset absolute(long n) {
        if (n < 0) {
            throw new IllegalArgumentException("Absolute offset must be >= 0, got " + n);
        }
        return new KafkaOffset(Type.ABSOLUTE, n, OPEN_END);
    }

    public static KafkaOffset fromTail(long n) {
        if (n >= 0) {
            throw new IllegalArgumentException("Tail-relative offset must be < 0, got " + n);
        }
        return new KafkaOffset(Type.FROM_TAIL, n, OPEN_END);
    }

    public static KafkaOffset offsetInterval(long begin, long end) {
        if (begin < 0 || end < begin) {
            throw new IllegalArgumentException("Invalid offset interval [" + begin + ", " + end + "]");
        }
        return new KafkaOffset(Type.OFFSET_INTERVAL, begin, end);
    }

    public static KafkaOffset timeInterval(long beginMs, long endMs) {
        if (beginMs < 0 || endMs < beginMs) {
            throw new IllegalArgumentException("Invalid time interval [" + beginMs + ", " + endMs + "]");
        }
        return new KafkaOffset(Type.TIME_INTERVAL, beginMs, endMs);
    }

    /**
     * Whether this is an interval with an explicit (closed) end bound.
     */
    public boolean hasEndBound() {
        return (type == Type.OFFSET_INTERVAL || type == Type.TIME_INTERVAL) && end != OPEN_END;
    }

    public enum Type {
        BEGINNING,
        END,
        STORED,
        ABSOLUTE,
        FROM_TAIL,
        OFFSET_INTERVAL,
        TIME_INTERVAL
    }
}
