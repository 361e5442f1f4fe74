package com.kafcat.core.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Concrete partition position handed to the engine when assigning a partition.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ResolvedOffset {
    private static final ResolvedOffset BEGINNING = new ResolvedOffset(Position.BEGINNING, 0);
    private static final ResolvedOffset END = new ResolvedOffset(Position.END, 0);
    private static final ResolvedOffset STORED = new ResolvedOffset(Position.STORED, 0);

    Position position;

    /**
     * Offset for ABSOLUTE, number of messages before the end for TAIL, unused otherwise.
     */
    long value;

    public static ResolvedOffset beginning() {
        return BEGINNING;
    }

    public static ResolvedOffset end() {
        return END;
    }

    public static ResolvedOffset stored() {
        return STORED;
    }

    public static ResolvedOffset absolute(long offset) {
        return new ResolvedOffset(Position.ABSOLUTE, offset);
    }

    public static ResolvedOffset tail(long messagesBeforeEnd) {
        return new ResolvedOffset(Position.TAIL, messagesBeforeEnd);
    }

    public enum Position {
        BEGINNING,
        END,
        STORED,
        ABSOLUTE,
        TAIL
    }
}
