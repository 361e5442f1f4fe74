package com.kafcat.core.model;

/**
 * Lowest and next-to-be-written offsets the broker reports for a partition.
 */
public record Watermarks(long low, long high) {

    /**
     * Number of messages currently retained in the partition.
     */
    public long messageCount() {
        return Math.max(0, high - low);
    }

    public boolean isEmpty() {
        return messageCount() == 0;
    }
}
