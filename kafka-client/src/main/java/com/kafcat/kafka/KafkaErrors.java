package com.kafcat.kafka;

import com.kafcat.core.error.BrokerRoundTripException;
import com.kafcat.core.error.KafcatException;
import org.apache.kafka.common.KafkaException;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Converts Kafka client exceptions into {@link KafcatException}s at the client boundary.
 */
public final class KafkaErrors {
    private KafkaErrors() {
    }

    /**
     * @param context what was being done, e.g. "poll orders-0"
     */
    public static KafcatException wrap(String context, Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof KafcatException kafcatException) {
            return kafcatException;
        }
        if (cause instanceof org.apache.kafka.common.errors.TimeoutException
            || cause instanceof java.util.concurrent.TimeoutException) {
            return new BrokerRoundTripException(context + " timed out: " + cause.getMessage(), cause);
        }
        if (cause instanceof KafkaException) {
            return new BrokerRoundTripException(context + " failed: " + cause.getMessage(), cause);
        }
        return new KafcatException(context + " failed: " + cause, cause);
    }

    /**
     * Strips the future wrappers admin and producer results come in.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
