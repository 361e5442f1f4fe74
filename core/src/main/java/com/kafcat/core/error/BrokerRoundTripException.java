package com.kafcat.core.error;

/**
 * A request to the broker failed: timeout, unknown topic/partition, rejected send, broken poll.
 */
public class BrokerRoundTripException extends KafcatException {

    public BrokerRoundTripException(String message, Throwable cause) {
        super(message, cause);
    }
}
