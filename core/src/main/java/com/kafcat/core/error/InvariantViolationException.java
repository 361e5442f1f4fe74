package com.kafcat.core.error;

/**
 * The engine returned something that contradicts the request that was made.
 */
public class InvariantViolationException extends KafcatException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
