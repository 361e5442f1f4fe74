package com.kafcat.core.error;

/**
 * Base type for every error surfaced by kafcat clients.
 * Engine-specific exceptions are wrapped into one of the subclasses at the client boundary.
 */
public class KafcatException extends RuntimeException {

    public KafcatException(String message) {
        super(message);
    }

    public KafcatException(String message, Throwable cause) {
        super(message, cause);
    }
}
