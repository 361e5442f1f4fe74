package com.kafcat.core.error;

/**
 * The underlying client could not be created. Treated as a startup failure; never retried.
 */
public class ConnectionException extends KafcatException {

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
