package com.kafcat.core.error;

/**
 * An operation was started on a connection that is already leased, usually by an active stream.
 */
public class ConnectionBusyException extends KafcatException {

    public ConnectionBusyException(String message) {
        super(message);
    }
}
