package com.p14n.eventrelay.store;

/**
 * The store gave no response: the connection could not be opened, a write
 * failed or the reply never arrived. The connection must be discarded.
 */
public class StoreTransportException extends StoreException {

    public StoreTransportException(String command, String message) {
        super(command, command + ": " + message, null);
    }

    public StoreTransportException(String command, Throwable cause) {
        super(command, command + ": " + cause.getMessage(), cause);
    }
}
