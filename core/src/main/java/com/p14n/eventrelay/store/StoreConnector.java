package com.p14n.eventrelay.store;

/**
 * Opens connections to the store.
 */
@FunctionalInterface
public interface StoreConnector {

    /**
     * Opens a new connection.
     *
     * @param endpoint where to connect
     * @return an open connection
     * @throws StoreTransportException if the connection cannot be established
     */
    StoreConnection open(StoreEndpoint endpoint);
}
