package com.p14n.eventrelay.store;

/**
 * Picks a connector by transport: path endpoints go to the unix-domain
 * connector, host and port endpoints to the TCP one.
 */
public class TransportStoreConnector implements StoreConnector {

    private final StoreConnector tcp;
    private final StoreConnector unix;

    public TransportStoreConnector(StoreConnector tcp, StoreConnector unix) {
        this.tcp = tcp;
        this.unix = unix;
    }

    @Override
    public StoreConnection open(StoreEndpoint endpoint) {
        return endpoint.isUnix() ? unix.open(endpoint) : tcp.open(endpoint);
    }
}
