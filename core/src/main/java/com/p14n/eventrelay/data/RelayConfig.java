package com.p14n.eventrelay.data;

import com.p14n.eventrelay.store.StoreEndpoint;

/**
 * Configuration interface for the event relay.
 * Defines the store connection parameters and the relay's timing.
 */
public interface RelayConfig {

    /**
     * Gets the name this relay instance logs under.
     *
     * @return The relay name
     */
    String name();

    /**
     * Gets the store host, used when no socket path is configured.
     *
     * @return The store host address
     */
    String host();

    /**
     * Gets the store port, used when no socket path is configured.
     *
     * @return The store port number
     */
    int port();

    /**
     * Gets the unix-domain socket path. A non-empty path takes precedence over
     * host and port.
     *
     * @return The socket path, or an empty string
     */
    String path();

    /**
     * Gets the store password. An empty password skips authentication.
     *
     * @return The password, or an empty string
     */
    String password();

    /**
     * Gets the prefix applied to every store key.
     *
     * @return The key prefix
     */
    String keyPrefix();

    /**
     * Gets the interval between reconnect attempts.
     *
     * @return The reconnect interval in seconds
     */
    int reconnectInterval();

    /**
     * Gets the interval between subscription registry refreshes.
     *
     * @return The refresh interval in seconds
     */
    int subscriptionInterval();

    /**
     * Gets how long a stored event body lives.
     *
     * @return The event time-to-live in seconds
     */
    int eventTtl();

    /**
     * Resolves the transport the relay connects with.
     *
     * @return The store endpoint
     */
    default StoreEndpoint endpoint() {
        return StoreEndpoint.of(path(), host(), port());
    }

    /**
     * Builds the key layout for the configured prefix.
     *
     * @return The key schema
     */
    default KeySchema keys() {
        return new KeySchema(keyPrefix());
    }

    default boolean hasPassword() {
        return password() != null && !password().isEmpty();
    }
}
