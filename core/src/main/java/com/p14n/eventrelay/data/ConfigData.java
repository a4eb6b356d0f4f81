package com.p14n.eventrelay.data;

/**
 * Implementation of RelayConfig holding the settings of one relay instance.
 *
 * @param name                 Name the relay logs under
 * @param host                 Store host address
 * @param port                 Store port number
 * @param path                 Unix-domain socket path, empty for TCP
 * @param password             Store password, empty to skip AUTH
 * @param keyPrefix            Prefix for every store key
 * @param reconnectInterval    Seconds between reconnect attempts
 * @param subscriptionInterval Seconds between registry refreshes
 * @param eventTtl             Seconds a stored event body lives
 */
public record ConfigData(String name,
        String host,
        int port,
        String path,
        String password,
        String keyPrefix,
        int reconnectInterval,
        int subscriptionInterval,
        int eventTtl) implements RelayConfig {

    public static final String DEFAULT_NAME = "event-relay";
    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 6379;
    public static final int DEFAULT_INTERVAL = 15;
    public static final int DEFAULT_EVENT_TTL = 3600;

    public ConfigData {
        name = name == null || name.isEmpty() ? DEFAULT_NAME : name;
        host = host == null || host.isEmpty() ? DEFAULT_HOST : host;
        path = path == null ? "" : path;
        password = password == null ? "" : password;
        keyPrefix = keyPrefix == null ? KeySchema.DEFAULT_PREFIX : keyPrefix;
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        if (reconnectInterval <= 0 || subscriptionInterval <= 0) {
            throw new IllegalArgumentException("intervals must be positive");
        }
        if (eventTtl <= 0) {
            throw new IllegalArgumentException("eventTtl must be positive");
        }
    }

    /**
     * Creates a TCP configuration with default timing and key prefix.
     *
     * @param name     Name the relay logs under
     * @param host     Store host address
     * @param port     Store port number
     * @param password Store password, empty to skip AUTH
     */
    public ConfigData(String name, String host, int port, String password) {
        this(name, host, port, "", password, KeySchema.DEFAULT_PREFIX,
                DEFAULT_INTERVAL, DEFAULT_INTERVAL, DEFAULT_EVENT_TTL);
    }

    /**
     * Creates a configuration pointing at the local store with all defaults.
     *
     * @param name Name the relay logs under
     */
    public ConfigData(String name) {
        this(name, DEFAULT_HOST, DEFAULT_PORT, "");
    }

    public ConfigData withPath(String path) {
        return new ConfigData(name, host, port, path, password, keyPrefix,
                reconnectInterval, subscriptionInterval, eventTtl);
    }
}
