package com.p14n.eventrelay.store.redisson;

import org.redisson.client.RedisClient;
import org.redisson.client.RedisClientConfig;
import org.redisson.client.RedisConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.eventrelay.store.StoreConnection;
import com.p14n.eventrelay.store.StoreConnector;
import com.p14n.eventrelay.store.StoreEndpoint;
import com.p14n.eventrelay.store.StoreTransportException;

/**
 * Opens store connections with the Redisson low-level client. Every
 * connection gets its own {@link RedisClient}, shut down together with the
 * connection.
 *
 * <p>
 * Only the TCP transport is available: the Redisson client has no
 * unix-domain socket channel, so a path endpoint is reported as a connection
 * failure. {@link com.p14n.eventrelay.store.TransportStoreConnector} pairs this
 * connector with one that handles paths.
 * </p>
 */
public class RedissonStoreConnector implements StoreConnector {

    private static final Logger logger = LoggerFactory.getLogger(RedissonStoreConnector.class);

    static final String REDISSON_HOST_PREFIX = "redis://";

    private final int connectTimeoutMillis;
    private final int commandTimeoutMillis;

    public RedissonStoreConnector() {
        this(5000, 8000);
    }

    public RedissonStoreConnector(int connectTimeoutMillis, int commandTimeoutMillis) {
        this.connectTimeoutMillis = connectTimeoutMillis;
        this.commandTimeoutMillis = commandTimeoutMillis;
    }

    @Override
    public StoreConnection open(StoreEndpoint endpoint) {
        if (endpoint.isUnix()) {
            throw new StoreTransportException("CONNECT",
                    "unix-domain transport is not supported by the redisson client (" + endpoint.path() + ")");
        }

        RedisClient client = null;
        try {
            RedisClientConfig config = new RedisClientConfig();
            config.setAddress(address(endpoint));
            config.setConnectTimeout(connectTimeoutMillis);
            config.setCommandTimeout(commandTimeoutMillis);

            client = RedisClient.create(config);
            RedisConnection connection = client.connect();
            logger.atDebug().addArgument(endpoint).log("Opened redis connection to {}");
            return new RedissonStoreConnection(client, connection);
        } catch (RuntimeException e) {
            if (client != null) {
                client.shutdown();
            }
            throw new StoreTransportException("CONNECT", e);
        }
    }

    static String address(StoreEndpoint endpoint) {
        return REDISSON_HOST_PREFIX + endpoint.host() + ":" + endpoint.port();
    }
}
