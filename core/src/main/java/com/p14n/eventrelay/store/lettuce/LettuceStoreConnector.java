package com.p14n.eventrelay.store.lettuce;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.eventrelay.store.StoreConnection;
import com.p14n.eventrelay.store.StoreConnector;
import com.p14n.eventrelay.store.StoreEndpoint;
import com.p14n.eventrelay.store.StoreTransportException;

import io.lettuce.core.ClientOptions;
import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisURI;
import io.lettuce.core.SocketOptions;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.codec.StringCodec;
import io.lettuce.core.protocol.ProtocolVersion;

/**
 * Opens store connections with the Lettuce client, over a unix-domain socket
 * when the endpoint has a path and over TCP otherwise. Unix-domain sockets
 * need the native Netty transport (epoll on Linux) on the class path.
 *
 * <p>
 * Lettuce's own reconnect is switched off: a dropped connection surfaces as a
 * transport failure and the relay opens a new one on its reconnect timer.
 * </p>
 */
public class LettuceStoreConnector implements StoreConnector {

    private static final Logger logger = LoggerFactory.getLogger(LettuceStoreConnector.class);

    private final Duration connectTimeout;
    private final Duration commandTimeout;

    public LettuceStoreConnector() {
        this(5000, 8000);
    }

    public LettuceStoreConnector(int connectTimeoutMillis, int commandTimeoutMillis) {
        this.connectTimeout = Duration.ofMillis(connectTimeoutMillis);
        this.commandTimeout = Duration.ofMillis(commandTimeoutMillis);
    }

    @Override
    public StoreConnection open(StoreEndpoint endpoint) {
        RedisClient client = null;
        try {
            client = RedisClient.create(uri(endpoint));
            client.setOptions(ClientOptions.builder()
                    .autoReconnect(false)
                    .protocolVersion(ProtocolVersion.RESP2)
                    .socketOptions(SocketOptions.builder().connectTimeout(connectTimeout).build())
                    .build());

            StatefulRedisConnection<String, String> connection = client.connect(StringCodec.UTF8);
            logger.atDebug().addArgument(endpoint).log("Opened redis connection to {}");
            return new LettuceStoreConnection(client, connection);
        } catch (RuntimeException e) {
            if (client != null) {
                client.shutdown(0, 2, TimeUnit.SECONDS);
            }
            throw new StoreTransportException("CONNECT", e);
        }
    }

    RedisURI uri(StoreEndpoint endpoint) {
        RedisURI.Builder builder = endpoint.isUnix()
                ? RedisURI.Builder.socket(endpoint.path())
                : RedisURI.Builder.redis(endpoint.host(), endpoint.port());
        return builder.withTimeout(commandTimeout).build();
    }
}
