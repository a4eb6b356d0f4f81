package com.p14n.eventrelay.relay;

import java.util.Optional;
import java.util.function.Function;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.eventrelay.data.RelayConfig;
import com.p14n.eventrelay.store.StoreConnection;
import com.p14n.eventrelay.store.StoreConnector;
import com.p14n.eventrelay.store.StoreEndpoint;
import com.p14n.eventrelay.store.StoreErrorException;
import com.p14n.eventrelay.store.StoreException;
import com.p14n.eventrelay.store.StoreTransportException;
import com.p14n.eventrelay.telemetry.RelayMetrics;

/**
 * Owns the single store connection.
 *
 * <p>
 * The connection moves between two states, connected and disconnected.
 * Commands go through {@link #execute(String, Function)}: a transport
 * failure tears the connection down so that the next reconnect attempt opens
 * a fresh one, while an error reply is logged and leaves the connection in
 * place.
 * </p>
 *
 * <p>
 * Not thread-safe. Every method is called from the pipeline worker only.
 * </p>
 */
public class ConnectionManager {

    private static final Logger logger = LoggerFactory.getLogger(ConnectionManager.class);

    private final RelayConfig config;
    private final StoreConnector connector;
    private final RelayMetrics metrics;
    private StoreConnection connection;

    public ConnectionManager(RelayConfig config, StoreConnector connector, RelayMetrics metrics) {
        this.config = config;
        this.connector = connector;
        this.metrics = metrics;
    }

    /**
     * Opens the connection if there is none, or if the current one was closed
     * underneath the manager. Failures are logged and leave the manager
     * disconnected.
     */
    public void connect() {
        if (connection != null) {
            if (connection.isOpen()) {
                return;
            }
            logger.atWarn().log("Redis connection closed by peer");
            teardown();
        }

        StoreEndpoint endpoint = config.endpoint();
        logger.atInfo().addArgument(endpoint).log("Trying to connect to redis server at {}");
        metrics.recordConnectAttempt();

        StoreConnection opened;
        try {
            opened = connector.open(endpoint);
        } catch (StoreException e) {
            metrics.recordConnectFailure();
            logger.atWarn()
                    .addArgument(endpoint)
                    .addArgument(e.getMessage())
                    .log("Connection error for {}: {}");
            return;
        } catch (RuntimeException e) {
            metrics.recordConnectFailure();
            logger.atWarn()
                    .setCause(e)
                    .addArgument(endpoint)
                    .log("Connection error for {}");
            return;
        }
        if (opened == null) {
            metrics.recordConnectFailure();
            logger.atWarn().log("Cannot allocate redis connection");
            return;
        }
        connection = opened;

        if (config.hasPassword()) {
            String password = config.password();
            execute("AUTH", c -> c.auth(password))
                    .ifPresent(status -> logger.atInfo().addArgument(status).log("AUTH: {}"));
        }

        if (connection != null) {
            logger.atInfo().addArgument(endpoint).log("Connected to redis server at {}");
        } else {
            metrics.recordConnectFailure();
        }
    }

    public boolean isConnected() {
        return connection != null;
    }

    /**
     * Releases the connection, if any, and moves to disconnected.
     */
    public void teardown() {
        if (connection == null) {
            return;
        }
        StoreConnection closing = connection;
        connection = null;
        metrics.recordTeardown();
        try {
            closing.close();
        } catch (RuntimeException e) {
            logger.atDebug().setCause(e).log("Error closing redis connection");
        }
        logger.atInfo().log("Disconnected from redis server");
    }

    /**
     * Runs one command against the connection.
     *
     * <p>
     * An empty result means the command produced no usable reply: the manager
     * was disconnected, the store answered with an error (logged, connection
     * kept) or the transport failed (logged, connection torn down). Callers
     * tell the last case apart with {@link #isConnected()}.
     * </p>
     *
     * @param command label used in log messages, for example {@code "INCR"}
     * @param action  the command
     * @param <T>     reply type
     * @return the reply, or empty
     */
    public <T> Optional<T> execute(String command, Function<StoreConnection, T> action) {
        if (connection == null) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(action.apply(connection));
        } catch (StoreTransportException e) {
            logger.atWarn()
                    .addArgument(command)
                    .addArgument(e.getMessage())
                    .log("No reply to {}, dropping connection: {}");
            teardown();
            return Optional.empty();
        } catch (StoreErrorException e) {
            logger.atInfo()
                    .addArgument(command)
                    .addArgument(e.getReply())
                    .log("{}: {}");
            return Optional.empty();
        }
    }
}
