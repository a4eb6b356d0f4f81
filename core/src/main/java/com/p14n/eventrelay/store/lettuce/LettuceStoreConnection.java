package com.p14n.eventrelay.store.lettuce;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.eventrelay.store.StoreConnection;
import com.p14n.eventrelay.store.StoreErrorException;
import com.p14n.eventrelay.store.StoreTransportException;

import io.lettuce.core.RedisClient;
import io.lettuce.core.RedisCommandExecutionException;
import io.lettuce.core.api.StatefulRedisConnection;
import io.lettuce.core.api.sync.RedisCommands;

/**
 * {@link StoreConnection} on top of one Lettuce connection, using its
 * synchronous API. Error replies become {@link StoreErrorException}; every
 * other Lettuce failure (timeouts, closed or refused connections) is a
 * transport failure.
 */
public class LettuceStoreConnection implements StoreConnection {

    private static final Logger logger = LoggerFactory.getLogger(LettuceStoreConnection.class);

    private final RedisClient client;
    private final StatefulRedisConnection<String, String> connection;
    private final RedisCommands<String, String> commands;

    public LettuceStoreConnection(RedisClient client, StatefulRedisConnection<String, String> connection) {
        this.client = client;
        this.connection = connection;
        this.commands = connection.sync();
    }

    @Override
    public long incr(String key) {
        return call("INCR", () -> commands.incr(key));
    }

    @Override
    public String set(String key, String value) {
        return call("SET", () -> commands.set(key, value));
    }

    @Override
    public boolean expire(String key, long seconds) {
        return call("EXPIRE", () -> commands.expire(key, seconds));
    }

    @Override
    public long lpush(String key, String value) {
        return call("LPUSH", () -> commands.lpush(key, value));
    }

    @Override
    public Map<String, String> hgetall(String key) {
        Map<String, String> reply = call("HGETALL", () -> commands.hgetall(key));
        return Collections.unmodifiableMap(new LinkedHashMap<>(reply));
    }

    @Override
    public String auth(String password) {
        return call("AUTH", () -> commands.auth(password));
    }

    @Override
    public boolean isOpen() {
        return connection.isOpen();
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (RuntimeException e) {
            logger.atDebug().setCause(e).log("Error closing redis connection");
        } finally {
            client.shutdown(0, 2, TimeUnit.SECONDS);
        }
    }

    private <T> T call(String command, Supplier<T> action) {
        T reply;
        try {
            reply = action.get();
        } catch (RedisCommandExecutionException e) {
            throw new StoreErrorException(command, e.getMessage());
        } catch (RuntimeException e) {
            throw new StoreTransportException(command, e);
        }
        if (reply == null) {
            throw new StoreTransportException(command, "no reply");
        }
        return reply;
    }
}
