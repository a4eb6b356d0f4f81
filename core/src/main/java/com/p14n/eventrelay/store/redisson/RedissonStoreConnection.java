package com.p14n.eventrelay.store.redisson;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

import org.redisson.client.RedisClient;
import org.redisson.client.RedisConnection;
import org.redisson.client.RedisConnectionException;
import org.redisson.client.RedisException;
import org.redisson.client.RedisTimeoutException;
import org.redisson.client.WriteRedisConnectionException;
import org.redisson.client.codec.StringCodec;
import org.redisson.client.protocol.RedisCommands;
import org.redisson.client.protocol.RedisStrictCommand;
import org.redisson.client.protocol.convertor.BooleanReplayConvertor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.eventrelay.store.StoreConnection;
import com.p14n.eventrelay.store.StoreErrorException;
import com.p14n.eventrelay.store.StoreTransportException;

/**
 * {@link StoreConnection} on top of a single Redisson low-level
 * {@link RedisConnection}. Each command is sent synchronously; Redisson
 * failures are translated into the relay's two-tier error model.
 */
public class RedissonStoreConnection implements StoreConnection {

    private static final Logger logger = LoggerFactory.getLogger(RedissonStoreConnection.class);

    /**
     * {@code EXPIRE} with a seconds argument; {@link RedisCommands} only ships
     * the millisecond variant.
     */
    static final RedisStrictCommand<Boolean> EXPIRE = new RedisStrictCommand<>("EXPIRE",
            new BooleanReplayConvertor());

    private final RedisClient client;
    private final RedisConnection connection;

    public RedissonStoreConnection(RedisClient client, RedisConnection connection) {
        this.client = client;
        this.connection = connection;
    }

    @Override
    public long incr(String key) {
        Number reply = call("INCR", () -> connection.sync(StringCodec.INSTANCE, RedisCommands.INCR, key));
        return reply.longValue();
    }

    @Override
    public String set(String key, String value) {
        call("SET", () -> connection.sync(StringCodec.INSTANCE, RedisCommands.SET, key, value), false);
        return "OK";
    }

    @Override
    public boolean expire(String key, long seconds) {
        Boolean reply = call("EXPIRE", () -> connection.sync(StringCodec.INSTANCE, EXPIRE, key, seconds));
        return reply;
    }

    @Override
    public long lpush(String key, String value) {
        Number reply = call("LPUSH", () -> connection.sync(StringCodec.INSTANCE, RedisCommands.LPUSH, key, value));
        return reply.longValue();
    }

    @Override
    public Map<String, String> hgetall(String key) {
        Map<Object, Object> reply = call("HGETALL",
                () -> connection.sync(StringCodec.INSTANCE, RedisCommands.HGETALL, key));
        Map<String, String> result = new LinkedHashMap<>();
        reply.forEach((field, value) -> result.put(String.valueOf(field), String.valueOf(value)));
        return Collections.unmodifiableMap(result);
    }

    @Override
    public String auth(String password) {
        call("AUTH", () -> connection.sync(StringCodec.INSTANCE, RedisCommands.AUTH, password), false);
        return "OK";
    }

    @Override
    public boolean isOpen() {
        return connection.isOpen();
    }

    @Override
    public void close() {
        try {
            connection.closeAsync();
        } catch (RuntimeException e) {
            logger.atDebug().setCause(e).log("Error closing redis connection");
        } finally {
            client.shutdown();
        }
    }

    private <T> T call(String command, Supplier<T> action) {
        return call(command, action, true);
    }

    private <T> T call(String command, Supplier<T> action, boolean replyRequired) {
        T reply;
        try {
            reply = action.get();
        } catch (RedisException e) {
            if (isTransportFailure(e)) {
                throw new StoreTransportException(command, e);
            }
            throw new StoreErrorException(command, e.getMessage());
        } catch (RuntimeException e) {
            throw new StoreTransportException(command, e);
        }
        if (reply == null && replyRequired) {
            throw new StoreTransportException(command, "no reply");
        }
        return reply;
    }

    private boolean isTransportFailure(RedisException e) {
        return e instanceof RedisConnectionException
                || e instanceof RedisTimeoutException
                || e instanceof WriteRedisConnectionException
                || !connection.isOpen();
    }
}
