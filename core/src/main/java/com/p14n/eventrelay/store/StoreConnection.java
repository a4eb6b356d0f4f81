package com.p14n.eventrelay.store;

import java.util.Map;

/**
 * Command surface of one open store connection.
 *
 * <p>
 * Every command either returns the decoded reply, throws
 * {@link StoreErrorException} when the store answered with an error, or throws
 * {@link StoreTransportException} when no reply could be obtained. A
 * connection is not thread-safe and is used by one thread at a time.
 * </p>
 */
public interface StoreConnection extends AutoCloseable {

    /**
     * {@code INCR key}.
     *
     * @param key the counter key
     * @return the value after the increment
     */
    long incr(String key);

    /**
     * {@code SET key value}.
     *
     * @param key   the key
     * @param value the value
     * @return the status reply
     */
    String set(String key, String value);

    /**
     * {@code EXPIRE key seconds}.
     *
     * @param key     the key
     * @param seconds time to live
     * @return true if the timeout was set
     */
    boolean expire(String key, long seconds);

    /**
     * {@code LPUSH key value}.
     *
     * @param key   the list key
     * @param value the element to prepend
     * @return the list length after the push
     */
    long lpush(String key, String value);

    /**
     * {@code HGETALL key}.
     *
     * @param key the hash key
     * @return field to value pairs in reply order, empty when the key is absent
     */
    Map<String, String> hgetall(String key);

    /**
     * {@code AUTH password}.
     *
     * @param password the password
     * @return the status reply
     */
    String auth(String password);

    /**
     * @return false once the connection was closed, locally or by the peer
     */
    boolean isOpen();

    /**
     * Releases the connection. Never throws.
     */
    @Override
    void close();
}
