package com.p14n.eventrelay.data;

/**
 * Naming of every key the relay reads or writes in the store.
 *
 * <p>
 * With the default prefix the layout is:
 * </p>
 * <ul>
 * <li>{@code icinga:event.idx} - global sequence counter</li>
 * <li>{@code icinga:event.<index>} - encoded event body</li>
 * <li>{@code icinga:event:<subscriber>} - list of indices for a subscriber</li>
 * <li>{@code icinga:subscription} - hash of subscriber descriptors</li>
 * </ul>
 *
 * @param prefix Prefix prepended to every key, may be empty
 */
public record KeySchema(String prefix) {

    public static final String DEFAULT_PREFIX = "icinga:";

    public KeySchema {
        prefix = prefix == null ? "" : prefix;
    }

    public static KeySchema defaults() {
        return new KeySchema(DEFAULT_PREFIX);
    }

    public String sequenceKey() {
        return prefix + "event.idx";
    }

    public String eventKey(long index) {
        return prefix + "event." + index;
    }

    public String subscriberListKey(String subscriberId) {
        return prefix + "event:" + subscriberId;
    }

    public String registryKey() {
        return prefix + "subscription";
    }
}
