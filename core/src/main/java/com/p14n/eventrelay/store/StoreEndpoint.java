package com.p14n.eventrelay.store;

/**
 * Transport the relay connects to the store with. A non-empty path selects
 * the unix-domain transport and takes precedence over host and port.
 *
 * @param path Unix-domain socket path, empty for TCP
 * @param host TCP host
 * @param port TCP port
 */
public record StoreEndpoint(String path, String host, int port) {

    public StoreEndpoint {
        path = path == null ? "" : path;
    }

    public static StoreEndpoint of(String path, String host, int port) {
        return new StoreEndpoint(path, host, port);
    }

    public static StoreEndpoint tcp(String host, int port) {
        return new StoreEndpoint("", host, port);
    }

    public static StoreEndpoint unix(String path) {
        return new StoreEndpoint(path, null, 0);
    }

    public boolean isUnix() {
        return !path.isEmpty();
    }

    @Override
    public String toString() {
        return isUnix() ? "unix:" + path : host + ":" + port;
    }
}
