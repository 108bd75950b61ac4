package com.acme.polyrpc.gateway.pool;

import java.util.Objects;

/**
 * Handle to one out-of-process worker. Exactly one in-flight request may hold it.
 */
public record Asset(String id, String host, int port) {
    public Asset {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(host, "host");
        if (port < 1 || port > 65_535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
    }

    /** Parses a {@code host:port} worker endpoint. */
    public static Asset fromEndpoint(String id, String endpoint) {
        Objects.requireNonNull(endpoint, "endpoint");
        int sep = endpoint.lastIndexOf(':');
        if (sep <= 0 || sep == endpoint.length() - 1) {
            throw new IllegalArgumentException("worker endpoint must be host:port, got '" + endpoint + "'");
        }
        try {
            return new Asset(id, endpoint.substring(0, sep), Integer.parseInt(endpoint.substring(sep + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("worker endpoint must be host:port, got '" + endpoint + "'", e);
        }
    }
}
