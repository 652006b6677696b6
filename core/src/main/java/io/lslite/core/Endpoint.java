package io.lslite.core;

import java.util.Objects;

/**
 * Network location of a neighbor's hello service (the "face" a probe goes out on).
 */
public record Endpoint(String host, int port) {
    public Endpoint {
        Objects.requireNonNull(host, "host");
        if (host.isBlank()) throw new IllegalArgumentException("host must not be blank");
        if (port <= 0 || port > 65535) throw new IllegalArgumentException("port out of range");
    }

    public String target() {
        return host + ":" + port;
    }
}
