package com.acme.polyrpc.gateway.routing;

import java.util.List;
import java.util.Objects;

/**
 * One pool descriptor: pool id, the modules it serves and its worker endpoints
 * ({@code host:port}).
 */
public record PoolConfig(String poolId, List<String> modules, List<String> workers) {
    public PoolConfig {
        Objects.requireNonNull(poolId, "poolId");
        modules = List.copyOf(modules == null ? List.of() : modules);
        workers = List.copyOf(workers == null ? List.of() : workers);
    }

    public PoolConfig(String poolId, List<String> modules) {
        this(poolId, modules, List.of());
    }
}
