package com.acme.polyrpc.gateway.routing;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Immutable module name to pool id mapping. When two descriptors claim the same
 * module the one registered first keeps it.
 */
public final class RoutingTable {
    private static final Logger LOG = Logger.getLogger(RoutingTable.class.getName());

    private final Map<String, String> poolByModule;

    private RoutingTable(Map<String, String> poolByModule) {
        this.poolByModule = Collections.unmodifiableMap(poolByModule);
    }

    public static RoutingTable fromConfigs(List<PoolConfig> configs) {
        Map<String, String> mapping = new LinkedHashMap<>();
        for (PoolConfig config : configs) {
            for (String module : config.modules()) {
                String existing = mapping.putIfAbsent(module, config.poolId());
                if (existing != null && !existing.equals(config.poolId())) {
                    LOG.fine(() -> "Module " + module + " already served by pool " + existing
                        + ", ignoring claim from pool " + config.poolId());
                }
            }
        }
        LOG.info(() -> "Routing table built: " + mapping);
        return new RoutingTable(mapping);
    }

    public Route lookup(String module) {
        String poolId = poolByModule.get(module);
        return poolId == null ? Route.NATIVE : new Route.Extern(poolId);
    }

    public int size() {
        return poolByModule.size();
    }
}
