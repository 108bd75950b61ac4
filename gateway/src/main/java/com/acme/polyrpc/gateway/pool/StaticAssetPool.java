package com.acme.polyrpc.gateway.pool;

import com.acme.polyrpc.gateway.routing.PoolConfig;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Pool manager backed by the configured worker endpoints: one asset per endpoint.
 *
 * <p>{@link #reload()} re-reads the descriptors from the source. Leased assets that
 * survive the reload go back to the idle set when returned; assets that no longer
 * exist are dropped on return.
 */
public final class StaticAssetPool implements AssetPool {
    private static final Logger LOG = Logger.getLogger(StaticAssetPool.class.getName());

    private final Supplier<List<PoolConfig>> configSource;
    private final Map<String, ArrayDeque<Asset>> idleByPool = new HashMap<>();
    private final Map<String, Map<String, Asset>> configuredByPool = new HashMap<>();
    private final Set<String> leased = new HashSet<>();

    public StaticAssetPool(Supplier<List<PoolConfig>> configSource) {
        this.configSource = Objects.requireNonNull(configSource, "configSource");
        install(configSource.get());
    }

    public static StaticAssetPool of(List<PoolConfig> configs) {
        List<PoolConfig> snapshot = List.copyOf(configs);
        return new StaticAssetPool(() -> snapshot);
    }

    @Override
    public synchronized LeaseResult lease(String poolId) {
        ArrayDeque<Asset> idle = idleByPool.get(poolId);
        if (idle == null) {
            throw new UnknownPoolException(poolId);
        }
        Asset asset = idle.pollFirst();
        if (asset == null) {
            return LeaseResult.EMPTY;
        }
        leased.add(asset.id());
        return new LeaseResult.Leased(asset);
    }

    @Override
    public synchronized void returnAsset(String poolId, Asset asset) {
        Objects.requireNonNull(asset, "asset");
        if (!leased.remove(asset.id())) {
            LOG.warning("Returned asset " + asset.id() + " of pool " + poolId + " was not leased");
            return;
        }
        Map<String, Asset> configured = configuredByPool.get(poolId);
        Asset current = configured == null ? null : configured.get(asset.id());
        if (current == null) {
            LOG.fine(() -> "Dropping retired asset " + asset.id() + " of pool " + poolId);
            return;
        }
        // a reload may have moved the endpoint behind this id
        idleByPool.get(poolId).addLast(current);
    }

    @Override
    public synchronized int idleCount() {
        int total = 0;
        for (ArrayDeque<Asset> idle : idleByPool.values()) {
            total += idle.size();
        }
        return total;
    }

    @Override
    public synchronized void reload() {
        install(configSource.get());
        LOG.info(() -> "Asset pools reloaded: pools=" + idleByPool.size() + " idle=" + idleCount()
            + " leased=" + leased.size());
    }

    public synchronized int leasedCount() {
        return leased.size();
    }

    /** Builds the new pool state aside and swaps it in only once every descriptor parsed. */
    private void install(List<PoolConfig> configs) {
        Map<String, ArrayDeque<Asset>> newIdle = new HashMap<>();
        Map<String, Map<String, Asset>> newConfigured = new HashMap<>();
        for (PoolConfig config : configs) {
            if (newIdle.containsKey(config.poolId())) {
                LOG.warning("Duplicate pool id " + config.poolId() + ", keeping the first descriptor");
                continue;
            }
            ArrayDeque<Asset> idle = new ArrayDeque<>();
            Map<String, Asset> configured = new LinkedHashMap<>();
            List<String> workers = config.workers();
            for (int i = 0; i < workers.size(); i++) {
                Asset asset = Asset.fromEndpoint(config.poolId() + "#" + i, workers.get(i));
                configured.put(asset.id(), asset);
                if (!leased.contains(asset.id())) {
                    idle.addLast(asset);
                }
            }
            newIdle.put(config.poolId(), idle);
            newConfigured.put(config.poolId(), configured);
        }
        idleByPool.clear();
        idleByPool.putAll(newIdle);
        configuredByPool.clear();
        configuredByPool.putAll(newConfigured);
    }
}
