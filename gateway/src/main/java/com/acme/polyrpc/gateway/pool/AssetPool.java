package com.acme.polyrpc.gateway.pool;

/**
 * Worker pool manager as seen by the admission core.
 *
 * <p>Implementations must be thread-safe: leases happen on the admission thread,
 * returns on worker task threads, and {@link #idleCount()} / {@link #reload()} on
 * connection threads.
 */
public interface AssetPool {
    /**
     * Takes one idle asset of {@code poolId}.
     *
     * @return {@link LeaseResult.Leased} or {@link LeaseResult#EMPTY} when nothing is idle
     * @throws UnknownPoolException if the pool id is not configured
     */
    LeaseResult lease(String poolId);

    /** Gives a leased asset back. Must be called exactly once per successful lease. */
    void returnAsset(String poolId, Asset asset);

    /** Idle assets across all pools. */
    int idleCount();

    /** Re-reads pool configuration. Assets currently leased stay valid until returned. */
    void reload();
}
