package com.acme.polyrpc.gateway.admission;

import com.acme.polyrpc.gateway.pool.Asset;

import java.util.Objects;

/** A request together with the asset leased for it. */
public record WorkerTask(String poolId, Asset asset, Request request) {
    public WorkerTask {
        Objects.requireNonNull(poolId, "poolId");
        Objects.requireNonNull(asset, "asset");
        Objects.requireNonNull(request, "request");
    }
}
