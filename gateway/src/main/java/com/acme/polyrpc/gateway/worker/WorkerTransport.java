package com.acme.polyrpc.gateway.worker;

import com.acme.polyrpc.gateway.pool.Asset;

import java.util.concurrent.CompletableFuture;

/**
 * Out-of-process RPC to one worker.
 *
 * <p>Implementations must eventually complete every returned future, normally or
 * exceptionally: the leased asset is held until they do.
 */
public interface WorkerTransport extends AutoCloseable {
    /**
     * Sends the encoded action term to the worker behind {@code asset}.
     *
     * @return the worker's encoded response, forwarded to call clients as-is
     */
    CompletableFuture<byte[]> rpc(Asset asset, byte[] actionFrame);

    @Override
    default void close() {
    }
}
