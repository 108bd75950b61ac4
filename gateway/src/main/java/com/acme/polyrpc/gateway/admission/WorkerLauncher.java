package com.acme.polyrpc.gateway.admission;

/**
 * Starts a leased task off the admission thread.
 */
public interface WorkerLauncher {
    /**
     * Runs {@code task} asynchronously and must not block. Once accepted, the launcher
     * owns the asset: it returns it, closes the connection and calls
     * {@code assetFreed} exactly once.
     *
     * @throws java.util.concurrent.RejectedExecutionException if the task was not accepted;
     *         ownership then stays with the caller
     */
    void launch(WorkerTask task, Runnable assetFreed);
}
