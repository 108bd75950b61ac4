package com.acme.polyrpc.gateway.worker;

import com.acme.polyrpc.gateway.admission.Request;
import com.acme.polyrpc.gateway.admission.WorkerLauncher;
import com.acme.polyrpc.gateway.admission.WorkerTask;
import com.acme.polyrpc.gateway.pool.AssetPool;
import com.acme.polyrpc.gateway.protocol.InboundMessage;
import com.acme.polyrpc.gateway.telemetry.GatewayMetrics;
import com.acme.polyrpc.gateway.telemetry.NoopGatewayMetrics;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs each leased request on its own thread, outside the admission thread.
 *
 * <p>Whatever the outcome, the task ends by returning the asset to its pool,
 * signalling asset-freed and closing the client connection, in that order and
 * exactly once. A failure in one of those steps does not skip the others.</p>
 */
public final class WorkerTaskExecutor implements WorkerLauncher, AutoCloseable {
    private static final Logger LOG = Logger.getLogger(WorkerTaskExecutor.class.getName());

    private final AssetPool assetPool;
    private final WorkerTransport transport;
    private final GatewayMetrics metrics;
    private final ExecutorService executor;

    public WorkerTaskExecutor(AssetPool assetPool, WorkerTransport transport, GatewayMetrics metrics) {
        this(assetPool, transport, metrics, newTaskPool());
    }

    public WorkerTaskExecutor(AssetPool assetPool,
                              WorkerTransport transport,
                              GatewayMetrics metrics,
                              ExecutorService executor) {
        this.assetPool = Objects.requireNonNull(assetPool, "assetPool");
        this.transport = Objects.requireNonNull(transport, "transport");
        this.metrics = metrics == null ? NoopGatewayMetrics.INSTANCE : metrics;
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    @Override
    public void launch(WorkerTask task, Runnable assetFreed) {
        Objects.requireNonNull(task, "task");
        Objects.requireNonNull(assetFreed, "assetFreed");
        executor.execute(() -> run(task, assetFreed));
    }

    void run(WorkerTask task, Runnable assetFreed) {
        long startNanos = System.nanoTime();
        metrics.addInFlight(1);
        try {
            invoke(task);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            metrics.incWorkerFailures(1L);
            LOG.warning("Worker task interrupted for " + task.request());
        } catch (Throwable t) {
            metrics.incWorkerFailures(1L);
            LOG.log(Level.WARNING, "Worker task failed for " + task.request()
                + " on asset " + task.asset().id(), unwrap(t));
        } finally {
            metrics.addInFlight(-1);
            metrics.observeWorkerNanos(System.nanoTime() - startNanos);
            release(task, assetFreed);
        }
    }

    private void invoke(WorkerTask task) throws Exception {
        Request request = task.request();
        InboundMessage.Action action = request.action();
        LOG.fine(() -> (action instanceof InboundMessage.Cast ? "Casting " : "Calling ")
            + action.module() + ":" + action.function() + " on asset " + task.asset().id());

        byte[] response = transport.rpc(task.asset(), request.actionFrame()).get();

        if (action instanceof InboundMessage.Call) {
            request.connection().sendAndClose(response);
        } else {
            // the client already got {noreply}; completing the rpc is what frees the slot
            LOG.fine(() -> "Cast completed for " + request);
        }
    }

    private void release(WorkerTask task, Runnable assetFreed) {
        try {
            assetPool.returnAsset(task.poolId(), task.asset());
        } catch (Throwable t) {
            LOG.log(Level.WARNING, "Failed to return asset " + task.asset().id() + " to pool " + task.poolId(), t);
        }
        try {
            assetFreed.run();
        } catch (Throwable t) {
            LOG.log(Level.WARNING, "Asset-freed signal failed for " + task.request(), t);
        }
        try {
            task.request().connection().close();
        } catch (Throwable t) {
            LOG.log(Level.FINE, "Closing connection failed for " + task.request(), t);
        }
    }

    private static Throwable unwrap(Throwable t) {
        return t instanceof ExecutionException && t.getCause() != null ? t.getCause() : t;
    }

    private static ExecutorService newTaskPool() {
        AtomicInteger seq = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "worker-task-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public void stop(Duration timeout) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(Math.max(1L, timeout.toMillis()), TimeUnit.MILLISECONDS)) {
                LOG.warning("Worker tasks still running after " + timeout.toMillis() + "ms");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop(Duration.ofSeconds(5));
    }
}
