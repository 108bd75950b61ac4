package com.acme.polyrpc.gateway.admission;

import com.acme.polyrpc.gateway.pool.Asset;
import com.acme.polyrpc.gateway.pool.AssetPool;
import com.acme.polyrpc.gateway.pool.LeaseResult;
import com.acme.polyrpc.gateway.routing.Route;
import com.acme.polyrpc.gateway.routing.RoutingTable;
import com.acme.polyrpc.gateway.telemetry.GatewayMetrics;
import com.acme.polyrpc.gateway.telemetry.NoopGatewayMetrics;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Lease-or-queue admission actor.
 *
 * <p>A single thread drains the mailbox and is the only reader and writer of
 * {@link ServerState}. New requests go straight to a lease attempt only when the
 * shared pending queue is empty; otherwise they join its tail. Every asset-freed
 * signal pops the queue head and retries it, whatever pool freed the slot. A head
 * whose pool is still saturated goes back to the tail.</p>
 */
public final class AdmissionController implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(AdmissionController.class.getName());

    private final ServerState state;
    private final AssetPool assetPool;
    private final WorkerLauncher launcher;
    private final NativeRequestHandler nativeHandler;
    private final GatewayMetrics metrics;
    private final Runnable assetFreedSignal = this::assetFreed;

    private final LinkedBlockingQueue<AdmissionEvent> mailbox = new LinkedBlockingQueue<>();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile Thread actorThread;

    public AdmissionController(RoutingTable routingTable,
                               AssetPool assetPool,
                               WorkerLauncher launcher) {
        this(routingTable, assetPool, launcher, NativeRequestHandler.NOOP, NoopGatewayMetrics.INSTANCE);
    }

    public AdmissionController(RoutingTable routingTable,
                               AssetPool assetPool,
                               WorkerLauncher launcher,
                               NativeRequestHandler nativeHandler,
                               GatewayMetrics metrics) {
        this.state = new ServerState(routingTable);
        this.assetPool = Objects.requireNonNull(assetPool, "assetPool");
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        this.nativeHandler = Objects.requireNonNull(nativeHandler, "nativeHandler");
        this.metrics = metrics == null ? NoopGatewayMetrics.INSTANCE : metrics;
    }

    public void start() {
        if (closed.get() || !running.compareAndSet(false, true)) {
            return;
        }
        Thread t = new Thread(this::eventLoop, "admission-controller");
        t.setDaemon(true);
        actorThread = t;
        t.start();
        LOG.info("Admission controller started");
    }

    /** Hands a decoded, not yet routed request to the admission thread. */
    public void submit(Request request) {
        post(new AdmissionEvent.NewRequest(request));
    }

    /** Signals that some worker slot, in any pool, has been released. */
    public void assetFreed() {
        post(AdmissionEvent.ASSET_FREED);
    }

    /** Reads counters through the admission thread so they are consistent with each other. */
    public CompletableFuture<AdmissionSnapshot> stats() {
        CompletableFuture<AdmissionSnapshot> reply = new CompletableFuture<>();
        post(new AdmissionEvent.StatsQuery(reply));
        return reply;
    }

    public void post(AdmissionEvent event) {
        Objects.requireNonNull(event, "event");
        if (closed.get()) {
            reject(event);
            return;
        }
        mailbox.offer(event);
        if (closed.get()) {
            // lost the race with stop(): its drain may already have run
            rejectMailbox();
        }
    }

    private void eventLoop() {
        while (running.get()) {
            AdmissionEvent event;
            try {
                event = mailbox.take();
            } catch (InterruptedException e) {
                if (!running.get()) {
                    break;
                }
                continue;
            }
            try {
                handle(event);
            } catch (Throwable t) {
                LOG.log(Level.SEVERE, "Admission event failed: " + event, t);
            }
        }
        closePending();
    }

    /**
     * Processes one event. Only ever called from the admission thread, or directly
     * by tests that never start it.
     */
    void handle(AdmissionEvent event) {
        if (event instanceof AdmissionEvent.NewRequest newRequest) {
            onNewRequest(newRequest.request());
        } else if (event instanceof AdmissionEvent.AssetFreed) {
            onAssetFreed();
        } else if (event instanceof AdmissionEvent.StatsQuery query) {
            query.reply().complete(new AdmissionSnapshot(state.totalDispatched(), state.pendingDepth()));
        } else {
            LOG.warning("Unexpected admission event ignored: " + event);
        }
        metrics.setPendingDepth(state.pendingDepth());
    }

    private void onNewRequest(Request request) {
        Route route = state.routingTable().lookup(request.module());
        if (!(route instanceof Route.Extern extern)) {
            LOG.fine(() -> "Dispatching to native handler: " + request);
            handleNative(request);
            return;
        }
        LOG.fine(() -> "Found pool " + extern.poolId() + " for " + request);
        if (state.hasPending()) {
            // a new arrival never overtakes requests already waiting, even for another pool
            enqueue(request, extern.poolId());
            return;
        }
        tryLease(extern.poolId(), request);
    }

    private void onAssetFreed() {
        Request head;
        while ((head = state.pollHead()) != null) {
            // only extern-routed requests are ever queued
            Route.Extern extern = (Route.Extern) state.routingTable().lookup(head.module());
            if (tryLease(extern.poolId(), head)) {
                return;
            }
        }
    }

    /**
     * Leases for {@code request} and launches it, or queues it when the pool is saturated.
     *
     * @return {@code false} when the request was dropped and the freed slot is still unclaimed
     */
    private boolean tryLease(String poolId, Request request) {
        LeaseResult lease;
        try {
            lease = assetPool.lease(poolId);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Lease from pool " + poolId + " failed, dropping " + request, e);
            request.connection().close();
            return false;
        }
        if (!(lease instanceof LeaseResult.Leased leased)) {
            enqueue(request, poolId);
            return true;
        }

        long total = state.recordDispatch();
        metrics.incDispatched(1L);
        Asset asset = leased.asset();
        LOG.fine(() -> "Leased asset " + asset.id() + " from pool " + poolId + " for " + request + " total=" + total);
        try {
            launcher.launch(new WorkerTask(poolId, asset, request), assetFreedSignal);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Worker launch failed for " + request, e);
            metrics.incWorkerFailures(1L);
            try {
                assetPool.returnAsset(poolId, asset);
            } catch (RuntimeException returnError) {
                LOG.log(Level.WARNING, "Failed to return asset " + asset.id() + " to pool " + poolId, returnError);
            }
            request.connection().close();
            assetFreed();
        }
        return true;
    }

    private void enqueue(Request request, String poolId) {
        state.enqueue(request);
        metrics.incQueued(1L);
        LOG.fine(() -> "Queued " + request + " for pool " + poolId + " depth=" + state.pendingDepth());
    }

    private void handleNative(Request request) {
        try {
            nativeHandler.handle(request);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Native handler failed for " + request, e);
            request.connection().close();
        }
    }

    private static void reject(AdmissionEvent event) {
        if (event instanceof AdmissionEvent.NewRequest newRequest) {
            LOG.fine(() -> "Admission closed, dropping " + newRequest.request());
            newRequest.request().connection().close();
        } else if (event instanceof AdmissionEvent.StatsQuery query) {
            query.reply().completeExceptionally(new IllegalStateException("admission controller closed"));
        }
    }

    public void stop(Duration timeout) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        running.set(false);
        Thread t = actorThread;
        if (t != null) {
            t.interrupt();
            try {
                t.join(Math.max(1L, timeout.toMillis()));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        rejectMailbox();
        if (t == null) {
            closePending();
        } else if (t.isAlive()) {
            LOG.warning("Admission thread still busy after " + timeout.toMillis()
                + "ms; it closes pending connections when it exits");
        }
    }

    private void rejectMailbox() {
        AdmissionEvent leftover;
        while ((leftover = mailbox.poll()) != null) {
            reject(leftover);
        }
    }

    /** Runs on the admission thread as it exits, or on the stopping thread when it never started. */
    private void closePending() {
        int dropped = 0;
        Request queued;
        while ((queued = state.pollHead()) != null) {
            queued.connection().close();
            dropped++;
        }
        metrics.setPendingDepth(0);
        int droppedTotal = dropped;
        LOG.info(() -> "Admission controller stopped, closed " + droppedTotal + " pending connections");
    }

    @Override
    public void close() {
        stop(Duration.ofSeconds(5));
    }
}
