package com.acme.polyrpc.gateway.admission;

import com.acme.polyrpc.gateway.pool.AssetPool;
import com.acme.polyrpc.gateway.pool.StaticAssetPool;
import com.acme.polyrpc.gateway.protocol.InboundMessage;
import com.acme.polyrpc.gateway.routing.PoolConfig;
import com.acme.polyrpc.gateway.routing.RoutingTable;
import com.acme.polyrpc.gateway.telemetry.AtomicGatewayMetrics;
import com.acme.polyrpc.gateway.term.Term;
import com.acme.polyrpc.gateway.transport.api.RecordingClientConnection;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AdmissionControllerTest {
    private static final AtomicLong REQUEST_IDS = new AtomicLong();

    @Test
    void shouldDispatchQueuedRequestWhenAssetIsFreed() throws Exception {
        StaticAssetPool pool = StaticAssetPool.of(List.of(
            new PoolConfig("A", List.of("m"), List.of("127.0.0.1:9101"))
        ));
        RecordingLauncher launcher = new RecordingLauncher();
        AdmissionController controller = new AdmissionController(routes(), pool, launcher);

        Request r1 = call("m");
        Request r2 = call("m");
        controller.handle(new AdmissionEvent.NewRequest(r1));
        controller.handle(new AdmissionEvent.NewRequest(r2));

        assertEquals(List.of(r1), launcher.requests());
        assertEquals(new AdmissionSnapshot(1, 1), snapshot(controller));

        launcher.finish(0, pool, controller);

        assertEquals(List.of(r1, r2), launcher.requests());
        assertEquals(new AdmissionSnapshot(2, 0), snapshot(controller));
    }

    @Test
    void shouldServeSaturatedPoolInArrivalOrder() throws Exception {
        StaticAssetPool pool = StaticAssetPool.of(List.of(
            new PoolConfig("A", List.of("m"), List.of("127.0.0.1:9101"))
        ));
        RecordingLauncher launcher = new RecordingLauncher();
        AdmissionController controller = new AdmissionController(routes(), pool, launcher);

        Request r1 = call("m");
        Request r2 = call("m");
        Request r3 = call("m");
        controller.handle(new AdmissionEvent.NewRequest(r1));
        controller.handle(new AdmissionEvent.NewRequest(r2));
        controller.handle(new AdmissionEvent.NewRequest(r3));
        launcher.finish(0, pool, controller);
        launcher.finish(1, pool, controller);

        assertEquals(List.of(r1, r2, r3), launcher.requests());
        assertEquals(3L, snapshot(controller).totalDispatched());
    }

    @Test
    void shouldQueueBehindOtherPoolsWhenAnythingIsPending() throws Exception {
        StaticAssetPool pool = StaticAssetPool.of(List.of(
            new PoolConfig("A", List.of("a"), List.of("127.0.0.1:9101")),
            new PoolConfig("B", List.of("b"), List.of("127.0.0.1:9201"))
        ));
        RecordingLauncher launcher = new RecordingLauncher();
        AdmissionController controller = new AdmissionController(routes(), pool, launcher);

        Request r1 = call("a");
        Request r2 = call("a");
        Request r3 = call("b");
        controller.handle(new AdmissionEvent.NewRequest(r1));
        controller.handle(new AdmissionEvent.NewRequest(r2));
        controller.handle(new AdmissionEvent.NewRequest(r3));

        // B has a free asset but r3 still waits behind r2
        assertEquals(List.of(r1), launcher.requests());
        assertEquals(2, snapshot(controller).pendingDepth());

        launcher.finish(0, pool, controller);
        assertEquals(List.of(r1, r2), launcher.requests());

        controller.handle(AdmissionEvent.ASSET_FREED);
        assertEquals(List.of(r1, r2, r3), launcher.requests());
        assertEquals("B", launcher.tasks().get(2).poolId());
    }

    @Test
    void shouldRequeueHeadAtTailWhenItsPoolIsStillSaturated() throws Exception {
        StaticAssetPool pool = StaticAssetPool.of(List.of(
            new PoolConfig("A", List.of("a"), List.of("127.0.0.1:9101")),
            new PoolConfig("B", List.of("b"))
        ));
        RecordingLauncher launcher = new RecordingLauncher();
        AdmissionController controller = new AdmissionController(routes(), pool, launcher);

        Request r1 = call("a");
        Request r2 = call("b");
        Request r3 = call("a");
        controller.handle(new AdmissionEvent.NewRequest(r1));
        controller.handle(new AdmissionEvent.NewRequest(r2));
        controller.handle(new AdmissionEvent.NewRequest(r3));

        launcher.finish(0, pool, controller);
        // r2 was retried first and went back to the tail; r3 waits for the next signal
        assertEquals(List.of(r1), launcher.requests());
        assertEquals(2, snapshot(controller).pendingDepth());

        controller.handle(AdmissionEvent.ASSET_FREED);
        assertEquals(List.of(r1, r3), launcher.requests());
        assertEquals(1, snapshot(controller).pendingDepth());
    }

    @Test
    void shouldKeepDrainingWhenQueuedRequestLosesItsPool() throws Exception {
        AtomicReference<List<PoolConfig>> source = new AtomicReference<>(List.of(
            new PoolConfig("A", List.of("a"), List.of("127.0.0.1:9101")),
            new PoolConfig("B", List.of("b"), List.of("127.0.0.1:9201"))
        ));
        StaticAssetPool pool = new StaticAssetPool(source::get);
        RecordingLauncher launcher = new RecordingLauncher();
        AdmissionController controller = new AdmissionController(routes(), pool, launcher);

        Request a1 = call("a");
        Request a2 = call("a");
        Request b1 = call("b");
        controller.handle(new AdmissionEvent.NewRequest(a1));
        controller.handle(new AdmissionEvent.NewRequest(a2));
        controller.handle(new AdmissionEvent.NewRequest(b1));

        source.set(List.of(new PoolConfig("B", List.of("b"), List.of("127.0.0.1:9201"))));
        pool.reload();
        launcher.finish(0, pool, controller);

        // a2 can no longer lease and is dropped; b1 still gets the idle B asset
        assertFalse(a2.connection().isOpen());
        assertEquals(List.of(a1, b1), launcher.requests());
        assertEquals(new AdmissionSnapshot(2, 0), snapshot(controller));

        Request b2 = call("b");
        controller.handle(new AdmissionEvent.NewRequest(b2));
        assertEquals(1, snapshot(controller).pendingDepth());
        launcher.finish(1, pool, controller);
        assertEquals(List.of(a1, b1, b2), launcher.requests());
    }

    @Test
    void shouldNeverQueueUnroutedRequests() throws Exception {
        StaticAssetPool pool = StaticAssetPool.of(List.of(new PoolConfig("A", List.of("a"))));
        RecordingLauncher launcher = new RecordingLauncher();
        List<Request> nativeRequests = new ArrayList<>();
        AdmissionController controller = new AdmissionController(
            routes(), pool, launcher, nativeRequests::add, new AtomicGatewayMetrics());

        Request queued = call("a");
        Request unrouted = call("unknown");
        controller.handle(new AdmissionEvent.NewRequest(queued));
        controller.handle(new AdmissionEvent.NewRequest(unrouted));

        assertEquals(List.of(unrouted), nativeRequests);
        assertEquals(new AdmissionSnapshot(0, 1), snapshot(controller));
        assertTrue(unrouted.connection().isOpen());
        assertTrue(launcher.requests().isEmpty());
    }

    @Test
    void shouldIgnoreAssetFreedWithNothingPending() throws Exception {
        StaticAssetPool pool = StaticAssetPool.of(List.of(new PoolConfig("A", List.of("a"))));
        AdmissionController controller = new AdmissionController(routes(), pool, new RecordingLauncher());

        controller.handle(AdmissionEvent.ASSET_FREED);

        assertEquals(new AdmissionSnapshot(0, 0), snapshot(controller));
    }

    @Test
    void shouldIgnoreUnexpectedEvents() throws Exception {
        StaticAssetPool pool = StaticAssetPool.of(List.of(
            new PoolConfig("A", List.of("a"), List.of("127.0.0.1:9101"))
        ));
        RecordingLauncher launcher = new RecordingLauncher();
        AdmissionController controller = new AdmissionController(routes(), pool, launcher);
        controller.handle(new AdmissionEvent.NewRequest(call("a")));

        controller.handle(new AdmissionEvent() {});

        assertEquals(new AdmissionSnapshot(1, 0), snapshot(controller));
        assertEquals(1, launcher.requests().size());
    }

    @Test
    void shouldReturnAssetAndCloseConnectionWhenLaunchIsRejected() throws Exception {
        StaticAssetPool pool = StaticAssetPool.of(List.of(
            new PoolConfig("A", List.of("a"), List.of("127.0.0.1:9101"))
        ));
        AtomicGatewayMetrics metrics = new AtomicGatewayMetrics();
        WorkerLauncher rejecting = (task, assetFreed) -> {
            throw new RejectedExecutionException("executor shut down");
        };
        AdmissionController controller = new AdmissionController(
            routes(), pool, rejecting, NativeRequestHandler.NOOP, metrics);

        Request request = call("a");
        controller.handle(new AdmissionEvent.NewRequest(request));

        assertFalse(request.connection().isOpen());
        assertEquals(1, pool.idleCount());
        assertEquals(0, pool.leasedCount());
        assertEquals(1L, metrics.snapshot().workerFailures());
    }

    @Test
    void shouldDropRequestWhenLeaseFails() throws Exception {
        StaticAssetPool pool = StaticAssetPool.of(List.of());
        RoutingTable routes = RoutingTable.fromConfigs(List.of(new PoolConfig("ghost", List.of("a"))));
        RecordingLauncher launcher = new RecordingLauncher();
        AdmissionController controller = new AdmissionController(routes, pool, launcher);

        Request request = call("a");
        controller.handle(new AdmissionEvent.NewRequest(request));

        assertFalse(request.connection().isOpen());
        assertEquals(new AdmissionSnapshot(0, 0), snapshot(controller));
    }

    @Test
    void shouldProcessEventsOnItsOwnThread() throws Exception {
        StaticAssetPool pool = StaticAssetPool.of(List.of(
            new PoolConfig("A", List.of("m"), List.of("127.0.0.1:9101"))
        ));
        RecordingLauncher launcher = new RecordingLauncher();
        AdmissionController controller = new AdmissionController(routes(), pool, launcher);
        controller.start();
        try {
            controller.submit(call("m"));
            controller.submit(call("m"));

            AdmissionSnapshot stats = controller.stats().get(5, TimeUnit.SECONDS);
            assertEquals(new AdmissionSnapshot(1, 1), stats);
            assertEquals("admission-controller", launcher.threadNames().get(0));
        } finally {
            controller.stop(Duration.ofSeconds(5));
        }
    }

    @Test
    void shouldClosePendingConnectionsFromAdmissionThreadOnStop() throws Exception {
        StaticAssetPool pool = StaticAssetPool.of(List.of(
            new PoolConfig("A", List.of("m"), List.of("127.0.0.1:9101"))
        ));
        AdmissionController controller = new AdmissionController(routes(), pool, new RecordingLauncher());
        controller.start();
        Request running = call("m");
        Request waiting = call("m");
        controller.submit(running);
        controller.submit(waiting);
        assertEquals(new AdmissionSnapshot(1, 1), controller.stats().get(5, TimeUnit.SECONDS));

        controller.stop(Duration.ofSeconds(5));

        assertFalse(waiting.connection().isOpen());
        assertTrue(running.connection().isOpen());
        Request late = call("m");
        controller.submit(late);
        assertFalse(late.connection().isOpen());
    }

    @Test
    void shouldClosePendingConnectionsOnStopAndRejectLaterEvents() throws Exception {
        StaticAssetPool pool = StaticAssetPool.of(List.of(new PoolConfig("A", List.of("m"))));
        AdmissionController controller = new AdmissionController(routes(), pool, new RecordingLauncher());
        Request waiting = call("m");
        controller.handle(new AdmissionEvent.NewRequest(waiting));

        controller.close();

        assertFalse(waiting.connection().isOpen());
        Request late = call("m");
        controller.submit(late);
        assertFalse(late.connection().isOpen());
        ExecutionException e = assertThrows(ExecutionException.class, () -> controller.stats().get(1, TimeUnit.SECONDS));
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    private static RoutingTable routes() {
        return RoutingTable.fromConfigs(List.of(
            new PoolConfig("A", List.of("m", "a")),
            new PoolConfig("B", List.of("b"))
        ));
    }

    private static AdmissionSnapshot snapshot(AdmissionController controller) throws Exception {
        CompletableFuture<AdmissionSnapshot> reply = new CompletableFuture<>();
        controller.handle(new AdmissionEvent.StatsQuery(reply));
        return reply.get(1, TimeUnit.SECONDS);
    }

    static Request call(String module) {
        return new Request(
            REQUEST_IDS.incrementAndGet(),
            new RecordingClientConnection(),
            null,
            new byte[]{(byte) 131, 106},
            new InboundMessage.Call(module, "run", Term.list())
        );
    }

    /** Keeps launched tasks so a test can finish them in any order. */
    static final class RecordingLauncher implements WorkerLauncher {
        private final List<WorkerTask> tasks = new ArrayList<>();
        private final List<String> threadNames = new ArrayList<>();

        @Override
        public synchronized void launch(WorkerTask task, Runnable assetFreed) {
            tasks.add(task);
            threadNames.add(Thread.currentThread().getName());
        }

        synchronized List<WorkerTask> tasks() {
            return List.copyOf(tasks);
        }

        synchronized List<Request> requests() {
            List<Request> out = new ArrayList<>();
            for (WorkerTask task : tasks) {
                out.add(task.request());
            }
            return out;
        }

        synchronized List<String> threadNames() {
            return List.copyOf(threadNames);
        }

        void finish(int index, AssetPool pool, AdmissionController controller) {
            WorkerTask task = tasks().get(index);
            pool.returnAsset(task.poolId(), task.asset());
            task.request().connection().close();
            controller.handle(AdmissionEvent.ASSET_FREED);
        }
    }
}
