package com.acme.polyrpc.gateway.transport.netty;

import com.acme.polyrpc.gateway.admin.AdminHandler;
import com.acme.polyrpc.gateway.admission.AdmissionController;
import com.acme.polyrpc.gateway.admission.AdmissionSnapshot;
import com.acme.polyrpc.gateway.admission.NativeRequestHandler;
import com.acme.polyrpc.gateway.admission.Request;
import com.acme.polyrpc.gateway.pool.StaticAssetPool;
import com.acme.polyrpc.gateway.routing.PoolConfig;
import com.acme.polyrpc.gateway.routing.RoutingTable;
import com.acme.polyrpc.gateway.telemetry.AtomicGatewayMetrics;
import com.acme.polyrpc.gateway.term.Term;
import com.acme.polyrpc.gateway.term.TermCodec;
import com.acme.polyrpc.gateway.util.GatewayDefaults;
import com.acme.polyrpc.gateway.worker.FakeWorker;
import com.acme.polyrpc.gateway.worker.NettyWorkerTransport;
import com.acme.polyrpc.gateway.worker.WorkerTaskExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.net.ServerSocket;
import java.net.Socket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class GatewayServerTest {
    private static final byte[] WORKER_RESPONSE = TermCodec.encode(Term.tuple(Term.atom("reply"), Term.integer(3)));

    private final List<AutoCloseable> resources = new ArrayList<>();

    @AfterEach
    void tearDown() throws Exception {
        for (int i = resources.size() - 1; i >= 0; i--) {
            resources.get(i).close();
        }
    }

    @Test
    void shouldForwardCallToWorkerAndReturnItsResponse() throws Exception {
        FakeWorker worker = track(new FakeWorker(frame -> WORKER_RESPONSE));
        Gateway gateway = startGateway(worker);
        byte[] call = frame("call", "calc", "add");

        try (Socket client = connect(gateway.server)) {
            write(client, call);

            assertArrayEquals(WORKER_RESPONSE, read(client));
            assertClosed(client);
        }
        assertEquals(1, worker.received().size());
        assertArrayEquals(call, worker.received().get(0));
        assertEquals(new AdmissionSnapshot(1, 0), gateway.controller.stats().get(5, TimeUnit.SECONDS));
    }

    @Test
    void shouldAcknowledgeCastBeforeWorkerFinishes() throws Exception {
        FakeWorker worker = track(new FakeWorker(frame -> WORKER_RESPONSE));
        worker.hold();
        Gateway gateway = startGateway(worker);

        try (Socket client = connect(gateway.server)) {
            write(client, frame("cast", "calc", "log"));

            assertEquals(Term.tuple(Term.atom("noreply")), TermCodec.decode(read(client)));
            assertClosed(client);
        } finally {
            worker.release();
        }
    }

    @Test
    void shouldAcceptInfoFramesBeforeTheAction() throws Exception {
        FakeWorker worker = track(new FakeWorker(frame -> WORKER_RESPONSE));
        Gateway gateway = startGateway(worker);
        byte[] info = TermCodec.encode(Term.tuple(Term.atom("info"), Term.atom("cache"), Term.list()));
        byte[] call = frame("call", "calc", "add");

        try (Socket client = connect(gateway.server)) {
            write(client, info);
            write(client, info);
            write(client, call);

            assertArrayEquals(WORKER_RESPONSE, read(client));
        }
        assertEquals(1, worker.received().size());
        assertArrayEquals(call, worker.received().get(0));
    }

    @Test
    void shouldAnswerAdminStatsInline() throws Exception {
        FakeWorker worker = track(new FakeWorker(frame -> WORKER_RESPONSE));
        Gateway gateway = startGateway(worker);

        try (Socket client = connect(gateway.server)) {
            write(client, frame("call", "__admin__", "stats"));

            Term.Tuple reply = (Term.Tuple) TermCodec.decode(read(client));
            assertEquals(Term.atom("reply"), reply.get(0));
            assertEquals("connections.total=0\nworkers.idle=1\nconnections.pending=0\n",
                ((Term.Bin) reply.get(1)).utf8());
            assertClosed(client);
        }
    }

    @Test
    void shouldCloseConnectionOnUnexpectedTerm() throws Exception {
        AtomicGatewayMetrics metrics = new AtomicGatewayMetrics();
        List<Request> dispatched = new ArrayList<>();
        GatewayServer server = track(new GatewayServer(0, new ListenRetryPolicy(1, 0), 1024,
            dispatched::add, adminHandler(), metrics));
        server.start();

        try (Socket client = connect(server)) {
            write(client, TermCodec.encode(Term.tuple(Term.atom("send"), Term.atom("calc"))));
            assertClosed(client);
        }
        try (Socket client = connect(server)) {
            write(client, new byte[]{1, 2, 3});
            assertClosed(client);
        }
        assertTrue(dispatched.isEmpty());
        assertEquals(1L, metrics.snapshot().protocolErrorsByReason().get("unexpected_term"));
        assertEquals(1L, metrics.snapshot().protocolErrorsByReason().get("undecodable"));
    }

    @Test
    void shouldGiveUpAfterListenRetriesAreExhausted() throws Exception {
        try (ServerSocket occupied = new ServerSocket(0)) {
            GatewayServer server = new GatewayServer(occupied.getLocalPort(), new ListenRetryPolicy(2, 10),
                GatewayDefaults.MAX_FRAME_BYTES, request -> { }, adminHandler(), null);

            GatewayStartupException e = assertThrows(GatewayStartupException.class, server::start);

            assertTrue(e.getMessage().contains(Integer.toString(occupied.getLocalPort())));
            assertThrows(IllegalStateException.class, server::boundPort);
        }
    }

    private Gateway startGateway(FakeWorker worker) {
        List<PoolConfig> pools = List.of(new PoolConfig("py", List.of("calc"), List.of(worker.endpoint())));
        StaticAssetPool pool = StaticAssetPool.of(pools);
        AtomicGatewayMetrics metrics = new AtomicGatewayMetrics();
        NettyWorkerTransport transport = track(new NettyWorkerTransport(1, GatewayDefaults.MAX_FRAME_BYTES, 0));
        WorkerTaskExecutor executor = track(new WorkerTaskExecutor(pool, transport, metrics));
        AdmissionController controller = track(new AdmissionController(
            RoutingTable.fromConfigs(pools), pool, executor, NativeRequestHandler.NOOP, metrics));
        controller.start();
        GatewayServer server = track(new GatewayServer(0, new ListenRetryPolicy(1, 0),
            GatewayDefaults.MAX_FRAME_BYTES, controller::submit, new AdminHandler(pool, controller::stats), metrics));
        server.start();
        return new Gateway(server, controller);
    }

    private static AdminHandler adminHandler() {
        return new AdminHandler(StaticAssetPool.of(List.of()),
            () -> CompletableFuture.completedFuture(new AdmissionSnapshot(0, 0)));
    }

    private <T extends AutoCloseable> T track(T resource) {
        resources.add(resource);
        return resource;
    }

    private static byte[] frame(String kind, String module, String function) {
        return TermCodec.encode(Term.tuple(Term.atom(kind), Term.atom(module), Term.atom(function),
            Term.list(Term.integer(1), Term.integer(2))));
    }

    private static Socket connect(GatewayServer server) throws IOException {
        Socket socket = new Socket("127.0.0.1", server.boundPort());
        socket.setSoTimeout((int) Duration.ofSeconds(5).toMillis());
        return socket;
    }

    private static void write(Socket socket, byte[] payload) throws IOException {
        DataOutputStream out = new DataOutputStream(socket.getOutputStream());
        out.writeInt(payload.length);
        out.write(payload);
        out.flush();
    }

    private static byte[] read(Socket socket) throws IOException {
        DataInputStream in = new DataInputStream(socket.getInputStream());
        byte[] payload = new byte[in.readInt()];
        in.readFully(payload);
        return payload;
    }

    private static void assertClosed(Socket socket) {
        assertThrows(IOException.class, () -> new DataInputStream(socket.getInputStream()).readInt());
    }

    private record Gateway(GatewayServer server, AdmissionController controller) {}
}
