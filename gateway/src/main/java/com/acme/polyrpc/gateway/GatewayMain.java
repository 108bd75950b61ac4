package com.acme.polyrpc.gateway;

import com.acme.polyrpc.gateway.admin.AdminHandler;
import com.acme.polyrpc.gateway.admission.AdmissionController;
import com.acme.polyrpc.gateway.admission.NativeRequestHandler;
import com.acme.polyrpc.gateway.config.GatewayConfig;
import com.acme.polyrpc.gateway.config.PoolConfigLoader;
import com.acme.polyrpc.gateway.pool.StaticAssetPool;
import com.acme.polyrpc.gateway.routing.PoolConfig;
import com.acme.polyrpc.gateway.routing.RoutingTable;
import com.acme.polyrpc.gateway.telemetry.AtomicGatewayMetrics;
import com.acme.polyrpc.gateway.telemetry.GatewayMetrics;
import com.acme.polyrpc.gateway.telemetry.MetricsHttpEndpoint;
import com.acme.polyrpc.gateway.telemetry.NoopGatewayMetrics;
import com.acme.polyrpc.gateway.telemetry.PeriodicMetricsReporter;
import com.acme.polyrpc.gateway.transport.netty.GatewayServer;
import com.acme.polyrpc.gateway.transport.netty.GatewayStartupException;
import com.acme.polyrpc.gateway.transport.netty.ListenRetryPolicy;
import com.acme.polyrpc.gateway.util.GatewayDefaults;
import com.acme.polyrpc.gateway.worker.NettyWorkerTransport;
import com.acme.polyrpc.gateway.worker.WorkerTaskExecutor;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.logging.Logger;

public final class GatewayMain {
    private static final Logger LOG = Logger.getLogger(GatewayMain.class.getName());

    private GatewayMain() {}

    public static void main(String[] args) throws Exception {
        GatewayConfig config = GatewayConfig.fromEnvironment(System.getenv(), args);

        List<PoolConfig> pools = PoolConfigLoader.load(config.poolsFile());
        RoutingTable routingTable = RoutingTable.fromConfigs(pools);
        LOG.info(() -> "Loaded " + pools.size() + " pools from " + config.poolsFile()
            + " routing " + routingTable.size() + " modules");
        StaticAssetPool assetPool = new StaticAssetPool(() -> PoolConfigLoader.load(config.poolsFile()));

        GatewayMetrics metrics = config.metricsEnabled() ? new AtomicGatewayMetrics() : NoopGatewayMetrics.INSTANCE;
        Supplier<Map<String, Long>> additionalGauges = () -> Map.of(
            "workers_idle", (long) assetPool.idleCount(),
            "workers_leased", (long) assetPool.leasedCount()
        );

        PeriodicMetricsReporter metricsReporter = null;
        MetricsHttpEndpoint metricsEndpoint = null;
        if (metrics instanceof AtomicGatewayMetrics atomicMetrics) {
            metricsReporter = new PeriodicMetricsReporter(atomicMetrics, config.metricsLogIntervalSec(), additionalGauges);
            if (config.metricsHttpEnabled()) {
                try {
                    metricsEndpoint = new MetricsHttpEndpoint(
                        atomicMetrics,
                        config.metricsHttpPort(),
                        config.metricsHttpPath(),
                        additionalGauges
                    );
                } catch (Exception e) {
                    LOG.warning("Metrics endpoint init failed: " + e.getClass().getSimpleName());
                }
            }
        }

        NettyWorkerTransport transport = new NettyWorkerTransport(
            config.workerIoThreads(), config.maxFrameBytes(), config.workerTimeoutMillis());
        WorkerTaskExecutor executor = new WorkerTaskExecutor(assetPool, transport, metrics);
        AdmissionController controller = new AdmissionController(
            routingTable, assetPool, executor, NativeRequestHandler.NOOP, metrics);
        AdminHandler adminHandler = new AdminHandler(assetPool, controller::stats);
        GatewayServer server = new GatewayServer(
            config.port(),
            new ListenRetryPolicy(config.listenRetries(), config.listenRetryDelayMillis()),
            config.maxFrameBytes(),
            controller::submit,
            adminHandler,
            metrics
        );

        AtomicBoolean stopped = new AtomicBoolean(false);
        CountDownLatch shutdownLatch = new CountDownLatch(1);
        PeriodicMetricsReporter reporterRef = metricsReporter;
        MetricsHttpEndpoint metricsEndpointRef = metricsEndpoint;
        Runnable stopAndSignal = () -> {
            try {
                stopAll(server, controller, executor, transport, reporterRef, metricsEndpointRef, stopped);
            } finally {
                shutdownLatch.countDown();
            }
        };
        Thread shutdownHook = new Thread(stopAndSignal, "gateway-shutdown-hook");
        Runtime.getRuntime().addShutdownHook(shutdownHook);

        try {
            if (metricsReporter != null) {
                metricsReporter.start();
            }
            if (metricsEndpoint != null) {
                metricsEndpoint.start();
            }
            controller.start();
            server.start();
            shutdownLatch.await();
        } catch (GatewayStartupException e) {
            LOG.severe("Gateway startup failed: " + e.getMessage());
            stopAndSignal.run();
            System.exit(1);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            try {
                Runtime.getRuntime().removeShutdownHook(shutdownHook);
            } catch (IllegalStateException ignored) {
                // JVM is shutting down and hook is already in-flight.
            }
            stopAndSignal.run();
        }
    }

    private static void stopAll(GatewayServer server,
                                AdmissionController controller,
                                WorkerTaskExecutor executor,
                                NettyWorkerTransport transport,
                                PeriodicMetricsReporter metricsReporter,
                                MetricsHttpEndpoint metricsEndpoint,
                                AtomicBoolean stopped) {
        if (!stopped.compareAndSet(false, true)) {
            return;
        }
        Duration timeout = Duration.ofMillis(GatewayDefaults.SHUTDOWN_TIMEOUT_MS);
        try {
            server.stop();
        } catch (Exception e) {
            LOG.fine("Shutdown: server stop failed: " + e.getClass().getSimpleName());
        }
        try {
            controller.stop(timeout);
        } catch (Exception e) {
            LOG.fine("Shutdown: admission controller stop failed: " + e.getClass().getSimpleName());
        }
        try {
            executor.stop(timeout);
        } catch (Exception e) {
            LOG.fine("Shutdown: worker executor stop failed: " + e.getClass().getSimpleName());
        }
        try {
            transport.close();
        } catch (Exception e) {
            LOG.fine("Shutdown: worker transport stop failed: " + e.getClass().getSimpleName());
        }
        if (metricsReporter != null) {
            try {
                metricsReporter.close();
            } catch (Exception e) {
                LOG.fine("Shutdown: metricsReporter stop failed: " + e.getClass().getSimpleName());
            }
        }
        if (metricsEndpoint != null) {
            try {
                metricsEndpoint.close();
            } catch (Exception e) {
                LOG.fine("Shutdown: metricsEndpoint stop failed: " + e.getClass().getSimpleName());
            }
        }
        LOG.info("Gateway stopped");
    }
}
