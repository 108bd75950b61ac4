package com.acme.polyrpc.gateway.telemetry;

import com.acme.polyrpc.gateway.util.JsonCodec;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Logs one JSON metrics line per interval.
 */
public final class PeriodicMetricsReporter implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(PeriodicMetricsReporter.class.getName());

    private final AtomicGatewayMetrics metrics;
    private final Supplier<Map<String, Long>> additionalGaugesSupplier;
    private final ScheduledExecutorService executor;
    private final long intervalSeconds;

    public PeriodicMetricsReporter(AtomicGatewayMetrics metrics,
                                   long intervalSeconds,
                                   Supplier<Map<String, Long>> additionalGaugesSupplier) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.intervalSeconds = Math.max(1L, intervalSeconds);
        this.additionalGaugesSupplier = additionalGaugesSupplier == null ? (() -> Map.of()) : additionalGaugesSupplier;
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "gateway-metrics-reporter");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        executor.scheduleAtFixedRate(this::emit, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
    }

    String render() {
        AtomicGatewayMetrics.Snapshot s = metrics.snapshot();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("component", "gateway");
        payload.put("type", "admission_metrics");
        payload.put("connectionsAccepted", s.connectionsAccepted());
        payload.put("requests", s.requests());
        payload.put("dispatched", s.dispatched());
        payload.put("queued", s.queued());
        payload.put("pendingDepth", s.pendingDepth());
        payload.put("inFlight", s.inFlight());
        payload.put("workerFailures", s.workerFailures());
        payload.put("workerNanosTotal", s.workerNanosTotal());
        payload.put("workerSamples", s.workerSamples());
        payload.put("protocolErrorsByReason", s.protocolErrorsByReason());
        Map<String, Long> extra = additionalGaugesSupplier.get();
        if (extra != null && !extra.isEmpty()) {
            payload.put("gauges", extra);
        }
        try {
            return JsonCodec.writeString(payload);
        } catch (Exception e) {
            return payload.toString();
        }
    }

    private void emit() {
        try {
            LOG.info(render());
        } catch (Throwable t) {
            LOG.warning("Metrics reporter failure: " + t.getClass().getSimpleName());
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
