package com.acme.polyrpc.gateway.telemetry;

import com.acme.polyrpc.gateway.util.GatewayDefaults;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.Executors;
import java.util.function.Supplier;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Prometheus text endpoint for ops scraping.
 */
public final class MetricsHttpEndpoint implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(MetricsHttpEndpoint.class.getName());
    private static final Pattern METRIC_NAME_SANITIZER = Pattern.compile("[^a-zA-Z0-9_]");

    private final AtomicGatewayMetrics metrics;
    private final String path;
    private final Supplier<Map<String, Long>> additionalGaugesSupplier;
    private final HttpServer server;

    public MetricsHttpEndpoint(AtomicGatewayMetrics metrics,
                               int port,
                               String path,
                               Supplier<Map<String, Long>> additionalGaugesSupplier) throws IOException {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.path = normalizePath(path);
        this.additionalGaugesSupplier = additionalGaugesSupplier == null ? (() -> Map.of()) : additionalGaugesSupplier;
        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.server.createContext(this.path, this::handle);
        this.server.setExecutor(Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "metrics-http-endpoint");
            t.setDaemon(true);
            return t;
        }));
    }

    public void start() {
        server.start();
        LOG.info("Metrics endpoint started on :" + port() + path);
    }

    public int port() {
        return server.getAddress().getPort();
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                write(exchange, 405, "method not allowed\n");
                return;
            }
            Map<String, Long> extra = additionalGaugesSupplier.get();
            write(exchange, 200, renderPrometheus(metrics.snapshot(), extra == null ? Map.of() : extra));
        } catch (Throwable t) {
            write(exchange, 500, "internal error\n");
        }
    }

    private static void write(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private static String normalizePath(String rawPath) {
        if (rawPath == null || rawPath.isBlank()) {
            return GatewayDefaults.DEFAULT_METRICS_HTTP_PATH;
        }
        return rawPath.startsWith("/") ? rawPath : "/" + rawPath;
    }

    static String renderPrometheus(AtomicGatewayMetrics.Snapshot snapshot, Map<String, Long> additionalGauges) {
        StringBuilder sb = new StringBuilder(GatewayDefaults.DEFAULT_METRICS_RENDER_BUFFER);

        appendHelpType(sb, "gateway_connections_accepted_total", "Accepted client connections", "counter");
        appendMetric(sb, "gateway_connections_accepted_total", null, snapshot.connectionsAccepted());

        appendHelpType(sb, "gateway_requests_total", "Decoded call and cast requests", "counter");
        appendMetric(sb, "gateway_requests_total", null, snapshot.requests());

        appendHelpType(sb, "gateway_dispatched_total", "Requests that leased a worker", "counter");
        appendMetric(sb, "gateway_dispatched_total", null, snapshot.dispatched());

        appendHelpType(sb, "gateway_queued_total", "Times a request was put on the pending queue", "counter");
        appendMetric(sb, "gateway_queued_total", null, snapshot.queued());

        appendHelpType(sb, "gateway_pending_depth", "Current pending queue depth", "gauge");
        appendMetric(sb, "gateway_pending_depth", null, snapshot.pendingDepth());

        appendHelpType(sb, "gateway_in_flight", "Worker tasks currently running", "gauge");
        appendMetric(sb, "gateway_in_flight", null, snapshot.inFlight());

        appendHelpType(sb, "gateway_worker_failures_total", "Worker tasks that ended in a fault", "counter");
        appendMetric(sb, "gateway_worker_failures_total", null, snapshot.workerFailures());

        appendHelpType(sb, "gateway_protocol_errors_total", "Connections closed on a protocol error", "counter");
        for (Map.Entry<String, Long> e : new TreeMap<>(snapshot.protocolErrorsByReason()).entrySet()) {
            appendMetric(sb, "gateway_protocol_errors_total", e.getKey(), e.getValue());
        }

        appendHelpType(sb, "gateway_worker_duration_nanos", "Worker task duration summary in nanoseconds", "summary");
        appendMetric(sb, "gateway_worker_duration_nanos_sum", null, snapshot.workerNanosTotal());
        appendMetric(sb, "gateway_worker_duration_nanos_count", null, snapshot.workerSamples());

        for (Map.Entry<String, Long> e : new TreeMap<>(additionalGauges).entrySet()) {
            String metricName = toMetricName("gateway_" + e.getKey());
            appendHelpType(sb, metricName, "Gateway gauge: " + e.getKey(), "gauge");
            appendMetric(sb, metricName, null, e.getValue());
        }
        return sb.toString();
    }

    private static String toMetricName(String raw) {
        return METRIC_NAME_SANITIZER.matcher(raw).replaceAll("_");
    }

    private static void appendHelpType(StringBuilder sb, String metric, String help, String type) {
        sb.append("# HELP ").append(metric).append(' ').append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(' ').append(type).append('\n');
    }

    private static void appendMetric(StringBuilder sb, String name, String reason, long value) {
        sb.append(name);
        if (reason != null) {
            sb.append("{reason=\"").append(escapeLabelValue(reason)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static String escapeLabelValue(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }

    @Override
    public void close() {
        server.stop(0);
    }
}
