package com.acme.polyrpc.gateway.telemetry;

import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MetricsHttpEndpointTest {

    @Test
    void shouldRenderPrometheusTextFormat() {
        AtomicGatewayMetrics metrics = new AtomicGatewayMetrics();
        metrics.incConnectionsAccepted(10);
        metrics.incRequests(8);
        metrics.incDispatched(6);
        metrics.incQueued(2);
        metrics.incProtocolErrors(2, "undecodable");
        metrics.incWorkerFailures(1);
        metrics.observeWorkerNanos(1_000);
        metrics.setPendingDepth(2);
        metrics.addInFlight(3);

        String body = MetricsHttpEndpoint.renderPrometheus(metrics.snapshot(), Map.of("workers_idle", 4L));

        assertTrue(body.contains("# HELP gateway_connections_accepted_total"));
        assertTrue(body.contains("gateway_connections_accepted_total 10\n"));
        assertTrue(body.contains("gateway_requests_total 8\n"));
        assertTrue(body.contains("gateway_dispatched_total 6\n"));
        assertTrue(body.contains("gateway_pending_depth 2\n"));
        assertTrue(body.contains("gateway_in_flight 3\n"));
        assertTrue(body.contains("gateway_protocol_errors_total{reason=\"undecodable\"} 2\n"));
        assertTrue(body.contains("gateway_worker_duration_nanos_count 1\n"));
        assertTrue(body.contains("# TYPE gateway_workers_idle gauge"));
        assertTrue(body.contains("gateway_workers_idle 4\n"));
    }

    @Test
    void shouldEscapeLabelValues() {
        AtomicGatewayMetrics metrics = new AtomicGatewayMetrics();
        metrics.incProtocolErrors(1, "bad\"reason");

        String body = MetricsHttpEndpoint.renderPrometheus(metrics.snapshot(), Map.of());

        assertTrue(body.contains("gateway_protocol_errors_total{reason=\"bad\\\"reason\"} 1\n"));
    }

    @Test
    void shouldServeMetricsOverHttp() throws Exception {
        AtomicGatewayMetrics metrics = new AtomicGatewayMetrics();
        metrics.incRequests(5);
        try (MetricsHttpEndpoint endpoint = new MetricsHttpEndpoint(metrics, 0, "metrics", () -> Map.of())) {
            endpoint.start();
            HttpClient client = HttpClient.newHttpClient();

            HttpResponse<String> ok = client.send(
                HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + endpoint.port() + "/metrics")).GET().build(),
                HttpResponse.BodyHandlers.ofString());
            HttpResponse<String> post = client.send(
                HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + endpoint.port() + "/metrics"))
                    .POST(HttpRequest.BodyPublishers.noBody()).build(),
                HttpResponse.BodyHandlers.ofString());

            assertEquals(200, ok.statusCode());
            assertTrue(ok.body().contains("gateway_requests_total 5\n"));
            assertEquals(405, post.statusCode());
        }
    }
}
