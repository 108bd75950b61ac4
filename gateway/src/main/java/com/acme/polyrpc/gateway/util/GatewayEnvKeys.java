package com.acme.polyrpc.gateway.util;

/**
 * Canonical environment variable names read at startup.
 */
public final class GatewayEnvKeys {
    public static final String GATEWAY_PORT = "GATEWAY_PORT";
    public static final String GATEWAY_POOLS_FILE = "GATEWAY_POOLS_FILE";
    public static final String GATEWAY_LISTEN_RETRIES = "GATEWAY_LISTEN_RETRIES";
    public static final String GATEWAY_LISTEN_RETRY_DELAY_MS = "GATEWAY_LISTEN_RETRY_DELAY_MS";
    public static final String GATEWAY_MAX_FRAME_BYTES = "GATEWAY_MAX_FRAME_BYTES";

    public static final String GATEWAY_WORKER_TIMEOUT_MS = "GATEWAY_WORKER_TIMEOUT_MS";
    public static final String GATEWAY_WORKER_IO_THREADS = "GATEWAY_WORKER_IO_THREADS";

    public static final String GATEWAY_METRICS_ENABLED = "GATEWAY_METRICS_ENABLED";
    public static final String GATEWAY_METRICS_LOG_INTERVAL_SEC = "GATEWAY_METRICS_LOG_INTERVAL_SEC";
    public static final String GATEWAY_METRICS_HTTP_ENABLED = "GATEWAY_METRICS_HTTP_ENABLED";
    public static final String GATEWAY_METRICS_HTTP_PORT = "GATEWAY_METRICS_HTTP_PORT";
    public static final String GATEWAY_METRICS_HTTP_PATH = "GATEWAY_METRICS_HTTP_PATH";

    private GatewayEnvKeys() {
    }
}
