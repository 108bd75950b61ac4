package com.acme.polyrpc.gateway.util;

/**
 * Default tuning constants, used when the corresponding environment variable is not set.
 */
public final class GatewayDefaults {

    // ---- Listener ----
    public static final int DEFAULT_PORT = 8000;
    public static final int DEFAULT_LISTEN_RETRIES = 500;
    public static final long DEFAULT_LISTEN_RETRY_DELAY_MS = 5_000L;
    public static final int DEFAULT_SO_BACKLOG = 1024;
    public static final int MAX_FRAME_BYTES = 16 * 1024 * 1024;

    // ---- Workers ----
    public static final String DEFAULT_POOLS_FILE = "./pools.json";
    public static final int DEFAULT_CONNECT_TIMEOUT_MS = 5_000;
    public static final long DEFAULT_WORKER_TIMEOUT_MS = 0L;
    public static final int DEFAULT_WORKER_IO_THREADS = 0;

    // ---- Metrics ----
    public static final int DEFAULT_METRICS_LOG_INTERVAL_SEC = 30;
    public static final int DEFAULT_METRICS_HTTP_PORT = 9464;
    public static final String DEFAULT_METRICS_HTTP_PATH = "/metrics";
    public static final int DEFAULT_METRICS_RENDER_BUFFER = 1024;

    // ---- Shutdown ----
    public static final long SHUTDOWN_TIMEOUT_MS = 5_000L;

    private GatewayDefaults() {
    }
}
