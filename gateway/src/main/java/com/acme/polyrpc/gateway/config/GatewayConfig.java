package com.acme.polyrpc.gateway.config;

import com.acme.polyrpc.gateway.util.EnvVars;
import com.acme.polyrpc.gateway.util.GatewayDefaults;
import com.acme.polyrpc.gateway.util.GatewayEnvKeys;

import java.nio.file.Path;
import java.util.Map;

/**
 * Startup settings. CLI arguments ({@code [port] [poolsFile]}) win over the environment.
 */
public record GatewayConfig(
    int port,
    Path poolsFile,
    int listenRetries,
    long listenRetryDelayMillis,
    int maxFrameBytes,
    long workerTimeoutMillis,
    int workerIoThreads,
    boolean metricsEnabled,
    int metricsLogIntervalSec,
    boolean metricsHttpEnabled,
    int metricsHttpPort,
    String metricsHttpPath
) {

    public static GatewayConfig fromEnvironment(Map<String, String> env, String[] args) {
        int port = EnvVars.getIntClamped(env, GatewayEnvKeys.GATEWAY_PORT, GatewayDefaults.DEFAULT_PORT, 0, 65_535);
        String poolsFile = EnvVars.getOrDefault(env, GatewayEnvKeys.GATEWAY_POOLS_FILE, GatewayDefaults.DEFAULT_POOLS_FILE);
        if (args != null && args.length > 0) {
            try {
                port = Integer.parseInt(args[0].trim());
            } catch (NumberFormatException e) {
                throw new GatewayConfigException("Port argument is not a number: " + args[0], e);
            }
        }
        if (args != null && args.length > 1) {
            poolsFile = args[1];
        }
        return new GatewayConfig(
            port,
            Path.of(poolsFile),
            EnvVars.getIntClamped(env, GatewayEnvKeys.GATEWAY_LISTEN_RETRIES,
                GatewayDefaults.DEFAULT_LISTEN_RETRIES, 1, 100_000),
            EnvVars.getLongClamped(env, GatewayEnvKeys.GATEWAY_LISTEN_RETRY_DELAY_MS,
                GatewayDefaults.DEFAULT_LISTEN_RETRY_DELAY_MS, 0L, 600_000L),
            EnvVars.getIntClamped(env, GatewayEnvKeys.GATEWAY_MAX_FRAME_BYTES,
                GatewayDefaults.MAX_FRAME_BYTES, 1024, Integer.MAX_VALUE),
            EnvVars.getLongClamped(env, GatewayEnvKeys.GATEWAY_WORKER_TIMEOUT_MS,
                GatewayDefaults.DEFAULT_WORKER_TIMEOUT_MS, 0L, 86_400_000L),
            EnvVars.getIntClamped(env, GatewayEnvKeys.GATEWAY_WORKER_IO_THREADS,
                GatewayDefaults.DEFAULT_WORKER_IO_THREADS, 0, 256),
            EnvVars.getBoolean(env, GatewayEnvKeys.GATEWAY_METRICS_ENABLED, true),
            EnvVars.getIntClamped(env, GatewayEnvKeys.GATEWAY_METRICS_LOG_INTERVAL_SEC,
                GatewayDefaults.DEFAULT_METRICS_LOG_INTERVAL_SEC, 1, 3600),
            EnvVars.getBoolean(env, GatewayEnvKeys.GATEWAY_METRICS_HTTP_ENABLED, false),
            EnvVars.getIntClamped(env, GatewayEnvKeys.GATEWAY_METRICS_HTTP_PORT,
                GatewayDefaults.DEFAULT_METRICS_HTTP_PORT, 1, 65_535),
            EnvVars.getOrDefault(env, GatewayEnvKeys.GATEWAY_METRICS_HTTP_PATH,
                GatewayDefaults.DEFAULT_METRICS_HTTP_PATH)
        );
    }
}
