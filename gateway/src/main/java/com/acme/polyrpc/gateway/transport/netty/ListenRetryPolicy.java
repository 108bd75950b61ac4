package com.acme.polyrpc.gateway.transport.netty;

import com.acme.polyrpc.gateway.util.GatewayDefaults;

/**
 * How often and how patiently the listener retries a failed bind.
 */
public record ListenRetryPolicy(int maxAttempts, long delayMillis) {
    public static final ListenRetryPolicy DEFAULT = new ListenRetryPolicy(
        GatewayDefaults.DEFAULT_LISTEN_RETRIES, GatewayDefaults.DEFAULT_LISTEN_RETRY_DELAY_MS);

    public ListenRetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        if (delayMillis < 0) {
            throw new IllegalArgumentException("delayMillis must be >= 0");
        }
    }
}
