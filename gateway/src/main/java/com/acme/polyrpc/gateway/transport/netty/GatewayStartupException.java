package com.acme.polyrpc.gateway.transport.netty;

/**
 * Fatal startup failure; the process must not continue.
 */
public final class GatewayStartupException extends RuntimeException {
    public GatewayStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
