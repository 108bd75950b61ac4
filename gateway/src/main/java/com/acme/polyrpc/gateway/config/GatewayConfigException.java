package com.acme.polyrpc.gateway.config;

public final class GatewayConfigException extends RuntimeException {
    public GatewayConfigException(String message) {
        super(message);
    }

    public GatewayConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
