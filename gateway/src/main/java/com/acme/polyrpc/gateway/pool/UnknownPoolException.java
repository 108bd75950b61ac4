package com.acme.polyrpc.gateway.pool;

public final class UnknownPoolException extends RuntimeException {
    private final String poolId;

    public UnknownPoolException(String poolId) {
        super("Unknown pool: " + poolId);
        this.poolId = poolId;
    }

    public String poolId() {
        return poolId;
    }
}
