package com.acme.polyrpc.gateway.telemetry;

public final class NoopGatewayMetrics implements GatewayMetrics {
    public static final NoopGatewayMetrics INSTANCE = new NoopGatewayMetrics();

    private NoopGatewayMetrics() {
    }

    @Override
    public void incConnectionsAccepted(long n) {
    }

    @Override
    public void incRequests(long n) {
    }

    @Override
    public void incDispatched(long n) {
    }

    @Override
    public void incQueued(long n) {
    }

    @Override
    public void incProtocolErrors(long n, String reason) {
    }

    @Override
    public void incWorkerFailures(long n) {
    }

    @Override
    public void observeWorkerNanos(long nanos) {
    }

    @Override
    public void setPendingDepth(int depth) {
    }

    @Override
    public void addInFlight(int delta) {
    }
}
