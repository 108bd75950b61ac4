package com.acme.polyrpc.gateway.telemetry;

public interface GatewayMetrics {
    void incConnectionsAccepted(long n);
    void incRequests(long n);
    void incDispatched(long n);
    void incQueued(long n);
    void incProtocolErrors(long n, String reason);
    void incWorkerFailures(long n);
    void observeWorkerNanos(long nanos);
    void setPendingDepth(int depth);
    void addInFlight(int delta);
}
