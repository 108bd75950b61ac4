package com.acme.polyrpc.gateway.telemetry;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

public final class AtomicGatewayMetrics implements GatewayMetrics {
    private final LongAdder connectionsAccepted = new LongAdder();
    private final LongAdder requests = new LongAdder();
    private final LongAdder dispatched = new LongAdder();
    private final LongAdder queued = new LongAdder();
    private final LongAdder workerFailures = new LongAdder();
    private final LongAdder workerNanos = new LongAdder();
    private final LongAdder workerSamples = new LongAdder();
    private final AtomicInteger pendingDepth = new AtomicInteger();
    private final AtomicInteger inFlight = new AtomicInteger();
    private final ConcurrentHashMap<String, LongAdder> protocolErrorsByReason = new ConcurrentHashMap<>();

    @Override
    public void incConnectionsAccepted(long n) {
        connectionsAccepted.add(Math.max(0L, n));
    }

    @Override
    public void incRequests(long n) {
        requests.add(Math.max(0L, n));
    }

    @Override
    public void incDispatched(long n) {
        dispatched.add(Math.max(0L, n));
    }

    @Override
    public void incQueued(long n) {
        queued.add(Math.max(0L, n));
    }

    @Override
    public void incProtocolErrors(long n, String reason) {
        if (n <= 0) return;
        protocolErrorsByReason.computeIfAbsent(reason == null ? "unknown" : reason, ignored -> new LongAdder()).add(n);
    }

    @Override
    public void incWorkerFailures(long n) {
        workerFailures.add(Math.max(0L, n));
    }

    @Override
    public void observeWorkerNanos(long nanos) {
        if (nanos < 0) return;
        workerNanos.add(nanos);
        workerSamples.increment();
    }

    @Override
    public void setPendingDepth(int depth) {
        pendingDepth.set(Math.max(0, depth));
    }

    @Override
    public void addInFlight(int delta) {
        inFlight.addAndGet(delta);
    }

    public Snapshot snapshot() {
        Map<String, Long> errors = new HashMap<>();
        protocolErrorsByReason.forEach((k, v) -> errors.put(k, v.sum()));
        return new Snapshot(
            connectionsAccepted.sum(),
            requests.sum(),
            dispatched.sum(),
            queued.sum(),
            workerFailures.sum(),
            workerNanos.sum(),
            workerSamples.sum(),
            pendingDepth.get(),
            inFlight.get(),
            Collections.unmodifiableMap(errors)
        );
    }

    public record Snapshot(long connectionsAccepted,
                           long requests,
                           long dispatched,
                           long queued,
                           long workerFailures,
                           long workerNanosTotal,
                           long workerSamples,
                           int pendingDepth,
                           int inFlight,
                           Map<String, Long> protocolErrorsByReason) {}
}
