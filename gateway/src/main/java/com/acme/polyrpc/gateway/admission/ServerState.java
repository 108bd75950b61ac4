package com.acme.polyrpc.gateway.admission;

import com.acme.polyrpc.gateway.routing.RoutingTable;

import java.util.ArrayDeque;
import java.util.Objects;

/**
 * State owned by the admission thread. Not thread-safe: nothing else may touch it.
 */
final class ServerState {
    private final ArrayDeque<Request> pending = new ArrayDeque<>();
    private final RoutingTable routingTable;
    private long totalDispatched;

    ServerState(RoutingTable routingTable) {
        this.routingTable = Objects.requireNonNull(routingTable, "routingTable");
    }

    RoutingTable routingTable() {
        return routingTable;
    }

    boolean hasPending() {
        return !pending.isEmpty();
    }

    int pendingDepth() {
        return pending.size();
    }

    void enqueue(Request request) {
        pending.addLast(request);
    }

    Request pollHead() {
        return pending.pollFirst();
    }

    long totalDispatched() {
        return totalDispatched;
    }

    long recordDispatch() {
        return ++totalDispatched;
    }
}
