package com.acme.polyrpc.gateway.admission;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Messages processed by the admission thread, one at a time in arrival order.
 */
public interface AdmissionEvent {

    record NewRequest(Request request) implements AdmissionEvent {
        public NewRequest {
            Objects.requireNonNull(request, "request");
        }
    }

    /** A worker task released its asset. Not tied to a pool. */
    record AssetFreed() implements AdmissionEvent {}

    record StatsQuery(CompletableFuture<AdmissionSnapshot> reply) implements AdmissionEvent {
        public StatsQuery {
            Objects.requireNonNull(reply, "reply");
        }
    }

    AssetFreed ASSET_FREED = new AssetFreed();
}
