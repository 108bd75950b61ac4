package com.acme.polyrpc.gateway.pool;

public sealed interface LeaseResult permits LeaseResult.Leased, LeaseResult.Empty {
    record Leased(Asset asset) implements LeaseResult {}
    record Empty() implements LeaseResult {}

    LeaseResult EMPTY = new Empty();
}
