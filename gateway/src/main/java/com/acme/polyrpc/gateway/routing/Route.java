package com.acme.polyrpc.gateway.routing;

public sealed interface Route permits Route.Extern, Route.Native {
    /** Served by an external worker pool. */
    record Extern(String poolId) implements Route {}

    /** No pool claims the module. */
    record Native() implements Route {}

    Route NATIVE = new Native();
}
