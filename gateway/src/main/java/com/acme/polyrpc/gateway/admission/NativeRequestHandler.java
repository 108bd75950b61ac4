package com.acme.polyrpc.gateway.admission;

/**
 * Handles requests for modules no pool serves. The default does nothing and leaves
 * the connection as it is.
 */
@FunctionalInterface
public interface NativeRequestHandler {
    void handle(Request request);

    NativeRequestHandler NOOP = request -> { };
}
