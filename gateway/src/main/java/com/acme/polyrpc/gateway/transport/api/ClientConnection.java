package com.acme.polyrpc.gateway.transport.api;

/**
 * Client socket as seen by the admission core.
 *
 * <p>Writes to a connection the peer already dropped fail silently. {@link #close()}
 * is idempotent and lets previously sent frames drain first.
 */
public interface ClientConnection {
    /** Stable id for logs. */
    long connectionId();

    /** Sends one frame; the transport adds the length prefix. */
    void send(byte[] payload);

    void close();

    boolean isOpen();

    default void sendAndClose(byte[] payload) {
        send(payload);
        close();
    }
}
