package com.acme.polyrpc.gateway.admission;

import com.acme.polyrpc.gateway.protocol.InboundMessage;
import com.acme.polyrpc.gateway.transport.api.ClientConnection;

import java.util.Objects;

/**
 * One client request: the connection it arrived on, the optional info prefix and
 * the action to run. A connection carries exactly one request.
 */
public final class Request {
    private final long requestId;
    private final ClientConnection connection;
    private final byte[] infoFrame;
    private final byte[] actionFrame;
    private final InboundMessage.Action action;

    public Request(long requestId,
                   ClientConnection connection,
                   byte[] infoFrame,
                   byte[] actionFrame,
                   InboundMessage.Action action) {
        this.requestId = requestId;
        this.connection = Objects.requireNonNull(connection, "connection");
        this.infoFrame = infoFrame;
        this.actionFrame = Objects.requireNonNull(actionFrame, "actionFrame");
        this.action = Objects.requireNonNull(action, "action");
    }

    public long requestId() {
        return requestId;
    }

    public ClientConnection connection() {
        return connection;
    }

    /** Raw bytes of the last info frame, or {@code null} when none was sent. */
    public byte[] infoFrame() {
        return infoFrame;
    }

    public byte[] actionFrame() {
        return actionFrame;
    }

    public InboundMessage.Action action() {
        return action;
    }

    public String module() {
        return action.module();
    }

    @Override
    public String toString() {
        return "Request{id=" + requestId
            + ", conn=" + connection.connectionId()
            + ", kind=" + (action instanceof InboundMessage.Cast ? "cast" : "call")
            + ", target=" + action.module() + ":" + action.function()
            + ", info=" + (infoFrame != null) + "}";
    }
}
