package com.acme.polyrpc.gateway.transport.netty;

import com.acme.polyrpc.gateway.admin.AdminHandler;
import com.acme.polyrpc.gateway.admission.Request;
import com.acme.polyrpc.gateway.protocol.InboundMessage;
import com.acme.polyrpc.gateway.protocol.OutboundMessages;
import com.acme.polyrpc.gateway.protocol.ProtocolClassifier;
import com.acme.polyrpc.gateway.telemetry.GatewayMetrics;
import com.acme.polyrpc.gateway.term.Term;
import com.acme.polyrpc.gateway.term.TermCodec;
import com.acme.polyrpc.gateway.term.TermDecodeException;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Per-connection protocol decoder. Reads frames until one carries an action or
 * an admin command; info frames before it are kept on the request. Once the
 * request is handed off the channel stops reading.
 */
final class RequestFrameHandler extends SimpleChannelInboundHandler<ByteBuf> {
    private static final Logger LOG = Logger.getLogger(RequestFrameHandler.class.getName());

    private final Consumer<Request> admission;
    private final AdminHandler adminHandler;
    private final GatewayMetrics metrics;
    private final AtomicLong requestIds;

    private NettyClientConnection connection;
    private byte[] infoFrame;
    private boolean handedOff;

    RequestFrameHandler(Consumer<Request> admission,
                        AdminHandler adminHandler,
                        GatewayMetrics metrics,
                        AtomicLong requestIds) {
        this.admission = Objects.requireNonNull(admission, "admission");
        this.adminHandler = Objects.requireNonNull(adminHandler, "adminHandler");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.requestIds = Objects.requireNonNull(requestIds, "requestIds");
    }

    @Override
    public void channelActive(ChannelHandlerContext ctx) throws Exception {
        connection = new NettyClientConnection(ctx.channel());
        metrics.incConnectionsAccepted(1L);
        LOG.fine(() -> "Accepted connection " + connection.connectionId() + " from " + ctx.channel().remoteAddress());
        super.channelActive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, ByteBuf frame) {
        if (handedOff) {
            LOG.fine(() -> "Ignoring extra frame on connection " + connection.connectionId());
            return;
        }
        byte[] raw = ByteBufUtil.getBytes(frame);
        Term term;
        try {
            term = TermCodec.decode(raw);
        } catch (TermDecodeException e) {
            protocolError("undecodable", "undecodable frame: " + e.getMessage());
            return;
        }
        LOG.fine(() -> "Got term " + term + " on connection " + connection.connectionId());

        InboundMessage message = ProtocolClassifier.classify(term);
        if (message instanceof InboundMessage.Info) {
            infoFrame = raw;
        } else if (message instanceof InboundMessage.AdminCall admin) {
            handOff(ctx);
            adminHandler.handle(admin, connection);
        } else if (message instanceof InboundMessage.Action action) {
            handOff(ctx);
            dispatch(action, raw);
        } else {
            protocolError("unexpected_term", "unexpected term " + term);
        }
    }

    private void dispatch(InboundMessage.Action action, byte[] actionFrame) {
        Request request = new Request(requestIds.incrementAndGet(), connection, infoFrame, actionFrame, action);
        metrics.incRequests(1L);
        if (action instanceof InboundMessage.Cast) {
            connection.sendAndClose(OutboundMessages.noreply());
            LOG.fine(() -> "Acknowledged cast " + request);
        }
        admission.accept(request);
    }

    private void handOff(ChannelHandlerContext ctx) {
        handedOff = true;
        ctx.channel().config().setAutoRead(false);
    }

    private void protocolError(String reason, String detail) {
        handedOff = true;
        metrics.incProtocolErrors(1L, reason);
        LOG.warning("Protocol error on connection " + connection.connectionId() + ": " + detail);
        connection.close();
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (!handedOff) {
            LOG.fine(() -> "Connection " + connection.connectionId() + " closed before a request arrived");
            connection.close();
        }
        super.channelInactive(ctx);
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        metrics.incProtocolErrors(1L, cause.getClass().getSimpleName());
        LOG.warning("Connection " + (connection == null ? "?" : connection.connectionId())
            + " failed: " + cause);
        if (connection != null) {
            connection.close();
        } else {
            ctx.close();
        }
    }
}
