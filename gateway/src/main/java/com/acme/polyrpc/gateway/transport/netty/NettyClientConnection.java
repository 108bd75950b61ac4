package com.acme.polyrpc.gateway.transport.netty;

import com.acme.polyrpc.gateway.transport.api.ClientConnection;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link ClientConnection} over a Netty channel. Safe to use from any thread; the
 * pipeline's {@code LengthFieldPrepender} frames outgoing payloads.
 */
public final class NettyClientConnection implements ClientConnection {
    private static final Logger LOG = Logger.getLogger(NettyClientConnection.class.getName());
    private static final AtomicLong IDS = new AtomicLong();

    private final Channel channel;
    private final long connectionId;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile ChannelFuture lastWrite;

    public NettyClientConnection(Channel channel) {
        this.channel = Objects.requireNonNull(channel, "channel");
        this.connectionId = IDS.incrementAndGet();
    }

    @Override
    public long connectionId() {
        return connectionId;
    }

    @Override
    public void send(byte[] payload) {
        if (closed.get()) {
            LOG.fine(() -> "Dropping " + payload.length + " bytes for closed connection " + connectionId);
            return;
        }
        ChannelFuture write = channel.writeAndFlush(Unpooled.wrappedBuffer(payload));
        write.addListener((ChannelFutureListener) f -> {
            if (!f.isSuccess()) {
                // peer went away; nothing to report back to
                LOG.log(Level.FINE, "Write failed on connection " + connectionId, f.cause());
            }
        });
        lastWrite = write;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        ChannelFuture pending = lastWrite;
        if (pending != null) {
            pending.addListener(ChannelFutureListener.CLOSE);
        } else {
            channel.close();
        }
    }

    @Override
    public boolean isOpen() {
        return !closed.get() && channel.isActive();
    }

    Channel channel() {
        return channel;
    }
}
