package com.acme.polyrpc.gateway.transport.netty;

import com.acme.polyrpc.gateway.admin.AdminHandler;
import com.acme.polyrpc.gateway.admission.Request;
import com.acme.polyrpc.gateway.telemetry.GatewayMetrics;
import com.acme.polyrpc.gateway.telemetry.NoopGatewayMetrics;
import com.acme.polyrpc.gateway.util.GatewayDefaults;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * TCP acceptor for length-framed term requests. Accepting runs on the Netty boss
 * loop and per-connection decoding on the worker loops; neither waits on admission.
 */
public final class GatewayServer implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(GatewayServer.class.getName());

    private final int port;
    private final ListenRetryPolicy retryPolicy;
    private final int maxFrameBytes;
    private final Consumer<Request> admission;
    private final AdminHandler adminHandler;
    private final GatewayMetrics metrics;
    private final AtomicLong requestIds = new AtomicLong();

    private volatile EventLoopGroup bossGroup;
    private volatile EventLoopGroup workerGroup;
    private volatile Channel serverChannel;

    public GatewayServer(int port,
                         Consumer<Request> admission,
                         AdminHandler adminHandler) {
        this(port, ListenRetryPolicy.DEFAULT, GatewayDefaults.MAX_FRAME_BYTES, admission, adminHandler,
            NoopGatewayMetrics.INSTANCE);
    }

    public GatewayServer(int port,
                         ListenRetryPolicy retryPolicy,
                         int maxFrameBytes,
                         Consumer<Request> admission,
                         AdminHandler adminHandler,
                         GatewayMetrics metrics) {
        this.port = port;
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.maxFrameBytes = Math.max(1, maxFrameBytes);
        this.admission = Objects.requireNonNull(admission, "admission");
        this.adminHandler = Objects.requireNonNull(adminHandler, "adminHandler");
        this.metrics = metrics == null ? NoopGatewayMetrics.INSTANCE : metrics;
    }

    /**
     * Binds the listening socket, retrying per {@link ListenRetryPolicy}.
     *
     * @throws GatewayStartupException when every attempt failed
     */
    public synchronized void start() {
        if (serverChannel != null) {
            return;
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        ServerBootstrap bootstrap = new ServerBootstrap()
            .group(bossGroup, workerGroup)
            .channel(NioServerSocketChannel.class)
            .option(ChannelOption.SO_BACKLOG, GatewayDefaults.DEFAULT_SO_BACKLOG)
            .option(ChannelOption.SO_REUSEADDR, true)
            .childOption(ChannelOption.TCP_NODELAY, true)
            .childHandler(new ChannelInitializer<SocketChannel>() {
                @Override
                protected void initChannel(SocketChannel ch) {
                    ch.pipeline().addLast(new LengthFieldBasedFrameDecoder(maxFrameBytes, 0, 4, 0, 4));
                    ch.pipeline().addLast(new LengthFieldPrepender(4));
                    ch.pipeline().addLast(new RequestFrameHandler(admission, adminHandler, metrics, requestIds));
                }
            });

        Exception lastError = null;
        for (int attempt = 1; attempt <= retryPolicy.maxAttempts(); attempt++) {
            try {
                serverChannel = bootstrap.bind(port).sync().channel();
                LOG.info(() -> "Listening on port " + boundPort());
                return;
            } catch (Exception e) {
                lastError = e;
                int failedAttempt = attempt;
                LOG.info(() -> "Could not listen on port " + port + ": " + e
                    + " (attempt " + failedAttempt + "/" + retryPolicy.maxAttempts() + ")");
            }
            if (attempt < retryPolicy.maxAttempts()) {
                try {
                    Thread.sleep(retryPolicy.delayMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    lastError = e;
                    break;
                }
            }
        }
        LOG.severe("Could not listen on port " + port);
        stop();
        throw new GatewayStartupException("Could not listen on port " + port, lastError);
    }

    /** Actual listening port; differs from the configured one when that was 0. */
    public int boundPort() {
        Channel ch = serverChannel;
        if (ch == null) {
            throw new IllegalStateException("server not started");
        }
        return ((InetSocketAddress) ch.localAddress()).getPort();
    }

    public synchronized void stop() {
        Channel ch = serverChannel;
        serverChannel = null;
        if (ch != null) {
            try {
                ch.close().syncUninterruptibly();
            } catch (Exception e) {
                LOG.log(Level.FINE, "Closing server channel failed", e);
            }
        }
        EventLoopGroup workers = workerGroup;
        workerGroup = null;
        if (workers != null) {
            workers.shutdownGracefully().syncUninterruptibly();
        }
        EventLoopGroup boss = bossGroup;
        bossGroup = null;
        if (boss != null) {
            boss.shutdownGracefully().syncUninterruptibly();
        }
        if (ch != null) {
            LOG.info("Gateway listener stopped");
        }
    }

    @Override
    public void close() {
        stop();
    }
}
