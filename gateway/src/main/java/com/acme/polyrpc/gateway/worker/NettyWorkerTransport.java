package com.acme.polyrpc.gateway.worker;

import com.acme.polyrpc.gateway.pool.Asset;
import com.acme.polyrpc.gateway.util.GatewayDefaults;
import io.netty.bootstrap.Bootstrap;
import io.netty.buffer.ByteBuf;
import io.netty.buffer.ByteBufUtil;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LengthFieldBasedFrameDecoder;
import io.netty.handler.codec.LengthFieldPrepender;
import io.netty.handler.timeout.ReadTimeoutHandler;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Logger;

/**
 * Worker transport over TCP: one connection per call, the action frame goes out
 * with a 4-byte length prefix and the first length-prefixed frame that comes back
 * is the response.
 */
public final class NettyWorkerTransport implements WorkerTransport {
    private static final Logger LOG = Logger.getLogger(NettyWorkerTransport.class.getName());

    private final EventLoopGroup ioGroup;
    private final Bootstrap bootstrap;
    private final int maxFrameBytes;
    private final long responseTimeoutMillis;

    public NettyWorkerTransport() {
        this(GatewayDefaults.DEFAULT_WORKER_IO_THREADS, GatewayDefaults.MAX_FRAME_BYTES,
            GatewayDefaults.DEFAULT_WORKER_TIMEOUT_MS);
    }

    /**
     * @param responseTimeoutMillis read timeout per call; {@code 0} waits for the worker indefinitely
     */
    public NettyWorkerTransport(int ioThreads, int maxFrameBytes, long responseTimeoutMillis) {
        this.maxFrameBytes = Math.max(1, maxFrameBytes);
        this.responseTimeoutMillis = Math.max(0L, responseTimeoutMillis);
        int threads = ioThreads > 0 ? ioThreads : Math.max(2, Runtime.getRuntime().availableProcessors());
        this.ioGroup = new NioEventLoopGroup(threads);
        this.bootstrap = new Bootstrap()
            .group(ioGroup)
            .channel(NioSocketChannel.class)
            .option(ChannelOption.TCP_NODELAY, true)
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, GatewayDefaults.DEFAULT_CONNECT_TIMEOUT_MS);
    }

    @Override
    public CompletableFuture<byte[]> rpc(Asset asset, byte[] actionFrame) {
        Objects.requireNonNull(asset, "asset");
        Objects.requireNonNull(actionFrame, "actionFrame");
        CompletableFuture<byte[]> result = new CompletableFuture<>();

        Bootstrap b = bootstrap.clone().handler(new ChannelInitializer<SocketChannel>() {
            @Override
            protected void initChannel(SocketChannel ch) {
                if (responseTimeoutMillis > 0) {
                    ch.pipeline().addLast(new ReadTimeoutHandler(responseTimeoutMillis, TimeUnit.MILLISECONDS));
                }
                ch.pipeline().addLast(new LengthFieldBasedFrameDecoder(maxFrameBytes, 0, 4, 0, 4));
                ch.pipeline().addLast(new LengthFieldPrepender(4));
                ch.pipeline().addLast(new ResponseHandler(result, asset));
            }
        });

        ChannelFuture connect = b.connect(asset.host(), asset.port());
        Channel channel = connect.channel();
        result.whenComplete((ignored, error) -> {
            if (error != null) {
                channel.close();
            }
        });
        connect.addListener((ChannelFutureListener) connected -> {
            if (!connected.isSuccess()) {
                result.completeExceptionally(connected.cause());
                return;
            }
            connected.channel().writeAndFlush(Unpooled.wrappedBuffer(actionFrame))
                .addListener((ChannelFutureListener) written -> {
                    if (!written.isSuccess()) {
                        result.completeExceptionally(written.cause());
                    }
                });
        });
        return result;
    }

    @Override
    public void close() {
        ioGroup.shutdownGracefully().syncUninterruptibly();
        LOG.info("Worker transport stopped");
    }

    private static final class ResponseHandler extends SimpleChannelInboundHandler<ByteBuf> {
        private final CompletableFuture<byte[]> result;
        private final Asset asset;

        private ResponseHandler(CompletableFuture<byte[]> result, Asset asset) {
            this.result = result;
            this.asset = asset;
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf frame) {
            result.complete(ByteBufUtil.getBytes(frame));
            ctx.close();
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            result.completeExceptionally(new IOException(
                "worker " + asset.id() + " closed the connection before responding"));
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            result.completeExceptionally(cause);
            ctx.close();
        }
    }
}
