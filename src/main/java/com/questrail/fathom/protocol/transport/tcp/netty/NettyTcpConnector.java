package com.questrail.fathom.protocol.transport.tcp.netty;

import com.questrail.fathom.protocol.transport.DuplexEndpoint;
import com.questrail.fathom.protocol.transport.DuplexEndpointListener;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * NettyTcpConnector
 * =============================================================================
 * Opens outbound TCP connections for the initiator.
 *
 * <p>One connector owns one event loop and can open any number of
 * connections over its lifetime; the initiator runtime uses it again for every
 * reconnect.</p>
 */
public final class NettyTcpConnector
{
    private final int maxFrameBytes;
    private final Duration connectTimeout;
    private final EventLoopGroup group;

    public NettyTcpConnector(int maxFrameBytes, Duration connectTimeout) {
        if (maxFrameBytes <= 0) {
            throw new IllegalArgumentException("maxFrameBytes must be positive");
        }
        this.maxFrameBytes = maxFrameBytes;
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
        this.group = new NioEventLoopGroup(1);
    }

    /**
     * Connects to {@code remote}. The listener produced by {@code sessionFactory}
     * is attached before the channel becomes active, so it sees
     * {@code onConnected} before the returned future completes.
     */
    public CompletableFuture<DuplexEndpoint> connect(InetSocketAddress remote,
                                                     Function<DuplexEndpoint, DuplexEndpointListener> sessionFactory) {
        Objects.requireNonNull(remote, "remote");
        Objects.requireNonNull(sessionFactory, "sessionFactory");

        CompletableFuture<DuplexEndpoint> result = new CompletableFuture<>();
        NettyChannelEndpoint[] endpoint = new NettyChannelEndpoint[1];

        Bootstrap bootstrap = new Bootstrap()
                .group(group)
                .channel(NioSocketChannel.class)
                .option(ChannelOption.TCP_NODELAY, true)
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(Integer.MAX_VALUE, connectTimeout.toMillis()))
                .handler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        endpoint[0] = NettyChannelEndpoint.install(ch, maxFrameBytes);
                        endpoint[0].setListener(sessionFactory.apply(endpoint[0]));
                    }
                });

        bootstrap.connect(remote).addListener((ChannelFutureListener) future -> {
            if (future.isSuccess()) {
                result.complete(endpoint[0]);
            } else {
                result.completeExceptionally(future.cause());
            }
        });
        return result;
    }

    public void close() {
        group.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
    }
}
