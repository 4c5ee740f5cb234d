package com.questrail.fathom.protocol.transport.tcp.netty;

import com.questrail.fathom.protocol.transport.DuplexEndpoint;
import com.questrail.fathom.protocol.transport.DuplexEndpointListener;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * NettyTcpServer
 * =============================================================================
 * Accepts TCP connections and gives each one its own listener.
 *
 * <p>The session factory is called on the event loop for every accepted
 * channel, before the channel becomes active. Whatever it returns receives the
 * endpoint's callbacks.</p>
 *
 * <h2>Lifecycle</h2>
 * {@link #start()} binds synchronously. {@link #stop()} closes the listening
 * socket and every accepted channel and shuts the event loops down.
 */
public final class NettyTcpServer
{
    private static final Logger log = LoggerFactory.getLogger(NettyTcpServer.class);

    private final InetSocketAddress bindAddress;
    private final int maxFrameBytes;
    private final Function<DuplexEndpoint, DuplexEndpointListener> sessionFactory;

    private final EventLoopGroup bossGroup;
    private final EventLoopGroup workerGroup;

    private volatile Channel serverChannel;

    public NettyTcpServer(InetSocketAddress bindAddress,
                          int maxFrameBytes,
                          Function<DuplexEndpoint, DuplexEndpointListener> sessionFactory) {
        this.bindAddress = Objects.requireNonNull(bindAddress, "bindAddress");
        this.sessionFactory = Objects.requireNonNull(sessionFactory, "sessionFactory");
        if (maxFrameBytes <= 0) {
            throw new IllegalArgumentException("maxFrameBytes must be positive");
        }
        this.maxFrameBytes = maxFrameBytes;
        this.bossGroup = new NioEventLoopGroup(1);
        this.workerGroup = new NioEventLoopGroup();
    }

    public void start() {
        ServerBootstrap bootstrap = new ServerBootstrap()
                .group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_REUSEADDR, true)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childOption(ChannelOption.SO_KEEPALIVE, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    protected void initChannel(SocketChannel ch) {
                        NettyChannelEndpoint endpoint = NettyChannelEndpoint.install(ch, maxFrameBytes);
                        endpoint.setListener(sessionFactory.apply(endpoint));
                    }
                });

        serverChannel = bootstrap.bind(bindAddress).syncUninterruptibly().channel();
        log.info("Fathom responder listening on {}", serverChannel.localAddress());
    }

    /**
     * Address actually bound; useful when binding to port 0.
     *
     * @throws IllegalStateException before {@link #start()}
     */
    public InetSocketAddress boundAddress() {
        Channel ch = serverChannel;
        if (ch == null) {
            throw new IllegalStateException("server not started");
        }
        return (InetSocketAddress) ch.localAddress();
    }

    public void stop() {
        Channel ch = serverChannel;
        if (ch != null) {
            ch.close().syncUninterruptibly();
        }
        workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
        bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).syncUninterruptibly();
    }
}
