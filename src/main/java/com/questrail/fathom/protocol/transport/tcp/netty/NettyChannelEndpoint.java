package com.questrail.fathom.protocol.transport.tcp.netty;

import com.questrail.fathom.protocol.transport.DuplexEndpoint;
import com.questrail.fathom.protocol.transport.DuplexEndpointListener;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.LineBasedFrameDecoder;
import io.netty.handler.codec.TooLongFrameException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.SocketAddress;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * NettyChannelEndpoint
 * =============================================================================
 * {@link DuplexEndpoint} over one Netty stream channel with newline framing.
 *
 * <h2>Netty containment rule</h2>
 * Netty types ({@code Channel}, {@code ByteBuf}, handlers) do not escape this
 * package. Inbound frames are copied into {@code byte[]} and every
 * reference-counted buffer is released here.
 *
 * <h2>Framing</h2>
 * Inbound: {@link LineBasedFrameDecoder} splits on {@code \n} (or {@code \r\n})
 * and strips the delimiter. A line longer than the configured maximum is
 * discarded and reported through {@link DuplexEndpointListener#onFrameRejected}.
 * Outbound: each frame is written followed by a single {@code \n}.
 */
final class NettyChannelEndpoint implements DuplexEndpoint
{
    private static final Logger log = LoggerFactory.getLogger(NettyChannelEndpoint.class);

    private static final byte[] DELIMITER = {'\n'};

    private final Channel channel;
    private final AtomicBoolean disconnected = new AtomicBoolean(false);

    private volatile DuplexEndpointListener listener;

    private NettyChannelEndpoint(Channel channel) {
        this.channel = Objects.requireNonNull(channel, "channel");
    }

    /**
     * Installs framing and the inbound handler on {@code channel} and returns the
     * endpoint wrapping it. Called from a {@code ChannelInitializer}.
     */
    static NettyChannelEndpoint install(Channel channel, int maxFrameBytes) {
        NettyChannelEndpoint endpoint = new NettyChannelEndpoint(channel);
        ChannelPipeline p = channel.pipeline();
        p.addLast(new LineBasedFrameDecoder(maxFrameBytes, true, false));
        p.addLast(endpoint.new InboundHandler());
        return endpoint;
    }

    @Override
    public void setListener(DuplexEndpointListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void send(byte[] frame) {
        Objects.requireNonNull(frame, "frame");
        if (!channel.isActive()) {
            log.debug("Dropping {} byte frame to closed channel {}", frame.length, channel.remoteAddress());
            return;
        }
        ByteBuf buf = Unpooled.wrappedBuffer(frame, DELIMITER);
        channel.writeAndFlush(buf).addListener((ChannelFutureListener) future -> {
            if (!future.isSuccess()) {
                log.debug("Write to {} failed", channel.remoteAddress(), future.cause());
            }
        });
    }

    @Override
    public void close() {
        channel.close();
    }

    @Override
    public boolean isOpen() {
        return channel.isActive() && !disconnected.get();
    }

    @Override
    public Optional<SocketAddress> remoteAddress() {
        return Optional.ofNullable(channel.remoteAddress());
    }

    private void fireDisconnected(Throwable cause) {
        if (disconnected.compareAndSet(false, true)) {
            DuplexEndpointListener l = listener;
            if (l != null) {
                l.onDisconnected(cause);
            }
        }
    }

    /**
     * Forwards complete lines to the port listener.
     */
    private final class InboundHandler extends SimpleChannelInboundHandler<ByteBuf>
    {
        @Override
        public void channelActive(ChannelHandlerContext ctx) throws Exception {
            DuplexEndpointListener l = listener;
            if (l != null) {
                l.onConnected();
            }
            super.channelActive(ctx);
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, ByteBuf frame) {
            DuplexEndpointListener l = listener;
            if (l == null) {
                return;
            }
            byte[] bytes = new byte[frame.readableBytes()];
            frame.getBytes(frame.readerIndex(), bytes);
            if (bytes.length == 0) {
                // Blank keep-alive line.
                return;
            }
            l.onFrame(bytes);
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) throws Exception {
            fireDisconnected(null);
            super.channelInactive(ctx);
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            if (cause instanceof TooLongFrameException) {
                DuplexEndpointListener l = listener;
                if (l != null) {
                    l.onFrameRejected(cause.getMessage());
                }
                return;
            }
            fireDisconnected(cause);
            ctx.close();
        }
    }
}
