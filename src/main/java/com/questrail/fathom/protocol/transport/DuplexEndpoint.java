package com.questrail.fathom.protocol.transport;

import java.net.SocketAddress;
import java.util.Optional;

/**
 * DuplexEndpoint
 * -----------------------------------------------------------------------------
 * One live, ordered, bidirectional frame channel to a single peer.
 *
 * <p>Frames are opaque byte arrays. The endpoint adds and strips the frame
 * delimiter; it never looks inside a frame.</p>
 *
 * <p>Implementations may be backed by Netty, java.nio, or an in-memory pair
 * in tests.</p>
 */
public interface DuplexEndpoint
{
    /**
     * Registers the listener. Must be called before the endpoint delivers its
     * first callback.
     */
    void setListener(DuplexEndpointListener listener);

    /**
     * Sends one frame. Frames from one thread are delivered in order. A frame
     * sent after the endpoint closed is discarded.
     */
    void send(byte[] frame);

    /**
     * Closes the endpoint. The listener is told once via
     * {@link DuplexEndpointListener#onDisconnected(Throwable)}.
     */
    void close();

    boolean isOpen();

    /**
     * Address of the peer, when the transport has one.
     */
    Optional<SocketAddress> remoteAddress();
}
