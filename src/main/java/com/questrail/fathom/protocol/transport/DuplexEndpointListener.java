package com.questrail.fathom.protocol.transport;

/**
 * Callback sink for a {@link DuplexEndpoint}.
 *
 * <p>Implementations deliver callbacks serially for one endpoint; Netty
 * endpoints deliver them on the channel's event loop.</p>
 */
public interface DuplexEndpointListener
{
    /**
     * The endpoint is open and frames may flow.
     */
    void onConnected();

    /**
     * The endpoint is closed. Delivered at most once.
     *
     * @param cause failure that closed the endpoint, or {@code null} for an orderly close
     */
    void onDisconnected(Throwable cause);

    /**
     * One complete frame, without its delimiter.
     */
    void onFrame(byte[] frame);

    /**
     * A frame was discarded by the transport before it could be delivered,
     * typically because it exceeded the maximum frame length.
     */
    default void onFrameRejected(String reason) {
    }
}
