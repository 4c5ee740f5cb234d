package com.questrail.fathom.protocol.transport;

import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * FakeDuplexEndpoint
 * -----------------------------------------------------------------------------
 * Test-only {@link DuplexEndpoint} implementation.
 *
 * <p>It contains no protocol semantics; it only stores outbound frames and
 * allows tests to inject inbound frames and connection events.</p>
 */
public final class FakeDuplexEndpoint implements DuplexEndpoint {

    private static final SocketAddress REMOTE = InetSocketAddress.createUnresolved("fake-peer", 7070);

    private DuplexEndpointListener listener;
    private final List<String> sent = new ArrayList<>();
    private boolean open = true;

    @Override
    public void setListener(DuplexEndpointListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public synchronized void send(byte[] frame) {
        Objects.requireNonNull(frame, "frame");
        if (open) {
            sent.add(new String(frame, StandardCharsets.UTF_8));
        }
    }

    @Override
    public void close() {
        boolean wasOpen;
        synchronized (this) {
            wasOpen = open;
            open = false;
        }
        if (wasOpen && listener != null) {
            listener.onDisconnected(null);
        }
    }

    @Override
    public synchronized boolean isOpen() {
        return open;
    }

    @Override
    public Optional<SocketAddress> remoteAddress() {
        return Optional.of(REMOTE);
    }

    // ---------------------------------------------------------------------
    // Test helpers
    // ---------------------------------------------------------------------

    public void connect() {
        requireListener().onConnected();
    }

    public void inject(String json) {
        requireListener().onFrame(json.getBytes(StandardCharsets.UTF_8));
    }

    public void rejectFrame(String reason) {
        requireListener().onFrameRejected(reason);
    }

    /**
     * Simulates the peer going away.
     */
    public void drop(Throwable cause) {
        synchronized (this) {
            open = false;
        }
        requireListener().onDisconnected(cause);
    }

    public synchronized List<String> sentFrames() {
        return new ArrayList<>(sent);
    }

    public synchronized void clearSent() {
        sent.clear();
    }

    private DuplexEndpointListener requireListener() {
        if (listener == null) {
            throw new IllegalStateException("No listener installed");
        }
        return listener;
    }
}
