package com.questrail.fathom.protocol.session;

import com.questrail.fathom.protocol.codec.EnvelopeDecodeException;
import com.questrail.fathom.protocol.internal.events.ExecutionLifecycleEvent;
import com.questrail.fathom.protocol.internal.exec.DeadlineWatchdog;
import com.questrail.fathom.protocol.internal.exec.ExecutionMachine;
import com.questrail.fathom.protocol.internal.exec.ExecutionRegistry;
import com.questrail.fathom.protocol.internal.state.ExecutionIntent;
import com.questrail.fathom.protocol.model.Envelope;
import com.questrail.fathom.protocol.model.ExecutionId;
import com.questrail.fathom.protocol.model.Role;
import com.questrail.fathom.protocol.observability.ConnectionObservabilityEvent;
import com.questrail.fathom.protocol.observability.FathomErrorEvent;
import com.questrail.fathom.protocol.observability.FathomObservabilitySink;
import com.questrail.fathom.protocol.observability.ProtocolObservabilityEvent;
import com.questrail.fathom.protocol.transport.DuplexEndpoint;
import com.questrail.fathom.protocol.transport.DuplexEndpointListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ConnectionSession
 * =============================================================================
 * Protocol endpoint bound to one physical connection.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Decode inbound frames and route them: connection-scoped messages are
 *       handled here, execution-scoped ones go to the owning machine</li>
 *   <li>Fix the negotiated version on the first decoded envelope</li>
 *   <li>Serialize outbound envelopes onto the endpoint</li>
 *   <li>Own the execution registry and the deadline watchdog</li>
 *   <li>Abandon every execution when the connection goes away</li>
 * </ul>
 *
 * <h2>Threading</h2>
 * {@link #onFrame(byte[])} runs on the transport thread and never blocks on
 * execution work; machines drain on the context's executor. {@link #send}
 * may be called from any thread.
 *
 * <h2>Lifetime</h2>
 * A session lives exactly as long as its connection. Executions never move
 * to another session: after a reconnect the initiator starts over.
 */
public abstract class ConnectionSession implements DuplexEndpointListener
{
    private static final Logger log = LoggerFactory.getLogger(ConnectionSession.class);

    protected final SessionContext context;
    protected final FathomObservabilitySink sink;

    private final Role role;
    private final DuplexEndpoint endpoint;
    private final ExecutionRegistry registry = new ExecutionRegistry();
    private final DeadlineWatchdog watchdog;

    private final Object sendLock = new Object();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile boolean established;
    private volatile int negotiatedVersion;
    private volatile int outboundVersion;

    protected ConnectionSession(Role role, DuplexEndpoint endpoint, SessionContext context, int outboundVersion) {
        this.role = Objects.requireNonNull(role, "role");
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.context = Objects.requireNonNull(context, "context");
        this.sink = context.sink();
        this.outboundVersion = outboundVersion;
        this.watchdog = new DeadlineWatchdog(context.scheduler(), context.clock(), this::onDeadlineExpired, sink);
    }

    // =====================================================================
    // Transport callbacks
    // =====================================================================

    @Override
    public void onConnected() {
        sink.onConnectionEvent(new ConnectionObservabilityEvent(now(), role,
                ConnectionObservabilityEvent.Kind.CONNECTED, describePeer()));
        connected();
    }

    @Override
    public void onDisconnected(Throwable cause) {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        watchdog.close();

        Instant now = now();
        long tick = tick();
        for (ExecutionMachine machine : registry.machines()) {
            machine.submit(new ExecutionLifecycleEvent.ConnectionLost(now, tick));
        }

        sink.onConnectionEvent(new ConnectionObservabilityEvent(now, role,
                ConnectionObservabilityEvent.Kind.DISCONNECTED,
                cause == null ? describePeer() : describePeer() + ": " + cause.getMessage()));
        disconnected(cause);
    }

    @Override
    public void onFrame(byte[] frame) {
        if (closed.get()) {
            return;
        }

        final Envelope envelope;
        try {
            envelope = context.decoder().decode(frame);
        } catch (EnvelopeDecodeException e) {
            sink.onProtocolEvent(ProtocolObservabilityEvent.of(now(), role,
                    ProtocolObservabilityEvent.Kind.DECODE_FAILURE, e.reason() + ": " + e.getMessage()));
            onDecodeFailure(e);
            return;
        }

        if (!established) {
            established = true;
            negotiatedVersion = envelope.version();
            outboundVersion = envelope.version();
            sink.onProtocolEvent(ProtocolObservabilityEvent.of(now(), role,
                    ProtocolObservabilityEvent.Kind.HANDSHAKE_COMPLETE, "version " + envelope.version()));
            sink.onConnectionEvent(new ConnectionObservabilityEvent(now(), role,
                    ConnectionObservabilityEvent.Kind.ESTABLISHED, describePeer()));
        }

        try {
            if (envelope.version() != negotiatedVersion) {
                sink.onProtocolEvent(new ProtocolObservabilityEvent(now(), role,
                        ProtocolObservabilityEvent.Kind.PROTOCOL_VIOLATION, envelope.executionId(),
                        "version " + envelope.version() + " after negotiating " + negotiatedVersion));
                onVersionMismatch(envelope);
                return;
            }
            if (!envelope.type().receivableBy(role)) {
                sink.onProtocolEvent(new ProtocolObservabilityEvent(now(), role,
                        ProtocolObservabilityEvent.Kind.PROTOCOL_VIOLATION, envelope.executionId(),
                        envelope.type().wireName() + " is not accepted by the " + role.name().toLowerCase()));
                onWrongDirection(envelope);
                return;
            }
            dispatch(envelope);
        } catch (RuntimeException e) {
            sink.onError(new FathomErrorEvent(now(), "Failed to handle " + envelope.type().wireName(), e));
        }
    }

    @Override
    public void onFrameRejected(String reason) {
        onDecodeFailure(new EnvelopeDecodeException(EnvelopeDecodeException.Reason.MALFORMED,
                "Frame rejected by transport: " + reason));
    }

    // =====================================================================
    // Role hooks
    // =====================================================================

    /** Handles a decoded envelope whose direction is valid for this role. */
    protected abstract void dispatch(Envelope envelope);

    /** Handles a frame that could not be decoded. */
    protected abstract void onDecodeFailure(EnvelopeDecodeException failure);

    /** Handles a decoded envelope that only the other role may receive. */
    protected abstract void onWrongDirection(Envelope envelope);

    /** Handles a decoded envelope whose version differs from the negotiated one. */
    protected abstract void onVersionMismatch(Envelope envelope);

    protected void connected() {
    }

    protected void disconnected(Throwable cause) {
    }

    // =====================================================================
    // Outbound
    // =====================================================================

    /**
     * Encodes and writes one envelope. Envelopes are stamped with the
     * negotiated version.
     *
     * @return {@code false} if the session is closed and the envelope was dropped
     */
    public boolean send(Envelope envelope) {
        Objects.requireNonNull(envelope, "envelope");
        synchronized (sendLock) {
            if (closed.get() || !endpoint.isOpen()) {
                log.debug("{} session closed; dropping {}", role, envelope.type().wireName());
                return false;
            }
            Envelope stamped = envelope.version() == outboundVersion
                    ? envelope
                    : new Envelope(outboundVersion, envelope.type(),
                            envelope.executionId().orElse(null), envelope.timestamp(), envelope.payload());
            endpoint.send(context.encoder().encode(stamped));
            return true;
        }
    }

    /**
     * Closes the connection. Owned executions are abandoned.
     */
    public void close() {
        endpoint.close();
        onDisconnected(null);
        sink.onConnectionEvent(new ConnectionObservabilityEvent(now(), role,
                ConnectionObservabilityEvent.Kind.CLOSED, describePeer()));
    }

    // =====================================================================
    // Intents shared by both roles
    // =====================================================================

    /**
     * Carries out deadline and eviction intents.
     *
     * @return {@code true} if the intent was one of them
     */
    protected boolean handleCommonIntent(ExecutionMachine machine, ExecutionIntent intent) {
        switch (intent.kind()) {
            case ARM_DEADLINE:
                watchdog.arm(machine.id(), ((ExecutionIntent.ArmDeadline) intent).deadlineNanos());
                return true;
            case DISARM_DEADLINE:
                watchdog.disarm(machine.id());
                return true;
            case EVICT:
                watchdog.disarm(machine.id());
                if (registry.evict(machine)) {
                    evicted(machine);
                }
                return true;
            case REPORT_VIOLATION:
                sink.onProtocolEvent(ProtocolObservabilityEvent.of(now(), role,
                        ProtocolObservabilityEvent.Kind.PROTOCOL_VIOLATION, machine.id(),
                        ((ExecutionIntent.ReportViolation) intent).detail()));
                return true;
            default:
                return false;
        }
    }

    /**
     * Called once after {@code machine} left the registry.
     */
    protected void evicted(ExecutionMachine machine) {
    }

    private void onDeadlineExpired(ExecutionId id) {
        registry.find(id).ifPresent(machine ->
                machine.submit(new ExecutionLifecycleEvent.DeadlineElapsed(now(), tick())));
    }

    // =====================================================================
    // Accessors
    // =====================================================================

    public Role role() {
        return role;
    }

    public boolean isEstablished() {
        return established;
    }

    /**
     * Version fixed by the first decoded envelope, if any has arrived.
     */
    public OptionalInt negotiatedVersion() {
        return established ? OptionalInt.of(negotiatedVersion) : OptionalInt.empty();
    }

    public boolean isClosed() {
        return closed.get();
    }

    public ExecutionRegistry registry() {
        return registry;
    }

    protected DeadlineWatchdog watchdog() {
        return watchdog;
    }

    protected Instant now() {
        return context.wallClock().now();
    }

    protected long tick() {
        return context.clock().nowNanos();
    }

    protected String describePeer() {
        return endpoint.remoteAddress().map(Object::toString).orElse("peer");
    }
}
