package com.questrail.fathom.protocol.session;

import com.questrail.fathom.protocol.FathomProtocolException;
import com.questrail.fathom.protocol.codec.EnvelopeDecodeException;
import com.questrail.fathom.protocol.config.InitiatorConfig;
import com.questrail.fathom.protocol.internal.events.ExecutionEvent;
import com.questrail.fathom.protocol.internal.events.ExecutionLifecycleEvent;
import com.questrail.fathom.protocol.internal.events.ExecutionMessageEvent;
import com.questrail.fathom.protocol.internal.exec.ExecutionMachine;
import com.questrail.fathom.protocol.internal.state.ExecutionState;
import com.questrail.fathom.protocol.internal.state.ExecutionStateReducer;
import com.questrail.fathom.protocol.internal.time.Cancellable;
import com.questrail.fathom.protocol.model.Envelope;
import com.questrail.fathom.protocol.model.ErrorCode;
import com.questrail.fathom.protocol.model.ExecutionId;
import com.questrail.fathom.protocol.model.ExecutionRequest;
import com.questrail.fathom.protocol.model.MessageType;
import com.questrail.fathom.protocol.model.OutputChannel;
import com.questrail.fathom.protocol.model.Payload;
import com.questrail.fathom.protocol.model.Role;
import com.questrail.fathom.protocol.model.ServerLoad;
import com.questrail.fathom.protocol.observability.ProtocolObservabilityEvent;
import com.questrail.fathom.protocol.transport.DuplexEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * InitiatorSession
 * =============================================================================
 * Client side of one connection.
 *
 * <h2>Usage</h2>
 * <pre>
 *   session.handshake().join();
 *   PendingExecution run = session.submit(request, listener);
 *   ExecutionOutcome outcome = run.outcome().join();
 * </pre>
 *
 * <h2>Behavior</h2>
 * <ul>
 *   <li>Each submission gets its own machine; inbound messages for it are
 *       turned into events and fed to that machine in arrival order</li>
 *   <li>Messages for an execution that has already settled are dropped and
 *       reported as late</li>
 *   <li>Pongs answer pings in the order the pings were sent</li>
 *   <li>When the connection drops, every unsettled execution settles as
 *       abandoned with a retryable {@code NETWORK_ERROR}</li>
 * </ul>
 */
public final class InitiatorSession extends ConnectionSession
{
    private static final Logger log = LoggerFactory.getLogger(InitiatorSession.class);

    private final InitiatorConfig config;
    private final ExecutionStateReducer reducer;
    private final Consumer<Throwable> onClosed;

    private final Deque<CompletableFuture<Optional<ServerLoad>>> pendingPings = new ArrayDeque<>();

    public InitiatorSession(DuplexEndpoint endpoint,
                            SessionContext context,
                            InitiatorConfig config,
                            ExecutionStateReducer reducer,
                            Consumer<Throwable> onClosed) {
        super(Role.INITIATOR, endpoint, context, config.protocolVersion());
        this.config = config;
        this.reducer = Objects.requireNonNull(reducer, "reducer");
        this.onClosed = onClosed;
    }

    // =====================================================================
    // Caller API
    // =====================================================================

    /**
     * Sends a ping and completes once the first pong arrives. Fails with
     * {@code NETWORK_ERROR} if no pong arrives within the configured
     * handshake timeout or the connection drops first.
     */
    public CompletableFuture<Void> handshake() {
        CompletableFuture<Void> done = new CompletableFuture<>();
        Cancellable timeout = context.scheduler().scheduleAfter(config.handshakeTimeout(), context.clock(), () ->
                done.completeExceptionally(new FathomProtocolException(ErrorCode.NETWORK_ERROR,
                        "No pong within " + config.handshakeTimeout().toMillis() + " ms")));

        ping().whenComplete((load, failure) -> {
            timeout.cancel();
            if (failure != null) {
                done.completeExceptionally(failure);
            } else {
                done.complete(null);
            }
        });
        return done;
    }

    /**
     * Sends a ping. The future completes with the load the responder
     * reported in its pong, if any.
     */
    public CompletableFuture<Optional<ServerLoad>> ping() {
        CompletableFuture<Optional<ServerLoad>> future = new CompletableFuture<>();
        synchronized (pendingPings) {
            if (isClosed()) {
                future.completeExceptionally(closedException());
                return future;
            }
            pendingPings.addLast(future);
        }
        if (!send(Envelope.ping(now()))) {
            synchronized (pendingPings) {
                pendingPings.remove(future);
            }
            future.completeExceptionally(closedException());
        }
        return future;
    }

    /**
     * Submits a request on this connection.
     *
     * @throws FathomProtocolException {@code NETWORK_ERROR} if the session is closed,
     *                                 {@code INVALID_REQUEST} if the id is already in flight
     */
    public PendingExecution submit(ExecutionRequest request, ExecutionListener listener) {
        Objects.requireNonNull(request, "request");
        ExecutionListener callbacks = listener == null ? ExecutionListener.NONE : listener;

        if (isClosed()) {
            throw closedException();
        }

        PendingExecution pending = new PendingExecution(request, context.wallClock(), context.clock());
        ExecutionMachine machine = registry().register(request.id(), () -> new ExecutionMachine(
                ExecutionState.initial(Role.INITIATOR, request, now(), tick()),
                reducer,
                new InitiatorIntentExecutor(this, pending, callbacks),
                context.machineExecutor(),
                sink));
        pending.attach(machine);

        machine.submit(new ExecutionLifecycleEvent.Submitted(request, now(), tick()));
        return pending;
    }

    public PendingExecution submit(ExecutionRequest request) {
        return submit(request, ExecutionListener.NONE);
    }

    public InitiatorConfig config() {
        return config;
    }

    // =====================================================================
    // Inbound
    // =====================================================================

    @Override
    protected void dispatch(Envelope envelope) {
        if (envelope.type() == MessageType.PONG) {
            onPong(envelope.payload(Payload.Pong.class).load());
            return;
        }

        Optional<ExecutionId> id = envelope.executionId();
        if (id.isEmpty()) {
            // Only an error may arrive without an id here.
            Payload.Error error = envelope.payload(Payload.Error.class);
            sink.onProtocolEvent(ProtocolObservabilityEvent.of(now(), role(),
                    ProtocolObservabilityEvent.Kind.CONNECTION_ERROR,
                    error.error().code().wireName() + ": " + error.error().message()));
            return;
        }

        Optional<ExecutionMachine> machine = registry().find(id.get());
        if (machine.isEmpty()) {
            sink.onProtocolEvent(ProtocolObservabilityEvent.of(now(), role(),
                    ProtocolObservabilityEvent.Kind.LATE_MESSAGE, id.get(), envelope.type().wireName()));
            return;
        }
        machine.get().submit(toEvent(envelope, now(), tick()));
    }

    private static ExecutionEvent toEvent(Envelope envelope, Instant now, long tick) {
        switch (envelope.type()) {
            case ACK:
                return new ExecutionMessageEvent.AckReceived(now, tick);
            case STATUS:
                return new ExecutionMessageEvent.StatusReceived(
                        envelope.payload(Payload.Status.class).status(), now, tick);
            case STDOUT:
            case STDERR:
                return new ExecutionMessageEvent.OutputReceived(OutputChannel.of(envelope.type()),
                        envelope.payload(Payload.Output.class).data(), now, tick);
            case RESULT:
                return new ExecutionMessageEvent.ResultReceived(
                        envelope.payload(Payload.Result.class).result(), now, tick);
            case ERROR:
                return new ExecutionMessageEvent.ErrorReceived(
                        envelope.payload(Payload.Error.class).error(), now, tick);
            default:
                throw new IllegalStateException("Unexpected " + envelope.type().wireName());
        }
    }

    private void onPong(Optional<ServerLoad> load) {
        CompletableFuture<Optional<ServerLoad>> waiting;
        synchronized (pendingPings) {
            waiting = pendingPings.pollFirst();
        }
        if (waiting == null) {
            log.debug("Unsolicited pong from {}", describePeer());
            return;
        }
        waiting.complete(load);
    }

    @Override
    protected void onDecodeFailure(EnvelopeDecodeException failure) {
        // Nothing is sent back; the responder is never told about our decode failures.
        log.warn("Dropped undecodable frame from {}: {}", describePeer(), failure.getMessage());
    }

    @Override
    protected void onWrongDirection(Envelope envelope) {
        log.warn("Dropped {} from {}: responders may not send it", envelope.type().wireName(), describePeer());
    }

    @Override
    protected void onVersionMismatch(Envelope envelope) {
        log.warn("Dropped {} v{} from {}: session negotiated v{}",
                envelope.type().wireName(), envelope.version(), describePeer(), negotiatedVersion().getAsInt());
    }

    @Override
    protected void disconnected(Throwable cause) {
        List<CompletableFuture<Optional<ServerLoad>>> orphaned;
        synchronized (pendingPings) {
            orphaned = new ArrayList<>(pendingPings);
            pendingPings.clear();
        }
        FathomProtocolException failure = closedException();
        orphaned.forEach(future -> future.completeExceptionally(failure));

        if (onClosed != null) {
            onClosed.accept(cause);
        }
    }

    private static FathomProtocolException closedException() {
        return new FathomProtocolException(ErrorCode.NETWORK_ERROR, "Connection is closed");
    }
}
