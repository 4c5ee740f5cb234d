package com.questrail.fathom.protocol.session;

import com.questrail.fathom.protocol.FathomProtocol;
import com.questrail.fathom.protocol.backend.ExecutionBackend;
import com.questrail.fathom.protocol.codec.EnvelopeDecodeException;
import com.questrail.fathom.protocol.config.ResponderConfig;
import com.questrail.fathom.protocol.internal.events.ExecutionLifecycleEvent;
import com.questrail.fathom.protocol.internal.exec.ExecutionAlreadyExistsException;
import com.questrail.fathom.protocol.internal.exec.ExecutionMachine;
import com.questrail.fathom.protocol.internal.exec.ExecutionSlots;
import com.questrail.fathom.protocol.internal.state.ExecutionState;
import com.questrail.fathom.protocol.internal.state.ExecutionStateReducer;
import com.questrail.fathom.protocol.model.Envelope;
import com.questrail.fathom.protocol.model.ErrorCode;
import com.questrail.fathom.protocol.model.ExecutionId;
import com.questrail.fathom.protocol.model.ExecutionRequest;
import com.questrail.fathom.protocol.model.Payload;
import com.questrail.fathom.protocol.model.ProtocolError;
import com.questrail.fathom.protocol.model.Role;
import com.questrail.fathom.protocol.observability.ProtocolObservabilityEvent;
import com.questrail.fathom.protocol.transport.DuplexEndpoint;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * ResponderSession
 * =============================================================================
 * Sandbox side of one connection.
 *
 * <h2>Admission</h2>
 * An {@code execute} request is checked in this order, and the first failure
 * is answered with an {@code error} carrying the request id and no {@code ack}:
 * <ol>
 *   <li>language supported, else {@code LANGUAGE_NOT_SUPPORTED}</li>
 *   <li>limits inside the configured bounds, else {@code INVALID_REQUEST}</li>
 *   <li>a free execution slot, else {@code SANDBOX_OVERLOADED}</li>
 *   <li>id not already live on this connection, else {@code INVALID_REQUEST}</li>
 * </ol>
 * An admitted request gets its own {@link ExecutionMachine}; from then on the
 * reducer decides every message sent for it.
 *
 * <h2>Connection-level failures</h2>
 * Undecodable frames and messages sent in the wrong direction are answered
 * with an {@code error} without an id. A version mismatch on the very first
 * frame also closes the connection.
 */
public final class ResponderSession extends ConnectionSession
{
    private final ResponderConfig config;
    private final ExecutionBackend backend;
    private final Executor pumpExecutor;
    private final ExecutionSlots slots;
    private final ExecutionStateReducer reducer;

    public ResponderSession(DuplexEndpoint endpoint,
                            SessionContext context,
                            ResponderConfig config,
                            ExecutionBackend backend,
                            Executor pumpExecutor,
                            ExecutionSlots slots,
                            ExecutionStateReducer reducer) {
        super(Role.RESPONDER, endpoint, context, FathomProtocol.CURRENT_VERSION);
        this.config = Objects.requireNonNull(config, "config");
        this.backend = Objects.requireNonNull(backend, "backend");
        this.pumpExecutor = Objects.requireNonNull(pumpExecutor, "pumpExecutor");
        this.slots = Objects.requireNonNull(slots, "slots");
        this.reducer = Objects.requireNonNull(reducer, "reducer");
    }

    @Override
    protected void dispatch(Envelope envelope) {
        switch (envelope.type()) {
            case EXECUTE:
                onExecute(envelope.payload(Payload.Execute.class).request());
                break;
            case CANCEL:
                onCancel(envelope.requireExecutionId());
                break;
            case PING:
                send(Envelope.pong(Optional.of(registry().load()), now()));
                break;
            default:
                // receivableBy() already filtered responder-bound types
                throw new IllegalStateException("Unexpected " + envelope.type().wireName());
        }
    }

    private void onExecute(ExecutionRequest request) {
        ExecutionId id = request.id();

        if (!config.supports(request.language())) {
            reject(id, ErrorCode.LANGUAGE_NOT_SUPPORTED,
                    "Language '" + request.language().name() + "' is not supported");
            return;
        }

        Optional<String> violation = config.limitBounds().violation(request.limits());
        if (violation.isPresent()) {
            reject(id, ErrorCode.INVALID_REQUEST, violation.get());
            return;
        }

        if (!slots.tryAcquire()) {
            reject(id, ErrorCode.SANDBOX_OVERLOADED,
                    "All " + slots.capacity() + " execution slots are in use");
            return;
        }

        ExecutionMachine machine;
        try {
            machine = registry().register(id, () -> newMachine(request));
        } catch (ExecutionAlreadyExistsException e) {
            slots.release();
            reject(id, ErrorCode.INVALID_REQUEST, "Execution " + id + " is already in progress");
            return;
        }

        machine.submit(new ExecutionLifecycleEvent.Submitted(request, now(), tick()));
    }

    private ExecutionMachine newMachine(ExecutionRequest request) {
        ExecutionState initial = ExecutionState.initial(Role.RESPONDER, request, now(), tick());
        ResponderIntentExecutor executor = new ResponderIntentExecutor(this, backend, pumpExecutor);
        return new ExecutionMachine(initial, reducer, executor, context.machineExecutor(), sink);
    }

    private void onCancel(ExecutionId id) {
        Optional<ExecutionMachine> machine = registry().find(id);
        if (machine.isEmpty()) {
            sink.onProtocolEvent(ProtocolObservabilityEvent.of(now(), role(),
                    ProtocolObservabilityEvent.Kind.UNKNOWN_EXECUTION, id, "cancel"));
            send(Envelope.error(id, ProtocolError.of(ErrorCode.UNKNOWN_EXECUTION,
                    "No execution " + id + " on this connection"), now()));
            return;
        }
        machine.get().submit(new ExecutionLifecycleEvent.CancelRequested(now(), tick()));
    }

    private void reject(ExecutionId id, ErrorCode code, String message) {
        sink.onProtocolEvent(ProtocolObservabilityEvent.of(now(), role(),
                ProtocolObservabilityEvent.Kind.REJECTED, id, code.wireName() + ": " + message));
        send(Envelope.error(id, ProtocolError.of(code, message), now()));
    }

    @Override
    protected void onDecodeFailure(EnvelopeDecodeException failure) {
        send(Envelope.connectionError(ProtocolError.of(ErrorCode.INVALID_REQUEST, failure.getMessage()), now()));

        if (failure.reason() == EnvelopeDecodeException.Reason.UNSUPPORTED_VERSION && !isEstablished()) {
            close();
        }
    }

    @Override
    protected void onWrongDirection(Envelope envelope) {
        send(Envelope.connectionError(ProtocolError.of(ErrorCode.INVALID_REQUEST,
                "Message type '" + envelope.type().wireName() + "' is not accepted by a responder"), now()));
    }

    @Override
    protected void onVersionMismatch(Envelope envelope) {
        send(Envelope.connectionError(ProtocolError.of(ErrorCode.INVALID_REQUEST,
                "Version " + envelope.version() + " differs from negotiated version " + negotiatedVersion().getAsInt()), now()));
    }

    @Override
    protected void evicted(ExecutionMachine machine) {
        slots.release();
    }

    public ResponderConfig config() {
        return config;
    }
}
