package com.questrail.fathom.protocol.internal.state;

import com.questrail.fathom.protocol.internal.events.BackendEvent;
import com.questrail.fathom.protocol.internal.events.ExecutionEvent;
import com.questrail.fathom.protocol.internal.events.ExecutionLifecycleEvent;
import com.questrail.fathom.protocol.internal.events.ExecutionMessageEvent;
import com.questrail.fathom.protocol.internal.state.ExecutionIntent.ArmDeadline;
import com.questrail.fathom.protocol.internal.state.ExecutionIntent.Complete;
import com.questrail.fathom.protocol.internal.state.ExecutionIntent.DeliverOutput;
import com.questrail.fathom.protocol.internal.state.ExecutionIntent.DisarmDeadline;
import com.questrail.fathom.protocol.internal.state.ExecutionIntent.EmitAck;
import com.questrail.fathom.protocol.internal.state.ExecutionIntent.EmitError;
import com.questrail.fathom.protocol.internal.state.ExecutionIntent.EmitOutput;
import com.questrail.fathom.protocol.internal.state.ExecutionIntent.EmitResult;
import com.questrail.fathom.protocol.internal.state.ExecutionIntent.EmitStatus;
import com.questrail.fathom.protocol.internal.state.ExecutionIntent.Evict;
import com.questrail.fathom.protocol.internal.state.ExecutionIntent.NotifyAck;
import com.questrail.fathom.protocol.internal.state.ExecutionIntent.NotifyStatus;
import com.questrail.fathom.protocol.internal.state.ExecutionIntent.ReportViolation;
import com.questrail.fathom.protocol.internal.state.ExecutionIntent.SendCancel;
import com.questrail.fathom.protocol.internal.state.ExecutionIntent.SendExecute;
import com.questrail.fathom.protocol.internal.state.ExecutionIntent.SignalCancel;
import com.questrail.fathom.protocol.internal.state.ExecutionIntent.StartBackend;
import com.questrail.fathom.protocol.model.ErrorCode;
import com.questrail.fathom.protocol.model.ExecStatus;
import com.questrail.fathom.protocol.model.ExecutionResult;
import com.questrail.fathom.protocol.model.ProtocolError;
import com.questrail.fathom.protocol.model.Role;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * ExecutionStateReducer
 * -----------------------------------------------------------------------------
 * Pure, deterministic transition function for one execution.
 *
 * <h2>Role in the architecture</h2>
 * Given the current {@link ExecutionState} and one {@link ExecutionEvent}, the
 * reducer computes the next state and the ordered {@link ExecutionIntents} that
 * the owning machine must carry out. It performs no I/O, reads no clock and
 * starts no timer; all times arrive on the event.
 *
 * <h2>Roles</h2>
 * The same reducer serves both sides of a connection. The state's {@link Role}
 * selects the transition table:
 * <ul>
 *   <li>Responder: admission has already happened; the reducer sequences ack,
 *       backend start, output streaming and the terminal status/result pair</li>
 *   <li>Initiator: the reducer tracks what the responder reports and decides
 *       when the caller's outcome is settled</li>
 * </ul>
 *
 * <h2>Races</h2>
 * The first transition into a terminal status wins. Every later attempt
 * (backend exit after a timeout, a cancel after completion, a second terminal
 * status from the peer) is absorbed with no intents.
 */
public final class ExecutionStateReducer
{
    /** Grace added to the request timeout before the initiator gives up on its own. */
    public static final Duration DEFAULT_INITIATOR_GRACE = Duration.ofSeconds(1);

    /**
     * Result of applying an event.
     *
     * @param newState the updated state
     * @param intents  actions to carry out, in order
     */
    public record Result(ExecutionState newState, ExecutionIntents intents) {
        public Result {
            Objects.requireNonNull(newState, "newState");
            Objects.requireNonNull(intents, "intents");
        }
    }

    private final Duration initiatorGrace;

    public ExecutionStateReducer() {
        this(DEFAULT_INITIATOR_GRACE);
    }

    public ExecutionStateReducer(Duration initiatorGrace) {
        this.initiatorGrace = Objects.requireNonNull(initiatorGrace, "initiatorGrace");
        if (initiatorGrace.isNegative()) {
            throw new IllegalArgumentException("initiatorGrace must be >= 0");
        }
    }

    public Result apply(ExecutionState state, ExecutionEvent event) {
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(event, "event");

        return state.role() == Role.RESPONDER
                ? applyResponder(state, event)
                : applyInitiator(state, event);
    }

    // =====================================================================
    // Responder
    // =====================================================================

    private Result applyResponder(ExecutionState state, ExecutionEvent event) {
        if (event instanceof ExecutionLifecycleEvent.Submitted e) {
            return onResponderSubmitted(state, e);
        }
        if (event instanceof BackendEvent.BackendStarted e) {
            return onBackendStarted(state, e);
        }

        // Everything below only moves a live execution.
        if (state.isTerminal()) {
            return unchanged(state);
        }

        if (event instanceof BackendEvent.OutputProduced e) {
            return onOutputProduced(state, e);
        }
        if (event instanceof BackendEvent.BackendExited e) {
            return onBackendExited(state, e);
        }
        if (event instanceof BackendEvent.BackendFailed e) {
            return onBackendFailed(state, e);
        }
        if (event instanceof ExecutionLifecycleEvent.CancelRequested e) {
            return onResponderCancel(state, e);
        }
        if (event instanceof ExecutionLifecycleEvent.DeadlineElapsed e) {
            return onResponderDeadline(state, e);
        }
        if (event instanceof ExecutionLifecycleEvent.ConnectionLost e) {
            return onResponderConnectionLost(state, e);
        }

        // Initiator-side message events never reach a responder machine.
        return unchanged(state);
    }

    private Result onResponderSubmitted(ExecutionState state, ExecutionLifecycleEvent.Submitted e) {
        // The connection may have dropped before the submission was drained.
        if (state.submitted() || state.isTerminal()) {
            return unchanged(state);
        }
        long deadline = e.tickNanos() + state.request().limits().timeout().toNanos();

        ExecutionState next = state
                .withSubmitted(deadline, e.timestamp())
                .withAcknowledged(e.timestamp());

        return new Result(next, ExecutionIntents.of(
                new EmitAck(),
                new ArmDeadline(deadline),
                new StartBackend(state.request())));
    }

    private Result onBackendStarted(ExecutionState state, BackendEvent.BackendStarted e) {
        if (state.isTerminal()) {
            // Late start after cancel or timeout: the process must not keep running.
            return new Result(state, ExecutionIntents.of(new SignalCancel()));
        }
        if (state.status() != ExecStatus.PENDING) {
            return unchanged(state);
        }
        return new Result(state.withStatus(ExecStatus.RUNNING, e.timestamp()),
                ExecutionIntents.of(new EmitStatus(ExecStatus.RUNNING)));
    }

    private Result onOutputProduced(ExecutionState state, BackendEvent.OutputProduced e) {
        long chunkBytes = utf8Length(e.data());
        long total = state.outputBytes() + chunkBytes;

        if (total <= state.request().limits().maxOutputBytes()) {
            return new Result(state.withOutputBytes(total),
                    ExecutionIntents.of(new EmitOutput(e.channel(), e.data())));
        }

        // The offending chunk is dropped; nothing beyond the limit is forwarded.
        ProtocolError error = ProtocolError.of(ErrorCode.OUTPUT_LIMIT,
                "Output exceeded " + state.request().limits().maxOutputBytes() + " bytes");
        ExecutionResult result = ExecutionResult.withoutExit(state.elapsed(e.tickNanos()));

        ExecutionState next = state
                .withStatus(ExecStatus.FAILED, e.timestamp())
                .withFailure(error, e.timestamp())
                .withResult(result, e.timestamp());

        return new Result(next, ExecutionIntents.of(
                new SignalCancel(),
                new DisarmDeadline(),
                new EmitError(error),
                new EmitStatus(ExecStatus.FAILED),
                new EmitResult(result),
                new Evict()));
    }

    private Result onBackendExited(ExecutionState state, BackendEvent.BackendExited e) {
        ExecStatus terminal = e.oomKilled() ? ExecStatus.OOM : ExecStatus.COMPLETED;
        ExecutionResult result = new ExecutionResult(e.exitCode(), state.elapsed(e.tickNanos()), e.usage());

        ExecutionState next = state
                .withStatus(terminal, e.timestamp())
                .withResult(result, e.timestamp());
        if (e.oomKilled()) {
            next = next.withFailure(ProtocolError.of(ErrorCode.OOM, "Memory limit exceeded"), e.timestamp());
        }

        return new Result(next, ExecutionIntents.of(
                new DisarmDeadline(),
                new EmitStatus(terminal),
                new EmitResult(result),
                new Evict()));
    }

    private Result onBackendFailed(ExecutionState state, BackendEvent.BackendFailed e) {
        ProtocolError error = ProtocolError.of(ErrorCode.INTERNAL_ERROR, e.message());
        ExecutionResult result = ExecutionResult.withoutExit(state.elapsed(e.tickNanos()));

        ExecutionState next = state
                .withStatus(ExecStatus.FAILED, e.timestamp())
                .withFailure(error, e.timestamp())
                .withResult(result, e.timestamp());

        return new Result(next, ExecutionIntents.of(
                new DisarmDeadline(),
                new EmitError(error),
                new EmitStatus(ExecStatus.FAILED),
                new EmitResult(result),
                new Evict()));
    }

    private Result onResponderCancel(ExecutionState state, ExecutionLifecycleEvent.CancelRequested e) {
        ExecutionResult result = ExecutionResult.withoutExit(state.elapsed(e.tickNanos()));

        ExecutionState next = state
                .withCancelRequested(e.timestamp())
                .withStatus(ExecStatus.CANCELLED, e.timestamp())
                .withResult(result, e.timestamp());

        return new Result(next, ExecutionIntents.of(
                new EmitAck(),
                new SignalCancel(),
                new DisarmDeadline(),
                new EmitStatus(ExecStatus.CANCELLED),
                new EmitResult(result),
                new Evict()));
    }

    private Result onResponderDeadline(ExecutionState state, ExecutionLifecycleEvent.DeadlineElapsed e) {
        ProtocolError error = ProtocolError.of(ErrorCode.TIMEOUT,
                "Execution exceeded " + state.request().limits().timeout().toMillis() + " ms");
        ExecutionResult result = ExecutionResult.withoutExit(state.elapsed(e.tickNanos()));

        ExecutionState next = state
                .withStatus(ExecStatus.TIMEOUT, e.timestamp())
                .withFailure(error, e.timestamp())
                .withResult(result, e.timestamp());

        return new Result(next, ExecutionIntents.of(
                new SignalCancel(),
                new EmitStatus(ExecStatus.TIMEOUT),
                new EmitResult(result),
                new Evict()));
    }

    private Result onResponderConnectionLost(ExecutionState state, ExecutionLifecycleEvent.ConnectionLost e) {
        // Nobody is listening any more: stop the work, emit nothing.
        ExecutionState next = state
                .withAbandoned(e.timestamp())
                .withStatus(ExecStatus.FAILED, e.timestamp())
                .withFailure(ProtocolError.of(ErrorCode.NETWORK_ERROR, "Connection lost"), e.timestamp());

        return new Result(next, ExecutionIntents.of(
                new SignalCancel(),
                new DisarmDeadline(),
                new Evict()));
    }

    // =====================================================================
    // Initiator
    // =====================================================================

    private Result applyInitiator(ExecutionState state, ExecutionEvent event) {
        if (event instanceof ExecutionLifecycleEvent.Submitted e) {
            return onInitiatorSubmitted(state, e);
        }

        // A settled execution has already been handed back to the caller.
        if (state.settled()) {
            return unchanged(state);
        }

        if (event instanceof ExecutionMessageEvent.AckReceived e) {
            return onAckReceived(state, e);
        }
        if (event instanceof ExecutionMessageEvent.ErrorReceived e) {
            return onErrorReceived(state, e);
        }
        if (event instanceof ExecutionMessageEvent.StatusReceived e) {
            return onStatusReceived(state, e);
        }
        if (event instanceof ExecutionMessageEvent.OutputReceived e) {
            return onOutputReceived(state, e);
        }
        if (event instanceof ExecutionMessageEvent.ResultReceived e) {
            return onResultReceived(state, e);
        }
        if (event instanceof ExecutionLifecycleEvent.CancelRequested e) {
            return onInitiatorCancel(state, e);
        }
        if (event instanceof ExecutionLifecycleEvent.DeadlineElapsed e) {
            return onInitiatorDeadline(state, e);
        }
        if (event instanceof ExecutionLifecycleEvent.ConnectionLost e) {
            return onInitiatorConnectionLost(state, e);
        }

        // Backend events never reach an initiator machine.
        return unchanged(state);
    }

    private Result onInitiatorSubmitted(ExecutionState state, ExecutionLifecycleEvent.Submitted e) {
        if (state.submitted() || state.settled()) {
            return unchanged(state);
        }
        long deadline = e.tickNanos()
                + state.request().limits().timeout().toNanos()
                + initiatorGrace.toNanos();

        return new Result(state.withSubmitted(deadline, e.timestamp()), ExecutionIntents.of(
                new ArmDeadline(deadline),
                new SendExecute(state.request())));
    }

    private Result onAckReceived(ExecutionState state, ExecutionMessageEvent.AckReceived e) {
        if (state.acknowledged()) {
            // The responder acks an accepted cancel too.
            return unchanged(state);
        }
        return new Result(state.withAcknowledged(e.timestamp()), ExecutionIntents.of(new NotifyAck()));
    }

    private Result onErrorReceived(ExecutionState state, ExecutionMessageEvent.ErrorReceived e) {
        if (!state.acknowledged() && !state.isTerminal()) {
            ExecutionState next = state
                    .withStatus(ExecStatus.FAILED, e.timestamp())
                    .withFailure(e.error(), e.timestamp())
                    .withRejected(e.timestamp())
                    .withSettled(e.timestamp());

            return new Result(next, ExecutionIntents.of(
                    new DisarmDeadline(),
                    new Complete(),
                    new Evict()));
        }

        // Accepted execution: the error explains the status and result that follow.
        if (state.failure().isPresent()) {
            return unchanged(state);
        }
        return new Result(state.withFailure(e.error(), e.timestamp()), ExecutionIntents.none());
    }

    private Result onStatusReceived(ExecutionState state, ExecutionMessageEvent.StatusReceived e) {
        if (state.isTerminal()) {
            return unchanged(state);
        }

        ExecutionState next = state;
        ExecutionIntents.Builder intents = ExecutionIntents.builder();

        if (!state.acknowledged()) {
            next = next.withAcknowledged(e.timestamp());
            intents.add(new ReportViolation("status " + e.status().wireName() + " before ack"));
            intents.add(new NotifyAck());
        }

        if (e.status() == ExecStatus.RUNNING) {
            if (state.status() == ExecStatus.RUNNING) {
                return new Result(next, intents.build());
            }
            next = next.withStatus(ExecStatus.RUNNING, e.timestamp());
            intents.add(new NotifyStatus(ExecStatus.RUNNING));
            return new Result(next, intents.build());
        }

        // Terminal: keep the watchdog armed until the result arrives.
        next = next.withStatus(e.status(), e.timestamp());
        intents.add(new NotifyStatus(e.status()));
        return new Result(next, intents.build());
    }

    private Result onOutputReceived(ExecutionState state, ExecutionMessageEvent.OutputReceived e) {
        long total = state.outputBytes() + utf8Length(e.data());
        long limit = state.request().limits().maxOutputBytes();

        if (total <= limit) {
            return new Result(state.withOutputBytes(total),
                    ExecutionIntents.of(new DeliverOutput(e.channel(), e.data())));
        }
        if (state.isTerminal()) {
            return unchanged(state);
        }

        ProtocolError error = ProtocolError.of(ErrorCode.OUTPUT_LIMIT,
                "Responder sent more than " + limit + " bytes of output");
        ExecutionState next = state
                .withStatus(ExecStatus.FAILED, e.timestamp())
                .withFailure(error, e.timestamp())
                .withResult(ExecutionResult.withoutExit(state.elapsed(e.tickNanos())), e.timestamp())
                .withCancelRequested(e.timestamp())
                .withSettled(e.timestamp());

        return new Result(next, ExecutionIntents.of(
                new SendCancel(),
                new DisarmDeadline(),
                new Complete(),
                new Evict()));
    }

    private Result onResultReceived(ExecutionState state, ExecutionMessageEvent.ResultReceived e) {
        if (!state.isTerminal()) {
            return new Result(state, ExecutionIntents.of(
                    new ReportViolation("result before terminal status")));
        }
        ExecutionState next = state
                .withResult(e.result(), e.timestamp())
                .withSettled(e.timestamp());

        return new Result(next, ExecutionIntents.of(
                new DisarmDeadline(),
                new Complete(),
                new Evict()));
    }

    private Result onInitiatorCancel(ExecutionState state, ExecutionLifecycleEvent.CancelRequested e) {
        if (state.isTerminal() || state.cancelRequested()) {
            return unchanged(state);
        }
        // Advisory: the status stays where it is until the responder confirms.
        return new Result(state.withCancelRequested(e.timestamp()), ExecutionIntents.of(new SendCancel()));
    }

    private Result onInitiatorDeadline(ExecutionState state, ExecutionLifecycleEvent.DeadlineElapsed e) {
        if (state.isTerminal()) {
            // Terminal status seen but the result never came.
            return new Result(state.withSettled(e.timestamp()), ExecutionIntents.of(
                    new Complete(),
                    new Evict()));
        }

        ProtocolError error = ProtocolError.of(ErrorCode.TIMEOUT,
                "No terminal status within " + state.request().limits().timeout().toMillis() + " ms");
        ExecutionState next = state
                .withStatus(ExecStatus.TIMEOUT, e.timestamp())
                .withFailure(error, e.timestamp())
                .withResult(ExecutionResult.withoutExit(state.elapsed(e.tickNanos())), e.timestamp())
                .withSettled(e.timestamp());

        ExecutionIntents.Builder intents = ExecutionIntents.builder();
        if (!state.cancelRequested()) {
            intents.add(new SendCancel());
        }
        return new Result(next, intents
                .add(new Complete())
                .add(new Evict())
                .build());
    }

    private Result onInitiatorConnectionLost(ExecutionState state, ExecutionLifecycleEvent.ConnectionLost e) {
        ExecutionState next = state.withAbandoned(e.timestamp());
        if (!state.isTerminal()) {
            next = next
                    .withStatus(ExecStatus.FAILED, e.timestamp())
                    .withFailure(ProtocolError.of(ErrorCode.NETWORK_ERROR, "Connection lost"), e.timestamp());
        }
        next = next.withSettled(e.timestamp());

        return new Result(next, ExecutionIntents.of(
                new DisarmDeadline(),
                new Complete(),
                new Evict()));
    }

    // =====================================================================
    // Helpers
    // =====================================================================

    private static Result unchanged(ExecutionState state) {
        return new Result(state, ExecutionIntents.none());
    }

    private static long utf8Length(String data) {
        return data.getBytes(StandardCharsets.UTF_8).length;
    }
}
