package com.questrail.fathom.protocol.internal.state;

import com.questrail.fathom.protocol.model.ExecStatus;
import com.questrail.fathom.protocol.model.ExecutionId;
import com.questrail.fathom.protocol.model.ExecutionRequest;
import com.questrail.fathom.protocol.model.ExecutionResult;
import com.questrail.fathom.protocol.model.ProtocolError;
import com.questrail.fathom.protocol.model.Role;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * ExecutionState
 * -----------------------------------------------------------------------------
 * Immutable snapshot of one execution as seen by one side of one connection.
 *
 * <h2>Role in the architecture</h2>
 * This is the state consumed and produced by {@link ExecutionStateReducer}. It
 * is pure data: every change produces a new instance through a {@code with*}
 * method, and the owning machine swaps its reference atomically.
 *
 * <h2>Flags</h2>
 * <ul>
 *   <li>{@code submitted}: the request has been admitted (responder) or sent
 *       (initiator)</li>
 *   <li>{@code acknowledged}: an {@code ack} has been emitted or received</li>
 *   <li>{@code cancelRequested}: a cancel has been asked for</li>
 *   <li>{@code settled}: initiator only; the outcome has been delivered</li>
 *   <li>{@code rejected}: initiator only; an {@code error} arrived before any ack</li>
 *   <li>{@code abandoned}: the connection was lost before the execution settled</li>
 * </ul>
 *
 * Deadline and creation ticks come from the monotonic clock. {@code lastTransition}
 * is a wall-clock instant kept for observability only.
 */
public final class ExecutionState
{
    private final ExecutionId id;
    private final Role role;
    private final ExecutionRequest request;
    private final ExecStatus status;
    private final boolean submitted;
    private final boolean acknowledged;
    private final boolean cancelRequested;
    private final boolean settled;
    private final boolean rejected;
    private final boolean abandoned;
    private final long createdNanos;
    private final long deadlineNanos;
    private final long outputBytes;
    private final ProtocolError failure;
    private final ExecutionResult result;
    private final Instant lastTransition;

    private ExecutionState(ExecutionId id,
                           Role role,
                           ExecutionRequest request,
                           ExecStatus status,
                           boolean submitted,
                           boolean acknowledged,
                           boolean cancelRequested,
                           boolean settled,
                           boolean rejected,
                           boolean abandoned,
                           long createdNanos,
                           long deadlineNanos,
                           long outputBytes,
                           ProtocolError failure,
                           ExecutionResult result,
                           Instant lastTransition) {
        this.id = Objects.requireNonNull(id, "id");
        this.role = Objects.requireNonNull(role, "role");
        this.request = Objects.requireNonNull(request, "request");
        this.status = Objects.requireNonNull(status, "status");
        this.submitted = submitted;
        this.acknowledged = acknowledged;
        this.cancelRequested = cancelRequested;
        this.settled = settled;
        this.rejected = rejected;
        this.abandoned = abandoned;
        this.createdNanos = createdNanos;
        this.deadlineNanos = deadlineNanos;
        this.outputBytes = outputBytes;
        this.failure = failure;
        this.result = result;
        this.lastTransition = Objects.requireNonNull(lastTransition, "lastTransition");
    }

    /**
     * State of an execution that exists but has not yet been submitted.
     */
    public static ExecutionState initial(Role role, ExecutionRequest request, Instant now, long nowNanos) {
        return new ExecutionState(request.id(), role, request, ExecStatus.PENDING,
                false, false, false, false, false, false,
                nowNanos, Long.MAX_VALUE, 0L, null, null, now);
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public ExecutionId id() {
        return id;
    }

    public Role role() {
        return role;
    }

    public ExecutionRequest request() {
        return request;
    }

    public ExecStatus status() {
        return status;
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean submitted() {
        return submitted;
    }

    public boolean acknowledged() {
        return acknowledged;
    }

    public boolean cancelRequested() {
        return cancelRequested;
    }

    public boolean settled() {
        return settled;
    }

    public boolean rejected() {
        return rejected;
    }

    public boolean abandoned() {
        return abandoned;
    }

    public long createdNanos() {
        return createdNanos;
    }

    /**
     * Monotonic deadline, or {@link Long#MAX_VALUE} before submission.
     */
    public long deadlineNanos() {
        return deadlineNanos;
    }

    /**
     * UTF-8 bytes of output emitted (responder) or delivered (initiator) so far.
     */
    public long outputBytes() {
        return outputBytes;
    }

    public Optional<ProtocolError> failure() {
        return Optional.ofNullable(failure);
    }

    public Optional<ExecutionResult> result() {
        return Optional.ofNullable(result);
    }

    public Instant lastTransition() {
        return lastTransition;
    }

    /**
     * Time elapsed since creation, measured on the monotonic clock.
     */
    public Duration elapsed(long nowNanos) {
        return Duration.ofNanos(Math.max(0L, nowNanos - createdNanos));
    }

    // ---------------------------------------------------------------------
    // Transitions (pure)
    // ---------------------------------------------------------------------

    public ExecutionState withSubmitted(long deadlineNanos, Instant now) {
        return new ExecutionState(id, role, request, status, true, acknowledged, cancelRequested,
                settled, rejected, abandoned, createdNanos, deadlineNanos, outputBytes, failure, result, now);
    }

    public ExecutionState withAcknowledged(Instant now) {
        return new ExecutionState(id, role, request, status, submitted, true, cancelRequested,
                settled, rejected, abandoned, createdNanos, deadlineNanos, outputBytes, failure, result, now);
    }

    public ExecutionState withStatus(ExecStatus newStatus, Instant now) {
        return new ExecutionState(id, role, request, newStatus, submitted, acknowledged, cancelRequested,
                settled, rejected, abandoned, createdNanos, deadlineNanos, outputBytes, failure, result, now);
    }

    public ExecutionState withCancelRequested(Instant now) {
        return new ExecutionState(id, role, request, status, submitted, acknowledged, true,
                settled, rejected, abandoned, createdNanos, deadlineNanos, outputBytes, failure, result, now);
    }

    public ExecutionState withSettled(Instant now) {
        return new ExecutionState(id, role, request, status, submitted, acknowledged, cancelRequested,
                true, rejected, abandoned, createdNanos, deadlineNanos, outputBytes, failure, result, now);
    }

    public ExecutionState withRejected(Instant now) {
        return new ExecutionState(id, role, request, status, submitted, acknowledged, cancelRequested,
                settled, true, abandoned, createdNanos, deadlineNanos, outputBytes, failure, result, now);
    }

    public ExecutionState withAbandoned(Instant now) {
        return new ExecutionState(id, role, request, status, submitted, acknowledged, cancelRequested,
                settled, rejected, true, createdNanos, deadlineNanos, outputBytes, failure, result, now);
    }

    public ExecutionState withOutputBytes(long bytes) {
        return new ExecutionState(id, role, request, status, submitted, acknowledged, cancelRequested,
                settled, rejected, abandoned, createdNanos, deadlineNanos, bytes, failure, result, lastTransition);
    }

    public ExecutionState withFailure(ProtocolError newFailure, Instant now) {
        return new ExecutionState(id, role, request, status, submitted, acknowledged, cancelRequested,
                settled, rejected, abandoned, createdNanos, deadlineNanos, outputBytes, newFailure, result, now);
    }

    public ExecutionState withResult(ExecutionResult newResult, Instant now) {
        return new ExecutionState(id, role, request, status, submitted, acknowledged, cancelRequested,
                settled, rejected, abandoned, createdNanos, deadlineNanos, outputBytes, failure, newResult, now);
    }

    @Override
    public String toString() {
        return "ExecutionState[id=" + id + ", role=" + role + ", status=" + status
                + ", acknowledged=" + acknowledged + ", settled=" + settled
                + (failure != null ? ", failure=" + failure.code() : "") + "]";
    }
}
