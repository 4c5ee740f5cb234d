package com.questrail.fathom.protocol.session;

import com.questrail.fathom.protocol.internal.state.ExecutionState;
import com.questrail.fathom.protocol.model.ErrorCode;
import com.questrail.fathom.protocol.model.ExecStatus;
import com.questrail.fathom.protocol.model.ExecutionId;
import com.questrail.fathom.protocol.model.ExecutionResult;
import com.questrail.fathom.protocol.model.ProtocolError;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * What the initiator learned about one execution once it settled.
 *
 * @param status       last status, {@code FAILED} for rejections and abandonment
 * @param acknowledged the responder accepted the request
 * @param rejected     the responder refused it before acknowledging
 * @param abandoned    the connection was lost before the execution settled
 * @param failure      the error that explains a non-{@code COMPLETED} status
 * @param result       final figures, absent for rejections and abandonment
 * @param stdout       every delivered stdout chunk, concatenated
 * @param stderr       every delivered stderr chunk, concatenated
 */
public record ExecutionOutcome(
        ExecutionId id,
        ExecStatus status,
        boolean acknowledged,
        boolean rejected,
        boolean abandoned,
        Optional<ProtocolError> failure,
        Optional<ExecutionResult> result,
        String stdout,
        String stderr
) {
    public ExecutionOutcome {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(status, "status");
        Objects.requireNonNull(failure, "failure");
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(stdout, "stdout");
        Objects.requireNonNull(stderr, "stderr");
    }

    static ExecutionOutcome from(ExecutionState state, String stdout, String stderr) {
        Optional<ProtocolError> failure = state.failure();
        if (failure.isEmpty() && state.abandoned()) {
            failure = Optional.of(ProtocolError.of(ErrorCode.NETWORK_ERROR, "Connection lost"));
        }
        return new ExecutionOutcome(state.id(), state.status(), state.acknowledged(), state.rejected(),
                state.abandoned(), failure, state.result(), stdout, stderr);
    }

    /**
     * True when the program ran to completion and exited with status 0.
     */
    public boolean succeeded() {
        return status == ExecStatus.COMPLETED && exitCode().isPresent() && exitCode().getAsInt() == 0;
    }

    public OptionalInt exitCode() {
        return result.map(ExecutionResult::exitCode).orElse(OptionalInt.empty());
    }

    /**
     * Whether submitting the same request again may succeed.
     */
    public boolean retryable() {
        return failure.map(ProtocolError::retryable).orElse(false);
    }
}
