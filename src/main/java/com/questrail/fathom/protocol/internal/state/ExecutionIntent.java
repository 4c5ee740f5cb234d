package com.questrail.fathom.protocol.internal.state;

import com.questrail.fathom.protocol.model.ExecStatus;
import com.questrail.fathom.protocol.model.ExecutionRequest;
import com.questrail.fathom.protocol.model.ExecutionResult;
import com.questrail.fathom.protocol.model.OutputChannel;
import com.questrail.fathom.protocol.model.ProtocolError;

import java.util.Objects;

/**
 * One action requested by the {@link ExecutionStateReducer}.
 *
 * <p>Intents describe what must happen, never how. They are carried out in
 * order by an {@code ExecutionIntentExecutor} bound to the owning session.</p>
 */
public sealed interface ExecutionIntent
{
    enum Kind {
        // Responder: messages to the initiator
        EMIT_ACK,
        EMIT_STATUS,
        EMIT_OUTPUT,
        EMIT_ERROR,
        EMIT_RESULT,

        // Responder: backend control
        START_BACKEND,
        SIGNAL_CANCEL,

        // Initiator: messages to the responder
        SEND_EXECUTE,
        SEND_CANCEL,

        // Initiator: caller-facing notifications
        NOTIFY_ACK,
        NOTIFY_STATUS,
        DELIVER_OUTPUT,
        COMPLETE,

        // Both roles
        ARM_DEADLINE,
        DISARM_DEADLINE,
        EVICT,
        REPORT_VIOLATION
    }

    Kind kind();

    record EmitAck() implements ExecutionIntent {
        @Override public Kind kind() { return Kind.EMIT_ACK; }
    }

    record EmitStatus(ExecStatus status) implements ExecutionIntent {
        public EmitStatus {
            Objects.requireNonNull(status, "status");
        }

        @Override public Kind kind() { return Kind.EMIT_STATUS; }
    }

    record EmitOutput(OutputChannel channel, String data) implements ExecutionIntent {
        public EmitOutput {
            Objects.requireNonNull(channel, "channel");
            Objects.requireNonNull(data, "data");
        }

        @Override public Kind kind() { return Kind.EMIT_OUTPUT; }
    }

    record EmitError(ProtocolError error) implements ExecutionIntent {
        public EmitError {
            Objects.requireNonNull(error, "error");
        }

        @Override public Kind kind() { return Kind.EMIT_ERROR; }
    }

    record EmitResult(ExecutionResult result) implements ExecutionIntent {
        public EmitResult {
            Objects.requireNonNull(result, "result");
        }

        @Override public Kind kind() { return Kind.EMIT_RESULT; }
    }

    record StartBackend(ExecutionRequest request) implements ExecutionIntent {
        public StartBackend {
            Objects.requireNonNull(request, "request");
        }

        @Override public Kind kind() { return Kind.START_BACKEND; }
    }

    record SignalCancel() implements ExecutionIntent {
        @Override public Kind kind() { return Kind.SIGNAL_CANCEL; }
    }

    record SendExecute(ExecutionRequest request) implements ExecutionIntent {
        public SendExecute {
            Objects.requireNonNull(request, "request");
        }

        @Override public Kind kind() { return Kind.SEND_EXECUTE; }
    }

    record SendCancel() implements ExecutionIntent {
        @Override public Kind kind() { return Kind.SEND_CANCEL; }
    }

    record NotifyAck() implements ExecutionIntent {
        @Override public Kind kind() { return Kind.NOTIFY_ACK; }
    }

    record NotifyStatus(ExecStatus status) implements ExecutionIntent {
        public NotifyStatus {
            Objects.requireNonNull(status, "status");
        }

        @Override public Kind kind() { return Kind.NOTIFY_STATUS; }
    }

    record DeliverOutput(OutputChannel channel, String data) implements ExecutionIntent {
        public DeliverOutput {
            Objects.requireNonNull(channel, "channel");
            Objects.requireNonNull(data, "data");
        }

        @Override public Kind kind() { return Kind.DELIVER_OUTPUT; }
    }

    /** Deliver the outcome held in the resulting state to the caller. */
    record Complete() implements ExecutionIntent {
        @Override public Kind kind() { return Kind.COMPLETE; }
    }

    record ArmDeadline(long deadlineNanos) implements ExecutionIntent {
        @Override public Kind kind() { return Kind.ARM_DEADLINE; }
    }

    record DisarmDeadline() implements ExecutionIntent {
        @Override public Kind kind() { return Kind.DISARM_DEADLINE; }
    }

    /** Remove the execution from the registry. Always the last intent of a batch. */
    record Evict() implements ExecutionIntent {
        @Override public Kind kind() { return Kind.EVICT; }
    }

    /** A peer message was dropped because it broke the protocol. */
    record ReportViolation(String detail) implements ExecutionIntent {
        public ReportViolation {
            Objects.requireNonNull(detail, "detail");
        }

        @Override public Kind kind() { return Kind.REPORT_VIOLATION; }
    }
}
