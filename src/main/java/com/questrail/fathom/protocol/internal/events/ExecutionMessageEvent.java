package com.questrail.fathom.protocol.internal.events;

import com.questrail.fathom.protocol.model.ExecStatus;
import com.questrail.fathom.protocol.model.ExecutionResult;
import com.questrail.fathom.protocol.model.OutputChannel;
import com.questrail.fathom.protocol.model.ProtocolError;

import java.time.Instant;
import java.util.Objects;

/**
 * ExecutionMessageEvent
 * -----------------------------------------------------------------------------
 * Execution-scoped messages received by the initiator, already decoded and
 * routed by execution id.
 */
public sealed interface ExecutionMessageEvent extends ExecutionEvent
        permits ExecutionMessageEvent.AckReceived,
                ExecutionMessageEvent.StatusReceived,
                ExecutionMessageEvent.OutputReceived,
                ExecutionMessageEvent.ErrorReceived,
                ExecutionMessageEvent.ResultReceived
{
    final class AckReceived extends ExecutionEvent.Base implements ExecutionMessageEvent {
        public AckReceived(Instant timestamp, long tickNanos) {
            super(timestamp, tickNanos);
        }
    }

    final class StatusReceived extends ExecutionEvent.Base implements ExecutionMessageEvent {
        private final ExecStatus status;

        public StatusReceived(ExecStatus status, Instant timestamp, long tickNanos) {
            super(timestamp, tickNanos);
            this.status = Objects.requireNonNull(status, "status");
        }

        public ExecStatus status() {
            return status;
        }
    }

    final class OutputReceived extends ExecutionEvent.Base implements ExecutionMessageEvent {
        private final OutputChannel channel;
        private final String data;

        public OutputReceived(OutputChannel channel, String data, Instant timestamp, long tickNanos) {
            super(timestamp, tickNanos);
            this.channel = Objects.requireNonNull(channel, "channel");
            this.data = Objects.requireNonNull(data, "data");
        }

        public OutputChannel channel() {
            return channel;
        }

        public String data() {
            return data;
        }
    }

    final class ErrorReceived extends ExecutionEvent.Base implements ExecutionMessageEvent {
        private final ProtocolError error;

        public ErrorReceived(ProtocolError error, Instant timestamp, long tickNanos) {
            super(timestamp, tickNanos);
            this.error = Objects.requireNonNull(error, "error");
        }

        public ProtocolError error() {
            return error;
        }
    }

    final class ResultReceived extends ExecutionEvent.Base implements ExecutionMessageEvent {
        private final ExecutionResult result;

        public ResultReceived(ExecutionResult result, Instant timestamp, long tickNanos) {
            super(timestamp, tickNanos);
            this.result = Objects.requireNonNull(result, "result");
        }

        public ExecutionResult result() {
            return result;
        }
    }
}
