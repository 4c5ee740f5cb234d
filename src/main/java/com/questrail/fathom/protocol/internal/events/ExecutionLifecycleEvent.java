package com.questrail.fathom.protocol.internal.events;

import com.questrail.fathom.protocol.model.ExecutionRequest;

import java.time.Instant;
import java.util.Objects;

/**
 * Lifecycle events that apply to both roles.
 */
public sealed interface ExecutionLifecycleEvent extends ExecutionEvent
        permits ExecutionLifecycleEvent.Submitted,
                ExecutionLifecycleEvent.CancelRequested,
                ExecutionLifecycleEvent.DeadlineElapsed,
                ExecutionLifecycleEvent.ConnectionLost
{
    /**
     * The request entered the registry. On the responder this follows a
     * successful admission; on the initiator it precedes sending {@code execute}.
     */
    final class Submitted extends ExecutionEvent.Base implements ExecutionLifecycleEvent {
        private final ExecutionRequest request;

        public Submitted(ExecutionRequest request, Instant timestamp, long tickNanos) {
            super(timestamp, tickNanos);
            this.request = Objects.requireNonNull(request, "request");
        }

        public ExecutionRequest request() {
            return request;
        }
    }

    /**
     * Cancellation was asked for: a received {@code cancel} on the responder,
     * a local call on the initiator.
     */
    final class CancelRequested extends ExecutionEvent.Base implements ExecutionLifecycleEvent {
        public CancelRequested(Instant timestamp, long tickNanos) {
            super(timestamp, tickNanos);
        }
    }

    /** The watchdog found the execution's deadline in the past. */
    final class DeadlineElapsed extends ExecutionEvent.Base implements ExecutionLifecycleEvent {
        public DeadlineElapsed(Instant timestamp, long tickNanos) {
            super(timestamp, tickNanos);
        }
    }

    /** The connection carrying this execution is gone. */
    final class ConnectionLost extends ExecutionEvent.Base implements ExecutionLifecycleEvent {
        public ConnectionLost(Instant timestamp, long tickNanos) {
            super(timestamp, tickNanos);
        }
    }
}
