package com.questrail.fathom.protocol.session;

import com.questrail.fathom.protocol.model.ExecStatus;
import com.questrail.fathom.protocol.model.ExecutionId;
import com.questrail.fathom.protocol.model.OutputChannel;

/**
 * Streaming callbacks for one submitted execution.
 *
 * <p>Callbacks for the same execution are never concurrent and arrive in
 * protocol order. They run on the session's machine executor and must not
 * block. Exceptions thrown here are reported to the observability sink and
 * otherwise ignored.</p>
 */
public interface ExecutionListener
{
    ExecutionListener NONE = new ExecutionListener() { };

    default void onAcknowledged(ExecutionId id) {
    }

    default void onStatus(ExecutionId id, ExecStatus status) {
    }

    default void onOutput(ExecutionId id, OutputChannel channel, String data) {
    }

    /**
     * Called exactly once, after {@link PendingExecution#outcome()} completed.
     */
    default void onComplete(ExecutionOutcome outcome) {
    }
}
