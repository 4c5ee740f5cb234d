package com.questrail.fathom.protocol.observability;

import com.questrail.fathom.protocol.internal.events.ExecutionEvent;
import com.questrail.fathom.protocol.internal.state.ExecutionIntents;
import com.questrail.fathom.protocol.internal.state.ExecutionState;

import java.time.Instant;

/**
 * Record of one reducer step taken by an execution machine.
 */
public record ExecutionTransitionEvent(
        Instant timestamp,
        ExecutionState oldState,
        ExecutionState newState,
        ExecutionEvent triggeringEvent,
        ExecutionIntents resultingIntents
) {
    /**
     * True if the execution status changed during this step.
     */
    public boolean isStatusChange() {
        return oldState.status() != newState.status();
    }
}
