package com.questrail.fathom.protocol.internal.exec;

import com.questrail.fathom.protocol.internal.state.ExecutionIntents;
import com.questrail.fathom.protocol.internal.state.ExecutionState;

/**
 * Carries out the intents produced by one reducer step.
 *
 * <p>Called on the machine's drain task, never concurrently for the same
 * machine. Implementations must not block: anything slow (starting a
 * process, reading its output) is handed to another executor, which reports
 * back by submitting events to {@code machine}.</p>
 */
@FunctionalInterface
public interface ExecutionIntentExecutor
{
    /**
     * @param machine the machine that produced the intents
     * @param state   the state after the step
     * @param intents the intents, in the order they must be carried out
     */
    void execute(ExecutionMachine machine, ExecutionState state, ExecutionIntents intents);
}
