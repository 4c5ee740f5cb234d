package com.questrail.fathom.protocol.internal.time;

/**
 * Handle for a task registered with a {@link MonotonicScheduler}.
 */
public interface Cancellable
{
    /**
     * Cancels the task if it has not run yet.
     *
     * @return {@code true} if this call prevented the task from running
     */
    boolean cancel();
}
