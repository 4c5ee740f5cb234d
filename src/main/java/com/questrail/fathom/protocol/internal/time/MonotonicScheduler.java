package com.questrail.fathom.protocol.internal.time;

import java.time.Duration;
import java.util.Objects;

/**
 * MonotonicScheduler
 * =============================================================================
 * Runs a task once a monotonic deadline has passed.
 *
 * <p>Deadlines are absolute {@link MonotonicClock} ticks. Implementations may run
 * a task late but never early.</p>
 */
public interface MonotonicScheduler
{
    /**
     * Schedules {@code task} to run at or after {@code deadlineNanos}.
     * A deadline already in the past runs as soon as possible.
     */
    Cancellable scheduleAtNanos(long deadlineNanos, Runnable task);

    /**
     * Schedules {@code task} to run once {@code delay} has elapsed on {@code clock}.
     */
    default Cancellable scheduleAfter(Duration delay, MonotonicClock clock, Runnable task)
    {
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(task, "task");

        if (delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }
        return scheduleAtNanos(clock.nowNanos() + delay.toNanos(), task);
    }
}
