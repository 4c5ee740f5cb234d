package com.questrail.fathom.protocol.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Tick source for every engine deadline.
 *
 * <h2>Binding invariant</h2>
 * Execution deadlines, handshake timeouts and reconnect delays are computed from
 * this clock only. Wall-clock time is used for envelope timestamps and
 * observability, never for deciding that something has expired.
 */
public interface MonotonicClock
{
    /**
     * Returns a non-decreasing tick value in nanoseconds. Only differences
     * between two readings are meaningful.
     */
    long nowNanos();
}
