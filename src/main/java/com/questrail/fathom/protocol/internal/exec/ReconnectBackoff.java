package com.questrail.fathom.protocol.internal.exec;

import java.time.Duration;
import java.util.Objects;

/**
 * Reconnect attempt tracker.
 *
 * - Counts consecutive reconnect attempts
 * - Resets when a handshake completes
 * - Delegates the delay curve to {@link ReconnectionPolicy}
 */
public final class ReconnectBackoff
{
    private final ReconnectionPolicy policy;
    private int attempt;

    public ReconnectBackoff(ReconnectionPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    /**
     * Records an attempt and returns how long to wait before making it.
     */
    public synchronized Duration next() {
        Duration delay = policy.nextDelay(attempt);
        if (attempt < Integer.MAX_VALUE) {
            attempt++;
        }
        return delay;
    }

    public synchronized void reset() {
        attempt = 0;
    }

    /**
     * Attempts recorded since the last reset.
     */
    public synchronized int attempt() {
        return attempt;
    }
}
