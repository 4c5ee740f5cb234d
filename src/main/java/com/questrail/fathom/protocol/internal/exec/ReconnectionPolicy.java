package com.questrail.fathom.protocol.internal.exec;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential reconnect backoff.
 *
 * <pre>
 *   attempt 0      → 0 (reconnect immediately)
 *   attempt n ≥ 1  → min(base · 2^(n-1), max)
 * </pre>
 *
 * The sequence is non-decreasing and capped at {@code max}.
 */
public record ReconnectionPolicy(Duration base, Duration max)
{
    public static final Duration DEFAULT_BASE = Duration.ofMillis(100);
    public static final Duration DEFAULT_MAX = Duration.ofSeconds(30);

    public ReconnectionPolicy {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(max, "max");
        if (base.isNegative() || base.isZero()) {
            throw new IllegalArgumentException("base must be positive");
        }
        if (max.compareTo(base) < 0) {
            throw new IllegalArgumentException("max must be >= base");
        }
    }

    public static ReconnectionPolicy defaults() {
        return new ReconnectionPolicy(DEFAULT_BASE, DEFAULT_MAX);
    }

    public Duration nextDelay(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException("attempt must be >= 0");
        }
        if (attempt == 0) {
            return Duration.ZERO;
        }

        int shift = attempt - 1;
        long baseNanos = base.toNanos();
        long maxNanos = max.toNanos();
        if (shift >= Long.SIZE - 2 || baseNanos > (maxNanos >> shift)) {
            return max;
        }
        return Duration.ofNanos(Math.min(baseNanos << shift, maxNanos));
    }
}
