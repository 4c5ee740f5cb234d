package com.questrail.fathom.protocol.model;

import com.questrail.fathom.protocol.FathomProtocol;

import java.time.Duration;
import java.util.Objects;
import java.util.OptionalInt;

/**
 * ResourceLimits
 * -----------------------------------------------------------------------------
 * Bounds requested for one execution.
 *
 * <p>The engine only carries these values and watches two of them itself: the
 * {@code timeout} (via the deadline watchdog) and {@code maxOutputBytes} (by
 * counting streamed output). Memory and CPU enforcement belong to the execution
 * backend.</p>
 *
 * <p>All bounds are strictly positive. Whether they fall inside what a responder
 * is willing to run is checked separately, before acknowledgment.</p>
 */
public record ResourceLimits(
        Duration timeout,
        long memoryMb,
        OptionalInt cpuShares,
        long maxOutputBytes
) {
    public ResourceLimits {
        Objects.requireNonNull(timeout, "timeout");
        Objects.requireNonNull(cpuShares, "cpuShares");

        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
        if (memoryMb <= 0) {
            throw new IllegalArgumentException("memoryMb must be positive");
        }
        if (cpuShares.isPresent() && cpuShares.getAsInt() <= 0) {
            throw new IllegalArgumentException("cpuShares must be positive");
        }
        if (maxOutputBytes <= 0) {
            throw new IllegalArgumentException("maxOutputBytes must be positive");
        }
    }

    /**
     * Limits with no CPU share and the default output budget.
     */
    public static ResourceLimits of(Duration timeout, long memoryMb) {
        return new ResourceLimits(timeout, memoryMb, OptionalInt.empty(),
                FathomProtocol.DEFAULT_MAX_OUTPUT_BYTES);
    }

    public ResourceLimits withCpuShares(int shares) {
        return new ResourceLimits(timeout, memoryMb, OptionalInt.of(shares), maxOutputBytes);
    }

    public ResourceLimits withMaxOutputBytes(long bytes) {
        return new ResourceLimits(timeout, memoryMb, cpuShares, bytes);
    }
}
