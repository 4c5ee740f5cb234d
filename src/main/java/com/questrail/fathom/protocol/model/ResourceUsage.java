package com.questrail.fathom.protocol.model;

import java.time.Duration;
import java.util.Objects;

/**
 * Resource consumption reported by the execution backend.
 */
public record ResourceUsage(long peakMemoryBytes, Duration cpuTime)
{
    public ResourceUsage {
        Objects.requireNonNull(cpuTime, "cpuTime");
        if (peakMemoryBytes < 0) {
            throw new IllegalArgumentException("peakMemoryBytes must be >= 0");
        }
        if (cpuTime.isNegative()) {
            throw new IllegalArgumentException("cpuTime must be >= 0");
        }
    }
}
