package com.questrail.fathom.protocol.model;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Final figures of an execution, attached once a terminal status is reached.
 *
 * <p>{@code exitCode} is empty whenever the process did not exit on its own
 * (timeout, cancellation, output limit, lost backend).</p>
 */
public record ExecutionResult(
        OptionalInt exitCode,
        Duration duration,
        Optional<ResourceUsage> resourceUsage
) {
    public ExecutionResult {
        Objects.requireNonNull(exitCode, "exitCode");
        Objects.requireNonNull(duration, "duration");
        Objects.requireNonNull(resourceUsage, "resourceUsage");
        if (duration.isNegative()) {
            duration = Duration.ZERO;
        }
    }

    public static ExecutionResult exited(int exitCode, Duration duration, Optional<ResourceUsage> usage) {
        return new ExecutionResult(OptionalInt.of(exitCode), duration, usage);
    }

    /**
     * Result for an execution that was stopped by the engine rather than exiting.
     */
    public static ExecutionResult withoutExit(Duration duration) {
        return new ExecutionResult(OptionalInt.empty(), duration, Optional.empty());
    }
}
