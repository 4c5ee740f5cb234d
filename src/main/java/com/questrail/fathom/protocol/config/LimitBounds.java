package com.questrail.fathom.protocol.config;

import com.questrail.fathom.protocol.model.ResourceLimits;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Range of resource limits a responder is willing to run.
 *
 * <p>A request whose limits fall outside these bounds is rejected with
 * {@code INVALID_REQUEST} before it is acknowledged.</p>
 */
public record LimitBounds(
        Duration minTimeout,
        Duration maxTimeout,
        long maxMemoryMb,
        int maxCpuShares,
        long maxOutputBytes
) {
    public LimitBounds {
        Objects.requireNonNull(minTimeout, "minTimeout");
        Objects.requireNonNull(maxTimeout, "maxTimeout");
        if (minTimeout.isNegative() || maxTimeout.compareTo(minTimeout) < 0) {
            throw new IllegalArgumentException("timeout range must be non-negative and ordered");
        }
        if (maxMemoryMb <= 0 || maxCpuShares <= 0 || maxOutputBytes <= 0) {
            throw new IllegalArgumentException("bounds must be positive");
        }
    }

    public static LimitBounds defaults() {
        return builder().build();
    }

    /**
     * Describes the first limit that falls outside these bounds, if any.
     */
    public Optional<String> violation(ResourceLimits limits) {
        Objects.requireNonNull(limits, "limits");

        if (limits.timeout().compareTo(minTimeout) < 0) {
            return Optional.of("timeout_ms " + limits.timeout().toMillis() + " is below " + minTimeout.toMillis());
        }
        if (limits.timeout().compareTo(maxTimeout) > 0) {
            return Optional.of("timeout_ms " + limits.timeout().toMillis() + " exceeds " + maxTimeout.toMillis());
        }
        if (limits.memoryMb() > maxMemoryMb) {
            return Optional.of("memory_mb " + limits.memoryMb() + " exceeds " + maxMemoryMb);
        }
        if (limits.cpuShares().isPresent() && limits.cpuShares().getAsInt() > maxCpuShares) {
            return Optional.of("cpu_shares " + limits.cpuShares().getAsInt() + " exceeds " + maxCpuShares);
        }
        if (limits.maxOutputBytes() > maxOutputBytes) {
            return Optional.of("max_output_bytes " + limits.maxOutputBytes() + " exceeds " + maxOutputBytes);
        }
        return Optional.empty();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Duration minTimeout = Duration.ofMillis(1);
        private Duration maxTimeout = Duration.ofMinutes(5);
        private long maxMemoryMb = 4096;
        private int maxCpuShares = 4096;
        private long maxOutputBytes = 16L * 1024 * 1024;

        public Builder withMinTimeout(Duration minTimeout) {
            this.minTimeout = minTimeout;
            return this;
        }

        public Builder withMaxTimeout(Duration maxTimeout) {
            this.maxTimeout = maxTimeout;
            return this;
        }

        public Builder withMaxMemoryMb(long maxMemoryMb) {
            this.maxMemoryMb = maxMemoryMb;
            return this;
        }

        public Builder withMaxCpuShares(int maxCpuShares) {
            this.maxCpuShares = maxCpuShares;
            return this;
        }

        public Builder withMaxOutputBytes(long maxOutputBytes) {
            this.maxOutputBytes = maxOutputBytes;
            return this;
        }

        public LimitBounds build() {
            return new LimitBounds(minTimeout, maxTimeout, maxMemoryMb, maxCpuShares, maxOutputBytes);
        }
    }
}
