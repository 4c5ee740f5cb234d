package com.questrail.fathom.protocol.backend;

import com.questrail.fathom.protocol.model.ResourceUsage;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * How a program ended.
 *
 * @param exitCode  empty when the program was killed by a signal
 * @param usage     resource figures, when the backend measures them
 * @param oomKilled true if the backend killed the program for exceeding its memory limit
 */
public record BackendExit(OptionalInt exitCode, Optional<ResourceUsage> usage, boolean oomKilled)
{
    public BackendExit {
        Objects.requireNonNull(exitCode, "exitCode");
        Objects.requireNonNull(usage, "usage");
    }

    public static BackendExit exited(int exitCode) {
        return new BackendExit(OptionalInt.of(exitCode), Optional.empty(), false);
    }

    public static BackendExit exited(int exitCode, ResourceUsage usage) {
        return new BackendExit(OptionalInt.of(exitCode), Optional.of(usage), false);
    }

    public static BackendExit killed() {
        return new BackendExit(OptionalInt.empty(), Optional.empty(), false);
    }

    public static BackendExit oomKilled(ResourceUsage usage) {
        return new BackendExit(OptionalInt.empty(), Optional.ofNullable(usage), true);
    }
}
