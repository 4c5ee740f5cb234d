package com.questrail.fathom.protocol.internal.events;

import com.questrail.fathom.protocol.model.OutputChannel;
import com.questrail.fathom.protocol.model.ResourceUsage;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Notifications from the execution backend, responder side only.
 */
public sealed interface BackendEvent extends ExecutionEvent
        permits BackendEvent.BackendStarted,
                BackendEvent.OutputProduced,
                BackendEvent.BackendExited,
                BackendEvent.BackendFailed
{
    /** The process is running. */
    final class BackendStarted extends ExecutionEvent.Base implements BackendEvent {
        public BackendStarted(Instant timestamp, long tickNanos) {
            super(timestamp, tickNanos);
        }
    }

    /** One chunk read from the process. */
    final class OutputProduced extends ExecutionEvent.Base implements BackendEvent {
        private final OutputChannel channel;
        private final String data;

        public OutputProduced(OutputChannel channel, String data, Instant timestamp, long tickNanos) {
            super(timestamp, tickNanos);
            this.channel = Objects.requireNonNull(channel, "channel");
            this.data = Objects.requireNonNull(data, "data");
        }

        public OutputChannel channel() {
            return channel;
        }

        public String data() {
            return data;
        }
    }

    /**
     * The process ended. {@code exitCode} is empty when the process was killed
     * by a signal; {@code oomKilled} reports a memory-limit kill.
     */
    final class BackendExited extends ExecutionEvent.Base implements BackendEvent {
        private final OptionalInt exitCode;
        private final Optional<ResourceUsage> usage;
        private final boolean oomKilled;

        public BackendExited(OptionalInt exitCode,
                             Optional<ResourceUsage> usage,
                             boolean oomKilled,
                             Instant timestamp,
                             long tickNanos) {
            super(timestamp, tickNanos);
            this.exitCode = Objects.requireNonNull(exitCode, "exitCode");
            this.usage = Objects.requireNonNull(usage, "usage");
            this.oomKilled = oomKilled;
        }

        public OptionalInt exitCode() {
            return exitCode;
        }

        public Optional<ResourceUsage> usage() {
            return usage;
        }

        public boolean oomKilled() {
            return oomKilled;
        }
    }

    /** The backend could not start or lost track of the process. */
    final class BackendFailed extends ExecutionEvent.Base implements BackendEvent {
        private final String message;

        public BackendFailed(String message, Instant timestamp, long tickNanos) {
            super(timestamp, tickNanos);
            this.message = message == null ? "" : message;
        }

        public String message() {
            return message;
        }
    }
}
