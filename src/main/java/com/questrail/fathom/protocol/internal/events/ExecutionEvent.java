package com.questrail.fathom.protocol.internal.events;

import java.time.Instant;
import java.util.Objects;

/**
 * ExecutionEvent
 * -----------------------------------------------------------------------------
 * Everything that can advance one execution's state.
 *
 * <h2>Role in the architecture</h2>
 * Each execution is driven by its own machine that processes events one at a
 * time. Events are the only way information reaches that machine:
 * <ul>
 *   <li>Lifecycle requests: submit, cancel, deadline, connection loss</li>
 *   <li>Messages received from the responder (initiator side)</li>
 *   <li>Notifications from the execution backend (responder side)</li>
 * </ul>
 *
 * Events are immutable and carry two times: the wall-clock {@link #timestamp()}
 * used for observability, and the monotonic {@link #tickNanos()} used for
 * deadlines and durations.
 */
public sealed interface ExecutionEvent
        permits ExecutionLifecycleEvent, ExecutionMessageEvent, BackendEvent
{
    Instant timestamp();

    /**
     * Monotonic tick at which the event was generated.
     */
    long tickNanos();

    /**
     * Convenience base class carrying both times.
     */
    abstract class Base {
        private final Instant timestamp;
        private final long tickNanos;

        protected Base(Instant timestamp, long tickNanos) {
            this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
            this.tickNanos = tickNanos;
        }

        public Instant timestamp() {
            return timestamp;
        }

        public long tickNanos() {
            return tickNanos;
        }

        @Override
        public String toString() {
            return getClass().getSimpleName() + "[ts=" + timestamp + "]";
        }
    }
}
