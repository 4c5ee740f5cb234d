package com.questrail.fathom.protocol.observability;

import com.questrail.fathom.protocol.model.Role;

import java.time.Instant;
import java.util.Objects;

/**
 * Connection lifecycle change seen by one session.
 */
public record ConnectionObservabilityEvent(
        Instant timestamp,
        Role role,
        Kind kind,
        String detail
) {
    public enum Kind {
        CONNECTED,
        ESTABLISHED,
        DISCONNECTED,
        CLOSED
    }

    public ConnectionObservabilityEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(kind, "kind");
        detail = detail == null ? "" : detail;
    }
}
