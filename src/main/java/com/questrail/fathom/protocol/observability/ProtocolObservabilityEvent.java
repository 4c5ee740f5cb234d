package com.questrail.fathom.protocol.observability;

import com.questrail.fathom.protocol.model.ExecutionId;
import com.questrail.fathom.protocol.model.Role;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Protocol-level fact observed by a session.
 */
public record ProtocolObservabilityEvent(
        Instant timestamp,
        Role role,
        Kind kind,
        Optional<ExecutionId> executionId,
        String detail
) {
    public enum Kind {
        /** A frame failed to decode. */
        DECODE_FAILURE,
        /** An execute request was refused before acknowledgment. */
        REJECTED,
        /** A message named an execution this side does not know. */
        UNKNOWN_EXECUTION,
        /** A message arrived in the wrong direction or out of order. */
        PROTOCOL_VIOLATION,
        /** A message arrived for an execution that already settled. */
        LATE_MESSAGE,
        /** The responder reported an error not attributed to any execution. */
        CONNECTION_ERROR,
        /** The first envelope was accepted and the version fixed. */
        HANDSHAKE_COMPLETE,
        /** The initiator runtime scheduled a reconnect. */
        RECONNECT_SCHEDULED
    }

    public ProtocolObservabilityEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(role, "role");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(executionId, "executionId");
        detail = detail == null ? "" : detail;
    }

    public static ProtocolObservabilityEvent of(Instant timestamp, Role role, Kind kind, String detail) {
        return new ProtocolObservabilityEvent(timestamp, role, kind, Optional.empty(), detail);
    }

    public static ProtocolObservabilityEvent of(Instant timestamp, Role role, Kind kind,
                                                ExecutionId id, String detail) {
        return new ProtocolObservabilityEvent(timestamp, role, kind, Optional.of(id), detail);
    }
}
