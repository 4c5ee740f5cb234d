package com.questrail.fathom.protocol.observability;

import java.time.Instant;

/**
 * Unexpected failure caught inside the engine.
 */
public record FathomErrorEvent(
        Instant timestamp,
        String message,
        Throwable cause
) {
}
