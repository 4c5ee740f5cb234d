package com.questrail.fathom.protocol.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Opaque identifier scoping every message that belongs to one execution request.
 *
 * <p>Identifiers are chosen by the initiator. The engine never interprets their
 * content; it only requires them to be non-blank.</p>
 */
public record ExecutionId(String value)
{
    public ExecutionId {
        Objects.requireNonNull(value, "value");
        if (value.isBlank()) {
            throw new IllegalArgumentException("execution id must not be blank");
        }
    }

    public static ExecutionId of(String value) {
        return new ExecutionId(value);
    }

    /**
     * Generates a fresh random identifier.
     */
    public static ExecutionId random() {
        return new ExecutionId(UUID.randomUUID().toString());
    }

    @Override
    public String toString() {
        return value;
    }
}
