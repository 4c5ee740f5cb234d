package com.questrail.fathom.protocol.model;

import java.util.Objects;

/**
 * Error carried by an {@code error} message, or recorded as the failure cause
 * of an execution.
 *
 * <p>{@code retryable} normally follows {@link ErrorCode#retryable()}, but it is
 * carried explicitly because it is what the peer actually sent.</p>
 */
public record ProtocolError(ErrorCode code, String message, boolean retryable)
{
    public ProtocolError {
        Objects.requireNonNull(code, "code");
        message = message == null ? "" : message;
    }

    public static ProtocolError of(ErrorCode code, String message) {
        return new ProtocolError(code, message, code.retryable());
    }
}
