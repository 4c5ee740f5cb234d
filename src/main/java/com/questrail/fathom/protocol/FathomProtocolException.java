package com.questrail.fathom.protocol;

import com.questrail.fathom.protocol.model.ErrorCode;

import java.util.Objects;

/**
 * Base type for protocol failures that map onto a canonical {@link ErrorCode}.
 *
 * <p>On the responder these never reach the wire as exceptions: sessions catch
 * them and answer with an {@code error} message carrying {@link #code()}. On the
 * initiator they are thrown from the submission API or fail its futures.</p>
 */
public class FathomProtocolException extends RuntimeException
{
    private final ErrorCode code;

    public FathomProtocolException(ErrorCode code, String message) {
        super(message);
        this.code = Objects.requireNonNull(code, "code");
    }

    public FathomProtocolException(ErrorCode code, String message, Throwable cause) {
        super(message, cause);
        this.code = Objects.requireNonNull(code, "code");
    }

    public ErrorCode code() {
        return code;
    }
}
