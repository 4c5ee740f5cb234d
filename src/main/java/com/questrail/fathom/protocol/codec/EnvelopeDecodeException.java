package com.questrail.fathom.protocol.codec;

import com.questrail.fathom.protocol.FathomProtocolException;
import com.questrail.fathom.protocol.model.ErrorCode;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Indicates that a frame could not be translated into a valid {@code Envelope}.
 *
 * <p>Always classified as {@link ErrorCode#INVALID_REQUEST}. The {@link Reason}
 * lets a session tell a handshake-fatal version mismatch apart from an ordinary
 * malformed message.</p>
 */
public final class EnvelopeDecodeException extends FathomProtocolException
{
    public enum Reason {
        /** Not parseable, or not a JSON object. */
        MALFORMED,
        /** A required field is absent or null. */
        MISSING_FIELD,
        /** A field is present but has the wrong shape or an illegal value. */
        INVALID_FIELD,
        /** The {@code v} field names a version this decoder does not speak. */
        UNSUPPORTED_VERSION,
        /** The {@code type} field is not in the message catalogue. */
        UNKNOWN_TYPE
    }

    private final Reason reason;
    private final Integer version;

    public EnvelopeDecodeException(Reason reason, String message) {
        this(reason, message, null, null);
    }

    public EnvelopeDecodeException(Reason reason, String message, Throwable cause) {
        this(reason, message, null, cause);
    }

    private EnvelopeDecodeException(Reason reason, String message, Integer version, Throwable cause) {
        super(ErrorCode.INVALID_REQUEST, message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
        this.version = version;
    }

    public static EnvelopeDecodeException unsupportedVersion(int version) {
        return new EnvelopeDecodeException(Reason.UNSUPPORTED_VERSION,
                "Unsupported protocol version: " + version, version, null);
    }

    public Reason reason() {
        return reason;
    }

    /**
     * The offending version, for {@link Reason#UNSUPPORTED_VERSION} failures.
     */
    public OptionalInt version() {
        return version == null ? OptionalInt.empty() : OptionalInt.of(version);
    }
}
