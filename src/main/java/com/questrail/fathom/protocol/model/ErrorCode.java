package com.questrail.fathom.protocol.model;

import java.util.Optional;

/**
 * Canonical error kinds shared by the codec, the registry, the watchdog and
 * both session roles.
 */
public enum ErrorCode {
    TIMEOUT(ErrorClass.RESOURCE),
    OOM(ErrorClass.RESOURCE),
    OUTPUT_LIMIT(ErrorClass.RESOURCE),

    LANGUAGE_NOT_SUPPORTED(ErrorClass.PROTOCOL),
    INVALID_REQUEST(ErrorClass.PROTOCOL),
    UNKNOWN_EXECUTION(ErrorClass.PROTOCOL),

    SANDBOX_OVERLOADED(ErrorClass.INFRASTRUCTURE),
    INTERNAL_ERROR(ErrorClass.INFRASTRUCTURE),
    NETWORK_ERROR(ErrorClass.INFRASTRUCTURE);

    private final ErrorClass errorClass;

    ErrorCode(ErrorClass errorClass) {
        this.errorClass = errorClass;
    }

    public ErrorClass errorClass() {
        return errorClass;
    }

    public boolean retryable() {
        return errorClass.retryable();
    }

    /**
     * Wire names are the constant names themselves, e.g. {@code "OUTPUT_LIMIT"}.
     */
    public String wireName() {
        return name();
    }

    public static Optional<ErrorCode> fromWireName(String wireName) {
        for (ErrorCode code : values()) {
            if (code.name().equals(wireName)) {
                return Optional.of(code);
            }
        }
        return Optional.empty();
    }
}
