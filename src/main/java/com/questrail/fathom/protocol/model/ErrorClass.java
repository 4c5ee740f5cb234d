package com.questrail.fathom.protocol.model;

/**
 * Coarse classification of {@link ErrorCode}s.
 *
 * <p>Retryability is a property of the class: only infrastructure failures are
 * worth retrying, and retrying is always the initiator's decision.</p>
 */
public enum ErrorClass {
    RESOURCE(false),
    PROTOCOL(false),
    INFRASTRUCTURE(true);

    private final boolean retryable;

    ErrorClass(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean retryable() {
        return retryable;
    }
}
