package com.questrail.fathom.protocol.backend;

/**
 * Checked failure reported by an {@link ExecutionBackend}.
 *
 * <p>The responder turns it into a retryable {@code INTERNAL_ERROR} for the
 * affected execution; it never reaches the connection.</p>
 */
public class ExecutionBackendException extends Exception
{
    public ExecutionBackendException(String message) {
        super(message);
    }

    public ExecutionBackendException(String message, Throwable cause) {
        super(message, cause);
    }
}
