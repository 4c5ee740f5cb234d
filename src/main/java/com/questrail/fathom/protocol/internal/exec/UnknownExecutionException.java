package com.questrail.fathom.protocol.internal.exec;

import com.questrail.fathom.protocol.FathomProtocolException;
import com.questrail.fathom.protocol.model.ErrorCode;
import com.questrail.fathom.protocol.model.ExecutionId;

/**
 * Raised when a message names an execution that is not registered.
 */
public final class UnknownExecutionException extends FathomProtocolException
{
    private final ExecutionId executionId;

    public UnknownExecutionException(ExecutionId executionId) {
        super(ErrorCode.UNKNOWN_EXECUTION, "Unknown execution: " + executionId);
        this.executionId = executionId;
    }

    public ExecutionId executionId() {
        return executionId;
    }
}
