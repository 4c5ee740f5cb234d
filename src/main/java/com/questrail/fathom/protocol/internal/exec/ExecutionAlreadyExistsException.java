package com.questrail.fathom.protocol.internal.exec;

import com.questrail.fathom.protocol.FathomProtocolException;
import com.questrail.fathom.protocol.model.ErrorCode;
import com.questrail.fathom.protocol.model.ExecutionId;

/**
 * Raised when an execution id is registered twice on one connection.
 */
public final class ExecutionAlreadyExistsException extends FathomProtocolException
{
    private final ExecutionId executionId;

    public ExecutionAlreadyExistsException(ExecutionId executionId) {
        super(ErrorCode.INVALID_REQUEST, "Execution id already in use: " + executionId);
        this.executionId = executionId;
    }

    public ExecutionId executionId() {
        return executionId;
    }
}
