package com.questrail.fathom.protocol.backend;

import com.questrail.fathom.protocol.model.ExecutionId;

/**
 * Backend-specific reference to one started program.
 */
public interface BackendHandle
{
    ExecutionId executionId();
}
