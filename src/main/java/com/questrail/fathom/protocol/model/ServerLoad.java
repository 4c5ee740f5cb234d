package com.questrail.fathom.protocol.model;

/**
 * Load snapshot attached to {@code pong}.
 *
 * @param activeExecutions executions currently running
 * @param queueDepth       executions acknowledged but not yet running
 */
public record ServerLoad(int activeExecutions, int queueDepth)
{
    public ServerLoad {
        if (activeExecutions < 0 || queueDepth < 0) {
            throw new IllegalArgumentException("load figures must be >= 0");
        }
    }
}
