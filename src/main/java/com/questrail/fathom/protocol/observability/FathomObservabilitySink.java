package com.questrail.fathom.protocol.observability;

/**
 * Receives observability events from sessions, machines and runtimes.
 * Implementations can provide logging, metrics, or tracing.
 *
 * <p>Callbacks arrive on transport, machine and scheduler threads, so
 * implementations must be thread-safe and must not block.</p>
 */
public interface FathomObservabilitySink
{
    /**
     * Called after a machine applied one event.
     */
    void onExecutionTransition(ExecutionTransitionEvent event);

    /**
     * Called for protocol-level facts: rejections, decode failures, late messages.
     */
    void onProtocolEvent(ProtocolObservabilityEvent event);

    /**
     * Called when a connection is opened, established, lost or closed.
     */
    void onConnectionEvent(ConnectionObservabilityEvent event);

    /**
     * Called when an unexpected exception is caught inside the engine.
     */
    void onError(FathomErrorEvent event);
}
