package com.questrail.fathom.protocol.observability;

/**
 * No-op {@link FathomObservabilitySink}.
 */
public final class NullObservabilitySink implements FathomObservabilitySink
{
    public static final NullObservabilitySink INSTANCE = new NullObservabilitySink();

    private NullObservabilitySink() {}

    @Override
    public void onExecutionTransition(ExecutionTransitionEvent event) {}

    @Override
    public void onProtocolEvent(ProtocolObservabilityEvent event) {}

    @Override
    public void onConnectionEvent(ConnectionObservabilityEvent event) {}

    @Override
    public void onError(FathomErrorEvent event) {}
}
