package com.questrail.fathom.protocol.observability;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Production {@link FathomObservabilitySink} that emits logs via SLF4J.
 */
public final class Slf4jFathomObservabilitySink implements FathomObservabilitySink
{
    private static final Logger log = LoggerFactory.getLogger(Slf4jFathomObservabilitySink.class);

    @Override
    public void onExecutionTransition(ExecutionTransitionEvent event) {
        if (event.isStatusChange()) {
            log.info("{} execution {}: {} -> {}",
                    event.newState().role(),
                    event.newState().id(),
                    event.oldState().status(),
                    event.newState().status());
        } else if (log.isTraceEnabled()) {
            log.trace("{} execution {}: {} on {}",
                    event.newState().role(),
                    event.newState().id(),
                    event.resultingIntents(),
                    event.triggeringEvent());
        }
    }

    @Override
    public void onProtocolEvent(ProtocolObservabilityEvent event) {
        if (event.kind() == ProtocolObservabilityEvent.Kind.REJECTED) {
            log.info("{} rejected execution {}: {}",
                    event.role(), event.executionId().map(Object::toString).orElse("-"), event.detail());
        } else {
            log.debug("{} protocol event {} [{}]: {}",
                    event.role(), event.kind(), event.executionId().map(Object::toString).orElse("-"), event.detail());
        }
    }

    @Override
    public void onConnectionEvent(ConnectionObservabilityEvent event) {
        log.info("{} connection {}: {}", event.role(), event.kind(), event.detail());
    }

    @Override
    public void onError(FathomErrorEvent event) {
        log.error("Fathom error: {}", event.message(), event.cause());
    }
}
