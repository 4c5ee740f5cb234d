package com.questrail.fathom.protocol.session;

import com.questrail.fathom.protocol.codec.EnvelopeDecoder;
import com.questrail.fathom.protocol.codec.EnvelopeEncoder;
import com.questrail.fathom.protocol.internal.time.MonotonicClock;
import com.questrail.fathom.protocol.internal.time.MonotonicScheduler;
import com.questrail.fathom.protocol.internal.time.WallClock;
import com.questrail.fathom.protocol.observability.FathomObservabilitySink;
import com.questrail.fathom.protocol.observability.NullObservabilitySink;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Collaborators shared by every session of one runtime.
 *
 * @param machineExecutor executor that drains execution mailboxes
 */
public record SessionContext(
        EnvelopeDecoder decoder,
        EnvelopeEncoder encoder,
        MonotonicClock clock,
        WallClock wallClock,
        MonotonicScheduler scheduler,
        Executor machineExecutor,
        FathomObservabilitySink sink
) {
    public SessionContext {
        Objects.requireNonNull(decoder, "decoder");
        Objects.requireNonNull(encoder, "encoder");
        Objects.requireNonNull(clock, "clock");
        Objects.requireNonNull(wallClock, "wallClock");
        Objects.requireNonNull(scheduler, "scheduler");
        Objects.requireNonNull(machineExecutor, "machineExecutor");
        sink = Objects.requireNonNullElse(sink, NullObservabilitySink.INSTANCE);
    }
}
