package com.questrail.fathom.protocol.internal.time;

import java.time.Instant;

/**
 * Source of envelope timestamps and observability instants.
 *
 * <p>May jump with NTP or manual adjustment. Never used to decide expiry;
 * see {@link MonotonicClock}.</p>
 */
public interface WallClock
{
    Instant now();
}
