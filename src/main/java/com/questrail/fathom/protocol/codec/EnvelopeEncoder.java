package com.questrail.fathom.protocol.codec;

import com.questrail.fathom.protocol.model.Envelope;

/**
 * Outbound codec boundary: one {@link Envelope} in, one transport frame out.
 *
 * <p>Envelopes validate themselves on construction, so encoding a well-formed
 * envelope never fails. The returned bytes contain no frame delimiter; adding
 * one is the transport's job.</p>
 */
public interface EnvelopeEncoder
{
    byte[] encode(Envelope envelope);
}
