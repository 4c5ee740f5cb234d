package com.questrail.fathom.protocol.codec;

import com.questrail.fathom.protocol.model.Envelope;

/**
 * EnvelopeDecoder
 * -----------------------------------------------------------------------------
 * Inbound codec boundary: one transport frame in, one {@link Envelope} out.
 *
 * <p>The decoder is responsible only for:</p>
 * <ul>
 *   <li>Parsing the wire representation</li>
 *   <li>Checking required fields and the protocol version</li>
 *   <li>Mapping the type name onto the closed {@code MessageType} catalogue</li>
 *   <li>Building the matching payload record</li>
 * </ul>
 *
 * <p>The decoder is <strong>not</strong> responsible for:</p>
 * <ul>
 *   <li>Looking up executions</li>
 *   <li>Checking message direction against the local role</li>
 *   <li>Checking limits against responder policy</li>
 * </ul>
 *
 * <p>Decoding is a pure transform. A failure is reported at the connection level
 * and is never attributed to an execution, even when the frame carried an id.</p>
 */
public interface EnvelopeDecoder
{
    /**
     * Decodes one complete frame.
     *
     * @param frame raw bytes of exactly one message
     * @return the decoded envelope
     * @throws EnvelopeDecodeException if the frame is not a valid envelope
     */
    Envelope decode(byte[] frame);
}
