/**
 * Envelope Codec
 * =============================================================================
 *
 * <p>The codec layer is the explicit boundary between wire bytes and the
 * semantic {@link com.questrail.fathom.protocol.model.Envelope} model:</p>
 *
 * <pre>
 *   byte[] frame
 *        → EnvelopeDecoder      (version, required fields, type catalogue)
 *            → Envelope         (immutable, type/payload consistent)
 *                → ConnectionSession dispatch
 * </pre>
 *
 * <p>Sessions, state machines and tests reason about envelopes only; JSON field
 * names and number shapes never leave this package and its {@code impl}
 * subpackage.</p>
 */
package com.questrail.fathom.protocol.codec;
