/**
 * Transport Ports
 * =============================================================================
 *
 * <p>Framework-agnostic boundary between a concrete stream transport and the
 * protocol sessions. Everything above this package sees only whole frames as
 * {@code byte[]} and connect/disconnect notifications.</p>
 *
 * <h2>Constraints</h2>
 * Implementations of these ports:
 * <ul>
 *   <li>perform framing and I/O only</li>
 *   <li>do not decode envelopes</li>
 *   <li>do not schedule retries, reconnects or timeouts</li>
 * </ul>
 *
 * <p>Reconnecting is the initiator runtime's job; deadlines belong to the
 * sessions.</p>
 */
package com.questrail.fathom.protocol.transport;
