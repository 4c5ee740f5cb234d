/**
 * Connection sessions: one per physical connection, one per role.
 *
 * <p>{@link com.questrail.fathom.protocol.session.ResponderSession} admits
 * requests and drives an execution backend.
 * {@link com.questrail.fathom.protocol.session.InitiatorSession} submits
 * requests and hands each caller a
 * {@link com.questrail.fathom.protocol.session.PendingExecution}. Both sit on
 * a {@link com.questrail.fathom.protocol.transport.DuplexEndpoint} and never
 * touch the network directly.</p>
 */
package com.questrail.fathom.protocol.session;
