package com.questrail.fathom.protocol.model;

/**
 * The side of a connection an engine instance plays.
 *
 * <p>Both roles share the same execution state machine. The responder
 * <em>emits</em> lifecycle messages; the initiator <em>observes</em> them.</p>
 */
public enum Role {
    /** Submits executions, cancels and pings. */
    INITIATOR,

    /** Accepts executions and drives the execution backend. */
    RESPONDER
}
