/**
 * Ready-to-run responder and initiator stacks over TCP.
 */
package com.questrail.fathom.protocol.runtime;
