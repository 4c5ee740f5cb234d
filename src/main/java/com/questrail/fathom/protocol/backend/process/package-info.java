/**
 * Execution backend that runs requests as unconfined local processes.
 */
package com.questrail.fathom.protocol.backend.process;
