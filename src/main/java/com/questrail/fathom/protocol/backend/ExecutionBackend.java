package com.questrail.fathom.protocol.backend;

import com.questrail.fathom.protocol.model.ExecutionRequest;

/**
 * ExecutionBackend
 * =============================================================================
 * Port to whatever actually runs code: a container, a microVM, a jailed process.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>Start the program described by a request inside its resource limits</li>
 *   <li>Hand back output in chunks, in the order the program produced it
 *       within each channel</li>
 *   <li>Report how the program ended, including memory-limit kills</li>
 *   <li>Stop the program when asked</li>
 * </ul>
 *
 * The engine never enforces memory or CPU limits itself; it watches only the
 * deadline and the output volume.
 *
 * <h2>Threading</h2>
 * The responder calls {@link #start}, {@link #pollOutput} and {@link #awaitExit}
 * from one pump thread per execution, in that order. {@link #signalCancel} may be
 * called from any thread, at any time after {@code start} returned, and more than
 * once. After a cancel signal the backend must let {@code pollOutput} reach end of
 * stream and {@code awaitExit} return promptly.
 */
public interface ExecutionBackend
{
    /**
     * Starts the program. May block until the sandbox is ready.
     */
    BackendHandle start(ExecutionRequest request) throws ExecutionBackendException;

    /**
     * Asks the program to stop. Idempotent.
     */
    void signalCancel(BackendHandle handle) throws ExecutionBackendException;

    /**
     * Blocks until the next output chunk is available.
     *
     * @return a chunk, or {@link OutputChunk#endOfStream()} once both channels are closed
     */
    OutputChunk pollOutput(BackendHandle handle) throws ExecutionBackendException, InterruptedException;

    /**
     * Blocks until the program has ended.
     */
    BackendExit awaitExit(BackendHandle handle) throws ExecutionBackendException, InterruptedException;
}
