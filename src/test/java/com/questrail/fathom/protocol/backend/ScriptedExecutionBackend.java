package com.questrail.fathom.protocol.backend;

import com.questrail.fathom.protocol.model.ExecutionId;
import com.questrail.fathom.protocol.model.ExecutionRequest;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Backend that replays a fixed script instead of running anything.
 *
 * <p>Every started program produces the configured chunks, then end of
 * stream, then the configured exit. Nothing blocks, so a pump on a direct
 * executor runs to completion in one call.</p>
 */
public final class ScriptedExecutionBackend implements ExecutionBackend {

    private final List<OutputChunk> chunks;
    private final BackendExit exit;
    private final String startFailure;

    private final Map<ExecutionId, Handle> handles = new ConcurrentHashMap<>();
    private final List<ExecutionRequest> started = new ArrayList<>();
    private final List<ExecutionId> cancelled = new ArrayList<>();

    private ScriptedExecutionBackend(List<OutputChunk> chunks, BackendExit exit, String startFailure) {
        this.chunks = List.copyOf(chunks);
        this.exit = exit;
        this.startFailure = startFailure;
    }

    public static ScriptedExecutionBackend producing(BackendExit exit, OutputChunk... chunks) {
        return new ScriptedExecutionBackend(List.of(chunks), exit, null);
    }

    public static ScriptedExecutionBackend failingToStart(String message) {
        return new ScriptedExecutionBackend(List.of(), BackendExit.exited(0), message);
    }

    @Override
    public synchronized BackendHandle start(ExecutionRequest request) throws ExecutionBackendException {
        started.add(request);
        if (startFailure != null) {
            throw new ExecutionBackendException(startFailure);
        }
        Handle handle = new Handle(request.id(), new ArrayDeque<>(chunks));
        handles.put(request.id(), handle);
        return handle;
    }

    @Override
    public synchronized void signalCancel(BackendHandle handle) {
        cancelled.add(handle.executionId());
        ((Handle) handle).remaining.clear();
    }

    @Override
    public synchronized OutputChunk pollOutput(BackendHandle handle) {
        OutputChunk next = ((Handle) handle).remaining.poll();
        return next == null ? OutputChunk.endOfStream() : next;
    }

    @Override
    public synchronized BackendExit awaitExit(BackendHandle handle) {
        return cancelled.contains(handle.executionId()) ? BackendExit.killed() : exit;
    }

    public synchronized List<ExecutionRequest> started() {
        return new ArrayList<>(started);
    }

    public synchronized List<ExecutionId> cancelled() {
        return new ArrayList<>(cancelled);
    }

    private static final class Handle implements BackendHandle {
        private final ExecutionId id;
        private final Deque<OutputChunk> remaining;

        Handle(ExecutionId id, Deque<OutputChunk> remaining) {
            this.id = id;
            this.remaining = remaining;
        }

        @Override
        public ExecutionId executionId() {
            return id;
        }
    }
}
