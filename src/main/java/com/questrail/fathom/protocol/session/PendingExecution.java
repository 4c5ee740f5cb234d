package com.questrail.fathom.protocol.session;

import com.questrail.fathom.protocol.internal.events.ExecutionLifecycleEvent;
import com.questrail.fathom.protocol.internal.exec.ExecutionMachine;
import com.questrail.fathom.protocol.internal.time.MonotonicClock;
import com.questrail.fathom.protocol.internal.time.WallClock;
import com.questrail.fathom.protocol.model.ExecStatus;
import com.questrail.fathom.protocol.model.ExecutionId;
import com.questrail.fathom.protocol.model.ExecutionRequest;
import com.questrail.fathom.protocol.model.OutputChannel;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Caller's handle on one submitted execution.
 *
 * <p>The {@link #outcome()} future completes exactly once, when the
 * execution settles: a result arrived, the responder rejected the request,
 * the initiator's own deadline expired, or the connection was lost. It never
 * completes exceptionally.</p>
 */
public final class PendingExecution
{
    private final ExecutionRequest request;
    private final WallClock wallClock;
    private final MonotonicClock clock;
    private final CompletableFuture<ExecutionOutcome> outcome = new CompletableFuture<>();

    private final StringBuilder stdout = new StringBuilder();
    private final StringBuilder stderr = new StringBuilder();

    private volatile ExecutionMachine machine;

    PendingExecution(ExecutionRequest request, WallClock wallClock, MonotonicClock clock) {
        this.request = Objects.requireNonNull(request, "request");
        this.wallClock = wallClock;
        this.clock = clock;
    }

    void attach(ExecutionMachine machine) {
        this.machine = machine;
    }

    public ExecutionId id() {
        return request.id();
    }

    public ExecutionRequest request() {
        return request;
    }

    public CompletableFuture<ExecutionOutcome> outcome() {
        return outcome;
    }

    public boolean isDone() {
        return outcome.isDone();
    }

    /**
     * Latest status known to the initiator.
     */
    public ExecStatus status() {
        ExecutionMachine current = machine;
        return current == null ? ExecStatus.PENDING : current.state().status();
    }

    /**
     * Asks the responder to stop the execution. Advisory: the outcome still
     * reflects whatever the responder reports.
     */
    public void cancel() {
        ExecutionMachine current = machine;
        if (current != null && !outcome.isDone()) {
            current.submit(new ExecutionLifecycleEvent.CancelRequested(wallClock.now(), clock.nowNanos()));
        }
    }

    /**
     * Stdout received so far.
     */
    public String stdout() {
        synchronized (stdout) {
            return stdout.toString();
        }
    }

    /**
     * Stderr received so far.
     */
    public String stderr() {
        synchronized (stderr) {
            return stderr.toString();
        }
    }

    void append(OutputChannel channel, String data) {
        StringBuilder target = channel == OutputChannel.STDOUT ? stdout : stderr;
        synchronized (target) {
            target.append(data);
        }
    }

    boolean complete(ExecutionOutcome result) {
        return outcome.complete(result);
    }

    @Override
    public String toString() {
        return "PendingExecution[" + request.id() + ", " + status() + "]";
    }
}
