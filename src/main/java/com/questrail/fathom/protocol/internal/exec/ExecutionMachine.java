package com.questrail.fathom.protocol.internal.exec;

import com.questrail.fathom.protocol.internal.events.ExecutionEvent;
import com.questrail.fathom.protocol.internal.state.ExecutionState;
import com.questrail.fathom.protocol.internal.state.ExecutionStateReducer;
import com.questrail.fathom.protocol.model.ExecutionId;
import com.questrail.fathom.protocol.observability.ExecutionTransitionEvent;
import com.questrail.fathom.protocol.observability.FathomErrorEvent;
import com.questrail.fathom.protocol.observability.FathomObservabilitySink;
import com.questrail.fathom.protocol.observability.NullObservabilitySink;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * ExecutionMachine
 * =============================================================================
 * Serialized owner of one execution's state.
 *
 * <h2>Threading model</h2>
 * The machine is a mailbox actor. {@link #submit(ExecutionEvent)} may be called
 * from any thread (transport event loop, watchdog timer, backend pump); events
 * are queued FIFO and drained by at most one task at a time on a shared
 * {@link Executor}. Only that task applies the reducer and swaps the state.
 * Many machines share one executor without sharing a thread.
 *
 * <pre>
 *   submit(event) → mailbox → drain task → reducer.apply → intents → executor
 * </pre>
 *
 * Events submitted while the machine is draining (including events produced by
 * its own intents) are appended to the mailbox and handled by the same drain
 * pass, so a direct executor gives fully deterministic behavior in tests.
 *
 * <h2>Failure handling</h2>
 * An exception thrown by the reducer or by intent execution is reported to the
 * observability sink. The machine keeps processing later events.
 */
public final class ExecutionMachine
{
    private final ExecutionStateReducer reducer;
    private final ExecutionIntentExecutor intentExecutor;
    private final Executor executor;
    private final FathomObservabilitySink sink;

    private final Queue<ExecutionEvent> mailbox = new ConcurrentLinkedQueue<>();
    private final AtomicBoolean draining = new AtomicBoolean(false);

    private volatile ExecutionState state;

    public ExecutionMachine(ExecutionState initialState,
                            ExecutionStateReducer reducer,
                            ExecutionIntentExecutor intentExecutor,
                            Executor executor,
                            FathomObservabilitySink sink) {
        this.state = Objects.requireNonNull(initialState, "initialState");
        this.reducer = Objects.requireNonNull(reducer, "reducer");
        this.intentExecutor = Objects.requireNonNull(intentExecutor, "intentExecutor");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.sink = Objects.requireNonNullElse(sink, NullObservabilitySink.INSTANCE);
    }

    public ExecutionId id() {
        return state.id();
    }

    /**
     * Latest state. Safe to read from any thread; may lag events still queued.
     */
    public ExecutionState state() {
        return state;
    }

    public boolean isTerminal() {
        return state.isTerminal();
    }

    /**
     * Queues an event for processing.
     */
    public void submit(ExecutionEvent event) {
        Objects.requireNonNull(event, "event");
        mailbox.add(event);
        scheduleDrain();
    }

    private void scheduleDrain() {
        if (!draining.compareAndSet(false, true)) {
            return;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            draining.set(false);
            sink.onError(new FathomErrorEvent(state.lastTransition(),
                    "Execution " + state.id() + " could not be scheduled; " + mailbox.size() + " event(s) pending",
                    e));
        }
    }

    private void drain() {
        try {
            ExecutionEvent event;
            while ((event = mailbox.poll()) != null) {
                process(event);
            }
        } finally {
            draining.set(false);
        }

        // An event may have slipped in between the last poll and the flag reset.
        if (!mailbox.isEmpty()) {
            scheduleDrain();
        }
    }

    private void process(ExecutionEvent event) {
        ExecutionState oldState = state;
        try {
            ExecutionStateReducer.Result result = reducer.apply(oldState, event);
            state = result.newState();

            sink.onExecutionTransition(new ExecutionTransitionEvent(
                    event.timestamp(),
                    oldState,
                    result.newState(),
                    event,
                    result.intents()));

            if (!result.intents().isEmpty()) {
                intentExecutor.execute(this, result.newState(), result.intents());
            }
        } catch (RuntimeException e) {
            sink.onError(new FathomErrorEvent(event.timestamp(),
                    "Execution " + oldState.id() + " failed to process " + event.getClass().getSimpleName(),
                    e));
        }
    }

    @Override
    public String toString() {
        return "ExecutionMachine[" + state + "]";
    }
}
