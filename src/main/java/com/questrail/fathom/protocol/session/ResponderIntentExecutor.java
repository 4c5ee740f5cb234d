package com.questrail.fathom.protocol.session;

import com.questrail.fathom.protocol.backend.BackendHandle;
import com.questrail.fathom.protocol.backend.ExecutionBackend;
import com.questrail.fathom.protocol.backend.ExecutionBackendException;
import com.questrail.fathom.protocol.internal.events.BackendEvent;
import com.questrail.fathom.protocol.internal.exec.ExecutionIntentExecutor;
import com.questrail.fathom.protocol.internal.exec.ExecutionMachine;
import com.questrail.fathom.protocol.internal.state.ExecutionIntent;
import com.questrail.fathom.protocol.internal.state.ExecutionIntents;
import com.questrail.fathom.protocol.internal.state.ExecutionState;
import com.questrail.fathom.protocol.model.Envelope;
import com.questrail.fathom.protocol.model.ExecutionId;
import com.questrail.fathom.protocol.observability.FathomErrorEvent;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Turns responder intents into envelopes and backend calls for one execution.
 */
final class ResponderIntentExecutor implements ExecutionIntentExecutor
{
    private final ResponderSession session;
    private final ExecutionBackend backend;
    private final Executor pumpExecutor;

    private final AtomicReference<BackendHandle> handle = new AtomicReference<>();
    private final AtomicBoolean cancelPending = new AtomicBoolean(false);

    ResponderIntentExecutor(ResponderSession session, ExecutionBackend backend, Executor pumpExecutor) {
        this.session = session;
        this.backend = backend;
        this.pumpExecutor = pumpExecutor;
    }

    @Override
    public void execute(ExecutionMachine machine, ExecutionState state, ExecutionIntents intents) {
        ExecutionId id = state.id();

        for (ExecutionIntent intent : intents.asList()) {
            switch (intent.kind()) {
                case EMIT_ACK:
                    session.send(Envelope.ack(id, session.now()));
                    break;
                case EMIT_STATUS:
                    session.send(Envelope.status(id, ((ExecutionIntent.EmitStatus) intent).status(), session.now()));
                    break;
                case EMIT_OUTPUT: {
                    ExecutionIntent.EmitOutput output = (ExecutionIntent.EmitOutput) intent;
                    session.send(Envelope.output(id, output.channel(), output.data(), session.now()));
                    break;
                }
                case EMIT_ERROR:
                    session.send(Envelope.error(id, ((ExecutionIntent.EmitError) intent).error(), session.now()));
                    break;
                case EMIT_RESULT:
                    session.send(Envelope.result(id, ((ExecutionIntent.EmitResult) intent).result(), session.now()));
                    break;
                case START_BACKEND:
                    startBackend(machine, ((ExecutionIntent.StartBackend) intent));
                    break;
                case SIGNAL_CANCEL:
                    signalCancel(machine);
                    break;
                default:
                    if (!session.handleCommonIntent(machine, intent)) {
                        throw new IllegalStateException("Responder cannot carry out " + intent.kind());
                    }
            }
        }
    }

    private void startBackend(ExecutionMachine machine, ExecutionIntent.StartBackend intent) {
        BackendOutputPump pump = new BackendOutputPump(machine, intent.request(), backend, this::onStarted,
                session.context.wallClock(), session.context.clock());
        try {
            pumpExecutor.execute(pump);
        } catch (RejectedExecutionException e) {
            machine.submit(new BackendEvent.BackendFailed("Backend pump could not be scheduled: " + e.getMessage(),
                    session.now(), session.tick()));
        }
    }

    /**
     * Called by the pump once {@code start} returned. A cancel that arrived
     * before the handle existed is delivered now.
     */
    private void onStarted(ExecutionMachine machine, BackendHandle started) {
        handle.set(started);
        if (cancelPending.get()) {
            deliverCancel(machine, started);
        }
    }

    private void signalCancel(ExecutionMachine machine) {
        cancelPending.set(true);
        BackendHandle current = handle.get();
        if (current != null) {
            deliverCancel(machine, current);
        }
    }

    private void deliverCancel(ExecutionMachine machine, BackendHandle target) {
        try {
            backend.signalCancel(target);
        } catch (ExecutionBackendException | RuntimeException e) {
            session.sink.onError(new FathomErrorEvent(session.now(),
                    "Failed to cancel execution " + machine.id(), e));
        }
    }
}
