package com.questrail.fathom.protocol.session;

import com.questrail.fathom.protocol.internal.events.ExecutionLifecycleEvent;
import com.questrail.fathom.protocol.internal.exec.ExecutionIntentExecutor;
import com.questrail.fathom.protocol.internal.exec.ExecutionMachine;
import com.questrail.fathom.protocol.internal.state.ExecutionIntent;
import com.questrail.fathom.protocol.internal.state.ExecutionIntents;
import com.questrail.fathom.protocol.internal.state.ExecutionState;
import com.questrail.fathom.protocol.model.Envelope;
import com.questrail.fathom.protocol.model.ExecutionId;
import com.questrail.fathom.protocol.observability.FathomErrorEvent;

/**
 * Turns initiator intents into outbound messages and caller notifications
 * for one execution.
 */
final class InitiatorIntentExecutor implements ExecutionIntentExecutor
{
    private final InitiatorSession session;
    private final PendingExecution pending;
    private final ExecutionListener listener;

    InitiatorIntentExecutor(InitiatorSession session, PendingExecution pending, ExecutionListener listener) {
        this.session = session;
        this.pending = pending;
        this.listener = listener;
    }

    @Override
    public void execute(ExecutionMachine machine, ExecutionState state, ExecutionIntents intents) {
        ExecutionId id = state.id();

        for (ExecutionIntent intent : intents.asList()) {
            switch (intent.kind()) {
                case SEND_EXECUTE:
                    if (!session.send(Envelope.execute(((ExecutionIntent.SendExecute) intent).request(),
                            session.now()))) {
                        machine.submit(new ExecutionLifecycleEvent.ConnectionLost(session.now(), session.tick()));
                    }
                    break;
                case SEND_CANCEL:
                    session.send(Envelope.cancel(id, session.now()));
                    break;
                case NOTIFY_ACK:
                    notifyListener(id, () -> listener.onAcknowledged(id));
                    break;
                case NOTIFY_STATUS: {
                    ExecutionIntent.NotifyStatus status = (ExecutionIntent.NotifyStatus) intent;
                    notifyListener(id, () -> listener.onStatus(id, status.status()));
                    break;
                }
                case DELIVER_OUTPUT: {
                    ExecutionIntent.DeliverOutput output = (ExecutionIntent.DeliverOutput) intent;
                    pending.append(output.channel(), output.data());
                    notifyListener(id, () -> listener.onOutput(id, output.channel(), output.data()));
                    break;
                }
                case COMPLETE: {
                    ExecutionOutcome outcome = ExecutionOutcome.from(state, pending.stdout(), pending.stderr());
                    if (pending.complete(outcome)) {
                        notifyListener(id, () -> listener.onComplete(outcome));
                    }
                    break;
                }
                default:
                    if (!session.handleCommonIntent(machine, intent)) {
                        throw new IllegalStateException("Initiator cannot carry out " + intent.kind());
                    }
            }
        }
    }

    private void notifyListener(ExecutionId id, Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            session.sink.onError(new FathomErrorEvent(session.now(), "Listener failed for execution " + id, e));
        }
    }
}
