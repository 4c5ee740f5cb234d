package com.questrail.fathom.protocol.internal.exec;

import com.questrail.fathom.protocol.internal.events.BackendEvent;
import com.questrail.fathom.protocol.internal.events.ExecutionLifecycleEvent;
import com.questrail.fathom.protocol.internal.state.ExecutionIntent;
import com.questrail.fathom.protocol.internal.state.ExecutionIntents;
import com.questrail.fathom.protocol.internal.state.ExecutionState;
import com.questrail.fathom.protocol.internal.state.ExecutionStateReducer;
import com.questrail.fathom.protocol.model.ExecStatus;
import com.questrail.fathom.protocol.model.ExecutionId;
import com.questrail.fathom.protocol.model.ExecutionRequest;
import com.questrail.fathom.protocol.model.Language;
import com.questrail.fathom.protocol.model.ResourceLimits;
import com.questrail.fathom.protocol.model.Role;
import com.questrail.fathom.protocol.observability.RecordingObservabilitySink;
import com.questrail.fathom.protocol.time.ManualExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ExecutionMachineTest
 * -----------------------------------------------------------------------------
 * Mailbox semantics of the per-execution actor: events are reduced one at a
 * time, in submission order, and intents run after each transition.
 */
class ExecutionMachineTest {

    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    private ExecutionRequest request;
    private ExecutionStateReducer reducer;
    private RecordingObservabilitySink sink;
    private List<ExecutionIntent.Kind> executed;

    @BeforeEach
    void setUp() {
        request = ExecutionRequest.builder(ExecutionId.of("m-1"))
                .language(Language.PYTHON)
                .code("pass")
                .limits(ResourceLimits.of(Duration.ofSeconds(1), 64))
                .build();
        reducer = new ExecutionStateReducer();
        sink = new RecordingObservabilitySink();
        executed = new ArrayList<>();
    }

    private ExecutionMachine machine(Executor executor, ExecutionIntentExecutor intents) {
        return new ExecutionMachine(ExecutionState.initial(Role.RESPONDER, request, NOW, 0L),
                reducer, intents, executor, sink);
    }

    private ExecutionIntentExecutor recording() {
        return (m, s, intents) -> executed.addAll(intents.kinds());
    }

    @Test
    void eventsWaitForTheExecutor() {
        ManualExecutor executor = new ManualExecutor();
        ExecutionMachine machine = machine(executor, recording());

        machine.submit(new ExecutionLifecycleEvent.Submitted(request, NOW, 0L));
        machine.submit(new BackendEvent.BackendStarted(NOW, 1L));

        assertEquals(ExecStatus.PENDING, machine.state().status());
        assertEquals(1, executor.pending(), "one drain covers both events");

        executor.runAll();

        assertEquals(ExecStatus.RUNNING, machine.state().status());
        assertEquals(List.of(ExecutionIntent.Kind.EMIT_ACK, ExecutionIntent.Kind.ARM_DEADLINE,
                ExecutionIntent.Kind.START_BACKEND, ExecutionIntent.Kind.EMIT_STATUS), executed);
    }

    @Test
    void eventsSubmittedByIntentsAreProcessedAfterTheCurrentOne() {
        List<ExecStatus> seen = new ArrayList<>();
        ExecutionMachine machine = machine(Runnable::run, (m, state, intents) -> {
            seen.add(state.status());
            if (intents.contains(ExecutionIntent.Kind.START_BACKEND)) {
                m.submit(new BackendEvent.BackendStarted(NOW, 1L));
                // Not yet applied: still inside the first transition.
                assertEquals(ExecStatus.PENDING, m.state().status());
            }
        });

        machine.submit(new ExecutionLifecycleEvent.Submitted(request, NOW, 0L));

        assertEquals(List.of(ExecStatus.PENDING, ExecStatus.RUNNING), seen);
    }

    @Test
    void everyEventProducesATransitionEvent() {
        ExecutionMachine machine = machine(Runnable::run, recording());

        machine.submit(new ExecutionLifecycleEvent.Submitted(request, NOW, 0L));
        machine.submit(new ExecutionLifecycleEvent.CancelRequested(NOW, 2L));
        machine.submit(new ExecutionLifecycleEvent.CancelRequested(NOW, 3L));

        assertEquals(3, sink.getTransitions().size());
        assertTrue(machine.isTerminal());
        assertEquals(ExecStatus.CANCELLED, sink.getTransitions().get(2).newState().status());
    }

    @Test
    void intentFailureIsReportedAndTheMachineKeepsGoing() {
        ExecutionMachine machine = machine(Runnable::run, (m, s, intents) -> {
            if (intents.contains(ExecutionIntent.Kind.START_BACKEND)) {
                throw new IllegalStateException("boom");
            }
            executed.addAll(intents.kinds());
        });

        machine.submit(new ExecutionLifecycleEvent.Submitted(request, NOW, 0L));
        machine.submit(new BackendEvent.BackendStarted(NOW, 1L));

        assertEquals(1, sink.getErrors().size());
        assertEquals(ExecStatus.RUNNING, machine.state().status());
        assertEquals(List.of(ExecutionIntent.Kind.EMIT_STATUS), executed);
    }

    @Test
    void rejectedDrainIsReported() {
        ExecutionMachine machine = machine(task -> {
            throw new RejectedExecutionException("shut down");
        }, recording());

        machine.submit(new ExecutionLifecycleEvent.Submitted(request, NOW, 0L));

        assertEquals(1, sink.getErrors().size());
        assertEquals(ExecStatus.PENDING, machine.state().status());
    }

    @Test
    void concurrentSubmissionsAreSerialized() throws InterruptedException {
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<ExecutionIntents> batches = Collections.synchronizedList(new ArrayList<>());
            ExecutionMachine machine = machine(pool, (m, s, intents) -> batches.add(intents));
            machine.submit(new ExecutionLifecycleEvent.Submitted(request, NOW, 0L));
            machine.submit(new BackendEvent.BackendStarted(NOW, 1L));

            CountDownLatch start = new CountDownLatch(1);
            CountDownLatch done = new CountDownLatch(8);
            for (int i = 0; i < 8; i++) {
                pool.execute(() -> {
                    try {
                        start.await();
                        machine.submit(new ExecutionLifecycleEvent.CancelRequested(NOW, 5L));
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                    } finally {
                        done.countDown();
                    }
                });
            }
            start.countDown();
            assertTrue(done.await(2, TimeUnit.SECONDS));

            long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(2);
            while (!machine.isTerminal() && System.nanoTime() < deadline) {
                Thread.sleep(5);
            }
            Thread.sleep(50);

            assertEquals(ExecStatus.CANCELLED, machine.state().status());
            long cancelBatches = batches.stream()
                    .filter(b -> b.contains(ExecutionIntent.Kind.SIGNAL_CANCEL))
                    .count();
            assertEquals(1, cancelBatches, "only the first cancel transitions");
        } finally {
            pool.shutdownNow();
        }
    }
}
