package com.questrail.fathom.protocol.session;

import com.questrail.fathom.protocol.backend.BackendExit;
import com.questrail.fathom.protocol.backend.BackendHandle;
import com.questrail.fathom.protocol.backend.ExecutionBackend;
import com.questrail.fathom.protocol.backend.ExecutionBackendException;
import com.questrail.fathom.protocol.backend.OutputChunk;
import com.questrail.fathom.protocol.internal.events.BackendEvent;
import com.questrail.fathom.protocol.internal.exec.ExecutionMachine;
import com.questrail.fathom.protocol.internal.time.MonotonicClock;
import com.questrail.fathom.protocol.internal.time.WallClock;
import com.questrail.fathom.protocol.model.ExecutionRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.BiConsumer;

/**
 * Blocking loop that drives one backend program and reports back to its
 * machine.
 *
 * <p>Runs on the pump executor, never on a machine drain task:
 * start, then output until end of stream, then exit. Every step is turned
 * into a {@link BackendEvent}; the machine decides what it means. Once the
 * machine is terminal the pump stops reading and leaves the program to the
 * cancel signal.</p>
 */
final class BackendOutputPump implements Runnable
{
    private static final Logger log = LoggerFactory.getLogger(BackendOutputPump.class);

    private final ExecutionMachine machine;
    private final ExecutionRequest request;
    private final ExecutionBackend backend;
    private final BiConsumer<ExecutionMachine, BackendHandle> onStarted;
    private final WallClock wallClock;
    private final MonotonicClock clock;

    BackendOutputPump(ExecutionMachine machine,
                      ExecutionRequest request,
                      ExecutionBackend backend,
                      BiConsumer<ExecutionMachine, BackendHandle> onStarted,
                      WallClock wallClock,
                      MonotonicClock clock) {
        this.machine = machine;
        this.request = request;
        this.backend = backend;
        this.onStarted = onStarted;
        this.wallClock = wallClock;
        this.clock = clock;
    }

    @Override
    public void run() {
        BackendHandle handle;
        try {
            handle = backend.start(request);
        } catch (ExecutionBackendException | RuntimeException e) {
            fail("Backend failed to start: " + e.getMessage());
            return;
        }

        onStarted.accept(machine, handle);
        machine.submit(new BackendEvent.BackendStarted(wallClock.now(), clock.nowNanos()));

        try {
            while (!machine.isTerminal()) {
                OutputChunk chunk = backend.pollOutput(handle);
                if (chunk.isEndOfStream()) {
                    break;
                }
                machine.submit(new BackendEvent.OutputProduced(chunk.channel(), chunk.data(),
                        wallClock.now(), clock.nowNanos()));
            }

            BackendExit exit = backend.awaitExit(handle);
            machine.submit(new BackendEvent.BackendExited(exit.exitCode(), exit.usage(), exit.oomKilled(),
                    wallClock.now(), clock.nowNanos()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            fail("Interrupted while waiting for execution " + request.id());
        } catch (ExecutionBackendException | RuntimeException e) {
            fail("Backend lost execution " + request.id() + ": " + e.getMessage());
        }
    }

    private void fail(String message) {
        log.warn("{}", message);
        machine.submit(new BackendEvent.BackendFailed(message, wallClock.now(), clock.nowNanos()));
    }
}
