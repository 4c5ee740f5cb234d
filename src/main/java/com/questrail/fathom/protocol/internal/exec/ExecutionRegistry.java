package com.questrail.fathom.protocol.internal.exec;

import com.questrail.fathom.protocol.internal.state.ExecutionState;
import com.questrail.fathom.protocol.model.ExecStatus;
import com.questrail.fathom.protocol.model.ExecutionId;
import com.questrail.fathom.protocol.model.ServerLoad;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * ExecutionRegistry
 * -----------------------------------------------------------------------------
 * Per-connection map from execution id to its machine.
 *
 * <p>This is the only structure shared between the transport thread, the
 * watchdog and the machines. Every operation is a single atomic map operation;
 * no lock is held while a machine runs.</p>
 */
public final class ExecutionRegistry
{
    private final ConcurrentMap<ExecutionId, ExecutionMachine> machines = new ConcurrentHashMap<>();

    /**
     * Registers a new machine under {@code id}. The factory is invoked at most
     * once and only when the id is free.
     *
     * @throws ExecutionAlreadyExistsException if the id is already registered
     */
    public ExecutionMachine register(ExecutionId id, Supplier<ExecutionMachine> factory) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(factory, "factory");

        boolean[] created = new boolean[1];
        ExecutionMachine machine = machines.computeIfAbsent(id, key -> {
            created[0] = true;
            return factory.get();
        });
        if (!created[0]) {
            throw new ExecutionAlreadyExistsException(id);
        }
        return machine;
    }

    /**
     * @throws UnknownExecutionException if no machine is registered under {@code id}
     */
    public ExecutionMachine lookup(ExecutionId id) {
        ExecutionMachine machine = machines.get(id);
        if (machine == null) {
            throw new UnknownExecutionException(id);
        }
        return machine;
    }

    public Optional<ExecutionMachine> find(ExecutionId id) {
        return Optional.ofNullable(machines.get(id));
    }

    /**
     * Removes {@code machine} if it is still the one registered under its id.
     * A later machine reusing the id is left alone.
     */
    public boolean evict(ExecutionMachine machine) {
        return machines.remove(machine.id(), machine);
    }

    public boolean evict(ExecutionId id) {
        return machines.remove(id) != null;
    }

    public int size() {
        return machines.size();
    }

    public boolean isEmpty() {
        return machines.isEmpty();
    }

    /**
     * Registered machines at this instant.
     */
    public List<ExecutionMachine> machines() {
        return List.copyOf(machines.values());
    }

    /**
     * Latest state of every registered execution.
     */
    public Map<ExecutionId, ExecutionState> snapshot() {
        Map<ExecutionId, ExecutionState> copy = new LinkedHashMap<>();
        machines.forEach((id, machine) -> copy.put(id, machine.state()));
        return copy;
    }

    /**
     * Running executions and executions acknowledged but not yet running.
     */
    public ServerLoad load() {
        int running = 0;
        int pending = 0;
        for (ExecutionMachine machine : machines.values()) {
            ExecStatus status = machine.state().status();
            if (status == ExecStatus.RUNNING) {
                running++;
            } else if (status == ExecStatus.PENDING) {
                pending++;
            }
        }
        return new ServerLoad(running, pending);
    }
}
