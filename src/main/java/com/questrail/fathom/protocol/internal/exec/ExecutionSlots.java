package com.questrail.fathom.protocol.internal.exec;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Responder-wide cap on concurrently admitted executions, shared by every
 * session of one runtime.
 */
public final class ExecutionSlots
{
    private final int capacity;
    private final AtomicInteger inUse = new AtomicInteger();

    public ExecutionSlots(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    /**
     * Takes a slot if one is free.
     */
    public boolean tryAcquire() {
        while (true) {
            int current = inUse.get();
            if (current >= capacity) {
                return false;
            }
            if (inUse.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    public void release() {
        inUse.updateAndGet(n -> Math.max(0, n - 1));
    }

    public int inUse() {
        return inUse.get();
    }

    public int capacity() {
        return capacity;
    }
}
