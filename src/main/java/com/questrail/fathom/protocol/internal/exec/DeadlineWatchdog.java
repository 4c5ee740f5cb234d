package com.questrail.fathom.protocol.internal.exec;

import com.questrail.fathom.protocol.internal.time.Cancellable;
import com.questrail.fathom.protocol.internal.time.MonotonicClock;
import com.questrail.fathom.protocol.internal.time.MonotonicScheduler;
import com.questrail.fathom.protocol.internal.time.SystemWallClock;
import com.questrail.fathom.protocol.model.ExecutionId;
import com.questrail.fathom.protocol.observability.FathomErrorEvent;
import com.questrail.fathom.protocol.observability.FathomObservabilitySink;
import com.questrail.fathom.protocol.observability.NullObservabilitySink;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.PriorityQueue;
import java.util.function.Consumer;

/**
 * DeadlineWatchdog
 * =============================================================================
 * Deadline service for all executions of one session.
 *
 * <h2>Design</h2>
 * Deadlines sit in a priority queue ordered by monotonic tick. Only the head
 * has a timer armed with the {@link MonotonicScheduler}; when it fires, every
 * due entry is expired and the timer is re-armed for the new head. Disarming
 * or re-arming an id removes its previous entry from the queue, so the queue
 * never holds more entries than there are armed deadlines.
 *
 * <p>Expiry does not decide anything. It hands the id to the callback, which
 * submits {@code DeadlineElapsed} to the machine; a machine that already
 * reached a terminal status ignores it.</p>
 *
 * <h2>Thread safety</h2>
 * All bookkeeping is guarded by this object's monitor. The expiry callback is
 * invoked outside the monitor.
 */
public final class DeadlineWatchdog
{
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private final Consumer<ExecutionId> onExpired;
    private final FathomObservabilitySink sink;

    private final PriorityQueue<Entry> queue = new PriorityQueue<>();
    private final Map<ExecutionId, Entry> armed = new HashMap<>();

    private Cancellable timer;
    private long timerDeadlineNanos = Long.MAX_VALUE;
    private boolean closed;

    public DeadlineWatchdog(MonotonicScheduler scheduler,
                            MonotonicClock clock,
                            Consumer<ExecutionId> onExpired,
                            FathomObservabilitySink sink) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.onExpired = Objects.requireNonNull(onExpired, "onExpired");
        this.sink = Objects.requireNonNullElse(sink, NullObservabilitySink.INSTANCE);
    }

    /**
     * Arms (or re-arms) the deadline for {@code id}.
     */
    public synchronized void arm(ExecutionId id, long deadlineNanos) {
        Objects.requireNonNull(id, "id");
        if (closed) {
            return;
        }
        Entry entry = new Entry(id, deadlineNanos);
        Entry previous = armed.put(id, entry);
        if (previous != null) {
            queue.remove(previous);
        }
        queue.add(entry);
        rearm();
    }

    /**
     * Disarms the deadline for {@code id}. No effect if none is armed.
     */
    public synchronized void disarm(ExecutionId id) {
        Entry entry = armed.remove(id);
        if (entry != null) {
            queue.remove(entry);
            rearm();
        }
    }

    public synchronized int armedCount() {
        return armed.size();
    }

    // Entries still held by the priority queue.
    synchronized int queuedCount() {
        return queue.size();
    }

    public synchronized boolean isArmed(ExecutionId id) {
        return armed.containsKey(id);
    }

    /**
     * Cancels the timer and forgets every deadline.
     */
    public synchronized void close() {
        closed = true;
        armed.clear();
        queue.clear();
        cancelTimer();
    }

    private void fire() {
        List<ExecutionId> expired = new ArrayList<>();

        synchronized (this) {
            timer = null;
            timerDeadlineNanos = Long.MAX_VALUE;

            long now = clock.nowNanos();
            Entry head;
            while ((head = queue.peek()) != null && head.deadlineNanos <= now) {
                queue.poll();
                if (armed.get(head.id) == head) {
                    armed.remove(head.id);
                    expired.add(head.id);
                }
            }
            rearm();
        }

        for (ExecutionId id : expired) {
            try {
                onExpired.accept(id);
            } catch (RuntimeException e) {
                sink.onError(new FathomErrorEvent(SystemWallClock.INSTANCE.now(),
                        "Deadline expiry handling failed for " + id, e));
            }
        }
    }

    // Caller holds the monitor.
    private void rearm() {
        Entry head;
        while ((head = queue.peek()) != null && armed.get(head.id) != head) {
            queue.poll();
        }

        if (head == null) {
            cancelTimer();
            return;
        }
        if (timer != null && timerDeadlineNanos == head.deadlineNanos) {
            return;
        }
        cancelTimer();
        timerDeadlineNanos = head.deadlineNanos;
        timer = scheduler.scheduleAtNanos(head.deadlineNanos, this::fire);
    }

    private void cancelTimer() {
        if (timer != null) {
            timer.cancel();
            timer = null;
        }
        timerDeadlineNanos = Long.MAX_VALUE;
    }

    private static final class Entry implements Comparable<Entry> {
        private final ExecutionId id;
        private final long deadlineNanos;

        private Entry(ExecutionId id, long deadlineNanos) {
            this.id = id;
            this.deadlineNanos = deadlineNanos;
        }

        @Override
        public int compareTo(Entry o) {
            // Overflow-safe for monotonic ticks.
            return Long.signum(deadlineNanos - o.deadlineNanos);
        }
    }
}
