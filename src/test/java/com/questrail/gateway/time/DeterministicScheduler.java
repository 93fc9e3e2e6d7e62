package com.questrail.gateway.time;

import java.time.Duration;
import java.util.PriorityQueue;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scheduler driven by a {@link ManualMonotonicClock}.
 *
 * Tasks run ONLY inside {@link #runDueTasks()} or {@link #advanceAndRun},
 * on the calling thread. Tasks with equal deadlines run in submission order.
 */
public final class DeterministicScheduler implements MonotonicScheduler {

    private final ManualMonotonicClock clock;
    private final PriorityQueue<Scheduled> queue = new PriorityQueue<>();
    private long sequence;

    public DeterministicScheduler(ManualMonotonicClock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Cancellable scheduleAtNanos(long deadlineNanos, Runnable task) {
        Scheduled scheduled = new Scheduled(deadlineNanos, sequence++, task);
        queue.add(scheduled);
        return scheduled;
    }

    /**
     * Run every task whose deadline is at or before the current clock time,
     * including tasks those tasks schedule for the same instant.
     */
    public void runDueTasks() {
        Scheduled next;
        while ((next = pollDue()) != null) {
            if (!next.cancelled.get()) {
                next.ran.set(true);
                next.task.run();
            }
        }
    }

    public void advanceAndRun(Duration delta) {
        clock.advance(delta);
        runDueTasks();
    }

    public synchronized int pendingCount() {
        return (int) queue.stream().filter(s -> !s.cancelled.get()).count();
    }

    private synchronized Scheduled pollDue() {
        if (queue.isEmpty() || queue.peek().deadlineNanos > clock.nowNanos()) {
            return null;
        }
        return queue.poll();
    }

    private static final class Scheduled implements Comparable<Scheduled>, Cancellable {
        private final long deadlineNanos;
        private final long sequence;
        private final Runnable task;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private final AtomicBoolean ran = new AtomicBoolean(false);

        private Scheduled(long deadlineNanos, long sequence, Runnable task) {
            this.deadlineNanos = deadlineNanos;
            this.sequence = sequence;
            this.task = task;
        }

        @Override
        public boolean cancel() {
            return !ran.get() && cancelled.compareAndSet(false, true);
        }

        @Override
        public int compareTo(Scheduled o) {
            int byDeadline = Long.compare(deadlineNanos, o.deadlineNanos);
            return byDeadline != 0 ? byDeadline : Long.compare(sequence, o.sequence);
        }
    }
}
