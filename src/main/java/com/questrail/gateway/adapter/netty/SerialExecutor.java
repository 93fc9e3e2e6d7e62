package com.questrail.gateway.adapter.netty;

import java.util.ArrayDeque;
import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.Executor;

/**
 * Runs submitted tasks one at a time, in submission order, on a shared pool.
 *
 * <p>Each accepted connection gets one of these: replies leave in request
 * order, and a connection whose handler blocks occupies one pool thread
 * without delaying any other connection.</p>
 */
final class SerialExecutor implements Executor
{
    private final Queue<Runnable> tasks = new ArrayDeque<>();
    private final Executor pool;
    private Runnable active;

    SerialExecutor(Executor pool)
    {
        this.pool = Objects.requireNonNull(pool, "pool");
    }

    @Override
    public synchronized void execute(Runnable task)
    {
        tasks.add(() -> {
            try {
                task.run();
            } finally {
                scheduleNext();
            }
        });
        if (active == null) {
            scheduleNext();
        }
    }

    private synchronized void scheduleNext()
    {
        if ((active = tasks.poll()) != null) {
            pool.execute(active);
        }
    }
}
