package com.questrail.gateway.migration;

import com.questrail.gateway.session.Session;
import com.questrail.gateway.session.SessionBinding;

import java.util.concurrent.TimeUnit;

/**
 * Open the new connection first and keep both live for the overlap window.
 *
 * <p>During the window the session is bound to two connections; the old one
 * remains authoritative, so exchanges keep flowing over it. When the window
 * ends, new work is held back, in-flight exchanges get one more window to
 * finish, and the old connection is closed.</p>
 */
public final class OverlapTransitionMigration implements MigrationStrategyExecutor
{
    @Override
    public MigrationStrategy strategy()
    {
        return MigrationStrategy.OVERLAP_TRANSITION;
    }

    @Override
    public Outcome execute(Session session, MigrationPlan plan, MigrationContext context)
            throws MigrationFailedException
    {
        SessionBinding next = context.openTarget(plan, true);
        long windowNanos = context.policy().overlapWindow().toNanos();

        session.lock();
        try {
            session.setOverlap(next);
        } finally {
            session.unlock();
        }

        try {
            TimeUnit.NANOSECONDS.sleep(windowNanos);
            session.lock();
            try {
                session.setAcceptingWork(false);
                session.awaitDrained(windowNanos);
            } finally {
                session.unlock();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandon(session, next, context);
            throw new MigrationFailedException(strategy(), "interrupted during overlap window", true, e);
        }

        int dropped = context.closePrimary(session);
        return new Outcome(next, dropped);
    }

    private static void abandon(Session session, SessionBinding next, MigrationContext context)
    {
        session.lock();
        try {
            session.setOverlap(null);
            session.setAcceptingWork(true);
        } finally {
            session.unlock();
        }
        context.release(next);
    }
}
