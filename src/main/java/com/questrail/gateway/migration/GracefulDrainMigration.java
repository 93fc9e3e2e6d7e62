package com.questrail.gateway.migration;

import com.questrail.gateway.session.Session;
import com.questrail.gateway.session.SessionBinding;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stop admitting work, wait for in-flight exchanges up to the drain timeout,
 * then open the new connection and close the old one. If the deadline expires
 * the remaining exchanges are dropped.
 */
public final class GracefulDrainMigration implements MigrationStrategyExecutor
{
    private static final Logger log = LoggerFactory.getLogger(GracefulDrainMigration.class);

    @Override
    public MigrationStrategy strategy()
    {
        return MigrationStrategy.GRACEFUL_DRAIN;
    }

    @Override
    public Outcome execute(Session session, MigrationPlan plan, MigrationContext context)
            throws MigrationFailedException
    {
        boolean drained;
        session.lock();
        try {
            session.setAcceptingWork(false);
            drained = session.awaitDrained(context.policy().drainTimeout().toNanos());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            session.setAcceptingWork(true);
            throw new MigrationFailedException(strategy(), "interrupted while draining", true, e);
        } finally {
            session.unlock();
        }
        if (!drained) {
            log.debug("Session {}: drain deadline of {} expired", session.id(), context.policy().drainTimeout());
        }

        SessionBinding next;
        try {
            next = context.openTarget(plan, true);
        } catch (MigrationFailedException e) {
            context.admitWork(session, true);
            throw e;
        }
        int dropped = context.closePrimary(session);
        return new Outcome(next, dropped);
    }
}
