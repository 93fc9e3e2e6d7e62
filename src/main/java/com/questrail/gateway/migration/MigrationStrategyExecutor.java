package com.questrail.gateway.migration;

import com.questrail.gateway.session.Session;
import com.questrail.gateway.session.SessionBinding;

/**
 * One migration strategy.
 *
 * <p>Runs without the session lock (taking it only for short bookkeeping) while
 * the session sits in {@code SWITCHING}. On success it returns the new binding
 * without committing it; committing is the {@code Switched} transition's job.
 * On failure it leaves the session either with its old binding intact and
 * admitting work ({@code rollbackPossible}) or with no binding at all.</p>
 */
public interface MigrationStrategyExecutor
{
    MigrationStrategy strategy();

    Outcome execute(Session session, MigrationPlan plan, MigrationContext context) throws MigrationFailedException;

    record Outcome(SessionBinding binding, int droppedConnections)
    {
    }
}
