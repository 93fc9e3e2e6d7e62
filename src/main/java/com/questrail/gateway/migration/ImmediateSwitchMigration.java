package com.questrail.gateway.migration;

import com.questrail.gateway.session.Session;
import com.questrail.gateway.session.SessionBinding;

/**
 * Close the old connection at once, dropping whatever is in flight, then open
 * the new one. A failure to open leaves the session without a connection.
 */
public final class ImmediateSwitchMigration implements MigrationStrategyExecutor
{
    @Override
    public MigrationStrategy strategy()
    {
        return MigrationStrategy.IMMEDIATE_SWITCH;
    }

    @Override
    public Outcome execute(Session session, MigrationPlan plan, MigrationContext context)
            throws MigrationFailedException
    {
        int dropped = context.closePrimary(session);
        SessionBinding next = context.openTarget(plan, false);
        return new Outcome(next, dropped);
    }
}
