package com.questrail.gateway.migration;

import com.questrail.gateway.session.Session;
import com.questrail.gateway.session.SessionBinding;

import java.io.IOException;
import java.util.Map;

/**
 * Serialize the application state, close the old connection, open the new one
 * and restore the state before any new exchange is admitted.
 *
 * <p>The serialized form is kept on the session's {@link MigrationPlan} so the
 * captured state is visible for the duration of the switch.</p>
 */
public final class StatePreservingMigration implements MigrationStrategyExecutor
{
    @Override
    public MigrationStrategy strategy()
    {
        return MigrationStrategy.STATE_PRESERVING;
    }

    @Override
    public Outcome execute(Session session, MigrationPlan plan, MigrationContext context)
            throws MigrationFailedException
    {
        byte[] captured;
        session.lock();
        try {
            session.setAcceptingWork(false);
            captured = context.stateCodec().encode(session.applicationState());
            session.setMigrationPlan(plan.withCapturedState(captured));
        } catch (IOException e) {
            session.setAcceptingWork(true);
            throw new MigrationFailedException(strategy(), "cannot serialize application state", true, e);
        } finally {
            session.unlock();
        }

        int dropped = context.closePrimary(session);
        SessionBinding next = context.openTarget(plan, false);

        Map<String, Object> restored;
        try {
            restored = context.stateCodec().decode(captured);
        } catch (IOException e) {
            context.release(next);
            throw new MigrationFailedException(strategy(), "cannot restore application state", false, e);
        }
        session.replaceApplicationState(restored);
        return new Outcome(next, dropped);
    }
}
