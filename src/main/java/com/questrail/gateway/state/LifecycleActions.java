package com.questrail.gateway.state;

import com.questrail.gateway.session.Session;

import java.util.Optional;

/**
 * Guards and actions plugged into the rows of the standard
 * {@link TransitionTable}.
 *
 * <p>Actions run with the session lock held. An action that throws sends the
 * session to {@link GatewayState#ERROR}; see {@link GatewayStateMachine}.
 * Guards are pure: they return a refusal reason or empty.</p>
 *
 * <p>All methods default to "allow / do nothing" so tests can override only
 * what they exercise.</p>
 */
public interface LifecycleActions
{
    // Guards ------------------------------------------------------------------

    default Optional<String> canSwitch(Session session, SessionEvent.Switch event)
    {
        return Optional.empty();
    }

    default Optional<String> canRetry(Session session, SessionEvent.Retry event)
    {
        return Optional.empty();
    }

    // Actions -----------------------------------------------------------------

    default void openConnection(Session session, SessionEvent.Connect event) throws Exception
    {
    }

    default void bindConnection(Session session, SessionEvent.Connected event) throws Exception
    {
    }

    default void recordConnectFailure(Session session, SessionEvent.Error event) throws Exception
    {
    }

    default void beginMigration(Session session, SessionEvent.Switch event) throws Exception
    {
    }

    default void commitMigration(Session session, SessionEvent.Switched event) throws Exception
    {
    }

    default void rollBackMigration(Session session, SessionEvent.RolledBack event) throws Exception
    {
    }

    default void abortMigration(Session session, SessionEvent.Error event) throws Exception
    {
    }

    default void beginTeardown(Session session, SessionEvent.Disconnect event) throws Exception
    {
    }

    default void releaseResources(Session session, SessionEvent.Disconnected event) throws Exception
    {
    }

    default void resetSession(Session session, SessionEvent.Retry event) throws Exception
    {
    }
}
