package com.questrail.gateway.migration;

import com.questrail.gateway.balance.BalancedConnector;
import com.questrail.gateway.balance.NoHealthyEndpointException;
import com.questrail.gateway.adapter.TransportUnavailableException;
import com.questrail.gateway.config.MigrationPolicy;
import com.questrail.gateway.session.Session;
import com.questrail.gateway.session.SessionBinding;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Collaborators and shared steps available to every migration strategy.
 */
public final class MigrationContext
{
    private final BalancedConnector connector;
    private final ApplicationStateCodec stateCodec;
    private final MigrationPolicy policy;
    private final Duration connectTimeout;

    public MigrationContext(BalancedConnector connector,
                            ApplicationStateCodec stateCodec,
                            MigrationPolicy policy,
                            Duration connectTimeout)
    {
        this.connector = Objects.requireNonNull(connector, "connector");
        this.stateCodec = Objects.requireNonNull(stateCodec, "stateCodec");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
    }

    public ApplicationStateCodec stateCodec()
    {
        return stateCodec;
    }

    public MigrationPolicy policy()
    {
        return policy;
    }

    /**
     * Open a connection on the plan's target protocol.
     *
     * @param oldStillOpen whether the session's previous connection is still
     *                     open, which decides if a failure can be rolled back
     */
    public SessionBinding openTarget(MigrationPlan plan, boolean oldStillOpen) throws MigrationFailedException
    {
        try {
            return connector.connect(plan.toProtocol(), connectTimeout);
        } catch (NoHealthyEndpointException | TransportUnavailableException e) {
            throw new MigrationFailedException(plan.strategy(),
                    "cannot open " + plan.toProtocol() + " connection: " + e.getMessage(), oldStillOpen, e);
        }
    }

    /**
     * Detach the session's primary binding and close it.
     *
     * @return exchanges still in flight at the moment of closing
     */
    public int closePrimary(Session session)
    {
        Optional<SessionBinding> old;
        int dropped;
        session.lock();
        try {
            dropped = session.inFlight();
            old = session.unbind();
        } finally {
            session.unlock();
        }
        old.ifPresent(connector::release);
        return dropped;
    }

    public void release(SessionBinding binding)
    {
        connector.release(binding);
    }

    /**
     * Stop or resume admitting new exchanges on the session.
     */
    public void admitWork(Session session, boolean admit)
    {
        session.lock();
        try {
            session.setAcceptingWork(admit);
        } finally {
            session.unlock();
        }
    }
}
