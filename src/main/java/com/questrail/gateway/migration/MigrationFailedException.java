package com.questrail.gateway.migration;

import com.questrail.gateway.api.ErrorKind;
import com.questrail.gateway.api.GatewayException;

/**
 * A migration aborted.
 *
 * <p>{@link #rollbackPossible()} tells whether the session's previous
 * connection is still open and authoritative. If so the session returns to
 * {@code CONNECTED} on its old protocol; otherwise it moves to {@code ERROR}.</p>
 */
public final class MigrationFailedException extends GatewayException
{
    private final MigrationStrategy strategy;
    private final String reason;
    private final boolean rollbackPossible;

    public MigrationFailedException(MigrationStrategy strategy, String reason, boolean rollbackPossible, Throwable cause)
    {
        super(strategy + " migration failed: " + reason, cause);
        this.strategy = strategy;
        this.reason = reason;
        this.rollbackPossible = rollbackPossible;
    }

    public MigrationStrategy strategy()
    {
        return strategy;
    }

    public String reason()
    {
        return reason;
    }

    public boolean rollbackPossible()
    {
        return rollbackPossible;
    }

    @Override
    public ErrorKind errorKind()
    {
        return ErrorKind.MIGRATION_FAILED;
    }
}
