package com.questrail.gateway.api;

/**
 * Checked failure raised inside the gateway that already knows which
 * {@link ErrorKind} it surfaces as. Internal components throw these; the
 * facade folds them into {@link GatewayError}s.
 */
public abstract class GatewayException extends Exception
{
    protected GatewayException(String message)
    {
        super(message);
    }

    protected GatewayException(String message, Throwable cause)
    {
        super(message, cause);
    }

    public abstract ErrorKind errorKind();

    public GatewayError toError()
    {
        return new GatewayError(errorKind(), getMessage(), this);
    }

    /**
     * Kind of an arbitrary failure: its own kind when it is a
     * {@link GatewayException}, otherwise {@code fallback}.
     */
    public static ErrorKind kindOf(Throwable failure, ErrorKind fallback)
    {
        return failure instanceof GatewayException g ? g.errorKind() : fallback;
    }
}
