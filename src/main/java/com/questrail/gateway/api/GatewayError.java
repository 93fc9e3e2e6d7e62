package com.questrail.gateway.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Error value carried by a failed {@link GatewayResult}.
 */
public record GatewayError(ErrorKind kind, String message, Throwable cause)
{
    public GatewayError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(message, "message");
    }

    public static GatewayError of(ErrorKind kind, String message)
    {
        return new GatewayError(kind, message, null);
    }

    public Optional<Throwable> optionalCause()
    {
        return Optional.ofNullable(cause);
    }

    @Override
    public String toString()
    {
        return kind + ": " + message;
    }
}
