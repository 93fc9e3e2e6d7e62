package com.questrail.gateway.api;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;

/**
 * GatewayResult
 * -----------------------------------------------------------------------------
 * Explicit outcome of a public gateway operation: either a value or a
 * {@link GatewayError}. The facade never lets an exception cross its public
 * surface; every failure is folded into one of these.
 *
 * @param <T> value type; {@link Void} operations succeed with {@code null}
 */
public final class GatewayResult<T>
{
    private final T value;
    private final GatewayError error;

    private GatewayResult(T value, GatewayError error)
    {
        this.value = value;
        this.error = error;
    }

    public static <T> GatewayResult<T> success(T value)
    {
        return new GatewayResult<>(value, null);
    }

    public static GatewayResult<Void> done()
    {
        return new GatewayResult<>(null, null);
    }

    public static <T> GatewayResult<T> failure(GatewayError error)
    {
        return new GatewayResult<>(null, Objects.requireNonNull(error, "error"));
    }

    public static <T> GatewayResult<T> failure(ErrorKind kind, String message)
    {
        return failure(GatewayError.of(kind, message));
    }

    public static <T> GatewayResult<T> failure(ErrorKind kind, String message, Throwable cause)
    {
        return failure(new GatewayError(kind, message, cause));
    }

    public boolean isSuccess()
    {
        return error == null;
    }

    public boolean isFailure()
    {
        return error != null;
    }

    /**
     * @throws NoSuchElementException if this result is a failure
     */
    public T value()
    {
        if (error != null) {
            throw new NoSuchElementException("No value present: " + error);
        }
        return value;
    }

    /**
     * @throws NoSuchElementException if this result is a success
     */
    public GatewayError error()
    {
        if (error == null) {
            throw new NoSuchElementException("Result is a success");
        }
        return error;
    }

    public boolean hasError(ErrorKind kind)
    {
        return error != null && error.kind() == kind;
    }

    public <U> GatewayResult<U> map(Function<? super T, ? extends U> mapper)
    {
        if (error != null) {
            return failure(error);
        }
        return success(mapper.apply(value));
    }

    @Override
    public String toString()
    {
        return error == null ? "Success[" + value + "]" : "Failure[" + error + "]";
    }
}
