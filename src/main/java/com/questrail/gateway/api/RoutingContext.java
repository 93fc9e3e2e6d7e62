package com.questrail.gateway.api;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Context evaluated alongside a {@link Message} by routing rules.
 *
 * @param identity        principal already authenticated upstream of the gateway
 *                        ({@code "anonymous"} when none)
 * @param currentProtocol protocol the message's session is bound to, if any
 * @param attributes      free-form attributes supplied by the caller
 */
public record RoutingContext(String identity,
                             Optional<ProtocolKind> currentProtocol,
                             Map<String, String> attributes)
{
    public RoutingContext {
        Objects.requireNonNull(identity, "identity");
        Objects.requireNonNull(currentProtocol, "currentProtocol");
        attributes = Map.copyOf(attributes);
    }

    public static RoutingContext anonymous()
    {
        return new RoutingContext("anonymous", Optional.empty(), Map.of());
    }

    public static RoutingContext of(String identity, ProtocolKind currentProtocol)
    {
        return new RoutingContext(identity, Optional.ofNullable(currentProtocol), Map.of());
    }

    public RoutingContext withAttribute(String name, String value)
    {
        HashMap<String, String> copy = new HashMap<>(attributes);
        copy.put(name, value);
        return new RoutingContext(identity, currentProtocol, copy);
    }

    public Optional<String> attribute(String name)
    {
        return Optional.ofNullable(attributes.get(name));
    }
}
