package com.questrail.gateway.routing;

import com.questrail.gateway.api.Message;
import com.questrail.gateway.api.ProtocolKind;
import com.questrail.gateway.api.RoutingContext;

import java.util.Objects;

/**
 * Predicate over an inbound message and its routing context.
 *
 * <p>Conditions MUST be pure: no I/O, no mutation, no dependence on anything but
 * their arguments. The router relies on this for determinism.</p>
 */
@FunctionalInterface
public interface RoutingCondition
{
    boolean test(Message message, RoutingContext context);

    default RoutingCondition and(RoutingCondition other)
    {
        Objects.requireNonNull(other, "other");
        return (m, c) -> test(m, c) && other.test(m, c);
    }

    default RoutingCondition or(RoutingCondition other)
    {
        Objects.requireNonNull(other, "other");
        return (m, c) -> test(m, c) || other.test(m, c);
    }

    default RoutingCondition negate()
    {
        return (m, c) -> !test(m, c);
    }

    // -------------------------------------------------------------------------
    // Factories
    // -------------------------------------------------------------------------

    static RoutingCondition always()
    {
        return (m, c) -> true;
    }

    static RoutingCondition headerEquals(String name, String value)
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        return (m, c) -> m.header(name).map(value::equals).orElse(false);
    }

    static RoutingCondition headerPresent(String name)
    {
        Objects.requireNonNull(name, "name");
        return (m, c) -> m.header(name).isPresent();
    }

    static RoutingCondition payloadLargerThan(int bytes)
    {
        return (m, c) -> m.size() > bytes;
    }

    static RoutingCondition attributeEquals(String name, String value)
    {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        return (m, c) -> c.attribute(name).map(value::equals).orElse(false);
    }

    static RoutingCondition sourceProtocolIs(ProtocolKind protocol)
    {
        Objects.requireNonNull(protocol, "protocol");
        return (m, c) -> m.sourceProtocol() == protocol;
    }

    static RoutingCondition not(RoutingCondition condition)
    {
        return Objects.requireNonNull(condition, "condition").negate();
    }
}
