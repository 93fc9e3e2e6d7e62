package com.questrail.gateway.routing;

import com.questrail.gateway.api.ProtocolKind;

import java.util.Objects;

/**
 * One prioritized routing rule. Higher {@code priority} is evaluated first.
 */
public record RoutingRule(RoutingCondition condition,
                          ProtocolKind targetProtocol,
                          int priority,
                          String description)
{
    public RoutingRule {
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(targetProtocol, "targetProtocol");
        description = description == null ? "" : description;
    }

    public static RoutingRule of(String description, int priority, ProtocolKind targetProtocol, RoutingCondition condition)
    {
        return new RoutingRule(condition, targetProtocol, priority, description);
    }

    @Override
    public String toString()
    {
        return "RoutingRule{'" + description + "' p=" + priority + " -> " + targetProtocol + "}";
    }
}
