package com.questrail.gateway.routing;

import com.questrail.gateway.api.Message;
import com.questrail.gateway.api.ProtocolKind;
import com.questrail.gateway.api.RoutingContext;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * ProtocolRouter
 * =============================================================================
 * Chooses the target protocol for an inbound message.
 *
 * <h2>Evaluation order</h2>
 * Rules are evaluated in descending priority; the first rule whose condition
 * holds wins. Rules of equal priority keep their registration order (the sort
 * is stable). When nothing matches, the default protocol is returned.
 *
 * <h2>Purity</h2>
 * The router holds no mutable state and {@link #route} has no side effects:
 * the same rules, message and context always yield the same protocol. Emitting
 * a routing-decision event is the caller's job.
 */
public final class ProtocolRouter
{
    private final List<RoutingRule> rules;
    private final ProtocolKind defaultProtocol;

    public ProtocolRouter(List<RoutingRule> rules, ProtocolKind defaultProtocol)
    {
        Objects.requireNonNull(rules, "rules");
        this.defaultProtocol = Objects.requireNonNull(defaultProtocol, "defaultProtocol");

        List<RoutingRule> ordered = new ArrayList<>(rules);
        ordered.sort(Comparator.comparingInt(RoutingRule::priority).reversed());
        this.rules = List.copyOf(ordered);
    }

    public ProtocolKind route(Message message, RoutingContext context)
    {
        return decide(message, context).target();
    }

    public RoutingDecision decide(Message message, RoutingContext context)
    {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(context, "context");

        for (RoutingRule rule : rules) {
            if (rule.condition().test(message, context)) {
                return new RoutingDecision(rule.targetProtocol(), Optional.of(rule));
            }
        }
        return new RoutingDecision(defaultProtocol, Optional.empty());
    }

    /**
     * Rules in evaluation order.
     */
    public List<RoutingRule> rules()
    {
        return rules;
    }

    public ProtocolKind defaultProtocol()
    {
        return defaultProtocol;
    }
}
