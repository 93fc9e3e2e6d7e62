package com.questrail.gateway.routing;

import com.questrail.gateway.api.ProtocolKind;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one routing evaluation: the chosen protocol and the rule that
 * chose it (empty when the default protocol applied).
 */
public record RoutingDecision(ProtocolKind target, Optional<RoutingRule> matchedRule)
{
    public RoutingDecision {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(matchedRule, "matchedRule");
    }

    public boolean isDefault()
    {
        return matchedRule.isEmpty();
    }

    public String ruleDescription()
    {
        return matchedRule.map(RoutingRule::description).orElse("default");
    }
}
