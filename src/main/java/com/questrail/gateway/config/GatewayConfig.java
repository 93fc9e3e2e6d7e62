package com.questrail.gateway.config;

import com.questrail.gateway.api.ProtocolKind;
import com.questrail.gateway.routing.RoutingRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Aggregated, read-only configuration of a protocol gateway.
 *
 * <p>Produced once at startup by whatever loads configuration; the gateway
 * never mutates it. {@code supportedProtocols} bounds both the protocols a
 * session may switch to and the listeners that may be started.</p>
 */
public record GatewayConfig(
    List<RoutingRule> routingRules,
    ProtocolKind defaultProtocol,
    Set<ProtocolKind> supportedProtocols,
    Map<ProtocolKind, ListenerAddress> listeners,
    MigrationPolicy migrationPolicy,
    HealthCheckPolicy healthCheckPolicy,
    SessionPolicy sessionPolicy,
    TransportSettings transportSettings
) {
    public GatewayConfig {
        Objects.requireNonNull(defaultProtocol, "defaultProtocol");
        Objects.requireNonNull(migrationPolicy, "migrationPolicy");
        Objects.requireNonNull(healthCheckPolicy, "healthCheckPolicy");
        Objects.requireNonNull(sessionPolicy, "sessionPolicy");
        Objects.requireNonNull(transportSettings, "transportSettings");
        routingRules = List.copyOf(routingRules);
        if (supportedProtocols.isEmpty()) {
            throw new IllegalArgumentException("supportedProtocols must not be empty");
        }
        supportedProtocols = Collections.unmodifiableSet(EnumSet.copyOf(supportedProtocols));
        listeners = Collections.unmodifiableMap(listeners.isEmpty()
                ? new EnumMap<>(ProtocolKind.class)
                : new EnumMap<>(listeners));

        if (!supportedProtocols.contains(defaultProtocol)) {
            throw new IllegalArgumentException("defaultProtocol " + defaultProtocol + " is not supported");
        }
        for (RoutingRule rule : routingRules) {
            if (!supportedProtocols.contains(rule.targetProtocol())) {
                throw new IllegalArgumentException("Rule targets unsupported protocol: " + rule);
            }
        }
        for (ProtocolKind kind : listeners.keySet()) {
            if (!supportedProtocols.contains(kind)) {
                throw new IllegalArgumentException("Listener configured for unsupported protocol: " + kind);
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private final List<RoutingRule> routingRules = new ArrayList<>();
        private ProtocolKind defaultProtocol = ProtocolKind.HTTP;
        private Set<ProtocolKind> supportedProtocols = EnumSet.allOf(ProtocolKind.class);
        private final Map<ProtocolKind, ListenerAddress> listeners = new EnumMap<>(ProtocolKind.class);
        private MigrationPolicy migrationPolicy = MigrationPolicy.defaults();
        private HealthCheckPolicy healthCheckPolicy = HealthCheckPolicy.defaults();
        private SessionPolicy sessionPolicy = SessionPolicy.defaults();
        private TransportSettings transportSettings = TransportSettings.defaults();

        public Builder withRule(RoutingRule rule) {
            this.routingRules.add(Objects.requireNonNull(rule, "rule"));
            return this;
        }

        public Builder withRules(List<RoutingRule> rules) {
            rules.forEach(this::withRule);
            return this;
        }

        public Builder withDefaultProtocol(ProtocolKind defaultProtocol) {
            this.defaultProtocol = defaultProtocol;
            return this;
        }

        public Builder withSupportedProtocols(Set<ProtocolKind> supportedProtocols) {
            this.supportedProtocols = supportedProtocols;
            return this;
        }

        public Builder withListener(ProtocolKind protocol, String address, int port) {
            this.listeners.put(protocol, new ListenerAddress(address, port));
            return this;
        }

        public Builder withMigrationPolicy(MigrationPolicy migrationPolicy) {
            this.migrationPolicy = migrationPolicy;
            return this;
        }

        public Builder withHealthCheckPolicy(HealthCheckPolicy healthCheckPolicy) {
            this.healthCheckPolicy = healthCheckPolicy;
            return this;
        }

        public Builder withSessionPolicy(SessionPolicy sessionPolicy) {
            this.sessionPolicy = sessionPolicy;
            return this;
        }

        public Builder withTransportSettings(TransportSettings transportSettings) {
            this.transportSettings = transportSettings;
            return this;
        }

        public GatewayConfig build() {
            return new GatewayConfig(routingRules, defaultProtocol, supportedProtocols, listeners,
                    migrationPolicy, healthCheckPolicy, sessionPolicy, transportSettings);
        }
    }
}
