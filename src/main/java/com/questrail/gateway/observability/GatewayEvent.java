package com.questrail.gateway.observability;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Structured gateway event handed to the external metrics/event sink.
 *
 * <p>{@link Type#wireName()} is the stable event name
 * ({@code protocol_switch}, {@code migration_complete},
 * {@code health_check_result}, {@code routing_decision}); attributes are plain
 * strings so any sink can serialize them.</p>
 */
public record GatewayEvent(
    Instant timestamp,
    Type type,
    Map<String, String> attributes
) {
    public enum Type {
        PROTOCOL_SWITCH("protocol_switch"),
        MIGRATION_COMPLETE("migration_complete"),
        HEALTH_CHECK_RESULT("health_check_result"),
        ROUTING_DECISION("routing_decision");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }
    }

    public GatewayEvent {
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(type, "type");
        attributes = Map.copyOf(attributes);
    }

    public String name() {
        return type.wireName();
    }

    public String attribute(String key) {
        return attributes.get(key);
    }

    public static Builder builder(Type type, Instant timestamp) {
        return new Builder(type, timestamp);
    }

    public static final class Builder {
        private final Type type;
        private final Instant timestamp;
        private final Map<String, String> attributes = new LinkedHashMap<>();

        private Builder(Type type, Instant timestamp) {
            this.type = type;
            this.timestamp = timestamp;
        }

        public Builder attribute(String key, Object value) {
            attributes.put(key, String.valueOf(value));
            return this;
        }

        public GatewayEvent build() {
            return new GatewayEvent(timestamp, type, attributes);
        }
    }
}
