package com.questrail.gateway.state;

import com.questrail.gateway.session.Session;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * TransitionTable
 * =============================================================================
 * The fixed set of legal {@code (state, event) -> state} moves, each with an
 * optional guard and action.
 *
 * <h2>Standard rows</h2>
 * <pre>
 *   IDLE          CONNECT       -> CONNECTING     open backend connection
 *   CONNECTING    CONNECTED     -> CONNECTED      bind session to connection
 *   CONNECTING    ERROR         -> ERROR          record failure
 *   CONNECTED     SWITCH        -> SWITCHING      [target supported, != current] begin migration plan
 *   SWITCHING     SWITCHED      -> CONNECTED      commit new binding, discard plan
 *   SWITCHING     ROLLED_BACK   -> CONNECTED      keep previous binding, discard plan
 *   SWITCHING     ERROR         -> ERROR          release partial binding, discard plan
 *   CONNECTED     DISCONNECT    -> DISCONNECTING  stop admitting work, drain
 *   DISCONNECTING DISCONNECTED  -> IDLE           release session resources
 *   ERROR         RETRY         -> IDLE           [backoff elapsed] reset session
 * </pre>
 * Anything else is illegal. The table is immutable once built.
 */
public final class TransitionTable
{
    @FunctionalInterface
    public interface Guard
    {
        /**
         * @return a refusal reason, or empty to allow the transition
         */
        Optional<String> check(Session session, SessionEvent event);
    }

    @FunctionalInterface
    public interface Action
    {
        void run(Session session, SessionEvent event) throws Exception;
    }

    public record Row(GatewayState from, SessionEvent.Type event, GatewayState to, Guard guard, Action action)
    {
        public Row {
            Objects.requireNonNull(from, "from");
            Objects.requireNonNull(event, "event");
            Objects.requireNonNull(to, "to");
            guard = guard == null ? (s, e) -> Optional.empty() : guard;
            action = action == null ? (s, e) -> { } : action;
        }
    }

    private final Map<GatewayState, Map<SessionEvent.Type, Row>> rows;

    private TransitionTable(Map<GatewayState, Map<SessionEvent.Type, Row>> rows)
    {
        this.rows = rows;
    }

    public Optional<Row> lookup(GatewayState from, SessionEvent.Type event)
    {
        Map<SessionEvent.Type, Row> byEvent = rows.get(from);
        return byEvent == null ? Optional.empty() : Optional.ofNullable(byEvent.get(event));
    }

    public boolean isLegal(GatewayState from, SessionEvent.Type event)
    {
        return lookup(from, event).isPresent();
    }

    public Collection<Row> rowsFrom(GatewayState from)
    {
        Map<SessionEvent.Type, Row> byEvent = rows.get(from);
        return byEvent == null ? Collections.emptyList() : Collections.unmodifiableCollection(byEvent.values());
    }

    /**
     * The gateway's session lifecycle with guards and actions taken from
     * {@code actions}.
     */
    public static TransitionTable standard(LifecycleActions actions)
    {
        Objects.requireNonNull(actions, "actions");
        return new Builder()
                .row(GatewayState.IDLE, SessionEvent.Type.CONNECT, GatewayState.CONNECTING, null,
                        (s, e) -> actions.openConnection(s, (SessionEvent.Connect) e))
                .row(GatewayState.CONNECTING, SessionEvent.Type.CONNECTED, GatewayState.CONNECTED, null,
                        (s, e) -> actions.bindConnection(s, (SessionEvent.Connected) e))
                .row(GatewayState.CONNECTING, SessionEvent.Type.ERROR, GatewayState.ERROR, null,
                        (s, e) -> actions.recordConnectFailure(s, (SessionEvent.Error) e))
                .row(GatewayState.CONNECTED, SessionEvent.Type.SWITCH, GatewayState.SWITCHING,
                        (s, e) -> actions.canSwitch(s, (SessionEvent.Switch) e),
                        (s, e) -> actions.beginMigration(s, (SessionEvent.Switch) e))
                .row(GatewayState.SWITCHING, SessionEvent.Type.SWITCHED, GatewayState.CONNECTED, null,
                        (s, e) -> actions.commitMigration(s, (SessionEvent.Switched) e))
                .row(GatewayState.SWITCHING, SessionEvent.Type.ROLLED_BACK, GatewayState.CONNECTED, null,
                        (s, e) -> actions.rollBackMigration(s, (SessionEvent.RolledBack) e))
                .row(GatewayState.SWITCHING, SessionEvent.Type.ERROR, GatewayState.ERROR, null,
                        (s, e) -> actions.abortMigration(s, (SessionEvent.Error) e))
                .row(GatewayState.CONNECTED, SessionEvent.Type.DISCONNECT, GatewayState.DISCONNECTING, null,
                        (s, e) -> actions.beginTeardown(s, (SessionEvent.Disconnect) e))
                .row(GatewayState.DISCONNECTING, SessionEvent.Type.DISCONNECTED, GatewayState.IDLE, null,
                        (s, e) -> actions.releaseResources(s, (SessionEvent.Disconnected) e))
                .row(GatewayState.ERROR, SessionEvent.Type.RETRY, GatewayState.IDLE,
                        (s, e) -> actions.canRetry(s, (SessionEvent.Retry) e),
                        (s, e) -> actions.resetSession(s, (SessionEvent.Retry) e))
                .build();
    }

    public static final class Builder
    {
        private final Map<GatewayState, Map<SessionEvent.Type, Row>> rows = new EnumMap<>(GatewayState.class);

        public Builder row(GatewayState from, SessionEvent.Type event, GatewayState to, Guard guard, Action action)
        {
            Map<SessionEvent.Type, Row> byEvent = rows.computeIfAbsent(from, k -> new EnumMap<>(SessionEvent.Type.class));
            if (byEvent.containsKey(event)) {
                throw new IllegalArgumentException("Duplicate row for " + from + " on " + event);
            }
            byEvent.put(event, new Row(from, event, to, guard, action));
            return this;
        }

        public TransitionTable build()
        {
            Map<GatewayState, Map<SessionEvent.Type, Row>> frozen = new EnumMap<>(GatewayState.class);
            rows.forEach((state, byEvent) -> frozen.put(state, Collections.unmodifiableMap(new EnumMap<>(byEvent))));
            return new TransitionTable(Collections.unmodifiableMap(frozen));
        }
    }
}
