package com.questrail.gateway.runtime;

import com.questrail.gateway.adapter.ProtocolListener;
import com.questrail.gateway.adapter.ProtocolTransportFactory;
import com.questrail.gateway.adapter.TransportException;
import com.questrail.gateway.adapter.TransportUnavailableException;
import com.questrail.gateway.adapter.netty.NettyProtocolTransportFactory;
import com.questrail.gateway.api.ErrorKind;
import com.questrail.gateway.api.GatewayError;
import com.questrail.gateway.api.GatewayResult;
import com.questrail.gateway.api.Message;
import com.questrail.gateway.api.ProtocolKind;
import com.questrail.gateway.api.RoutingContext;
import com.questrail.gateway.balance.BalancedConnector;
import com.questrail.gateway.balance.LoadBalancer;
import com.questrail.gateway.balance.LoadBalancingStrategy;
import com.questrail.gateway.balance.RoundRobinStrategy;
import com.questrail.gateway.config.GatewayConfig;
import com.questrail.gateway.config.ListenerAddress;
import com.questrail.gateway.migration.ApplicationStateCodec;
import com.questrail.gateway.migration.ConnectionMigrator;
import com.questrail.gateway.migration.JacksonApplicationStateCodec;
import com.questrail.gateway.migration.MigrationContext;
import com.questrail.gateway.migration.MigrationFailedException;
import com.questrail.gateway.migration.MigrationResult;
import com.questrail.gateway.migration.MigrationStrategy;
import com.questrail.gateway.observability.GatewayErrorEvent;
import com.questrail.gateway.observability.GatewayEvent;
import com.questrail.gateway.observability.GatewayObservabilitySink;
import com.questrail.gateway.observability.Slf4jGatewayObservabilitySink;
import com.questrail.gateway.registry.Endpoint;
import com.questrail.gateway.registry.EndpointRegistry;
import com.questrail.gateway.registry.HealthChecker;
import com.questrail.gateway.routing.ProtocolRouter;
import com.questrail.gateway.routing.RoutingDecision;
import com.questrail.gateway.session.ExchangeFailureTracker;
import com.questrail.gateway.session.Session;
import com.questrail.gateway.session.SessionBinding;
import com.questrail.gateway.session.SessionReaper;
import com.questrail.gateway.session.SessionRegistry;
import com.questrail.gateway.state.GatewayState;
import com.questrail.gateway.state.GatewayStateMachine;
import com.questrail.gateway.state.SessionEvent;
import com.questrail.gateway.state.TransitionResult;
import com.questrail.gateway.state.TransitionTable;
import com.questrail.gateway.time.MonotonicClock;
import com.questrail.gateway.time.MonotonicScheduler;
import com.questrail.gateway.time.ScheduledExecutorScheduler;
import com.questrail.gateway.time.SystemMonotonicClock;
import com.questrail.gateway.time.SystemWallClock;
import com.questrail.gateway.time.WallClock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * ProtocolGateway
 * =============================================================================
 * Composition root and public entry point of the gateway.
 *
 * <h2>Responsibilities</h2>
 * <ul>
 *   <li>owns every long-lived collaborator: transport factory, endpoint
 *       registry, load balancer, health checker, session registry, state
 *       machine, migrator, router and the background scheduler</li>
 *   <li>wires router, state machine, migrator and adapters together</li>
 *   <li>starts and stops protocol listeners</li>
 * </ul>
 *
 * <h2>Error contract</h2>
 * No public operation throws. Every outcome is a {@link GatewayResult}; each
 * failure is also logged at WARN and reported to the observability sink.
 *
 * <h2>State authority</h2>
 * Session state changes only through the {@link GatewayStateMachine}. The
 * facade fires events and reacts to their {@link TransitionResult}s; it never
 * sets state itself.
 */
public final class ProtocolGateway
{
    private static final Logger log = LoggerFactory.getLogger(ProtocolGateway.class);
    private static final long SETTLE_POLL_MILLIS = 10;

    private final GatewayConfig config;
    private final ProtocolTransportFactory transport;
    private final EndpointRegistry endpoints;
    private final LoadBalancer balancer;
    private final HealthChecker healthChecker;
    private final SessionRegistry sessions;
    private final ExchangeFailureTracker failures;
    private final SessionLifecycle lifecycle;
    private final GatewayStateMachine machine;
    private final ConnectionMigrator migrator;
    private final ProtocolRouter router;
    private final SessionReaper reaper;
    private final InboundDispatcher dispatcher;
    private final GatewayObservabilitySink sink;
    private final MonotonicClock clock;
    private final WallClock wallClock;
    private final Set<ProtocolKind> supported;
    private final List<AutoCloseable> owned;

    private final Object listenerLock = new Object();
    private final Map<ProtocolKind, ProtocolListener> listeners = new EnumMap<>(ProtocolKind.class);
    private final Map<ProtocolKind, InetSocketAddress> requestedAddresses = new EnumMap<>(ProtocolKind.class);
    private final AtomicBoolean shutDown = new AtomicBoolean();

    private ProtocolGateway(Builder b, Wiring w)
    {
        this.config = b.config;
        this.transport = w.transport;
        this.endpoints = w.endpoints;
        this.balancer = w.balancer;
        this.healthChecker = w.healthChecker;
        this.sessions = w.sessions;
        this.failures = w.failures;
        this.lifecycle = w.lifecycle;
        this.machine = w.machine;
        this.migrator = w.migrator;
        this.router = w.router;
        this.sink = b.observabilitySink;
        this.clock = b.clock;
        this.wallClock = b.wallClock;
        this.supported = w.supported;
        this.owned = w.owned;
        this.reaper = new SessionReaper(sessions, clock, w.scheduler,
                config.sessionPolicy().idleTimeout(), this::closeIdleSession);
        this.dispatcher = new InboundDispatcher(this, b.requestHandler, b.contextResolver,
                config.migrationPolicy().defaultStrategy());
    }

    // -------------------------------------------------------------------------
    // Listeners
    // -------------------------------------------------------------------------

    /**
     * Start the listener for {@code protocol}. Idempotent per protocol: asking
     * again for the address it already listens on returns the bound address;
     * asking for a different one restarts it there.
     *
     * @return the address actually bound
     */
    public GatewayResult<InetSocketAddress> listen(ProtocolKind protocol, String address, int port)
    {
        return guarded("listen", null, ErrorKind.LISTEN_FAILED, () -> doListen(protocol, address, port));
    }

    /**
     * Start every listener named in the configuration.
     */
    public GatewayResult<Map<ProtocolKind, InetSocketAddress>> listenAll()
    {
        return guarded("listenAll", null, ErrorKind.LISTEN_FAILED, () -> {
            Map<ProtocolKind, InetSocketAddress> bound = new EnumMap<>(ProtocolKind.class);
            for (Map.Entry<ProtocolKind, ListenerAddress> e : config.listeners().entrySet()) {
                GatewayResult<InetSocketAddress> r = doListen(e.getKey(), e.getValue().address(), e.getValue().port());
                if (r.isFailure()) {
                    return GatewayResult.failure(r.error());
                }
                bound.put(e.getKey(), r.value());
            }
            return GatewayResult.success(Collections.unmodifiableMap(bound));
        });
    }

    private GatewayResult<InetSocketAddress> doListen(ProtocolKind protocol, String address, int port)
    {
        Objects.requireNonNull(protocol, "protocol");
        if (shutDown.get()) {
            return fail(null, GatewayError.of(ErrorKind.SHUTDOWN, "Gateway is shut down"));
        }
        if (!supported.contains(protocol)) {
            return fail(null, GatewayError.of(ErrorKind.LISTEN_FAILED, "Protocol " + protocol + " is not supported"));
        }
        InetSocketAddress requested = new ListenerAddress(address, port).toSocketAddress();

        synchronized (listenerLock) {
            ProtocolListener current = listeners.get(protocol);
            if (current != null && current.isRunning()) {
                if (requested.equals(requestedAddresses.get(protocol))) {
                    return GatewayResult.success(current.boundAddress().orElse(requested));
                }
                log.info("Restarting {} listener: {} -> {}", protocol, requestedAddresses.get(protocol), requested);
                current.stop();
            }

            ProtocolListener listener = transport.newListener(protocol);
            try {
                InetSocketAddress bound = listener.start(requested, dispatcher);
                listeners.put(protocol, listener);
                requestedAddresses.put(protocol, requested);
                log.info("Listening for {} on {}", protocol, bound);
                return GatewayResult.success(bound);
            } catch (TransportUnavailableException e) {
                listeners.remove(protocol);
                requestedAddresses.remove(protocol);
                return fail(null, new GatewayError(ErrorKind.LISTEN_FAILED,
                        "Cannot listen for " + protocol + " on " + requested + ": " + e.getMessage(), e));
            }
        }
    }

    /**
     * Address the listener for {@code protocol} is bound to, if it is running.
     */
    public Optional<InetSocketAddress> listenerAddress(ProtocolKind protocol)
    {
        synchronized (listenerLock) {
            ProtocolListener listener = listeners.get(protocol);
            return listener == null || !listener.isRunning() ? Optional.empty() : listener.boundAddress();
        }
    }

    // -------------------------------------------------------------------------
    // Routing and endpoints
    // -------------------------------------------------------------------------

    /**
     * Pick the target protocol for {@code message} and publish a
     * {@code routing_decision} event.
     */
    public GatewayResult<ProtocolKind> route(Message message, RoutingContext context)
    {
        return guarded("route", null, ErrorKind.HANDLER_FAILED, () -> {
            RoutingDecision decision = router.decide(message, context);
            sink.onGatewayEvent(GatewayEvent.builder(GatewayEvent.Type.ROUTING_DECISION, wallClock.now())
                    .attribute("session", message.sessionId())
                    .attribute("from", message.sourceProtocol())
                    .attribute("to", decision.target())
                    .attribute("rule", decision.ruleDescription())
                    .build());
            return GatewayResult.success(decision.target());
        });
    }

    /**
     * @return {@code true} if newly registered, {@code false} if already present
     */
    public GatewayResult<Boolean> registerEndpoint(Endpoint endpoint)
    {
        return guarded("registerEndpoint", null, ErrorKind.TRANSPORT_UNAVAILABLE, () -> {
            if (!supported.contains(endpoint.protocol())) {
                return fail(null, GatewayError.of(ErrorKind.TRANSPORT_UNAVAILABLE,
                        "Protocol " + endpoint.protocol() + " is not supported"));
            }
            boolean added = endpoints.register(endpoint);
            if (added) {
                log.info("Registered endpoint {}", endpoint.id());
            }
            return GatewayResult.success(added);
        });
    }

    /**
     * @return {@code true} if the endpoint was registered
     */
    public GatewayResult<Boolean> deregisterEndpoint(Endpoint endpoint)
    {
        return guarded("deregisterEndpoint", null, ErrorKind.TRANSPORT_UNAVAILABLE, () -> {
            boolean removed = endpoints.deregister(endpoint);
            if (removed) {
                log.info("Deregistered endpoint {}", endpoint.id());
            }
            return GatewayResult.success(removed);
        });
    }

    public GatewayResult<Endpoint> selectEndpoint(ProtocolKind protocol)
    {
        return guarded("selectEndpoint", null, ErrorKind.NO_HEALTHY_ENDPOINT, () -> {
            Endpoint chosen = balancer.selectEndpoint(protocol);
            if (chosen == null) {
                return fail(null, GatewayError.of(ErrorKind.NO_HEALTHY_ENDPOINT,
                        "No healthy " + protocol + " endpoint"));
            }
            return GatewayResult.success(chosen);
        });
    }

    public GatewayResult<Void> startHealthChecks()
    {
        return guarded("startHealthChecks", null, ErrorKind.SHUTDOWN, () -> {
            if (shutDown.get()) {
                return fail(null, GatewayError.of(ErrorKind.SHUTDOWN, "Gateway is shut down"));
            }
            healthChecker.start();
            log.info("Health checks every {}", config.healthCheckPolicy().interval());
            return GatewayResult.done();
        });
    }

    /**
     * Probe every registered endpoint now and wait for the results.
     */
    public GatewayResult<Map<Endpoint, Boolean>> checkHealthNow()
    {
        return guarded("checkHealthNow", null, ErrorKind.TRANSPORT_UNAVAILABLE,
                () -> GatewayResult.success(healthChecker.checkNow()));
    }

    // -------------------------------------------------------------------------
    // Sessions
    // -------------------------------------------------------------------------

    public GatewayResult<Session> session(String id)
    {
        return guarded("session", id, ErrorKind.UNKNOWN_SESSION, () -> sessions.find(id)
                .map(GatewayResult::success)
                .orElseGet(() -> GatewayResult.failure(ErrorKind.UNKNOWN_SESSION, "No session " + id)));
    }

    public List<Session> sessions()
    {
        return sessions.all();
    }

    /**
     * Create session {@code id} and connect it to a healthy endpoint of
     * {@code protocol}. An idle session with the same id is reused.
     */
    public GatewayResult<Session> openSession(String id, ProtocolKind protocol, Map<String, Object> initialState)
    {
        return guarded("openSession", id, ErrorKind.TRANSPORT_UNAVAILABLE, () -> {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(protocol, "protocol");
            if (shutDown.get()) {
                return fail(id, GatewayError.of(ErrorKind.SHUTDOWN, "Gateway is shut down"));
            }
            if (!supported.contains(protocol)) {
                return fail(id, GatewayError.of(ErrorKind.TRANSPORT_UNAVAILABLE,
                        "Protocol " + protocol + " is not supported"));
            }

            Optional<Session> created = sessions.createIfAbsent(id,
                    k -> new Session(k, protocol, initialState, wallClock.now(), clock.nowNanos()));
            Session session;
            if (created.isPresent()) {
                session = created.get();
            } else {
                session = sessions.find(id).orElse(null);
                if (session == null || session.state() != GatewayState.IDLE) {
                    return fail(id, GatewayError.of(ErrorKind.INVALID_TRANSITION, "Session " + id + " is already open"));
                }
                if (initialState != null && !initialState.isEmpty()) {
                    session.replaceApplicationState(initialState);
                }
            }
            return connect(session, protocol);
        });
    }

    /**
     * Send {@code payload} over the session's connection and wait up to
     * {@code timeout} for the reply.
     *
     * <p>Exchanges on one session run one at a time; an admitted caller queued
     * behind another spends part of its {@code timeout} waiting for its turn.
     * Replies left over from an earlier exchange that timed out are dropped
     * before the request is written.</p>
     */
    public GatewayResult<byte[]> exchange(Session session, byte[] payload, Duration timeout)
    {
        return guarded("exchange", session == null ? null : session.id(), ErrorKind.SEND_FAILED, () -> {
            Objects.requireNonNull(payload, "payload");
            Objects.requireNonNull(timeout, "timeout");
            if (shutDown.get()) {
                return fail(session.id(), GatewayError.of(ErrorKind.SHUTDOWN, "Gateway is shut down"));
            }

            Optional<SessionBinding> admitted;
            GatewayState state;
            session.lock();
            try {
                admitted = session.beginExchange();
                state = session.state();
            } finally {
                session.unlock();
            }
            if (admitted.isEmpty()) {
                return state == GatewayState.SWITCHING
                        ? fail(session.id(), GatewayError.of(ErrorKind.MIGRATION_IN_PROGRESS,
                                "Session " + session.id() + " is switching protocols"))
                        : fail(session.id(), GatewayError.of(ErrorKind.INVALID_TRANSITION,
                                "Session " + session.id() + " is not connected (" + state + ")"));
            }

            SessionBinding binding = admitted.get();
            long deadline = SystemMonotonicClock.INSTANCE.nowNanos() + timeout.toNanos();
            byte[] reply = null;
            TransportException failure = null;
            GatewayError notRun = null;
            try {
                if (session.tryAcquireExchange(timeout.toNanos())) {
                    try {
                        int stale = binding.adapter().discardPending(binding.connection());
                        if (stale > 0) {
                            log.debug("Session {}: dropped {} late reply(ies) before sending", session.id(), stale);
                        }
                        binding.adapter().send(binding.connection(), payload);
                        reply = binding.adapter().receive(binding.connection(), Duration.ofNanos(
                                Math.max(0L, deadline - SystemMonotonicClock.INSTANCE.nowNanos())));
                    } finally {
                        session.releaseExchange();
                    }
                } else {
                    notRun = GatewayError.of(ErrorKind.RECEIVE_TIMEOUT, "Session " + session.id()
                            + " still busy with an earlier exchange after " + timeout.toMillis() + "ms");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                notRun = new GatewayError(ErrorKind.RECEIVE_TIMEOUT,
                        "Interrupted while waiting to exchange on session " + session.id(), e);
            } catch (TransportException e) {
                failure = e;
            } finally {
                session.lock();
                try {
                    session.endExchange();
                } finally {
                    session.unlock();
                }
            }

            if (notRun != null) {
                return fail(session.id(), notRun);
            }
            if (failure != null) {
                return exchangeFailed(session, binding, failure);
            }
            failures.reset(session.id());
            session.touch(wallClock.now(), clock.nowNanos());
            return GatewayResult.success(reply);
        });
    }

    private GatewayResult<byte[]> exchangeFailed(Session session, SessionBinding binding, TransportException failure)
    {
        boolean onCurrentConnection;
        session.lock();
        try {
            onCurrentConnection = session.state() == GatewayState.CONNECTED
                    && session.primaryBinding().map(b -> b == binding).orElse(false);
        } finally {
            session.unlock();
        }

        GatewayResult<byte[]> result = fail(session.id(), failure.toError());
        if (onCurrentConnection && failures.recordFailure(session.id())) {
            log.warn("Session {}: {} consecutive exchange failures, disconnecting",
                    session.id(), failures.threshold());
            disconnect(session, "exchange failure threshold reached", config.migrationPolicy().drainTimeout());
        }
        return result;
    }

    /**
     * Drain and close the session, then forget it.
     */
    public GatewayResult<Void> closeSession(Session session)
    {
        return guarded("closeSession", session == null ? null : session.id(), ErrorKind.INVALID_TRANSITION, () -> {
            if (sessions.find(session.id()).orElse(null) != session) {
                return fail(session.id(), GatewayError.of(ErrorKind.UNKNOWN_SESSION, "No session " + session.id()));
            }
            return switch (session.state()) {
                case IDLE, ERROR -> discard(session);
                default -> disconnect(session, "closed", config.migrationPolicy().drainTimeout());
            };
        });
    }

    /**
     * Leave {@code ERROR} once the retry backoff has elapsed and reconnect on
     * the session's current protocol.
     */
    public GatewayResult<Session> retry(Session session)
    {
        return guarded("retry", session == null ? null : session.id(), ErrorKind.TRANSPORT_UNAVAILABLE, () -> {
            if (shutDown.get()) {
                return fail(session.id(), GatewayError.of(ErrorKind.SHUTDOWN, "Gateway is shut down"));
            }
            ProtocolKind protocol = session.currentProtocol();
            TransitionResult reset = machine.fire(session, new SessionEvent.Retry());
            if (!reset.isTransitioned()) {
                return fail(session.id(), errorOf(reset));
            }
            log.info("Session {}: retrying on {}", session.id(), protocol);
            return connect(session, protocol);
        });
    }

    private GatewayResult<Session> connect(Session session, ProtocolKind protocol)
    {
        TransitionResult opened = machine.fire(session, new SessionEvent.Connect(protocol));
        if (!opened.isTransitioned()) {
            return fail(session.id(), errorOf(opened));
        }

        SessionBinding binding;
        session.lock();
        try {
            binding = session.pendingBinding().orElse(null);
        } finally {
            session.unlock();
        }
        if (binding == null) {
            GatewayError missing = GatewayError.of(ErrorKind.TRANSPORT_UNAVAILABLE, "Connect produced no connection");
            machine.fire(session, SessionEvent.Error.of(missing));
            return fail(session.id(), missing);
        }

        TransitionResult bound = machine.fire(session, new SessionEvent.Connected(binding));
        if (!bound.isTransitioned()) {
            return fail(session.id(), errorOf(bound));
        }
        session.touch(wallClock.now(), clock.nowNanos());
        log.debug("Session {}: connected on {} via {}", session.id(), protocol, binding.endpoint().id());
        return GatewayResult.success(session);
    }

    private GatewayResult<Void> disconnect(Session session, String reason, Duration drainTimeout)
    {
        TransitionResult teardown = machine.fire(session, new SessionEvent.Disconnect(reason, drainTimeout));
        if (!teardown.isTransitioned()) {
            return fail(session.id(), errorOf(teardown));
        }
        TransitionResult released = machine.fire(session, new SessionEvent.Disconnected());
        if (!released.isTransitioned()) {
            return fail(session.id(), errorOf(released));
        }
        sessions.remove(session);
        failures.reset(session.id());
        log.debug("Session {}: closed ({})", session.id(), reason);
        return GatewayResult.done();
    }

    /**
     * Forget a session that holds no live connection state: {@code IDLE}, or
     * {@code ERROR} that will not be retried.
     */
    private GatewayResult<Void> discard(Session session)
    {
        session.lock();
        try {
            GatewayState state = session.state();
            if (state != GatewayState.IDLE && state != GatewayState.ERROR) {
                return fail(session.id(), GatewayError.of(ErrorKind.INVALID_TRANSITION,
                        "Session " + session.id() + " is " + state));
            }
            lifecycle.releaseAll(session);
        } finally {
            session.unlock();
        }
        sessions.remove(session);
        failures.reset(session.id());
        return GatewayResult.done();
    }

    void touch(Session session)
    {
        session.touch(wallClock.now(), clock.nowNanos());
    }

    private void closeIdleSession(Session session)
    {
        GatewayResult<Void> closed = closeSession(session);
        if (closed.isFailure()) {
            log.debug("Idle session {} not closed: {}", session.id(), closed.error());
        }
    }

    // -------------------------------------------------------------------------
    // Protocol switch
    // -------------------------------------------------------------------------

    /**
     * Move the session to {@code target} using {@code strategy}.
     *
     * <p>If the migration fails while the old connection is still open the
     * session is rolled back to {@code CONNECTED} on its old protocol;
     * otherwise it moves to {@code ERROR}. Either way the result is a
     * {@link ErrorKind#MIGRATION_FAILED} failure.</p>
     */
    public GatewayResult<MigrationResult> switchProtocol(Session session, ProtocolKind target, MigrationStrategy strategy)
    {
        return guarded("switchProtocol", session == null ? null : session.id(), ErrorKind.MIGRATION_FAILED, () -> {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(strategy, "strategy");
            if (shutDown.get()) {
                return fail(session.id(), GatewayError.of(ErrorKind.SHUTDOWN, "Gateway is shut down"));
            }

            ProtocolKind from;
            session.lock();
            try {
                from = session.currentProtocol();
                TransitionResult begun = machine.fire(session, new SessionEvent.Switch(target, strategy));
                if (!begun.isTransitioned()) {
                    return fail(session.id(), errorOf(begun));
                }
            } finally {
                session.unlock();
            }

            ConnectionMigrator.Outcome outcome;
            try {
                outcome = migrator.migrate(session, from, target, strategy);
            } catch (MigrationFailedException e) {
                if (e.rollbackPossible()) {
                    machine.fire(session, new SessionEvent.RolledBack(strategy, e.reason()));
                } else {
                    machine.fire(session, new SessionEvent.Error(null, ErrorKind.MIGRATION_FAILED, e.getMessage(), e));
                }
                return fail(session.id(), e.toError());
            } catch (RuntimeException e) {
                machine.fire(session, new SessionEvent.Error(null, ErrorKind.MIGRATION_FAILED, String.valueOf(e), e));
                throw e;
            }

            TransitionResult committed = machine.fire(session, new SessionEvent.Switched(outcome.binding()));
            if (!committed.isTransitioned()) {
                return fail(session.id(), errorOf(committed));
            }

            MigrationResult result = outcome.result();
            sink.onGatewayEvent(GatewayEvent.builder(GatewayEvent.Type.PROTOCOL_SWITCH, wallClock.now())
                    .attribute("session", session.id())
                    .attribute("from", from)
                    .attribute("to", target)
                    .attribute("strategy", strategy)
                    .build());
            sink.onGatewayEvent(GatewayEvent.builder(GatewayEvent.Type.MIGRATION_COMPLETE, wallClock.now())
                    .attribute("session", session.id())
                    .attribute("strategy", strategy)
                    .attribute("dropped_connections", result.droppedConnections())
                    .attribute("migration_time_ms", result.migrationTimeMs())
                    .build());
            log.info("Session {}: switched {} -> {} via {} ({} dropped, {}ms)", session.id(), from, target,
                    strategy, result.droppedConnections(), result.migrationTimeMs());
            return GatewayResult.success(result);
        });
    }

    // -------------------------------------------------------------------------
    // Shutdown
    // -------------------------------------------------------------------------

    /**
     * Disconnect every session, letting in-flight exchanges drain until
     * {@code timeout} has elapsed overall, then stop all listeners and release
     * transport resources. Idempotent.
     */
    public GatewayResult<Void> shutdown(Duration timeout)
    {
        return guarded("shutdown", null, ErrorKind.SHUTDOWN, () -> {
            Objects.requireNonNull(timeout, "timeout");
            if (!shutDown.compareAndSet(false, true)) {
                return GatewayResult.done();
            }
            log.info("Shutting down gateway: {} session(s), timeout {}ms", sessions.size(), timeout.toMillis());

            // Real time: the waits below block the calling thread.
            long deadline = SystemMonotonicClock.INSTANCE.nowNanos() + timeout.toNanos();
            healthChecker.stop();
            reaper.stop();

            AtomicInteger unclean = new AtomicInteger();
            for (Session session : sessions.all()) {
                awaitSettled(session, deadline);
                Duration remaining = Duration.ofNanos(
                        Math.max(0L, deadline - SystemMonotonicClock.INSTANCE.nowNanos()));
                GatewayResult<Void> closed = session.state() == GatewayState.CONNECTED
                        ? disconnect(session, "gateway shutdown", remaining)
                        : discard(session);
                if (closed.isFailure()) {
                    unclean.incrementAndGet();
                }
            }

            synchronized (listenerLock) {
                listeners.values().forEach(ProtocolListener::stop);
                listeners.clear();
                requestedAddresses.clear();
            }
            closeOwned();

            if (unclean.get() > 0) {
                log.warn("Gateway shut down; {} session(s) did not close cleanly", unclean.get());
            } else {
                log.info("Gateway shut down");
            }
            return GatewayResult.done();
        });
    }

    public boolean isShutDown()
    {
        return shutDown.get();
    }

    /**
     * Wait for a session caught mid-transition (switching, connecting) to
     * settle, polling until the shared shutdown {@code deadline} passes.
     */
    private static void awaitSettled(Session session, long deadline)
    {
        while (isTransient(session.state())) {
            long left = deadline - SystemMonotonicClock.INSTANCE.nowNanos();
            if (left <= 0) {
                return;
            }
            try {
                TimeUnit.NANOSECONDS.sleep(Math.min(left, TimeUnit.MILLISECONDS.toNanos(SETTLE_POLL_MILLIS)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private static boolean isTransient(GatewayState state)
    {
        return state == GatewayState.SWITCHING
                || state == GatewayState.CONNECTING
                || state == GatewayState.DISCONNECTING;
    }

    private void closeOwned()
    {
        for (AutoCloseable resource : owned) {
            try {
                resource.close();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while releasing {}", resource);
            } catch (Exception e) {
                log.warn("Failed to release {}", resource, e);
            }
        }
    }

    // -------------------------------------------------------------------------
    // Accessors
    // -------------------------------------------------------------------------

    public GatewayConfig config()
    {
        return config;
    }

    public EndpointRegistry endpointRegistry()
    {
        return endpoints;
    }

    public LoadBalancer loadBalancer()
    {
        return balancer;
    }

    public ProtocolTransportFactory transport()
    {
        return transport;
    }

    GatewayStateMachine stateMachine()
    {
        return machine;
    }

    SessionReaper reaper()
    {
        return reaper;
    }

    ExchangeFailureTracker failureTracker()
    {
        return failures;
    }

    InboundDispatcher dispatcher()
    {
        return dispatcher;
    }

    // -------------------------------------------------------------------------
    // Error plumbing
    // -------------------------------------------------------------------------

    /**
     * Log {@code error}, report it to the sink and wrap it in a failed result.
     */
    <T> GatewayResult<T> fail(String sessionId, GatewayError error)
    {
        if (sessionId == null) {
            log.warn("{}: {}", error.kind(), error.message());
        } else {
            log.warn("Session {}: {}: {}", sessionId, error.kind(), error.message());
        }
        sink.onError(new GatewayErrorEvent(wallClock.now(), error.kind(), sessionId, error.message(), error.cause()));
        return GatewayResult.failure(error);
    }

    private static GatewayError errorOf(TransitionResult result)
    {
        if (result instanceof TransitionResult.Rejected rejected) {
            return rejected.toGatewayError();
        }
        if (result instanceof TransitionResult.Failed failed) {
            return failed.toGatewayError();
        }
        throw new IllegalArgumentException("Transition succeeded: " + result);
    }

    private <T> GatewayResult<T> guarded(String operation, String sessionId, ErrorKind kind,
                                         Supplier<GatewayResult<T>> body)
    {
        try {
            return body.get();
        } catch (RuntimeException e) {
            log.debug("{} failed", operation, e);
            return fail(sessionId, new GatewayError(kind, operation + " failed: " + e, e));
        }
    }

    // -------------------------------------------------------------------------
    // Builder
    // -------------------------------------------------------------------------

    public static Builder builder()
    {
        return new Builder();
    }

    /**
     * Collaborators built once by {@link Builder#build()}.
     */
    private static final class Wiring
    {
        ProtocolTransportFactory transport;
        MonotonicScheduler scheduler;
        EndpointRegistry endpoints;
        LoadBalancer balancer;
        HealthChecker healthChecker;
        SessionRegistry sessions;
        ExchangeFailureTracker failures;
        SessionLifecycle lifecycle;
        GatewayStateMachine machine;
        ConnectionMigrator migrator;
        ProtocolRouter router;
        Set<ProtocolKind> supported;
        final List<AutoCloseable> owned = new ArrayList<>();
    }

    public static final class Builder
    {
        private GatewayConfig config;
        private ProtocolTransportFactory transportFactory;
        private GatewayObservabilitySink observabilitySink = new Slf4jGatewayObservabilitySink();
        private LoadBalancingStrategy loadBalancingStrategy = new RoundRobinStrategy();
        private MonotonicClock clock = SystemMonotonicClock.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;
        private MonotonicScheduler scheduler;
        private ExecutorService probeExecutor;
        private ApplicationStateCodec stateCodec = new JacksonApplicationStateCodec();
        private RequestHandler requestHandler;
        private Function<Message, RoutingContext> contextResolver = m -> RoutingContext.anonymous();

        public Builder withConfig(GatewayConfig config)
        {
            this.config = config;
            return this;
        }

        /**
         * Transport to use instead of the Netty one. The gateway does not close
         * a factory it was handed.
         */
        public Builder withTransportFactory(ProtocolTransportFactory factory)
        {
            this.transportFactory = factory;
            return this;
        }

        /**
         * Receives events, transitions and errors. Defaults to logging them.
         */
        public Builder withObservabilitySink(GatewayObservabilitySink sink)
        {
            this.observabilitySink = sink;
            return this;
        }

        public Builder withLoadBalancingStrategy(LoadBalancingStrategy strategy)
        {
            this.loadBalancingStrategy = strategy;
            return this;
        }

        public Builder withClock(MonotonicClock clock)
        {
            this.clock = clock;
            return this;
        }

        public Builder withWallClock(WallClock wallClock)
        {
            this.wallClock = wallClock;
            return this;
        }

        public Builder withScheduler(MonotonicScheduler scheduler)
        {
            this.scheduler = scheduler;
            return this;
        }

        public Builder withProbeExecutor(ExecutorService executor)
        {
            this.probeExecutor = executor;
            return this;
        }

        public Builder withStateCodec(ApplicationStateCodec codec)
        {
            this.stateCodec = codec;
            return this;
        }

        public Builder withRequestHandler(RequestHandler handler)
        {
            this.requestHandler = handler;
            return this;
        }

        /**
         * Supplies the authenticated identity and attributes of an inbound
         * message. Defaults to anonymous.
         */
        public Builder withContextResolver(Function<Message, RoutingContext> resolver)
        {
            this.contextResolver = resolver;
            return this;
        }

        public ProtocolGateway build()
        {
            Objects.requireNonNull(config, "config");
            Objects.requireNonNull(observabilitySink, "observabilitySink");
            Objects.requireNonNull(loadBalancingStrategy, "loadBalancingStrategy");
            Objects.requireNonNull(clock, "clock");
            Objects.requireNonNull(wallClock, "wallClock");
            Objects.requireNonNull(stateCodec, "stateCodec");
            Objects.requireNonNull(contextResolver, "contextResolver");
            if (requestHandler == null) {
                requestHandler = new ForwardingRequestHandler(config.transportSettings().writeTimeout());
            }

            Wiring w = new Wiring();

            // 1. Background scheduling
            if (scheduler == null) {
                ScheduledExecutorService schedulerExec = Executors.newScheduledThreadPool(1, daemon("gateway-scheduler"));
                w.owned.add(new ExecutorCloser(schedulerExec));
                w.scheduler = new ScheduledExecutorScheduler(schedulerExec, clock);
            } else {
                w.scheduler = scheduler;
            }
            if (probeExecutor == null) {
                probeExecutor = Executors.newCachedThreadPool(daemon("gateway-probe"));
                w.owned.add(new ExecutorCloser(probeExecutor));
            }

            // 2. Transport
            if (transportFactory == null) {
                NettyProtocolTransportFactory netty = new NettyProtocolTransportFactory(config.transportSettings());
                w.owned.add(netty);
                w.transport = netty;
            } else {
                w.transport = transportFactory;
            }
            Set<ProtocolKind> supported = EnumSet.copyOf(config.supportedProtocols());
            supported.retainAll(w.transport.supportedProtocols());
            w.supported = Collections.unmodifiableSet(supported);

            // 3. Endpoints, balancing, health
            w.endpoints = new EndpointRegistry();
            w.balancer = new LoadBalancer(loadBalancingStrategy, w.endpoints);
            BalancedConnector connector = new BalancedConnector(w.balancer, w.endpoints, w.transport::adapter);
            w.healthChecker = new HealthChecker(w.endpoints, w.transport::adapter, probeExecutor, clock,
                    w.scheduler, wallClock, config.healthCheckPolicy(), observabilitySink);

            // 4. Sessions and their state machine
            w.sessions = new SessionRegistry();
            w.failures = new ExchangeFailureTracker(config.sessionPolicy().failureThreshold());
            w.lifecycle = new SessionLifecycle(connector, w.supported, config.sessionPolicy(), w.failures,
                    clock, wallClock);
            w.machine = new GatewayStateMachine(TransitionTable.standard(w.lifecycle), clock, wallClock,
                    observabilitySink);

            // 5. Migration
            MigrationContext migrationContext = new MigrationContext(connector, stateCodec,
                    config.migrationPolicy(), config.sessionPolicy().connectTimeout());
            w.migrator = new ConnectionMigrator(migrationContext, clock);

            // 6. Routing
            w.router = new ProtocolRouter(config.routingRules(), config.defaultProtocol());

            ProtocolGateway gateway = new ProtocolGateway(this, w);
            gateway.reaper.start();
            return gateway;
        }

        private static ThreadFactory daemon(String name)
        {
            AtomicInteger count = new AtomicInteger();
            return r -> {
                Thread t = new Thread(r, name + "-" + count.incrementAndGet());
                t.setDaemon(true);
                return t;
            };
        }
    }

    /**
     * Owned executor: orderly shutdown, forced after five seconds.
     */
    private record ExecutorCloser(ExecutorService executor) implements AutoCloseable
    {
        @Override
        public void close() throws InterruptedException
        {
            executor.shutdown();
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        }
    }
}
