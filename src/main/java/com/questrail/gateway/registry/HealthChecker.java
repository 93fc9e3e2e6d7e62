package com.questrail.gateway.registry;

import com.questrail.gateway.adapter.Connection;
import com.questrail.gateway.adapter.ProtocolAdapter;
import com.questrail.gateway.adapter.TransportException;
import com.questrail.gateway.api.ProtocolKind;
import com.questrail.gateway.config.HealthCheckPolicy;
import com.questrail.gateway.observability.GatewayEvent;
import com.questrail.gateway.observability.GatewayObservabilitySink;
import com.questrail.gateway.time.Cancellable;
import com.questrail.gateway.time.MonotonicClock;
import com.questrail.gateway.time.MonotonicScheduler;
import com.questrail.gateway.time.WallClock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * HealthChecker
 * =============================================================================
 * Periodically probes every registered endpoint and records the outcome.
 *
 * <h2>Probe</h2>
 * {@code adapter.connect(endpoint, probeTimeout)} followed by
 * {@code adapter.disconnect(connection)}. Success marks the endpoint healthy;
 * any failure, timeout or refusal marks it unhealthy. This class is the only
 * writer of the health flag.
 *
 * <h2>Concurrency</h2>
 * Probes of one round run concurrently on the probe executor. A probe that
 * does not complete within {@code probeTimeout} plus a grace period counts as
 * failed. Scheduled rounds do not wait for their probes; {@link #checkNow()}
 * does.
 */
public final class HealthChecker
{
    private static final Logger log = LoggerFactory.getLogger(HealthChecker.class);
    private static final long PROBE_GRACE_MILLIS = 1000;

    private final EndpointRegistry registry;
    private final Function<ProtocolKind, ProtocolAdapter> adapters;
    private final Executor probeExecutor;
    private final MonotonicClock clock;
    private final MonotonicScheduler scheduler;
    private final WallClock wallClock;
    private final HealthCheckPolicy policy;
    private final GatewayObservabilitySink sink;

    private volatile Cancellable nextRound;
    private volatile boolean running;

    public HealthChecker(EndpointRegistry registry,
                         Function<ProtocolKind, ProtocolAdapter> adapters,
                         Executor probeExecutor,
                         MonotonicClock clock,
                         MonotonicScheduler scheduler,
                         WallClock wallClock,
                         HealthCheckPolicy policy,
                         GatewayObservabilitySink sink)
    {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.adapters = Objects.requireNonNull(adapters, "adapters");
        this.probeExecutor = Objects.requireNonNull(probeExecutor, "probeExecutor");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    /**
     * Start periodic rounds; the first one runs after one interval. Idempotent.
     */
    public synchronized void start()
    {
        if (running) {
            return;
        }
        running = true;
        scheduleNext();
    }

    public synchronized void stop()
    {
        running = false;
        Cancellable c = nextRound;
        if (c != null) {
            c.cancel();
        }
    }

    public boolean isRunning()
    {
        return running;
    }

    /**
     * Probe every registered endpoint and wait for all results.
     *
     * @return probe outcome per endpoint, in registration order
     */
    public Map<Endpoint, Boolean> checkNow()
    {
        return runRound().join();
    }

    /**
     * Start one round of concurrent probes.
     */
    public CompletableFuture<Map<Endpoint, Boolean>> runRound()
    {
        List<Endpoint> endpoints = registry.all();
        Map<Endpoint, CompletableFuture<Boolean>> probes = new LinkedHashMap<>();
        for (Endpoint endpoint : endpoints) {
            probes.put(endpoint, CompletableFuture
                    .supplyAsync(() -> probe(endpoint), probeExecutor)
                    .completeOnTimeout(false, policy.probeTimeout().toMillis() + PROBE_GRACE_MILLIS, TimeUnit.MILLISECONDS)
                    .thenApply(healthy -> record(endpoint, healthy)));
        }

        return CompletableFuture.allOf(probes.values().toArray(new CompletableFuture<?>[0]))
                .thenApply(done -> {
                    Map<Endpoint, Boolean> results = new LinkedHashMap<>();
                    probes.forEach((endpoint, f) -> results.put(endpoint, f.join()));
                    return results;
                });
    }

    // -------------------------------------------------------------------------
    // Internals
    // -------------------------------------------------------------------------

    private boolean probe(Endpoint endpoint)
    {
        try {
            ProtocolAdapter adapter = adapters.apply(endpoint.protocol());
            Connection connection = adapter.connect(endpoint, policy.probeTimeout());
            adapter.disconnect(connection);
            return true;
        } catch (TransportException e) {
            log.debug("Probe of {} failed: {}", endpoint.id(), e.getMessage());
            return false;
        } catch (RuntimeException e) {
            log.debug("Probe of {} failed unexpectedly", endpoint.id(), e);
            return false;
        }
    }

    private boolean record(Endpoint endpoint, boolean healthy)
    {
        boolean changed = registry.updateHealth(endpoint, healthy);
        if (changed) {
            log.info("Endpoint {} is now {}", endpoint.id(), healthy ? "healthy" : "unhealthy");
        }
        sink.onGatewayEvent(GatewayEvent.builder(GatewayEvent.Type.HEALTH_CHECK_RESULT, wallClock.now())
                .attribute("endpoint", endpoint.id())
                .attribute("protocol", endpoint.protocol())
                .attribute("healthy", healthy)
                .attribute("changed", changed)
                .build());
        return healthy;
    }

    private void scheduleNext()
    {
        nextRound = scheduler.scheduleAfter(policy.interval(), clock, () -> {
            if (!running) {
                return;
            }
            runRound();
            synchronized (this) {
                if (running) {
                    scheduleNext();
                }
            }
        });
    }
}
