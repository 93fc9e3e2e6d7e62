package com.questrail.gateway.session;

import com.questrail.gateway.api.GatewayError;
import com.questrail.gateway.api.ProtocolKind;
import com.questrail.gateway.migration.MigrationPlan;
import com.questrail.gateway.state.GatewayState;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Session
 * =============================================================================
 * Logical client interaction that may outlive any single transport connection.
 *
 * <h2>Ownership</h2>
 * Sessions are owned by the gateway's {@link SessionRegistry}. State changes
 * only through {@link com.questrail.gateway.state.GatewayStateMachine}; bindings
 * change only inside transition actions and migration strategies.
 *
 * <h2>Binding invariant</h2>
 * At most one primary binding at any instant. A second, overlap binding exists
 * only while an overlap-transition migration holds both connections open; the
 * primary stays authoritative for writes until the migration commits.
 *
 * <h2>Locking</h2>
 * One {@link ReentrantLock} per session serializes every mutation. Callers
 * bracket access with {@link #lock()} / {@link #unlock()}. Connection setup and
 * teardown run inside transition actions with the lock held, bounded by their
 * deadlines; exchanges and migrations do their I/O without it. The drain wait
 * releases the lock while waiting.
 *
 * <p>A separate exchange permit, taken without the session lock, keeps one
 * send/receive pair on the connection at a time so replies cannot cross
 * between concurrent callers.</p>
 */
public final class Session
{
    private final String id;
    private final Instant createdAt;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition drained = lock.newCondition();
    private final Semaphore exchangePermit = new Semaphore(1, true);

    private volatile GatewayState state = GatewayState.IDLE;
    private volatile ProtocolKind currentProtocol;
    private volatile Instant lastActivity;
    private volatile long lastActivityNanos;

    private SessionBinding pending;
    private SessionBinding primary;
    private SessionBinding overlap;
    private MigrationPlan migrationPlan;
    private int inFlight;
    private boolean acceptingWork;
    private GatewayError lastError;
    private long errorAtNanos;
    private Map<String, Object> applicationState;

    public Session(String id, ProtocolKind initialProtocol, Map<String, Object> applicationState,
                   Instant createdAt, long createdAtNanos)
    {
        this.id = Objects.requireNonNull(id, "id");
        this.currentProtocol = Objects.requireNonNull(initialProtocol, "initialProtocol");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.lastActivity = createdAt;
        this.lastActivityNanos = createdAtNanos;
        this.applicationState = copy(applicationState == null ? Map.of() : applicationState);
    }

    // -------------------------------------------------------------------------
    // Lock
    // -------------------------------------------------------------------------

    public void lock()
    {
        lock.lock();
    }

    public void unlock()
    {
        lock.unlock();
    }

    public boolean isLockedByCurrentThread()
    {
        return lock.isHeldByCurrentThread();
    }

    private void requireLock()
    {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Session " + id + " lock not held");
        }
    }

    // -------------------------------------------------------------------------
    // Identity and state (lock-free reads)
    // -------------------------------------------------------------------------

    public String id()
    {
        return id;
    }

    public GatewayState state()
    {
        return state;
    }

    /**
     * Only the state machine calls this.
     */
    public void enterState(GatewayState next)
    {
        requireLock();
        this.state = Objects.requireNonNull(next, "next");
    }

    public ProtocolKind currentProtocol()
    {
        return currentProtocol;
    }

    public Instant createdAt()
    {
        return createdAt;
    }

    public Instant lastActivity()
    {
        return lastActivity;
    }

    public long lastActivityNanos()
    {
        return lastActivityNanos;
    }

    public void touch(Instant now, long nowNanos)
    {
        this.lastActivity = now;
        this.lastActivityNanos = nowNanos;
    }

    // -------------------------------------------------------------------------
    // Bindings (lock required)
    // -------------------------------------------------------------------------

    public Optional<SessionBinding> primaryBinding()
    {
        requireLock();
        return Optional.ofNullable(primary);
    }

    public Optional<SessionBinding> overlapBinding()
    {
        requireLock();
        return Optional.ofNullable(overlap);
    }

    public Optional<SessionBinding> pendingBinding()
    {
        requireLock();
        return Optional.ofNullable(pending);
    }

    public void setPending(SessionBinding binding)
    {
        requireLock();
        this.pending = binding;
    }

    /**
     * Make {@code binding} the primary binding and start admitting work.
     */
    public void bind(SessionBinding binding)
    {
        requireLock();
        this.primary = Objects.requireNonNull(binding, "binding");
        this.currentProtocol = binding.protocol();
        if (pending == binding) {
            pending = null;
        }
        this.acceptingWork = true;
    }

    public void setOverlap(SessionBinding binding)
    {
        requireLock();
        if (binding != null && primary == null) {
            throw new IllegalStateException("Session " + id + " has no primary binding to overlap");
        }
        this.overlap = binding;
    }

    /**
     * Drop the primary binding and return it so the caller can close it.
     */
    public Optional<SessionBinding> unbind()
    {
        requireLock();
        SessionBinding previous = primary;
        primary = null;
        acceptingWork = false;
        return Optional.ofNullable(previous);
    }

    // -------------------------------------------------------------------------
    // Migration plan (lock required)
    // -------------------------------------------------------------------------

    public Optional<MigrationPlan> migrationPlan()
    {
        requireLock();
        return Optional.ofNullable(migrationPlan);
    }

    public void setMigrationPlan(MigrationPlan plan)
    {
        requireLock();
        this.migrationPlan = plan;
    }

    // -------------------------------------------------------------------------
    // Work admission and drain (lock required)
    // -------------------------------------------------------------------------

    public boolean isAcceptingWork()
    {
        requireLock();
        return acceptingWork;
    }

    public void setAcceptingWork(boolean accepting)
    {
        requireLock();
        this.acceptingWork = accepting;
    }

    /**
     * Admit one exchange on the primary binding.
     *
     * @return the binding to use, or empty if the session does not admit work
     *         right now
     */
    public Optional<SessionBinding> beginExchange()
    {
        requireLock();
        boolean live = state == GatewayState.CONNECTED || state == GatewayState.SWITCHING;
        if (!live || !acceptingWork || primary == null) {
            return Optional.empty();
        }
        inFlight++;
        return Optional.of(primary);
    }

    public void endExchange()
    {
        requireLock();
        if (inFlight > 0) {
            inFlight--;
        }
        if (inFlight == 0) {
            drained.signalAll();
        }
    }

    public int inFlight()
    {
        requireLock();
        return inFlight;
    }

    /**
     * Wait, releasing the lock, until no exchange is in flight or the timeout
     * elapses.
     *
     * @return {@code true} if drained, {@code false} on timeout
     */
    public boolean awaitDrained(long timeoutNanos) throws InterruptedException
    {
        requireLock();
        long remaining = timeoutNanos;
        while (inFlight > 0) {
            if (remaining <= 0) {
                return false;
            }
            remaining = drained.awaitNanos(remaining);
        }
        return true;
    }

    public boolean awaitDrained(long timeout, TimeUnit unit) throws InterruptedException
    {
        return awaitDrained(unit.toNanos(timeout));
    }

    // -------------------------------------------------------------------------
    // Exchange serialization (must NOT hold the session lock)
    // -------------------------------------------------------------------------

    /**
     * Claim the session's connection for one send/receive pair. Waiters are
     * served in arrival order.
     *
     * @return {@code false} if another exchange still holds it after
     *         {@code timeoutNanos}
     */
    public boolean tryAcquireExchange(long timeoutNanos) throws InterruptedException
    {
        if (lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Session lock must not be held while waiting for the exchange permit");
        }
        return exchangePermit.tryAcquire(Math.max(0L, timeoutNanos), TimeUnit.NANOSECONDS);
    }

    public void releaseExchange()
    {
        exchangePermit.release();
    }

    // -------------------------------------------------------------------------
    // Error bookkeeping (lock required)
    // -------------------------------------------------------------------------

    public void recordError(GatewayError error, long atNanos)
    {
        requireLock();
        this.lastError = error;
        this.errorAtNanos = atNanos;
    }

    public Optional<GatewayError> lastError()
    {
        requireLock();
        return Optional.ofNullable(lastError);
    }

    public long errorAtNanos()
    {
        requireLock();
        return errorAtNanos;
    }

    public void clearError()
    {
        requireLock();
        this.lastError = null;
        this.errorAtNanos = 0L;
    }

    // -------------------------------------------------------------------------
    // Application state (opaque to the gateway)
    // -------------------------------------------------------------------------

    public Map<String, Object> applicationState()
    {
        lock.lock();
        try {
            return applicationState;
        } finally {
            lock.unlock();
        }
    }

    public void putApplicationState(String key, Object value)
    {
        lock.lock();
        try {
            Map<String, Object> next = new LinkedHashMap<>(applicationState);
            next.put(key, value);
            applicationState = Collections.unmodifiableMap(next);
        } finally {
            lock.unlock();
        }
    }

    public void replaceApplicationState(Map<String, Object> state)
    {
        lock.lock();
        try {
            applicationState = copy(state);
        } finally {
            lock.unlock();
        }
    }

    private static Map<String, Object> copy(Map<String, Object> state)
    {
        return Collections.unmodifiableMap(new LinkedHashMap<>(state));
    }

    @Override
    public String toString()
    {
        return "Session{" + id + ", " + state + ", " + currentProtocol + "}";
    }
}
