package com.questrail.gateway.session;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;

/**
 * Live sessions by id. One instance per gateway, passed explicitly to every
 * component that needs it.
 */
public final class SessionRegistry
{
    private final ConcurrentMap<String, Session> sessions = new ConcurrentHashMap<>();

    /**
     * Register a new session built by {@code factory}, unless one with the same
     * id is already registered.
     *
     * @return the newly registered session, or empty if the id is taken
     */
    public Optional<Session> createIfAbsent(String id, Function<String, Session> factory)
    {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(factory, "factory");

        Session[] created = new Session[1];
        sessions.computeIfAbsent(id, k -> created[0] = factory.apply(k));
        return Optional.ofNullable(created[0]);
    }

    public Optional<Session> find(String id)
    {
        return Optional.ofNullable(sessions.get(id));
    }

    /**
     * Remove {@code session} if it is still the one registered under its id.
     */
    public boolean remove(Session session)
    {
        return sessions.remove(session.id(), session);
    }

    public List<Session> all()
    {
        return List.copyOf(sessions.values());
    }

    public int size()
    {
        return sessions.size();
    }
}
