package com.questrail.chatwire.session;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * PeerRegistry
 * =============================================================================
 * Identifier to session map owned by one server.
 *
 * <h2>Locking</h2>
 * A single monitor guards the map. It is held only for map operations and
 * session construction; never across socket I/O or collaborator callbacks.
 * Readers get snapshots.
 *
 * @param <S> session type
 */
public final class PeerRegistry<S extends AbstractSession>
{
    private final Object lock = new Object();
    private final Map<String, S> sessions = new LinkedHashMap<>();

    /**
     * @return {@code false} if a session with the same identifier is already present
     */
    public boolean register(S session)
    {
        Objects.requireNonNull(session, "session");
        synchronized (lock) {
            return sessions.putIfAbsent(session.identifier(), session) == null;
        }
    }

    /**
     * Returns the session for {@code identifier}, creating and registering one
     * when absent. {@code factory} runs under the registry lock and must not
     * block.
     */
    public S lookupOrCreate(String identifier, Function<String, S> factory)
    {
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(factory, "factory");
        synchronized (lock) {
            return sessions.computeIfAbsent(identifier, factory);
        }
    }

    public Optional<S> find(String identifier)
    {
        synchronized (lock) {
            return Optional.ofNullable(sessions.get(identifier));
        }
    }

    /**
     * Removes {@code session} if it is still the one registered under its
     * identifier.
     */
    public boolean remove(AbstractSession session)
    {
        Objects.requireNonNull(session, "session");
        synchronized (lock) {
            return sessions.remove(session.identifier(), session);
        }
    }

    public List<S> snapshot()
    {
        synchronized (lock) {
            return new ArrayList<>(sessions.values());
        }
    }

    public int size()
    {
        synchronized (lock) {
            return sessions.size();
        }
    }
}
