package io.leanweb.server.core;

import io.leanweb.server.spi.Session;
import io.leanweb.server.spi.SessionStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link SessionStore} using {@link ConcurrentHashMap}.
 *
 * <p>Sessions do not survive a restart. Creation goes through
 * {@link ConcurrentHashMap#computeIfAbsent}, so concurrent first requests from one client share a
 * single session.
 */
public final class InMemorySessionStore implements SessionStore {

    private final ConcurrentHashMap<String, Session> sessions = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemorySessionStore() {
        this(Clock.systemUTC());
    }

    public InMemorySessionStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public Session resolve(String clientKey) {
        Objects.requireNonNull(clientKey, "clientKey");
        return sessions.computeIfAbsent(clientKey, k -> new Session(k, clock.instant()));
    }

    @Override
    public Optional<Session> find(String clientKey) {
        Objects.requireNonNull(clientKey, "clientKey");
        return Optional.ofNullable(sessions.get(clientKey));
    }

    @Override
    public void touch(Session session) {
        Objects.requireNonNull(session, "session");
        session.markActivity(clock.instant());
    }

    @Override
    public boolean isExpired(Session session, Duration ttl) {
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(ttl, "ttl");
        return Duration.between(session.lastActivity(), clock.instant()).compareTo(ttl) > 0;
    }

    @Override
    public boolean remove(String clientKey) {
        Objects.requireNonNull(clientKey, "clientKey");
        return sessions.remove(clientKey) != null;
    }

    @Override
    public int evictIdle(Duration idle) {
        Objects.requireNonNull(idle, "idle");
        Instant cutoff = clock.instant().minus(idle);
        int removed = 0;
        for (Session session : sessions.values()) {
            // remove(key, value) leaves a session alone if it was replaced meanwhile
            if (session.lastActivity().isBefore(cutoff) && sessions.remove(session.clientKey(), session)) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public int size() {
        return sessions.size();
    }
}
