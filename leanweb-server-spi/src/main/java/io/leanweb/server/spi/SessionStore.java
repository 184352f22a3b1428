package io.leanweb.server.spi;

import java.time.Duration;
import java.util.Optional;

/**
 * Owns the live sessions, keyed by client key.
 *
 * <p>Implementations must be safe for concurrent use. {@link #resolve(String)} is atomic per key:
 * callers racing on the same key all receive the same {@link Session}.
 *
 * <p>Expiration is advisory. The store never rejects a request; a {@link Dispatcher} that serves
 * pages requiring a live session checks {@link #isExpired(Session, Duration)} and answers with
 * {@link io.leanweb.core.ErrorKind#EXPIRED_SESSION}.
 */
public interface SessionStore {

    /**
     * Returns the session for the client key, creating and storing one on first contact.
     */
    Session resolve(String clientKey);

    Optional<Session> find(String clientKey);

    /**
     * Sets the session's last activity to now.
     */
    void touch(Session session);

    /**
     * Returns {@code true} when more than {@code ttl} has elapsed since the last activity.
     */
    boolean isExpired(Session session, Duration ttl);

    boolean remove(String clientKey);

    /**
     * Removes every session idle for longer than {@code idle}.
     *
     * @return the number of sessions removed
     */
    int evictIdle(Duration idle);

    int size();
}
