package io.leanweb.server.spi;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Per-client state keyed by the client's network identity.
 *
 * <p>Values are string-keyed and string-valued; the only value the server itself uses is the
 * anti-forgery token. Instances are shared by concurrent requests from the same client, so all
 * mutable state is thread-safe, but no ordering between such requests is guaranteed.
 */
public final class Session {
    private final String clientKey;
    private final Instant createdAt;
    private volatile Instant lastActivity;
    private final Map<String, String> values = new ConcurrentHashMap<>();

    public Session(String clientKey, Instant createdAt) {
        this.clientKey = Objects.requireNonNull(clientKey, "clientKey");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt");
        this.lastActivity = createdAt;
    }

    public String clientKey() {
        return clientKey;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant lastActivity() {
        return lastActivity;
    }

    /**
     * Records activity at the given instant. Called by the {@link SessionStore}.
     */
    public void markActivity(Instant now) {
        this.lastActivity = Objects.requireNonNull(now, "now");
    }

    public Optional<String> value(String name) {
        Objects.requireNonNull(name, "name");
        return Optional.ofNullable(values.get(name));
    }

    /**
     * Stores a value; a {@code null} value removes the entry.
     */
    public void put(String name, String value) {
        Objects.requireNonNull(name, "name");
        if (value == null) {
            values.remove(name);
        } else {
            values.put(name, value);
        }
    }

    /**
     * Stores a value unless one is already present, and returns the value now stored.
     */
    public String putIfAbsent(String name, String value) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(value, "value");
        String existing = values.putIfAbsent(name, value);
        return existing != null ? existing : value;
    }

    public Optional<String> remove(String name) {
        Objects.requireNonNull(name, "name");
        return Optional.ofNullable(values.remove(name));
    }

    public Map<String, String> values() {
        return Collections.unmodifiableMap(values);
    }

    @Override
    public String toString() {
        return "Session[" + clientKey + ", created " + createdAt + ", last activity " + lastActivity + "]";
    }
}
