package io.leanweb.server.core;

import io.leanweb.server.spi.Session;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class InMemorySessionStoreTest {

    private final ManualClock clock = ManualClock.startingAt("2025-01-01T00:00:00Z");
    private final InMemorySessionStore store = new InMemorySessionStore(clock);

    @Test
    void resolveCreatesOnceAndReturnsSameSession() {
        Session first = store.resolve("10.0.0.1");
        Session again = store.resolve("10.0.0.1");
        Session other = store.resolve("10.0.0.2");

        assertThat(again).isSameAs(first);
        assertThat(other).isNotSameAs(first);
        assertThat(store.size()).isEqualTo(2);
        assertThat(first.createdAt()).isEqualTo(clock.instant());
    }

    @Test
    void concurrentResolveForSameKeyCreatesOneSession() throws Exception {
        int callers = 32;
        ExecutorService pool = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Session>> results = new ArrayList<>();
            for (int i = 0; i < callers; i++) {
                Callable<Session> call = () -> {
                    start.await();
                    return store.resolve("proxy");
                };
                results.add(pool.submit(call));
            }
            start.countDown();

            Set<Session> distinct = ConcurrentHashMap.newKeySet();
            for (Future<Session> f : results) {
                distinct.add(f.get(5, TimeUnit.SECONDS));
            }
            assertThat(distinct).hasSize(1);
            assertThat(store.size()).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void expiresOnlyAfterTtlElapsesSinceLastTouch() {
        Duration ttl = Duration.ofSeconds(60);
        Session session = store.resolve("10.0.0.1");
        store.touch(session);
        assertThat(store.isExpired(session, ttl)).isFalse();

        clock.advance(Duration.ofSeconds(60));
        assertThat(store.isExpired(session, ttl)).isFalse();

        clock.advance(Duration.ofMillis(1));
        assertThat(store.isExpired(session, ttl)).isTrue();

        store.touch(session);
        assertThat(store.isExpired(session, ttl)).isFalse();
    }

    @Test
    void resolveDoesNotReplaceExpiredSession() {
        Session session = store.resolve("10.0.0.1");
        clock.advance(Duration.ofMinutes(5));

        assertThat(store.resolve("10.0.0.1")).isSameAs(session);
        assertThat(store.isExpired(session, Duration.ofSeconds(60))).isTrue();
    }

    @Test
    void evictIdleRemovesOnlyStaleSessions() {
        Session stale = store.resolve("10.0.0.1");
        clock.advance(Duration.ofMinutes(9));
        Session fresh = store.resolve("10.0.0.2");
        clock.advance(Duration.ofMinutes(2));

        int removed = store.evictIdle(Duration.ofMinutes(10));

        assertThat(removed).isEqualTo(1);
        assertThat(store.find(stale.clientKey())).isEmpty();
        assertThat(store.find(fresh.clientKey())).containsSame(fresh);
        assertThat(store.resolve(stale.clientKey())).isNotSameAs(stale);
    }

    @Test
    void removeDropsSession() {
        store.resolve("10.0.0.1");
        assertThat(store.remove("10.0.0.1")).isTrue();
        assertThat(store.remove("10.0.0.1")).isFalse();
        assertThat(store.size()).isZero();
    }
}
