package io.leanweb.server.core;

import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Counting-permit gate in front of the listener.
 *
 * <p>At most {@link #capacity()} callers hold a permit at any time. The capacity is fixed at
 * construction. Every {@link #release()} must pair with an earlier {@link #acquire()}; an unpaired
 * release fails instead of growing the pool.
 */
public final class ConnectionAdmission {

    private final int capacity;
    private final Semaphore permits;
    private final AtomicInteger held = new AtomicInteger();

    public ConnectionAdmission(int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be positive");
        this.capacity = capacity;
        this.permits = new Semaphore(capacity, true);
    }

    /**
     * Blocks until a permit is available.
     */
    public void acquire() throws InterruptedException {
        permits.acquire();
        held.incrementAndGet();
    }

    public void release() {
        if (held.getAndUpdate(n -> n > 0 ? n - 1 : n) <= 0) {
            throw new IllegalStateException("release without a matching acquire");
        }
        permits.release();
    }

    public int capacity() {
        return capacity;
    }

    public int available() {
        return permits.availablePermits();
    }

    /**
     * Number of permits currently held.
     */
    public int inUse() {
        return held.get();
    }
}
