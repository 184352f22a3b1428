package io.leanweb.server.javalin;

import io.leanweb.server.core.AcceptLoop;
import io.leanweb.server.core.ConnectionAdmission;
import io.leanweb.server.core.InMemorySessionStore;
import io.leanweb.server.core.RequestPipeline;
import io.leanweb.server.core.ServerConfig;
import io.leanweb.server.spi.Dispatcher;
import io.leanweb.server.spi.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A running server: Javalin listeners, accept loop, request workers and session sweeper.
 *
 * <pre>{@code
 * ServerConfig config = ServerConfig.builder(error -> "/error").port(8080).build();
 * try (LeanWebServer server = LeanWebServer.start(config, dispatcher)) {
 *     server.termination().join();
 * }
 * }</pre>
 */
public final class LeanWebServer implements AutoCloseable {
    private static final Logger LOG = LoggerFactory.getLogger(LeanWebServer.class);

    private static final Duration MAX_SWEEP_INTERVAL = Duration.ofMinutes(1);
    private static final long STOP_WAIT_MILLIS = 5000;

    private final ServerConfig config;
    private final SessionStore sessions;
    private final JavalinConnectionSource source;
    private final AcceptLoop loop;
    private final ExecutorService workers;
    private final ScheduledExecutorService sweeper;
    private final Thread acceptThread;
    private final CompletableFuture<Void> termination = new CompletableFuture<>();
    private final AtomicBoolean closed = new AtomicBoolean();

    private LeanWebServer(ServerConfig config, SessionStore sessions, JavalinConnectionSource source, Dispatcher dispatcher) {
        this.config = config;
        this.sessions = sessions;
        this.source = source;
        this.workers = Executors.newCachedThreadPool(daemonThreads("leanweb-worker-"));
        this.loop = new AcceptLoop(
                new ConnectionAdmission(config.maxSimultaneousConnections()),
                source,
                new RequestPipeline(config, sessions, dispatcher),
                workers);
        this.sweeper = config.sessionEviction().isZero() ? null
                : Executors.newSingleThreadScheduledExecutor(daemonThreads("leanweb-session-sweeper-"));
        this.acceptThread = new Thread(this::runLoop, "leanweb-accept");
    }

    public static LeanWebServer start(ServerConfig config, Dispatcher dispatcher) throws IOException {
        Objects.requireNonNull(config, "config");
        return start(config, dispatcher, new InMemorySessionStore(config.clock()));
    }

    /**
     * Binds the listener and starts accepting connections.
     *
     * @throws IOException if an address cannot be bound
     */
    public static LeanWebServer start(ServerConfig config, Dispatcher dispatcher, SessionStore sessions) throws IOException {
        Objects.requireNonNull(config, "config");
        Objects.requireNonNull(dispatcher, "dispatcher");
        Objects.requireNonNull(sessions, "sessions");

        LOG.info("Public address: {}", config.publicAddress().isEmpty() ? "<local address of each request>" : config.publicAddress());
        List<InetAddress> addresses = LocalAddresses.bindAddresses(config.bindLocalInterfaces());
        JavalinConnectionSource source = JavalinConnectionSource.bind(addresses, config.port());
        for (InetSocketAddress bound : source.addresses()) {
            LOG.info("Listening on http://{}:{}/", bound.getAddress().getHostAddress(), bound.getPort());
        }

        LeanWebServer server = new LeanWebServer(config, sessions, source, dispatcher);
        server.startSweeper();
        server.acceptThread.start();
        return server;
    }

    public ServerConfig config() {
        return config;
    }

    public SessionStore sessions() {
        return sessions;
    }

    public List<InetSocketAddress> addresses() {
        return source.addresses();
    }

    /**
     * Completes when the accept loop ends; completes exceptionally with
     * {@link io.leanweb.core.LeanWebException.ListenerFailure} if the listener failed.
     */
    public CompletableFuture<Void> termination() {
        return termination;
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        loop.stop();
        source.close();
        workers.shutdown();
        if (sweeper != null) sweeper.shutdownNow();
        try {
            acceptThread.join(STOP_WAIT_MILLIS);
            if (!workers.awaitTermination(STOP_WAIT_MILLIS, TimeUnit.MILLISECONDS)) {
                LOG.warn("Request workers still running after {} ms", STOP_WAIT_MILLIS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        LOG.info("Server stopped");
    }

    private void runLoop() {
        try {
            loop.serve();
            termination.complete(null);
        } catch (RuntimeException e) {
            LOG.error("Accept loop terminated", e);
            source.close();
            termination.completeExceptionally(e);
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return task -> {
            Thread t = new Thread(task, prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private void startSweeper() {
        if (sweeper == null) return;
        Duration eviction = config.sessionEviction();
        long interval = Math.max(1, Math.min(eviction.toMillis(), MAX_SWEEP_INTERVAL.toMillis()));
        sweeper.scheduleAtFixedRate(() -> {
            try {
                int removed = sessions.evictIdle(eviction);
                if (removed > 0) {
                    LOG.debug("Evicted {} idle sessions, {} remain", removed, sessions.size());
                }
            } catch (RuntimeException e) {
                LOG.warn("Session sweep failed", e);
            }
        }, interval, interval, TimeUnit.MILLISECONDS);
    }
}
