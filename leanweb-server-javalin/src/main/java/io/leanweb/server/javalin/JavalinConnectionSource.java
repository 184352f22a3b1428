package io.leanweb.server.javalin;

import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.http.HandlerType;
import io.javalin.http.HttpStatus;
import io.leanweb.server.core.ConnectionSource;
import io.leanweb.server.core.InboundConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.nio.channels.ClosedChannelException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * {@link ConnectionSource} backed by one {@link Javalin} instance per bound address.
 *
 * <p>Every instance parks its requests with {@code ctx.future(...)} and hands them to a shared
 * queue; {@link #accept()} takes them off in arrival order. A request stays parked until the
 * pipeline closes its connection.
 */
public final class JavalinConnectionSource implements ConnectionSource {
    private static final Logger LOG = LoggerFactory.getLogger(JavalinConnectionSource.class);

    private static final long POLL_MILLIS = 200;
    private static final List<HandlerType> ROUTED = List.of(
            HandlerType.GET, HandlerType.HEAD, HandlerType.POST, HandlerType.PUT,
            HandlerType.DELETE, HandlerType.PATCH, HandlerType.OPTIONS);

    private final List<Bound> apps = new ArrayList<>();
    private final BlockingQueue<JavalinInboundConnection> pending = new LinkedBlockingQueue<>();
    private volatile boolean closed;

    private JavalinConnectionSource() {
    }

    /**
     * Starts a Javalin instance on each address.
     *
     * @throws IOException if any address cannot be bound; instances already started are stopped
     */
    public static JavalinConnectionSource bind(List<InetAddress> addresses, int port) throws IOException {
        Objects.requireNonNull(addresses, "addresses");
        if (addresses.isEmpty()) throw new IllegalArgumentException("no addresses to bind");
        JavalinConnectionSource source = new JavalinConnectionSource();
        for (InetAddress address : addresses) {
            Javalin app = Javalin.create(config -> {
                config.showJavalinBanner = false;
                config.http.disableCompression();
            });
            source.route(app);
            try {
                app.start(address.getHostAddress(), port);
            } catch (RuntimeException e) {
                source.close();
                throw new IOException("cannot listen on " + address.getHostAddress() + ":" + port, e);
            }
            source.apps.add(new Bound(app, address));
        }
        return source;
    }

    public List<InetSocketAddress> addresses() {
        List<InetSocketAddress> out = new ArrayList<>(apps.size());
        for (Bound bound : apps) {
            out.add(new InetSocketAddress(bound.address, bound.app.port()));
        }
        return Collections.unmodifiableList(out);
    }

    @Override
    public InboundConnection accept() throws IOException, InterruptedException {
        while (true) {
            if (closed) throw new ClosedChannelException();
            JavalinInboundConnection next = pending.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
            if (next != null) {
                return next;
            }
        }
    }

    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        JavalinInboundConnection orphan;
        while ((orphan = pending.poll()) != null) {
            orphan.reject(HttpStatus.SERVICE_UNAVAILABLE.getCode());
        }
        for (Bound bound : apps) {
            bound.app.stop();
        }
    }

    private void route(Javalin app) {
        for (HandlerType type : ROUTED) {
            app.addHttpHandler(type, "/", this::enqueue);
            app.addHttpHandler(type, "/*", this::enqueue);
        }
    }

    private void enqueue(Context ctx) {
        JavalinInboundConnection connection = new JavalinInboundConnection(ctx);
        ctx.future(connection::completion);
        if (closed) {
            LOG.debug("Rejecting request from {} after close", ctx.req().getRemoteAddr());
            connection.reject(HttpStatus.SERVICE_UNAVAILABLE.getCode());
            return;
        }
        pending.add(connection);
    }

    private static final class Bound {
        private final Javalin app;
        private final InetAddress address;

        private Bound(Javalin app, InetAddress address) {
            this.app = app;
            this.address = address;
        }
    }
}
