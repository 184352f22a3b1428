package io.leanweb.server.core;

import io.leanweb.core.LeanWebException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The process-wide accept cycle.
 *
 * <p>Each turn takes an admission permit and starts a worker that waits for the next connection.
 * The worker gives the permit back as soon as {@link ConnectionSource#accept()} returns, then
 * serves the request through the {@link RequestPipeline}. The permit therefore bounds how many
 * workers wait for a connection at once, not how many requests are in flight.
 *
 * <p>An I/O failure of the listener ends the loop: {@link #serve()} throws
 * {@link LeanWebException.ListenerFailure}. Failures after {@link #stop()} end it quietly.
 */
public final class AcceptLoop {
    private static final Logger LOG = LoggerFactory.getLogger(AcceptLoop.class);

    private final ConnectionAdmission admission;
    private final ConnectionSource source;
    private final RequestPipeline pipeline;
    private final ExecutorService workers;
    private final AtomicReference<Throwable> failure = new AtomicReference<>();
    private final Object threadLock = new Object();
    private volatile boolean stopped;
    private Thread loopThread;
    private boolean interruptSent;

    public AcceptLoop(ConnectionAdmission admission, ConnectionSource source, RequestPipeline pipeline, ExecutorService workers) {
        this.admission = Objects.requireNonNull(admission, "admission");
        this.source = Objects.requireNonNull(source, "source");
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.workers = Objects.requireNonNull(workers, "workers");
    }

    /**
     * Runs the loop on the calling thread until {@link #stop()} or a listener failure.
     *
     * @throws LeanWebException.ListenerFailure if the listener failed
     */
    public void serve() {
        synchronized (threadLock) {
            loopThread = Thread.currentThread();
        }
        try {
            while (!stopped) {
                try {
                    admission.acquire();
                } catch (InterruptedException e) {
                    if (!stopped) {
                        // interrupted by a failing worker or by the owner of the thread
                        stopped = true;
                        if (failure.get() == null) Thread.currentThread().interrupt();
                    }
                    break;
                }
                if (stopped) {
                    admission.release();
                    break;
                }
                try {
                    workers.execute(this::acceptNext);
                } catch (RejectedExecutionException e) {
                    admission.release();
                    if (!stopped) {
                        failure.compareAndSet(null, e);
                        stopped = true;
                    }
                }
            }
        } finally {
            synchronized (threadLock) {
                loopThread = null;
                // an interrupt from stop() that landed outside acquire() must not leak to the caller
                if (interruptSent) Thread.interrupted();
            }
        }
        Throwable cause = failure.get();
        if (cause != null) {
            throw new LeanWebException.ListenerFailure("listener failed: " + cause.getMessage(), cause);
        }
    }

    /**
     * Asks the loop to end. Workers already waiting in accept end when the source is closed.
     */
    public void stop() {
        stopped = true;
        synchronized (threadLock) {
            if (loopThread != null) {
                interruptSent = true;
                loopThread.interrupt();
            }
        }
    }

    public boolean isStopped() {
        return stopped;
    }

    private void acceptNext() {
        InboundConnection connection;
        try {
            connection = source.accept();
        } catch (IOException e) {
            fail(e);
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return;
        } catch (RuntimeException e) {
            fail(e);
            return;
        } finally {
            admission.release();
        }
        pipeline.handle(connection);
    }

    private void fail(Throwable cause) {
        if (stopped) {
            LOG.debug("Accept ended after stop: {}", cause.toString());
            return;
        }
        if (failure.compareAndSet(null, cause)) {
            LOG.error("Listener failed, stopping accept loop", cause);
            stop();
        }
    }
}
