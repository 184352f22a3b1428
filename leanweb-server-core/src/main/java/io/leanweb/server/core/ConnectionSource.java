package io.leanweb.server.core;

import java.io.Closeable;
import java.io.IOException;

/**
 * Pull-style listener: hands out accepted connections one at a time.
 */
public interface ConnectionSource extends Closeable {

    /**
     * Blocks until the next connection arrives.
     *
     * @throws IOException if the listener failed or was closed
     * @throws InterruptedException if the waiting thread was interrupted
     */
    InboundConnection accept() throws IOException, InterruptedException;
}
