package io.leanweb.server.core;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.nio.charset.Charset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One accepted request and the channel its response goes back on.
 *
 * <p>Listener adapters map their framework-specific exchange objects to this interface.
 * {@link #close()} is called exactly once by the pipeline, whichever way the request ends.
 */
public interface InboundConnection extends Closeable {

    InetSocketAddress remoteAddress();

    /**
     * Stable key identifying the client for session lookup.
     */
    String clientKey();

    /**
     * The request method as sent by the client.
     */
    String method();

    /**
     * The request target: path plus query string, as sent.
     */
    String rawUrl();

    Map<String, List<String>> headers();

    /**
     * The charset the client declared for the body, if any.
     */
    Optional<Charset> contentCharset();

    /**
     * The request body, or {@code null} if there is none.
     */
    InputStream body();

    /**
     * Local address and port the request arrived on, as {@code host:port} with IPv6 hosts in
     * brackets. Used to build redirect locations when no public address is configured. Adapters
     * must not take this from the {@code Host} header, which the client controls.
     */
    String hostAddress();

    void send(ServerResponse response) throws IOException;
}
