package io.leanweb.server.spi;

import io.leanweb.core.HttpMethod;

import java.util.Map;

/**
 * Routing SPI: maps a decoded request to a {@link ResponseDescriptor}.
 *
 * <p>Route tables, static files and markup generation live behind this interface. Any exception
 * thrown by {@link #route} is logged by the server and answered with the redirect configured for
 * {@link io.leanweb.core.ErrorKind#SERVER_ERROR}.
 */
@FunctionalInterface
public interface Dispatcher {

    /**
     * @param session the caller's session, in the state it had before this request
     * @param method the request method
     * @param path the request URL up to the first {@code ?}
     * @param parameters query string and body parameters, body values taking precedence
     * @return the response to send, never {@code null}
     */
    ResponseDescriptor route(Session session, HttpMethod method, String path, Map<String, String> parameters);
}
