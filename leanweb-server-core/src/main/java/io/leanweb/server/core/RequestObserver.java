package io.leanweb.server.core;

import io.leanweb.server.spi.Session;

/**
 * Best-effort hook invoked once per request after the session is resolved.
 *
 * <p>Exceptions thrown by an observer are logged and otherwise ignored.
 */
@FunctionalInterface
public interface RequestObserver {

    void observed(Session session, InboundConnection connection);

    static RequestObserver none() {
        return (session, connection) -> { };
    }
}
