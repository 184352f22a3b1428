package io.leanweb.server.spi;

/**
 * Rewrites outgoing HTML before it is written to the client.
 */
@FunctionalInterface
public interface PostProcessor {

    String process(Session session, String html);

    /**
     * Returns HTML unchanged.
     */
    static PostProcessor identity() {
        return (session, html) -> html;
    }
}
