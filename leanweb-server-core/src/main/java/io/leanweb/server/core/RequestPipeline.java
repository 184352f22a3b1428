package io.leanweb.server.core;

import io.leanweb.core.ErrorKind;
import io.leanweb.core.Headers;
import io.leanweb.server.spi.Dispatcher;
import io.leanweb.server.spi.ErrorRedirects;
import io.leanweb.server.spi.ResponseDescriptor;
import io.leanweb.server.spi.Session;
import io.leanweb.server.spi.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;

/**
 * Serves one accepted connection: parse, resolve the session, dispatch, translate errors into
 * redirects, post-process HTML, write, close.
 *
 * <p>Nothing thrown while parsing or dispatching reaches the caller. Such failures are logged and
 * the client is redirected to the path configured for {@link ErrorKind#SERVER_ERROR}.
 */
public final class RequestPipeline {
    private static final Logger LOG = LoggerFactory.getLogger(RequestPipeline.class);

    static final String FALLBACK_REDIRECT = "/";

    private final ServerConfig config;
    private final SessionStore sessions;
    private final Dispatcher dispatcher;
    private final ResponseWriter writer;

    public RequestPipeline(ServerConfig config, SessionStore sessions, Dispatcher dispatcher) {
        this.config = Objects.requireNonNull(config, "config");
        this.sessions = Objects.requireNonNull(sessions, "sessions");
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.writer = new ResponseWriter(config.publicAddress());
    }

    public void handle(InboundConnection connection) {
        Objects.requireNonNull(connection, "connection");
        try (connection) {
            LOG.info("{} {} {}", connection.remoteAddress(), connection.method(), connection.rawUrl());
            ResponseDescriptor response = process(connection);
            writer.write(connection, response);
        } catch (IOException e) {
            LOG.warn("Could not complete response to {}", connection.remoteAddress(), e);
        } catch (RuntimeException e) {
            LOG.error("Response to {} failed", connection.remoteAddress(), e);
        }
    }

    ResponseDescriptor process(InboundConnection connection) {
        try {
            RequestContext request = RequestContext.parse(connection, config.defaultCharset(), config.maxBodySize());
            logParameters(request.parameters());

            Session session = sessions.resolve(connection.clientKey());
            observe(session, connection);

            ResponseDescriptor routed = dispatcher.route(session, request.method(), request.path(), request.parameters());
            Objects.requireNonNull(routed, "dispatcher returned no response");

            // after dispatch, so expiry checks made while routing see the previous activity
            sessions.touch(session);

            if (routed.error().isError()) {
                return ResponseDescriptor.redirect(redirectFor(routed.error()));
            }
            return postProcess(session, routed);
        } catch (Exception e) {
            LOG.error("Request {} {} from {} failed", connection.method(), connection.rawUrl(), connection.remoteAddress(), e);
            return ResponseDescriptor.redirect(redirectFor(ErrorKind.SERVER_ERROR));
        }
    }

    private ResponseDescriptor postProcess(Session session, ResponseDescriptor response) {
        if (!(response instanceof ResponseDescriptor.Content content) || !Headers.isHtml(content.contentType())) {
            return response;
        }
        Charset charset = content.encoding() != null
                ? content.encoding()
                : Headers.charset(content.contentType()).orElse(StandardCharsets.UTF_8);
        String html = new String(content.data(), charset);
        String processed = config.postProcessor().process(session, html);
        if (processed == null || processed.equals(html)) {
            return response;
        }
        return ResponseDescriptor.content(processed.getBytes(charset), content.contentType(), content.encoding());
    }

    private void observe(Session session, InboundConnection connection) {
        try {
            config.requestObserver().observed(session, connection);
        } catch (RuntimeException e) {
            LOG.warn("Request observer failed for {}", connection.remoteAddress(), e);
        }
    }

    private String redirectFor(ErrorKind error) {
        ErrorRedirects redirects = config.errorRedirects();
        try {
            String target = redirects.redirectFor(error);
            if (target != null) return target;
            LOG.warn("No redirect configured for {}, using {}", error, FALLBACK_REDIRECT);
        } catch (RuntimeException e) {
            LOG.error("Error redirect mapping failed for {}, using {}", error, FALLBACK_REDIRECT, e);
        }
        return FALLBACK_REDIRECT;
    }

    private static void logParameters(Map<String, String> parameters) {
        if (!LOG.isDebugEnabled()) return;
        parameters.forEach((key, value) -> LOG.debug("{} : {}", key, value));
    }
}
