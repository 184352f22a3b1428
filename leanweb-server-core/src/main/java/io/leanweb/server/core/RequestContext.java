package io.leanweb.server.core;

import io.leanweb.core.HttpMethod;
import io.leanweb.server.spi.BodySizeLimiter;

import java.io.IOException;
import java.nio.charset.Charset;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A request decomposed into method, path and one merged parameter map.
 *
 * <p>Query string parameters are inserted first and body parameters second, so a body value
 * replaces a query value of the same name.
 */
public final class RequestContext {
    private final HttpMethod method;
    private final String path;
    private final Map<String, String> parameters;

    public RequestContext(HttpMethod method, String path, Map<String, String> parameters) {
        this.method = Objects.requireNonNull(method, "method");
        this.path = Objects.requireNonNull(path, "path");
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }

    /**
     * Reads and decodes a connection's request line and body.
     *
     * @param defaultCharset used when the client declared no body charset
     * @param maxBodySize body limit in bytes, zero or less for none
     */
    public static RequestContext parse(InboundConnection connection, Charset defaultCharset, long maxBodySize)
            throws IOException {
        HttpMethod method = HttpMethod.parse(connection.method());
        String rawUrl = connection.rawUrl() == null ? "" : connection.rawUrl();
        int q = rawUrl.indexOf('?');
        String path = q < 0 ? rawUrl : rawUrl.substring(0, q);
        String query = q < 0 ? "" : rawUrl.substring(q + 1);

        Map<String, String> parameters = ParameterCodec.decode(query);
        byte[] body = BodySizeLimiter.readBody(connection.body(), maxBodySize);
        if (body.length > 0) {
            Charset charset = connection.contentCharset().orElse(defaultCharset);
            ParameterCodec.decode(new String(body, charset), parameters);
        }
        return new RequestContext(method, path, parameters);
    }

    public HttpMethod method() {
        return method;
    }

    public String path() {
        return path;
    }

    public Map<String, String> parameters() {
        return parameters;
    }
}
