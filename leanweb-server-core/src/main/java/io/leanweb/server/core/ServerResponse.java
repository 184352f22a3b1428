package io.leanweb.server.core;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Status line, headers and body exactly as they go on the wire.
 *
 * <p>Listener adapters copy instances of this class onto their framework-specific response
 * objects.
 */
public final class ServerResponse {
    private final int status;
    private final Map<String, List<String>> headers = new LinkedHashMap<>();
    private final ResponseBody body;

    public ServerResponse(int status, ResponseBody body) {
        this.status = status;
        this.body = Objects.requireNonNull(body, "body");
    }

    public int status() {
        return status;
    }

    public Map<String, List<String>> headers() {
        return headers;
    }

    public ResponseBody body() {
        return body;
    }

    /**
     * Adds a header to the response.
     *
     * @return this response (for chaining)
     */
    public ServerResponse header(String name, String value) {
        headers.computeIfAbsent(name, k -> new ArrayList<>()).add(value);
        return this;
    }

    public Optional<String> firstHeader(String name) {
        List<String> values = headers.get(name);
        if (values == null || values.isEmpty()) return Optional.empty();
        return Optional.of(values.get(0));
    }
}
