package io.leanweb.server.javalin;

import io.javalin.http.Context;
import io.leanweb.core.Headers;
import io.leanweb.core.Http;
import io.leanweb.core.HttpMethod;
import io.leanweb.server.core.InboundConnection;
import io.leanweb.server.core.ResponseBody;
import io.leanweb.server.core.ServerResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * {@link InboundConnection} over a parked Javalin {@link Context}.
 *
 * <p>The Javalin handler hands the context over and returns {@link #completion()} to
 * {@code ctx.future(...)}; Javalin commits the response once the connection is closed.
 */
final class JavalinInboundConnection implements InboundConnection {
    private final Context ctx;
    private final Map<String, List<String>> headers;
    private final CompletableFuture<Void> completion = new CompletableFuture<>();

    JavalinInboundConnection(Context ctx) {
        this.ctx = Objects.requireNonNull(ctx, "ctx");
        this.headers = copyHeaders(ctx.req());
    }

    CompletableFuture<Void> completion() {
        return completion;
    }

    @Override
    public InetSocketAddress remoteAddress() {
        HttpServletRequest req = ctx.req();
        return new InetSocketAddress(req.getRemoteAddr(), req.getRemotePort());
    }

    @Override
    public String clientKey() {
        return ctx.req().getRemoteAddr();
    }

    @Override
    public String method() {
        return ctx.req().getMethod();
    }

    @Override
    public String rawUrl() {
        HttpServletRequest req = ctx.req();
        String path = req.getRequestURI() == null || req.getRequestURI().isEmpty() ? "/" : req.getRequestURI();
        return req.getQueryString() == null ? path : path + "?" + req.getQueryString();
    }

    @Override
    public Map<String, List<String>> headers() {
        return headers;
    }

    @Override
    public Optional<Charset> contentCharset() {
        return Headers.firstValue(headers, Http.H_CONTENT_TYPE).flatMap(Headers::charset);
    }

    @Override
    public InputStream body() {
        return ctx.req().getContentLengthLong() == 0 ? null : ctx.bodyInputStream();
    }

    @Override
    public String hostAddress() {
        HttpServletRequest req = ctx.req();
        return hostPort(req.getLocalAddr(), req.getLocalPort());
    }

    @Override
    public void send(ServerResponse response) throws IOException {
        if (completion.isDone()) {
            throw new IOException("response already completed");
        }
        HttpServletResponse res = ctx.res();
        ctx.status(response.status());
        response.headers().forEach((name, values) -> {
            for (int i = 0; i < values.size(); i++) {
                if (i == 0) res.setHeader(name, values.get(i)); else res.addHeader(name, values.get(i));
            }
        });
        // a HEAD response carries the headers of the content but never the bytes
        if (response.body() instanceof ResponseBody.Bytes bytes && !isHead()) {
            ctx.result(bytes.bytes());
        }
    }

    /**
     * Answers a request that will never reach the pipeline.
     */
    void reject(int status) {
        ctx.status(status);
        completion.complete(null);
    }

    @Override
    public void close() {
        completion.complete(null);
    }

    private boolean isHead() {
        return HttpMethod.HEAD.name().equalsIgnoreCase(ctx.req().getMethod());
    }

    static String hostPort(String host, int port) {
        String h = host.indexOf(':') >= 0 && !host.startsWith("[") ? "[" + host + "]" : host;
        return h + ":" + port;
    }

    private static Map<String, List<String>> copyHeaders(HttpServletRequest req) {
        Map<String, List<String>> out = new LinkedHashMap<>();
        for (String name : Collections.list(req.getHeaderNames())) {
            out.put(name, new ArrayList<>(Collections.list(req.getHeaders(name))));
        }
        return Collections.unmodifiableMap(out);
    }
}
