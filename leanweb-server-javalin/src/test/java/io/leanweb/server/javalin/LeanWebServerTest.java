package io.leanweb.server.javalin;

import io.leanweb.core.ErrorKind;
import io.leanweb.core.HttpMethod;
import io.leanweb.server.core.CsrfTokens;
import io.leanweb.server.core.ServerConfig;
import io.leanweb.server.spi.Dispatcher;
import io.leanweb.server.spi.ResponseDescriptor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class LeanWebServerTest {

    private static final Dispatcher ROUTES = (session, method, path, params) -> {
        switch (path) {
            case "/go":
                return ResponseDescriptor.redirect("/landing");
            case "/form":
                return ResponseDescriptor.html("<form><%AntiForgeryToken%></form>");
            case "/submit":
                return CsrfTokens.matches(session, params, "__CSRFToken__")
                        ? ResponseDescriptor.redirect("/done")
                        : ResponseDescriptor.failure(ErrorKind.VALIDATION_ERROR);
            case "/crash":
                throw new IllegalStateException("boom");
            default:
                return ResponseDescriptor.failure(ErrorKind.PAGE_NOT_FOUND);
        }
    };

    private final HttpClient client = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .followRedirects(HttpClient.Redirect.NEVER)
            .connectTimeout(Duration.ofSeconds(5))
            .build();

    private LeanWebServer server;

    @AfterEach
    void tearDown() {
        if (server != null) server.close();
    }

    @Test
    void redirectUsesRequestHostWithoutPublicAddress() throws Exception {
        server = LeanWebServer.start(config().build(), ROUTES);

        HttpResponse<String> response = get("/go");

        assertThat(response.statusCode()).isEqualTo(302);
        assertThat(response.headers().firstValue("Location")).contains(base() + "/landing");
    }

    @Test
    void redirectIgnoresClientSuppliedHost() throws Exception {
        server = LeanWebServer.start(config().build(), ROUTES);
        InetSocketAddress bound = server.addresses().get(0);

        String raw;
        try (Socket socket = new Socket(bound.getAddress(), bound.getPort())) {
            socket.setSoTimeout(5000);
            OutputStream out = socket.getOutputStream();
            out.write(("GET /go HTTP/1.1\r\nHost: evil.example\r\nConnection: close\r\n\r\n")
                    .getBytes(StandardCharsets.US_ASCII));
            out.flush();
            raw = new String(socket.getInputStream().readAllBytes(), StandardCharsets.ISO_8859_1);
        }

        assertThat(raw).startsWith("HTTP/1.1 302");
        assertThat(raw.lines().filter(line -> line.regionMatches(true, 0, "Location:", 0, 9)))
                .singleElement()
                .satisfies(line -> assertThat(line.substring(9).trim()).isEqualTo(base() + "/landing"));
        assertThat(raw).doesNotContain("evil.example");
    }

    @Test
    void headResponseHasHeadersButNoBody() throws Exception {
        server = LeanWebServer.start(config().build(), ROUTES);

        HttpResponse<String> response = client.send(
                HttpRequest.newBuilder(URI.create(base() + "/form"))
                        .method("HEAD", HttpRequest.BodyPublishers.noBody())
                        .build(),
                HttpResponse.BodyHandlers.ofString());

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.headers().firstValue("Content-Type")).isPresent();
        assertThat(response.body()).isEmpty();
    }

    @Test
    void redirectUsesPublicAddressWhenConfigured() throws Exception {
        server = LeanWebServer.start(config().publicAddress("1.2.3.4").build(), ROUTES);

        HttpResponse<String> response = get("/go");

        assertThat(response.headers().firstValue("Location")).contains("http://1.2.3.4/landing");
    }

    @Test
    void htmlContentCarriesTokenAndHeaders() throws Exception {
        server = LeanWebServer.start(config().build(), ROUTES);

        HttpResponse<String> response = get("/form");

        String token = server.sessions().find("127.0.0.1").orElseThrow().value("__CSRFToken__").orElseThrow();
        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.headers().firstValue("Content-Type"))
                .hasValueSatisfying(type -> assertThat(type.replace(" ", "")).isEqualToIgnoringCase("text/html;charset=utf-8"));
        assertThat(response.body())
                .isEqualTo("<form><input name='__CSRFToken__' type='hidden' value='" + token + "' id='__csrf__'/></form>");
        assertThat(response.headers().firstValueAsLong("Content-Length"))
                .hasValue(response.body().getBytes(StandardCharsets.UTF_8).length);
    }

    @Test
    void postedTokenIsValidatedAgainstSession() throws Exception {
        server = LeanWebServer.start(config().build(), ROUTES);
        get("/form");
        String token = server.sessions().find("127.0.0.1").orElseThrow().value("__CSRFToken__").orElseThrow();

        HttpResponse<String> forged = post("/submit", "__CSRFToken__=forged");
        HttpResponse<String> genuine = post("/submit", "__CSRFToken__=" + token);

        assertThat(forged.headers().firstValue("Location")).contains(base() + "/error/validation-error");
        assertThat(genuine.headers().firstValue("Location")).contains(base() + "/done");
    }

    @Test
    void queryAndBodyParametersReachDispatcher() throws Exception {
        AtomicReference<Map<String, String>> seen = new AtomicReference<>();
        AtomicReference<HttpMethod> method = new AtomicReference<>();
        server = LeanWebServer.start(config().build(), (session, m, path, params) -> {
            method.set(m);
            seen.set(params);
            return ResponseDescriptor.redirect("/");
        });

        post("/path?debug=1", "username=abc&password=123");

        assertThat(method.get()).isEqualTo(HttpMethod.POST);
        assertThat(seen.get()).containsOnly(
                Map.entry("debug", "1"), Map.entry("username", "abc"), Map.entry("password", "123"));
    }

    @Test
    void failuresAreAnsweredWithErrorRedirects() throws Exception {
        server = LeanWebServer.start(config().build(), ROUTES);

        assertThat(get("/nowhere").headers().firstValue("Location")).contains(base() + "/error/page-not-found");
        assertThat(get("/crash").headers().firstValue("Location")).contains(base() + "/error/server-error");
        // still serving after a dispatcher failure
        assertThat(get("/go").statusCode()).isEqualTo(302);
    }

    @Test
    void closeEndsTerminationNormally() throws Exception {
        server = LeanWebServer.start(config().build(), ROUTES);

        server.close();
        server.close();

        server.termination().get(5, TimeUnit.SECONDS);
        assertThat(server.termination()).isCompleted().isNotCompletedExceptionally();
    }

    private ServerConfig.Builder config() {
        return ServerConfig.builder(error -> "/error/" + error.name().toLowerCase(Locale.ROOT).replace('_', '-'))
                .port(0)
                .bindLocalInterfaces(false)
                .sessionEviction(Duration.ZERO)
                .maxSimultaneousConnections(4);
    }

    private String base() {
        InetSocketAddress bound = server.addresses().get(0);
        return "http://" + bound.getAddress().getHostAddress() + ":" + bound.getPort();
    }

    private HttpResponse<String> get(String path) throws IOException, InterruptedException {
        return client.send(HttpRequest.newBuilder(URI.create(base() + path)).GET().build(),
                HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String form) throws IOException, InterruptedException {
        HttpRequest request = HttpRequest.newBuilder(URI.create(base() + path))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(form))
                .build();
        return client.send(request, HttpResponse.BodyHandlers.ofString());
    }
}
