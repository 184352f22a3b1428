package io.leanweb.server.core;

import io.leanweb.server.spi.BodySizeLimiter;
import io.leanweb.server.spi.ErrorRedirects;
import io.leanweb.server.spi.PostProcessor;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Startup configuration, built once and handed to the admission gate, session store and request
 * pipeline.
 *
 * <p>Use {@link #builder(ErrorRedirects)} to create instances:
 * <pre>{@code
 * ServerConfig config = ServerConfig.builder(error -> "/error/" + error.name().toLowerCase())
 *     .maxSimultaneousConnections(50)
 *     .sessionExpiration(Duration.ofMinutes(5))
 *     .publicAddress("203.0.113.7")
 *     .build();
 * }</pre>
 */
public final class ServerConfig {

    public static final int DEFAULT_MAX_SIMULTANEOUS_CONNECTIONS = 20;
    public static final Duration DEFAULT_SESSION_EXPIRATION = Duration.ofSeconds(60);
    public static final Duration DEFAULT_SESSION_EVICTION = Duration.ofMinutes(10);
    public static final int DEFAULT_PORT = 80;

    private final int maxSimultaneousConnections;
    private final Duration sessionExpiration;
    private final Duration sessionEviction;
    private final String publicAddress;
    private final String validationTokenPlaceholder;
    private final String validationTokenFieldName;
    private final int port;
    private final boolean bindLocalInterfaces;
    private final long maxBodySize;
    private final Charset defaultCharset;
    private final ErrorRedirects errorRedirects;
    private final RequestObserver requestObserver;
    private final PostProcessor postProcessor;
    private final Clock clock;

    /**
     * Creates a new builder.
     *
     * @param errorRedirects maps error classifications to redirect paths (required)
     */
    public static Builder builder(ErrorRedirects errorRedirects) {
        return new Builder(errorRedirects);
    }

    private ServerConfig(Builder builder) {
        if (builder.maxSimultaneousConnections <= 0) {
            throw new IllegalArgumentException("maxSimultaneousConnections must be positive");
        }
        if (builder.sessionExpiration.isNegative()) {
            throw new IllegalArgumentException("sessionExpiration must not be negative");
        }
        if (builder.sessionEviction.isNegative()) {
            throw new IllegalArgumentException("sessionEviction must not be negative");
        }
        if (!builder.sessionEviction.isZero() && builder.sessionEviction.compareTo(builder.sessionExpiration) < 0) {
            // sweeping must only ever drop sessions that already count as expired
            throw new IllegalArgumentException("sessionEviction " + builder.sessionEviction
                    + " is shorter than sessionExpiration " + builder.sessionExpiration);
        }
        if (builder.port < 0 || builder.port > 65535) {
            throw new IllegalArgumentException("port out of range: " + builder.port);
        }
        this.maxSimultaneousConnections = builder.maxSimultaneousConnections;
        this.sessionExpiration = builder.sessionExpiration;
        this.sessionEviction = builder.sessionEviction;
        this.publicAddress = builder.publicAddress;
        this.validationTokenPlaceholder = builder.validationTokenPlaceholder;
        this.validationTokenFieldName = builder.validationTokenFieldName;
        this.port = builder.port;
        this.bindLocalInterfaces = builder.bindLocalInterfaces;
        this.maxBodySize = builder.maxBodySize > 0 ? builder.maxBodySize : BodySizeLimiter.UNLIMITED;
        this.defaultCharset = builder.defaultCharset;
        this.errorRedirects = builder.errorRedirects;
        this.requestObserver = builder.requestObserver != null ? builder.requestObserver : RequestObserver.none();
        this.postProcessor = builder.postProcessor != null
                ? builder.postProcessor
                : new CsrfTokenPostProcessor(validationTokenPlaceholder, validationTokenFieldName);
        this.clock = builder.clock;
    }

    public int maxSimultaneousConnections() {
        return maxSimultaneousConnections;
    }

    public Duration sessionExpiration() {
        return sessionExpiration;
    }

    /**
     * Idle time after which sessions are swept from the store; zero disables sweeping.
     */
    public Duration sessionEviction() {
        return sessionEviction;
    }

    /**
     * Host used in redirect locations; empty means the host the client addressed.
     */
    public String publicAddress() {
        return publicAddress;
    }

    public String validationTokenPlaceholder() {
        return validationTokenPlaceholder;
    }

    public String validationTokenFieldName() {
        return validationTokenFieldName;
    }

    public int port() {
        return port;
    }

    public boolean bindLocalInterfaces() {
        return bindLocalInterfaces;
    }

    public long maxBodySize() {
        return maxBodySize;
    }

    public Charset defaultCharset() {
        return defaultCharset;
    }

    public ErrorRedirects errorRedirects() {
        return errorRedirects;
    }

    public RequestObserver requestObserver() {
        return requestObserver;
    }

    public PostProcessor postProcessor() {
        return postProcessor;
    }

    public Clock clock() {
        return clock;
    }

    /**
     * Builder for {@link ServerConfig}.
     */
    public static final class Builder {
        private final ErrorRedirects errorRedirects;
        private int maxSimultaneousConnections = DEFAULT_MAX_SIMULTANEOUS_CONNECTIONS;
        private Duration sessionExpiration = DEFAULT_SESSION_EXPIRATION;
        private Duration sessionEviction = DEFAULT_SESSION_EVICTION;
        private String publicAddress = "";
        private String validationTokenPlaceholder = CsrfTokenPostProcessor.DEFAULT_PLACEHOLDER;
        private String validationTokenFieldName = CsrfTokenPostProcessor.DEFAULT_FIELD_NAME;
        private int port = DEFAULT_PORT;
        private boolean bindLocalInterfaces = true;
        private long maxBodySize = BodySizeLimiter.UNLIMITED;
        private Charset defaultCharset = StandardCharsets.UTF_8;
        private RequestObserver requestObserver;
        private PostProcessor postProcessor;
        private Clock clock = Clock.systemUTC();

        private Builder(ErrorRedirects errorRedirects) {
            this.errorRedirects = Objects.requireNonNull(errorRedirects, "errorRedirects");
        }

        /** Sets how many workers may wait for a connection at once. Default: 20. */
        public Builder maxSimultaneousConnections(int maxSimultaneousConnections) {
            this.maxSimultaneousConnections = maxSimultaneousConnections;
            return this;
        }

        /** Sets the idle time after which a session counts as expired. Default: 60 seconds. */
        public Builder sessionExpiration(Duration sessionExpiration) {
            this.sessionExpiration = Objects.requireNonNull(sessionExpiration, "sessionExpiration");
            return this;
        }

        /**
         * Sets the idle time after which sessions are dropped; zero disables. Must not be shorter
         * than the session expiration. Default: 10 minutes.
         */
        public Builder sessionEviction(Duration sessionEviction) {
            this.sessionEviction = Objects.requireNonNull(sessionEviction, "sessionEviction");
            return this;
        }

        /** Sets the host used in redirect locations. Default: empty. */
        public Builder publicAddress(String publicAddress) {
            this.publicAddress = publicAddress == null ? "" : publicAddress.trim();
            return this;
        }

        /**
         * Sets the text the default post-processor replaces with the token field.
         * Default: {@code <%AntiForgeryToken%>}.
         */
        public Builder validationTokenPlaceholder(String validationTokenPlaceholder) {
            this.validationTokenPlaceholder = Objects.requireNonNull(validationTokenPlaceholder, "validationTokenPlaceholder");
            return this;
        }

        /** Sets the session key and form field name of the anti-forgery token. Default: {@code __CSRFToken__}. */
        public Builder validationTokenFieldName(String validationTokenFieldName) {
            this.validationTokenFieldName = Objects.requireNonNull(validationTokenFieldName, "validationTokenFieldName");
            return this;
        }

        /** Sets the listening port; 0 picks an ephemeral port. Default: 80. */
        public Builder port(int port) {
            this.port = port;
            return this;
        }

        /** Sets whether to listen on every local IPv4 interface besides localhost. Default: true. */
        public Builder bindLocalInterfaces(boolean bindLocalInterfaces) {
            this.bindLocalInterfaces = bindLocalInterfaces;
            return this;
        }

        /** Sets the maximum request body size in bytes; zero or less disables. Default: unlimited. */
        public Builder maxBodySize(long maxBodySize) {
            this.maxBodySize = maxBodySize;
            return this;
        }

        /** Sets the charset for bodies that declare none. Default: UTF-8. */
        public Builder defaultCharset(Charset defaultCharset) {
            this.defaultCharset = Objects.requireNonNull(defaultCharset, "defaultCharset");
            return this;
        }

        /** Sets the request observation hook. Default: none. */
        public Builder requestObserver(RequestObserver requestObserver) {
            this.requestObserver = requestObserver;
            return this;
        }

        /** Sets the HTML post-processor. Default: {@link CsrfTokenPostProcessor}. */
        public Builder postProcessor(PostProcessor postProcessor) {
            this.postProcessor = postProcessor;
            return this;
        }

        /** Sets the clock for session timestamps. Default: system UTC. */
        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        /** Builds the configuration with the configured settings. */
        public ServerConfig build() {
            return new ServerConfig(this);
        }
    }
}
