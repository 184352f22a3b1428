package io.leanweb.server.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.leanweb.core.LeanWebException;
import io.leanweb.server.spi.ErrorRedirects;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Iterator;
import java.util.Map;
import java.util.Objects;

/**
 * Reads the scalar {@link ServerConfig} options from a JSON document.
 *
 * <pre>{@code
 * {
 *   "maxSimultaneousConnections": 20,
 *   "sessionExpirationSeconds": 60,
 *   "sessionEvictionSeconds": 600,
 *   "publicAddress": "",
 *   "validationTokenPlaceholder": "<%AntiForgeryToken%>",
 *   "validationTokenFieldName": "__CSRFToken__",
 *   "port": 80,
 *   "bindLocalInterfaces": true,
 *   "maxBodySize": 1048576,
 *   "defaultCharset": "UTF-8"
 * }
 * }</pre>
 *
 * Every key is optional. Hooks cannot be expressed in JSON and are set on the returned builder.
 */
public final class ServerConfigLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ServerConfigLoader() {}

    public static ServerConfig.Builder load(Path file, ErrorRedirects errorRedirects) {
        Objects.requireNonNull(file, "file");
        try (InputStream in = Files.newInputStream(file)) {
            return load(in, errorRedirects);
        } catch (IOException e) {
            throw new LeanWebException.InvalidConfiguration("cannot read configuration " + file, e);
        }
    }

    public static ServerConfig.Builder load(InputStream in, ErrorRedirects errorRedirects) {
        Objects.requireNonNull(in, "in");
        JsonNode root;
        try {
            root = MAPPER.readTree(in);
        } catch (JsonProcessingException e) {
            throw new LeanWebException.InvalidConfiguration("malformed configuration: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new LeanWebException.InvalidConfiguration("cannot read configuration", e);
        }
        return apply(root, ServerConfig.builder(errorRedirects));
    }

    /**
     * Copies every option present in {@code root} onto the builder.
     */
    public static ServerConfig.Builder apply(JsonNode root, ServerConfig.Builder builder) {
        if (root == null || root.isMissingNode() || root.isNull()) return builder;
        if (!root.isObject()) {
            throw new LeanWebException.InvalidConfiguration("configuration must be a JSON object");
        }
        for (Iterator<Map.Entry<String, JsonNode>> it = root.fields(); it.hasNext(); ) {
            Map.Entry<String, JsonNode> field = it.next();
            String key = field.getKey();
            JsonNode value = field.getValue();
            switch (key) {
                case "maxSimultaneousConnections" -> builder.maxSimultaneousConnections(intValue(key, value));
                case "sessionExpirationSeconds" -> builder.sessionExpiration(Duration.ofSeconds(longValue(key, value)));
                case "sessionEvictionSeconds" -> builder.sessionEviction(Duration.ofSeconds(longValue(key, value)));
                case "publicAddress" -> builder.publicAddress(text(key, value));
                case "validationTokenPlaceholder" -> builder.validationTokenPlaceholder(text(key, value));
                case "validationTokenFieldName" -> builder.validationTokenFieldName(text(key, value));
                case "port" -> builder.port(intValue(key, value));
                case "bindLocalInterfaces" -> builder.bindLocalInterfaces(bool(key, value));
                case "maxBodySize" -> builder.maxBodySize(longValue(key, value));
                case "defaultCharset" -> builder.defaultCharset(charset(key, value));
                default -> throw new LeanWebException.InvalidConfiguration("unknown configuration key: " + key);
            }
        }
        return builder;
    }

    private static int intValue(String key, JsonNode value) {
        if (!value.isIntegralNumber() || !value.canConvertToInt()) {
            throw new LeanWebException.InvalidConfiguration(key + " must be an integer");
        }
        return value.intValue();
    }

    private static long longValue(String key, JsonNode value) {
        if (!value.isIntegralNumber() || !value.canConvertToLong()) {
            throw new LeanWebException.InvalidConfiguration(key + " must be an integer");
        }
        return value.longValue();
    }

    private static String text(String key, JsonNode value) {
        if (!value.isTextual()) {
            throw new LeanWebException.InvalidConfiguration(key + " must be a string");
        }
        return value.textValue();
    }

    private static boolean bool(String key, JsonNode value) {
        if (!value.isBoolean()) {
            throw new LeanWebException.InvalidConfiguration(key + " must be a boolean");
        }
        return value.booleanValue();
    }

    private static Charset charset(String key, JsonNode value) {
        String name = text(key, value);
        try {
            return Charset.forName(name);
        } catch (IllegalArgumentException e) {
            throw new LeanWebException.InvalidConfiguration(key + " names an unknown charset: " + name, e);
        }
    }
}
