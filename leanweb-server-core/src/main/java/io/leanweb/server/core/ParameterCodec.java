package io.leanweb.server.core;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Permissive {@code key=value&key=value} decoder for query strings and form bodies.
 *
 * <p>Later occurrences of a key overwrite earlier ones. Malformed input never raises: a segment
 * without {@code =} becomes a key with an empty value, and a bad percent escape is kept as
 * written.
 */
public final class ParameterCodec {
    private ParameterCodec() {}

    public static Map<String, String> decode(String raw) {
        return decode(raw, new LinkedHashMap<>());
    }

    /**
     * Decodes into the given map and returns it.
     */
    public static Map<String, String> decode(String raw, Map<String, String> into) {
        if (raw == null || raw.isEmpty()) return into;
        for (String part : raw.split("&")) {
            if (part.isEmpty()) continue;
            int eq = part.indexOf('=');
            if (eq < 0) {
                into.put(unescape(part), "");
            } else {
                into.put(unescape(part.substring(0, eq)), unescape(part.substring(eq + 1)));
            }
        }
        return into;
    }

    private static String unescape(String s) {
        try {
            return URLDecoder.decode(s, StandardCharsets.UTF_8);
        } catch (IllegalArgumentException malformed) {
            return s;
        }
    }
}
