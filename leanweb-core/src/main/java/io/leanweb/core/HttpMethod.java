package io.leanweb.core;

import java.util.Locale;

public enum HttpMethod {
    GET,
    HEAD,
    POST,
    PUT,
    DELETE,
    PATCH,
    OPTIONS;

    /**
     * Parses a request verb, ignoring case.
     *
     * @throws LeanWebException.UnsupportedMethod if the verb is not one of the known methods
     */
    public static HttpMethod parse(String verb) {
        if (verb == null || verb.isBlank()) {
            throw new LeanWebException.UnsupportedMethod("missing request method");
        }
        try {
            return valueOf(verb.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new LeanWebException.UnsupportedMethod("unsupported request method: " + verb);
        }
    }
}
