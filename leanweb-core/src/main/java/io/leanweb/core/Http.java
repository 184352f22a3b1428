package io.leanweb.core;

/**
 * HTTP constants (status codes, header names, and well-known values) shared by the server modules.
 *
 * <p>This module intentionally contains no HTTP server bindings.
 */
public final class Http {
    private Http() {}

    // Status codes
    public static final int STATUS_OK = 200;
    public static final int STATUS_FOUND = 302;

    // Headers
    public static final String H_CONTENT_TYPE = "Content-Type";
    public static final String H_CONTENT_LENGTH = "Content-Length";
    public static final String H_LOCATION = "Location";
    public static final String H_HOST = "Host";

    // Content types
    public static final String TEXT_HTML = "text/html";

    public static final String SCHEME_PREFIX = "http://";
    public static final String CHARSET_PARAM = "charset=";
}
