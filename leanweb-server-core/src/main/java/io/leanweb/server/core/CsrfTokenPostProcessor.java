package io.leanweb.server.core;

import io.leanweb.server.spi.PostProcessor;
import io.leanweb.server.spi.Session;

import java.util.Objects;

/**
 * Default {@link PostProcessor}: replaces the token placeholder with a hidden form field holding
 * the session's anti-forgery token.
 */
public final class CsrfTokenPostProcessor implements PostProcessor {

    public static final String DEFAULT_PLACEHOLDER = "<%AntiForgeryToken%>";
    public static final String DEFAULT_FIELD_NAME = "__CSRFToken__";

    private final String placeholder;
    private final String fieldName;

    public CsrfTokenPostProcessor() {
        this(DEFAULT_PLACEHOLDER, DEFAULT_FIELD_NAME);
    }

    public CsrfTokenPostProcessor(String placeholder, String fieldName) {
        this.placeholder = Objects.requireNonNull(placeholder, "placeholder");
        this.fieldName = Objects.requireNonNull(fieldName, "fieldName");
        if (placeholder.isEmpty()) throw new IllegalArgumentException("placeholder must not be empty");
    }

    @Override
    public String process(Session session, String html) {
        if (html == null || !html.contains(placeholder)) return html;
        String token = CsrfTokens.ensure(session, fieldName);
        return html.replace(placeholder, hiddenField(token));
    }

    String hiddenField(String token) {
        return "<input name='" + fieldName + "' type='hidden' value='" + token + "' id='__csrf__'/>";
    }
}
