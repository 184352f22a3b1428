package io.leanweb.server.core;

import io.leanweb.server.spi.Session;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.Map;
import java.util.Objects;

/**
 * Anti-forgery token helpers.
 *
 * <p>The token lives in the session under the configured field name; forms carry it back as a
 * parameter of the same name.
 */
public final class CsrfTokens {

    private static final SecureRandom RANDOM = new SecureRandom();
    private static final int TOKEN_BYTES = 32;

    private CsrfTokens() {}

    public static String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    /**
     * Returns the session's token, generating and storing one first if there is none.
     */
    public static String ensure(Session session, String fieldName) {
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(fieldName, "fieldName");
        return session.value(fieldName).orElseGet(() -> session.putIfAbsent(fieldName, newToken()));
    }

    /**
     * Returns {@code true} when the submitted parameter equals the session's token.
     */
    public static boolean matches(Session session, Map<String, String> parameters, String fieldName) {
        Objects.requireNonNull(session, "session");
        Objects.requireNonNull(parameters, "parameters");
        String expected = session.value(fieldName).orElse(null);
        String submitted = parameters.get(fieldName);
        if (expected == null || submitted == null) return false;
        return MessageDigest.isEqual(
                expected.getBytes(StandardCharsets.UTF_8),
                submitted.getBytes(StandardCharsets.UTF_8));
    }
}
