package com.example.leanweb;

import io.leanweb.core.ErrorKind;
import io.leanweb.core.HttpMethod;
import io.leanweb.server.core.CsrfTokens;
import io.leanweb.server.spi.Dispatcher;
import io.leanweb.server.spi.ResponseDescriptor;
import io.leanweb.server.spi.Session;
import io.leanweb.server.spi.SessionStore;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

/**
 * Small login flow: a form carrying the anti-forgery token, a page that needs a live session, and
 * an error page per classification.
 */
final class DemoDispatcher implements Dispatcher {
    static final String USER = "user";

    private final SessionStore sessions;
    private final Duration sessionExpiration;
    private final String tokenFieldName;
    private final String tokenPlaceholder;

    DemoDispatcher(SessionStore sessions, Duration sessionExpiration, String tokenFieldName, String tokenPlaceholder) {
        this.sessions = sessions;
        this.sessionExpiration = sessionExpiration;
        this.tokenFieldName = tokenFieldName;
        this.tokenPlaceholder = tokenPlaceholder;
    }

    static String errorPath(ErrorKind error) {
        return "/error/" + error.name().toLowerCase(Locale.ROOT).replace('_', '-');
    }

    @Override
    public ResponseDescriptor route(Session session, HttpMethod method, String path, Map<String, String> parameters) {
        if (path.startsWith("/error/")) {
            return page("Something went wrong", "<p>" + escape(path.substring("/error/".length())) + "</p>"
                    + "<p><a href='/login'>Log in</a></p>");
        }
        switch (path) {
            case "/":
                return page("LeanWeb", "<p><a href='/login'>Log in</a> or see <a href='/account'>your account</a>.</p>");
            case "/login":
                return method == HttpMethod.POST ? login(session, parameters) : loginForm();
            case "/account":
                return account(session);
            case "/logout":
                session.remove(USER);
                return ResponseDescriptor.redirect("/");
            default:
                return ResponseDescriptor.failure(ErrorKind.PAGE_NOT_FOUND);
        }
    }

    private ResponseDescriptor loginForm() {
        return page("Log in", "<form method='post' action='/login'>" + tokenPlaceholder
                + "<input name='username'/><input name='password' type='password'/>"
                + "<button type='submit'>Log in</button></form>");
    }

    private ResponseDescriptor login(Session session, Map<String, String> parameters) {
        if (!CsrfTokens.matches(session, parameters, tokenFieldName)) {
            return ResponseDescriptor.failure(ErrorKind.VALIDATION_ERROR);
        }
        String username = parameters.getOrDefault("username", "").trim();
        if (username.isEmpty() || parameters.getOrDefault("password", "").isEmpty()) {
            return ResponseDescriptor.failure(ErrorKind.NOT_AUTHORIZED);
        }
        session.put(USER, username);
        return ResponseDescriptor.redirect("/account");
    }

    private ResponseDescriptor account(Session session) {
        if (session.value(USER).isEmpty()) {
            return ResponseDescriptor.failure(ErrorKind.NOT_AUTHORIZED);
        }
        if (sessions.isExpired(session, sessionExpiration)) {
            session.remove(USER);
            return ResponseDescriptor.failure(ErrorKind.EXPIRED_SESSION);
        }
        return page("Account", "<p>Signed in as " + escape(session.value(USER).orElse("")) + ".</p>"
                + "<p><a href='/logout'>Log out</a></p>");
    }

    private static ResponseDescriptor page(String title, String body) {
        return ResponseDescriptor.html("<!DOCTYPE html><html><head><title>" + title + "</title></head><body>"
                + "<h1>" + title + "</h1>" + body + "</body></html>");
    }

    private static String escape(String text) {
        return text.replace("&", "&amp;").replace("<", "&lt;").replace(">", "&gt;").replace("'", "&#39;");
    }
}
