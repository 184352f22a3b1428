package io.leanweb.server.spi;

import io.leanweb.core.ErrorKind;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Outcome of dispatching a request: a redirect, a content body, or a classified failure.
 *
 * <p>{@link Redirect} and {@link Content} always report {@link ErrorKind#OK}; a {@link Failure}
 * is turned into a redirect by the server's error mapping before anything is written.
 */
public sealed interface ResponseDescriptor
        permits ResponseDescriptor.Redirect, ResponseDescriptor.Content, ResponseDescriptor.Failure {

    ErrorKind error();

    /**
     * Redirect to a server-relative target path such as {@code /login}.
     */
    record Redirect(String target) implements ResponseDescriptor {
        public Redirect {
            Objects.requireNonNull(target, "target");
        }

        @Override
        public ErrorKind error() {
            return ErrorKind.OK;
        }
    }

    /**
     * Body bytes written verbatim with the given content type and text encoding.
     *
     * @param encoding the text encoding, or {@code null} for binary content
     */
    record Content(byte[] data, String contentType, Charset encoding) implements ResponseDescriptor {
        public Content {
            Objects.requireNonNull(data, "data");
            Objects.requireNonNull(contentType, "contentType");
        }

        @Override
        public ErrorKind error() {
            return ErrorKind.OK;
        }
    }

    record Failure(ErrorKind error) implements ResponseDescriptor {
        public Failure {
            Objects.requireNonNull(error, "error");
            if (!error.isError()) {
                throw new IllegalArgumentException("failure requires an error classification, got " + error);
            }
        }
    }

    static ResponseDescriptor redirect(String target) {
        return new Redirect(target);
    }

    static ResponseDescriptor content(byte[] data, String contentType, Charset encoding) {
        return new Content(data, contentType, encoding);
    }

    static ResponseDescriptor html(String html) {
        return new Content(html.getBytes(StandardCharsets.UTF_8), "text/html", StandardCharsets.UTF_8);
    }

    static ResponseDescriptor failure(ErrorKind error) {
        return new Failure(error);
    }
}
