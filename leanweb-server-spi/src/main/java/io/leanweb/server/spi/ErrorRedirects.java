package io.leanweb.server.spi;

import io.leanweb.core.ErrorKind;

/**
 * Maps an error classification to the server-relative path clients are redirected to.
 */
@FunctionalInterface
public interface ErrorRedirects {

    String redirectFor(ErrorKind error);
}
