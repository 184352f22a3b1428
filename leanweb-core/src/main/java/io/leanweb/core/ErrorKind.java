package io.leanweb.core;

/**
 * Classification of a dispatch outcome.
 *
 * <p>Every value except {@link #OK} is translated into a redirect by the server's configured
 * error-to-redirect mapping.
 */
public enum ErrorKind {
    OK,
    EXPIRED_SESSION,
    NOT_AUTHORIZED,
    FILE_NOT_FOUND,
    PAGE_NOT_FOUND,
    SERVER_ERROR,
    UNKNOWN_TYPE,
    VALIDATION_ERROR;

    public boolean isError() {
        return this != OK;
    }
}
