package io.leanweb.core;

/**
 * Base class for LeanWeb related exceptions.
 *
 * <p>Subclasses are specific to the error condition and preserve the original cause when
 * applicable.
 */
public abstract class LeanWebException extends RuntimeException {

    protected LeanWebException(String message) {
        super(message);
    }

    protected LeanWebException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when the listener stops accepting connections because of an I/O failure.
     * This terminates the accept loop and is meant for the operator, not for clients.
     */
    public static class ListenerFailure extends LeanWebException {
        public ListenerFailure(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when server configuration is missing, malformed, or out of range.
     */
    public static class InvalidConfiguration extends LeanWebException {
        public InvalidConfiguration(String message) {
            super(message);
        }

        public InvalidConfiguration(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when a request uses a method the server does not understand.
     */
    public static class UnsupportedMethod extends LeanWebException {
        public UnsupportedMethod(String message) {
            super(message);
        }
    }
}
