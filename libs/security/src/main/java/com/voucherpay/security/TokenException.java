package com.voucherpay.security;

/**
 * Base class for token decoding failures.
 * <p>
 * Subclasses name the exact check that failed so it can be logged; callers at the HTTP
 * boundary only ever see {@link UnauthenticatedException}.
 */
public abstract class TokenException extends RuntimeException {

    protected TokenException(String message) {
        super(message);
    }

    protected TokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
