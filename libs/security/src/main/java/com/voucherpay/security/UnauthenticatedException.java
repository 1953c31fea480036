package com.voucherpay.security;

/**
 * The single failure callers see when a bearer token is not acceptable.
 * <p>
 * {@link #getMessage()} is the same for every reason, so it can be rendered to clients
 * as-is. {@link #reason()} and {@link #getCause()} carry the detail for logs.
 */
public class UnauthenticatedException extends RuntimeException {

    /** Public message; identical for every failure reason. */
    public static final String MESSAGE = "Could not validate credentials";

    /** Internal classification of what went wrong. */
    public enum Reason {
        MISSING_TOKEN,
        MALFORMED,
        INVALID_SIGNATURE,
        EXPIRED,
        TYPE_MISMATCH
    }

    private final Reason reason;

    public UnauthenticatedException(Reason reason, Throwable cause) {
        super(MESSAGE, cause);
        this.reason = reason;
    }

    public UnauthenticatedException(Reason reason) {
        this(reason, null);
    }

    public Reason reason() {
        return reason;
    }
}
