package com.voucherpay.security;

/** The token is not a compact signed JWT, or a required claim is missing or of the wrong type. */
public class MalformedTokenException extends TokenException {

    public MalformedTokenException(String message) {
        super(message);
    }

    public MalformedTokenException(String message, Throwable cause) {
        super(message, cause);
    }
}
