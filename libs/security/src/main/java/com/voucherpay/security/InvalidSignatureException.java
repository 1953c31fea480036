package com.voucherpay.security;

/** The token's signature does not verify against the configured secret and algorithm. */
public class InvalidSignatureException extends TokenException {

    public InvalidSignatureException(String message) {
        super(message);
    }

    public InvalidSignatureException(String message, Throwable cause) {
        super(message, cause);
    }
}
