package com.voucherpay.security;

/** A valid token was presented to an operation that expects a different {@link TokenType}. */
public class TokenTypeMismatchException extends TokenException {

    private final TokenType expected;
    private final TokenType actual;

    public TokenTypeMismatchException(TokenType expected, TokenType actual) {
        super("Expected %s token but got %s".formatted(expected.claimValue(), actual.claimValue()));
        this.expected = expected;
        this.actual = actual;
    }

    public TokenType expected() {
        return expected;
    }

    public TokenType actual() {
        return actual;
    }
}
