package com.voucherpay.security;

import java.time.Instant;

/** The token's {@code exp} instant lies in the past. */
public class TokenExpiredException extends TokenException {

    private final Instant expiredAt;

    public TokenExpiredException(Instant expiredAt, Instant now) {
        super("Token expired at %s (now %s)".formatted(expiredAt, now));
        this.expiredAt = expiredAt;
    }

    public Instant expiredAt() {
        return expiredAt;
    }
}
