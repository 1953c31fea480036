package com.voucherpay.security;

import java.time.Duration;
import java.time.Instant;

/**
 * A freshly signed token together with the metadata a login response needs.
 *
 * @param value     compact serialized token; opaque to clients
 * @param type      the type it was issued as
 * @param issuedAt  issuance instant
 * @param expiresAt expiry instant
 */
public record IssuedToken(String value, TokenType type, Instant issuedAt, Instant expiresAt) {

    /** Lifetime in whole seconds, as reported in {@code expires_in}. */
    public long expiresInSeconds() {
        return Duration.between(issuedAt, expiresAt).toSeconds();
    }

    @Override
    public String toString() {
        return "IssuedToken[type=%s, expiresAt=%s]".formatted(type, expiresAt);
    }
}
