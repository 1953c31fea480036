package com.voucherpay.security;

import java.time.Instant;
import java.util.Map;

/**
 * Typed, immutable claim set carried inside a signed token.
 * <p>
 * The well-known claims are named fields; anything else a caller attached travels in
 * {@link #additional()}. {@code type} and {@code exp} are always present. Access and refresh
 * tokens also carry {@code sub}; password-reset tokens carry the email as {@code sub} and a
 * {@code nbf}.
 *
 * @param subject    {@code sub} claim
 * @param email      {@code email} claim (nullable)
 * @param role       {@code role} claim (nullable)
 * @param type       {@code type} discriminator
 * @param expiresAt  {@code exp}, second precision on the wire
 * @param notBefore  {@code nbf} (nullable; informational)
 * @param additional extension claims
 */
public record ClaimSet(
        String subject,
        String email,
        String role,
        TokenType type,
        Instant expiresAt,
        Instant notBefore,
        Map<String, Object> additional
) {

    public ClaimSet {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (expiresAt == null) {
            throw new IllegalArgumentException("expiresAt must not be null");
        }
        additional = additional == null ? Map.of() : Map.copyOf(additional);
    }

    /** Builds the claim set for an access or refresh token. */
    public static ClaimSet forSubject(SubjectClaims subject, TokenType type, Instant expiresAt) {
        return new ClaimSet(subject.subject(), subject.email(), subject.role(), type, expiresAt, null,
                subject.additional());
    }

    /** Returns true when {@code now} is strictly after the expiry instant. */
    public boolean isExpiredAt(Instant now) {
        return now.isAfter(expiresAt);
    }
}
