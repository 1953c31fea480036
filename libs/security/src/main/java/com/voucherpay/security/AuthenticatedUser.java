package com.voucherpay.security;

/**
 * The caller behind a verified access token.
 *
 * @param userId unique user identifier (from the {@code sub} claim)
 * @param email  user's email address (nullable)
 * @param role   platform role; {@link Role#USER} when the claim is absent or unknown
 * @param claims the full verified claim set
 */
public record AuthenticatedUser(String userId, String email, Role role, ClaimSet claims) {

    /** Builds the user from claims already verified as {@link TokenType#ACCESS}. */
    public static AuthenticatedUser from(ClaimSet claims) {
        return new AuthenticatedUser(
                claims.subject(),
                claims.email(),
                Role.fromValue(claims.role()).orElse(Role.USER),
                claims);
    }
}
