package com.voucherpay.security;

import java.util.Optional;

/**
 * Pulls the token out of an {@code Authorization: Bearer <token>} header value.
 */
public final class BearerTokenExtractor {

    private static final String SCHEME = "Bearer";

    private BearerTokenExtractor() {
        // utility class
    }

    /**
     * Extracts the bearer token from an Authorization header value.
     * The scheme is matched case-insensitively and must be followed by whitespace.
     *
     * @param authorizationHeader the full header value (may be null)
     * @return the token, or empty if the header is missing, uses another scheme, or has no token
     */
    public static Optional<String> extract(String authorizationHeader) {
        if (authorizationHeader == null) {
            return Optional.empty();
        }
        String trimmed = authorizationHeader.strip();
        if (trimmed.length() <= SCHEME.length()
                || !trimmed.regionMatches(true, 0, SCHEME, 0, SCHEME.length())
                || !Character.isWhitespace(trimmed.charAt(SCHEME.length()))) {
            return Optional.empty();
        }
        String token = trimmed.substring(SCHEME.length()).strip();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }

    /**
     * Extracts the token from the header, failing the way token verification does.
     *
     * @throws UnauthenticatedException with reason {@code MISSING_TOKEN} when absent
     */
    public static String require(String authorizationHeader) {
        return extract(authorizationHeader)
                .orElseThrow(() -> new UnauthenticatedException(UnauthenticatedException.Reason.MISSING_TOKEN));
    }
}
