package com.voucherpay.security;

import java.util.Map;

/**
 * Identity claims a caller supplies when asking for an access or refresh token.
 *
 * @param subject    unique subject identifier ({@code sub}); required
 * @param email      email address (nullable)
 * @param role       role name, e.g. "user" (nullable)
 * @param additional forward-compatible extra claims (strings, booleans, lists); reserved names are rejected
 */
public record SubjectClaims(String subject, String email, String role, Map<String, Object> additional) {

    public SubjectClaims {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject must not be null or blank");
        }
        additional = additional == null ? Map.of() : Map.copyOf(additional);
        for (String name : additional.keySet()) {
            if (ClaimNames.RESERVED.contains(name)) {
                throw new IllegalArgumentException("additional claims must not redefine '" + name + "'");
            }
        }
    }

    public SubjectClaims(String subject, String email, String role) {
        this(subject, email, role, Map.of());
    }

    /** Extracts the subject claims of an already verified token, e.g. to re-issue an access token. */
    public static SubjectClaims from(ClaimSet claims) {
        return new SubjectClaims(claims.subject(), claims.email(), claims.role(), claims.additional());
    }
}
