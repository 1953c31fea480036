package com.voucherpay.security;

import java.util.Optional;

/**
 * Discriminator carried in the {@code type} claim of every token this platform signs.
 * <p>
 * A token is only accepted by an operation that expects exactly its type; a refresh token
 * presented as an access token is rejected.
 */
public enum TokenType {

    ACCESS("access"),
    REFRESH("refresh"),
    PASSWORD_RESET("password_reset");

    private final String claimValue;

    TokenType(String claimValue) {
        this.claimValue = claimValue;
    }

    /** The value written into the {@code type} claim (e.g., "password_reset"). */
    public String claimValue() {
        return claimValue;
    }

    /**
     * Looks up a type by its claim value.
     *
     * @param value the raw claim value (may be null)
     * @return the matching type, or empty if unknown
     */
    public static Optional<TokenType> fromClaimValue(String value) {
        for (TokenType type : values()) {
            if (type.claimValue.equals(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
