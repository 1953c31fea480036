package com.voucherpay.security;

import java.util.Optional;

/**
 * Platform roles carried in the {@code role} claim.
 */
public enum Role {

    USER("user"),
    ADMIN("admin"),
    MODERATOR("moderator"),
    ADVOCATE("advocate"),
    EMPLOYER("employer");

    private final String value;

    Role(String value) {
        this.value = value;
    }

    /** The claim value (e.g., "user"). */
    public String value() {
        return value;
    }

    /**
     * Looks up a Role by its claim value, ignoring case.
     *
     * @param value the string to match
     * @return the matching Role, or empty if not found
     */
    public static Optional<Role> fromValue(String value) {
        for (Role role : values()) {
            if (role.value.equalsIgnoreCase(value)) {
                return Optional.of(role);
            }
        }
        return Optional.empty();
    }
}
