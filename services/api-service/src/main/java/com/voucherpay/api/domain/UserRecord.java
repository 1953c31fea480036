package com.voucherpay.api.domain;

import com.voucherpay.security.Role;
import com.voucherpay.security.SubjectClaims;

/**
 * A user as stored by the {@link UserDirectory}.
 *
 * @param id               stable user id, used as the token subject
 * @param email            email address
 * @param username         login name (nullable)
 * @param role             platform role
 * @param passwordHash     hash produced by the {@link PasswordHasher}
 * @param totpSecret       active two-factor secret (nullable)
 * @param twoFactorEnabled whether login requires a one-time code
 */
public record UserRecord(
        String id,
        String email,
        String username,
        Role role,
        String passwordHash,
        String totpSecret,
        boolean twoFactorEnabled) {

    public UserRecord {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (role == null) {
            role = Role.USER;
        }
    }

    public SubjectClaims subjectClaims() {
        return new SubjectClaims(id, email, role.value());
    }

    public UserRecord withPasswordHash(String newHash) {
        return new UserRecord(id, email, username, role, newHash, totpSecret, twoFactorEnabled);
    }

    public UserRecord withTwoFactor(String secret) {
        return new UserRecord(id, email, username, role, passwordHash, secret, true);
    }

    @Override
    public String toString() {
        return "UserRecord[id=%s, role=%s, twoFactorEnabled=%s]".formatted(id, role, twoFactorEnabled);
    }
}
