package com.voucherpay.api.domain;

import java.util.Optional;

/**
 * The user-record store. Owns persisted credentials, including two-factor secrets.
 */
public interface UserDirectory {

    /**
     * Finds a user by id, email or username. Email and username matches ignore case.
     */
    Optional<UserRecord> findByIdentifier(String identifier);

    /**
     * @throws java.util.NoSuchElementException if no user has this id
     */
    void updatePasswordHash(String userId, String passwordHash);

    /**
     * Stores a verified two-factor secret and turns two-factor login on.
     *
     * @throws java.util.NoSuchElementException if no user has this id
     */
    void activateTwoFactor(String userId, String totpSecret);
}
