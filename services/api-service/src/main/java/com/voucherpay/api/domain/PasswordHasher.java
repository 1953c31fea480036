package com.voucherpay.api.domain;

/**
 * One-way password hashing.
 */
public interface PasswordHasher {

    String hash(String plainPassword);

    boolean verify(String plainPassword, String hash);
}
