package com.voucherpay.api.infrastructure.user;

import com.voucherpay.api.domain.PasswordHasher;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

/**
 * {@link PasswordHasher} backed by Spring Security's BCrypt encoder.
 */
@Component
public class BcryptPasswordHasher implements PasswordHasher {

    private final PasswordEncoder encoder;

    public BcryptPasswordHasher(PasswordEncoder encoder) {
        this.encoder = encoder;
    }

    @Override
    public String hash(String plainPassword) {
        return encoder.encode(plainPassword);
    }

    @Override
    public boolean verify(String plainPassword, String hash) {
        if (plainPassword == null || hash == null || hash.isBlank()) {
            return false;
        }
        return encoder.matches(plainPassword, hash);
    }
}
