package com.voucherpay.api.infrastructure.user;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

@DisplayName("BcryptPasswordHasher")
class BcryptPasswordHasherTest {

    private final BcryptPasswordHasher hasher = new BcryptPasswordHasher(new BCryptPasswordEncoder(4));

    @Test
    @DisplayName("verifies the password it hashed and nothing else")
    void verifiesOwnHash() {
        String hash = hasher.hash("correct horse battery staple");

        assertThat(hash).startsWith("$2a$").doesNotContain("correct horse");
        assertThat(hasher.verify("correct horse battery staple", hash)).isTrue();
        assertThat(hasher.verify("wrong", hash)).isFalse();
    }

    @Test
    @DisplayName("rejects a missing hash instead of throwing")
    void rejectsMissingHash() {
        assertThat(hasher.verify("anything", null)).isFalse();
    }
}
