package com.voucherpay.api.infrastructure.user;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.voucherpay.api.domain.UserRecord;
import com.voucherpay.security.Role;
import java.util.NoSuchElementException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("InMemoryUserDirectory")
class InMemoryUserDirectoryTest {

    private final InMemoryUserDirectory directory = new InMemoryUserDirectory();

    @BeforeEach
    void seed() {
        directory.save(new UserRecord("u-1", "Jane@Example.com", "jane", Role.ADVOCATE, "hash-1", null, false));
    }

    @Test
    @DisplayName("finds a user by id, email or username, ignoring case")
    void findsByAnyIdentifier() {
        assertThat(directory.findByIdentifier("u-1")).isPresent();
        assertThat(directory.findByIdentifier("jane@example.com")).map(UserRecord::id).contains("u-1");
        assertThat(directory.findByIdentifier(" JANE ")).map(UserRecord::id).contains("u-1");
    }

    @Test
    @DisplayName("returns empty for unknown or blank identifiers")
    void emptyForUnknown() {
        assertThat(directory.findByIdentifier("nobody")).isEmpty();
        assertThat(directory.findByIdentifier("")).isEmpty();
        assertThat(directory.findByIdentifier(null)).isEmpty();
    }

    @Test
    @DisplayName("updates the password hash in place")
    void updatesPasswordHash() {
        directory.updatePasswordHash("u-1", "hash-2");

        assertThat(directory.findByIdentifier("u-1")).map(UserRecord::passwordHash).contains("hash-2");
    }

    @Test
    @DisplayName("activating two-factor stores the secret and enables it")
    void activatesTwoFactor() {
        directory.activateTwoFactor("u-1", "JBSWY3DPEHPK3PXP");

        UserRecord user = directory.findByIdentifier("u-1").orElseThrow();
        assertThat(user.twoFactorEnabled()).isTrue();
        assertThat(user.totpSecret()).isEqualTo("JBSWY3DPEHPK3PXP");
        assertThat(user.passwordHash()).isEqualTo("hash-1");
    }

    @Test
    @DisplayName("updating an unknown user fails")
    void unknownUserFails() {
        assertThatThrownBy(() -> directory.updatePasswordHash("u-404", "x"))
                .isInstanceOf(NoSuchElementException.class);
    }

    @Test
    @DisplayName("toString never includes the password hash or secret")
    void toStringHidesSecrets() {
        directory.activateTwoFactor("u-1", "JBSWY3DPEHPK3PXP");

        String text = directory.findByIdentifier("u-1").orElseThrow().toString();
        assertThat(text).doesNotContain("hash-1").doesNotContain("JBSWY3DPEHPK3PXP");
    }
}
