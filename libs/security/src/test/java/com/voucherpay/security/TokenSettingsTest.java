package com.voucherpay.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.nimbusds.jose.JWSAlgorithm;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("TokenSettings")
class TokenSettingsTest {

    @Test
    @DisplayName("applies defaults for algorithm and lifetimes")
    void defaults() {
        TokenSettings settings = TokenSettings.withSecret(TestTokens.SECRET);

        assertThat(settings.algorithm()).isEqualTo("HS256");
        assertThat(settings.jwsAlgorithm()).isEqualTo(JWSAlgorithm.HS256);
        assertThat(settings.accessTokenTtl()).isEqualTo(Duration.ofMinutes(30));
        assertThat(settings.refreshTokenTtl()).isEqualTo(Duration.ofDays(7));
        assertThat(settings.passwordResetTtl()).isEqualTo(Duration.ofHours(1));
    }

    @Test
    @DisplayName("rejects a secret shorter than the digest")
    void shortSecret() {
        assertThatThrownBy(() -> TokenSettings.withSecret("too-short"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("32 bytes");
        assertThatThrownBy(() -> new TokenSettings(TestTokens.SECRET, "HS512", null, null, null))
                .hasMessageContaining("64 bytes");
    }

    @Test
    @DisplayName("rejects algorithms other than HMAC SHA-2")
    void unsupportedAlgorithm() {
        assertThatThrownBy(() -> new TokenSettings(TestTokens.SECRET, "RS256", null, null, null))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("RS256");
    }

    @Test
    @DisplayName("requires refresh tokens to outlive access tokens")
    void refreshLongerThanAccess() {
        assertThatThrownBy(() -> new TokenSettings(TestTokens.SECRET, "HS256",
                Duration.ofDays(8), Duration.ofDays(7), null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("toString does not expose the secret")
    void toStringHidesSecret() {
        assertThat(TokenSettings.withSecret(TestTokens.SECRET).toString()).doesNotContain(TestTokens.SECRET);
    }
}
