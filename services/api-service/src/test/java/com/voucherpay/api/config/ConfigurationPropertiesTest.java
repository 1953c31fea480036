package com.voucherpay.api.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.voucherpay.security.TokenSettings;
import com.voucherpay.security.totp.TotpSettings;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Compact-constructor defaults of the configuration records, checked without a Spring context.
 */
@DisplayName("Configuration properties")
class ConfigurationPropertiesTest {

    private static final String SECRET = "0123456789abcdef0123456789abcdef";

    @Nested
    @DisplayName("ServiceProperties")
    class Service {

        @Test
        @DisplayName("keeps explicit values")
        void keepsExplicitValues() {
            var props = new ServiceProperties("voucherpay-api", "production", "API");
            assertThat(props.name()).isEqualTo("voucherpay-api");
            assertThat(props.environment()).isEqualTo("production");
            assertThat(props.description()).isEqualTo("API");
        }

        @Test
        @DisplayName("defaults environment to 'development' when null or blank")
        void defaultsEnvironment() {
            assertThat(new ServiceProperties("svc", null, null).environment()).isEqualTo("development");
            assertThat(new ServiceProperties("svc", " ", null).environment()).isEqualTo("development");
            assertThat(new ServiceProperties("svc", null, null).description()).isEmpty();
        }
    }

    @Nested
    @DisplayName("JwtProperties")
    class Jwt {

        @Test
        @DisplayName("builds token settings with defaults for unset lifetimes")
        void buildsSettingsWithDefaults() {
            TokenSettings settings = new JwtProperties(SECRET, null, null, null, null).toSettings();

            assertThat(settings.algorithm()).isEqualTo("HS256");
            assertThat(settings.accessTokenTtl()).isEqualTo(Duration.ofMinutes(30));
            assertThat(settings.refreshTokenTtl()).isEqualTo(Duration.ofDays(7));
            assertThat(settings.passwordResetTtl()).isEqualTo(Duration.ofHours(1));
        }

        @Test
        @DisplayName("rejects a secret too short for the algorithm")
        void rejectsShortSecret() {
            var props = new JwtProperties("short", "HS256", null, null, null);
            assertThatThrownBy(props::toSettings).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("never prints the secret")
        void toStringHidesSecret() {
            assertThat(new JwtProperties(SECRET, "HS256", null, null, null).toString()).doesNotContain(SECRET);
        }
    }

    @Nested
    @DisplayName("TotpProperties")
    class Totp {

        @Test
        @DisplayName("falls back to the TOTP defaults when nothing is configured")
        void fallsBackToDefaults() {
            assertThat(new TotpProperties(null, null, null, null, null).toSettings())
                    .isEqualTo(TotpSettings.defaults());
        }

        @Test
        @DisplayName("passes configured values through")
        void passesConfiguredValues() {
            TotpSettings settings = new TotpProperties("Acme", 8, Duration.ofSeconds(60), 2, 16).toSettings();

            assertThat(settings.issuer()).isEqualTo("Acme");
            assertThat(settings.digits()).isEqualTo(8);
            assertThat(settings.period()).isEqualTo(Duration.ofSeconds(60));
            assertThat(settings.window()).isEqualTo(2);
            assertThat(settings.secretLength()).isEqualTo(16);
        }
    }

    @Nested
    @DisplayName("AccessibilityProperties")
    class Accessibility {

        @Test
        @DisplayName("defaults to enabled at level AA")
        void defaults() {
            var props = new AccessibilityProperties(null, null);
            assertThat(props.wcagLevel()).isEqualTo("AA");
            assertThat(props.enabled()).isTrue();
        }
    }

    @Nested
    @DisplayName("AnalyticsProperties")
    class Analytics {

        @Test
        @DisplayName("defaults timeout and capacity when unset or invalid")
        void defaults() {
            var props = new AnalyticsProperties(null, Duration.ofMillis(-1), 0);
            assertThat(props.enabled()).isTrue();
            assertThat(props.emitTimeout()).isEqualTo(Duration.ofMillis(500));
            assertThat(props.queueCapacity()).isEqualTo(1000);
        }
    }

    @Nested
    @DisplayName("CorsProperties")
    class Cors {

        @Test
        @DisplayName("defaults to the local front-end origins")
        void defaultsOrigins() {
            assertThat(new CorsProperties(null).allowedOrigins())
                    .containsExactly("http://localhost:3000", "http://localhost:5173");
        }

        @Test
        @DisplayName("keeps configured origins")
        void keepsConfiguredOrigins() {
            assertThat(new CorsProperties(List.of("https://app.voucherpay.com")).allowedOrigins())
                    .containsExactly("https://app.voucherpay.com");
        }
    }
}
