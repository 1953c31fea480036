package com.voucherpay.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("BearerTokenExtractor")
class BearerTokenExtractorTest {

    @Nested
    @DisplayName("valid headers")
    class ValidHeaders {

        @Test
        @DisplayName("extracts token from 'Bearer xxx' header")
        void extractsToken() {
            assertThat(BearerTokenExtractor.extract("Bearer eyJhbGciOiJIUzI1NiJ9.payload.sig"))
                    .contains("eyJhbGciOiJIUzI1NiJ9.payload.sig");
        }

        @Test
        @DisplayName("is case-insensitive and tolerates extra whitespace")
        void lenientScheme() {
            assertThat(BearerTokenExtractor.extract("  bearer    my-token ")).contains("my-token");
        }
    }

    @Nested
    @DisplayName("invalid headers")
    class InvalidHeaders {

        @Test
        @DisplayName("returns empty for null, empty, other schemes and missing token")
        void empty() {
            assertThat(BearerTokenExtractor.extract(null)).isEmpty();
            assertThat(BearerTokenExtractor.extract("")).isEmpty();
            assertThat(BearerTokenExtractor.extract("Basic dXNlcjpwYXNz")).isEmpty();
            assertThat(BearerTokenExtractor.extract("Bearer ")).isEmpty();
            assertThat(BearerTokenExtractor.extract("Bearer")).isEmpty();
        }

        @Test
        @DisplayName("does not accept a scheme that merely starts with 'bearer'")
        void schemePrefix() {
            assertThat(BearerTokenExtractor.extract("BearerToken abc")).isEmpty();
        }

        @Test
        @DisplayName("require fails as a missing token")
        void requireFails() {
            assertThatThrownBy(() -> BearerTokenExtractor.require(null))
                    .isInstanceOf(UnauthenticatedException.class)
                    .extracting(e -> ((UnauthenticatedException) e).reason())
                    .isEqualTo(UnauthenticatedException.Reason.MISSING_TOKEN);
        }
    }
}
