package com.voucherpay.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.voucherpay.security.testing.MutableClockSource;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

/**
 * Issuance and verification of access, refresh and password-reset tokens.
 */
@DisplayName("Session token lifecycle")
class SessionTokenLifecycleTest {

    private MutableClockSource clock;
    private SessionTokenIssuer issuer;
    private SessionTokenVerifier verifier;

    private final SubjectClaims user = new SubjectClaims("u1", "u1@example.com", "user", Map.of("plan", "basic"));

    @BeforeEach
    void setUp() {
        clock = TestTokens.clock();
        TokenSettings settings = TestTokens.settings();
        TokenCodec codec = new TokenCodec(settings, clock);
        issuer = new SessionTokenIssuer(codec, settings, clock);
        verifier = new SessionTokenVerifier(codec);
    }

    private UnauthenticatedException.Reason reasonOf(Runnable call) {
        try {
            call.run();
        } catch (UnauthenticatedException e) {
            return e.reason();
        }
        throw new AssertionError("expected UnauthenticatedException");
    }

    @Nested
    @DisplayName("access tokens")
    class AccessTokens {

        @Test
        @DisplayName("verify before expiry returns the subject claims plus type")
        void verifiesBeforeExpiry() {
            IssuedToken token = issuer.issueAccess(user, Duration.ofMinutes(30));

            ClaimSet claims = verifier.verify(token.value(), TokenType.ACCESS);

            assertThat(claims.subject()).isEqualTo("u1");
            assertThat(claims.email()).isEqualTo("u1@example.com");
            assertThat(claims.role()).isEqualTo("user");
            assertThat(claims.type()).isEqualTo(TokenType.ACCESS);
            assertThat(claims.additional()).containsEntry("plan", "basic");
            assertThat(claims.expiresAt()).isEqualTo(TestTokens.START.plus(Duration.ofMinutes(30)));
        }

        @Test
        @DisplayName("reports expires_in from the ttl")
        void expiresIn() {
            assertThat(issuer.issueAccess(user, Duration.ofMinutes(30)).expiresInSeconds()).isEqualTo(1800);
            assertThat(issuer.issueAccess(user).expiresInSeconds()).isEqualTo(1800);
        }

        @Test
        @DisplayName("fails as unauthenticated 31 minutes after a 30 minute token was issued")
        void expiresAfterTtl() {
            IssuedToken token = issuer.issueAccess(new SubjectClaims("u1", null, "user"), Duration.ofMinutes(30));
            assertThat(verifier.verify(token.value(), TokenType.ACCESS).subject()).isEqualTo("u1");

            clock.advance(Duration.ofMinutes(31));

            assertThatThrownBy(() -> verifier.verify(token.value(), TokenType.ACCESS))
                    .isInstanceOf(UnauthenticatedException.class)
                    .hasMessage(UnauthenticatedException.MESSAGE)
                    .hasCauseInstanceOf(TokenExpiredException.class);
        }

        @Test
        @DisplayName("rejects a non-positive ttl")
        void rejectsBadTtl() {
            assertThatThrownBy(() -> issuer.issueAccess(user, Duration.ZERO))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("sub-second issuance clock")
    class SubSecondClock {

        private final Instant issuedAt = Instant.parse("2024-01-01T12:00:00.700Z");

        @BeforeEach
        void startMidSecond() {
            clock.set(issuedAt);
        }

        @Test
        @DisplayName("reported expiry matches the exp carried in the token")
        void reportedExpiryMatchesWire() {
            IssuedToken token = issuer.issueAccess(user, Duration.ofMinutes(30));

            assertThat(token.expiresAt()).isEqualTo(Instant.parse("2024-01-01T12:30:00Z"));
            assertThat(verifier.verify(token.value(), TokenType.ACCESS).expiresAt()).isEqualTo(token.expiresAt());
        }

        @Test
        @DisplayName("an access token still verifies at the reported expiry instant")
        void validUntilReportedExpiry() {
            IssuedToken token = issuer.issueAccess(user, Duration.ofMinutes(30));

            clock.set(token.expiresAt());
            assertThat(verifier.verify(token.value(), TokenType.ACCESS).subject()).isEqualTo("u1");

            clock.advance(Duration.ofMillis(1));
            assertThat(reasonOf(() -> verifier.verify(token.value(), TokenType.ACCESS)))
                    .isEqualTo(UnauthenticatedException.Reason.EXPIRED);
        }

        @Test
        @DisplayName("a reset token's nbf and exp are whole seconds")
        void resetTokenWholeSeconds() {
            IssuedToken token = issuer.issuePasswordReset("a@b.com");
            ClaimSet claims = new TokenCodec(TestTokens.settings(), clock).decode(token.value());

            assertThat(claims.notBefore()).isEqualTo(Instant.parse("2024-01-01T12:00:00Z"));
            assertThat(claims.expiresAt()).isEqualTo(token.expiresAt());
            assertThat(token.expiresInSeconds()).isEqualTo(3600);
        }
    }

    @Nested
    @DisplayName("type confusion")
    class TypeConfusion {

        @Test
        @DisplayName("a refresh token is never accepted as an access token")
        void refreshAsAccess() {
            IssuedToken refresh = issuer.issueRefresh(user);

            assertThat(reasonOf(() -> verifier.verify(refresh.value(), TokenType.ACCESS)))
                    .isEqualTo(UnauthenticatedException.Reason.TYPE_MISMATCH);
        }

        @Test
        @DisplayName("an access token is never accepted as a refresh token")
        void accessAsRefresh() {
            IssuedToken access = issuer.issueAccess(user);

            assertThat(reasonOf(() -> verifier.verify(access.value(), TokenType.REFRESH)))
                    .isEqualTo(UnauthenticatedException.Reason.TYPE_MISMATCH);
        }

        @ParameterizedTest
        @EnumSource(value = TokenType.class, names = {"ACCESS", "REFRESH"})
        @DisplayName("a password-reset token is accepted by neither session operation")
        void resetAsSession(TokenType expected) {
            IssuedToken reset = issuer.issuePasswordReset("a@b.com");

            assertThat(reasonOf(() -> verifier.verify(reset.value(), expected)))
                    .isEqualTo(UnauthenticatedException.Reason.TYPE_MISMATCH);
        }

        @Test
        @DisplayName("every failure carries the same public message")
        void sameMessageForEveryReason() {
            String refresh = issuer.issueRefresh(user).value();
            String access = issuer.issueAccess(user, Duration.ofMinutes(1)).value();

            UnauthenticatedException mismatch = catchUnauthenticated(() -> verifier.verify(refresh, TokenType.ACCESS));
            UnauthenticatedException garbage = catchUnauthenticated(() -> verifier.verify("x.y.z", TokenType.ACCESS));
            clock.advance(Duration.ofMinutes(2));
            UnauthenticatedException expired = catchUnauthenticated(() -> verifier.verify(access, TokenType.ACCESS));

            assertThat(mismatch.getMessage()).isEqualTo(garbage.getMessage()).isEqualTo(expired.getMessage());
            assertThat(mismatch.reason()).isEqualTo(UnauthenticatedException.Reason.TYPE_MISMATCH);
            assertThat(garbage.reason()).isEqualTo(UnauthenticatedException.Reason.MALFORMED);
            assertThat(expired.reason()).isEqualTo(UnauthenticatedException.Reason.EXPIRED);
        }

        private UnauthenticatedException catchUnauthenticated(Runnable call) {
            try {
                call.run();
            } catch (UnauthenticatedException e) {
                return e;
            }
            throw new AssertionError("expected UnauthenticatedException");
        }
    }

    @Test
    @DisplayName("refresh tokens live for the configured number of days")
    void refreshLifetime() {
        IssuedToken refresh = issuer.issueRefresh(user);

        assertThat(refresh.expiresAt()).isEqualTo(TestTokens.START.plus(Duration.ofDays(7)));
        clock.advance(Duration.ofDays(6));
        assertThat(verifier.verify(refresh.value(), TokenType.REFRESH).subject()).isEqualTo("u1");
    }

    @Test
    @DisplayName("a missing token is unauthenticated")
    void missingToken() {
        assertThat(reasonOf(() -> verifier.verify(null, TokenType.ACCESS)))
                .isEqualTo(UnauthenticatedException.Reason.MISSING_TOKEN);
    }

    @Nested
    @DisplayName("password reset")
    class PasswordReset {

        @Test
        @DisplayName("resolves to the email immediately after issuance")
        void resolvesEmail() {
            String token = issuer.issuePasswordReset("a@b.com").value();

            assertThat(verifier.verifyPasswordReset(token)).contains("a@b.com");
        }

        @Test
        @DisplayName("carries nbf = issuance time")
        void carriesNotBefore() {
            TokenCodec codec = new TokenCodec(TestTokens.settings(), clock);
            ClaimSet claims = codec.decode(issuer.issuePasswordReset("a@b.com").value());

            assertThat(claims.notBefore()).isEqualTo(TestTokens.START);
            assertThat(claims.expiresAt()).isEqualTo(TestTokens.START.plus(Duration.ofHours(1)));
        }

        @Test
        @DisplayName("returns empty once the clock passes one hour")
        void emptyAfterAnHour() {
            String token = issuer.issuePasswordReset("a@b.com").value();
            clock.advance(Duration.ofHours(1).plusSeconds(1));

            assertThat(verifier.verifyPasswordReset(token)).isEmpty();
        }

        @Test
        @DisplayName("returns empty for an access token or garbage")
        void emptyForWrongInput() {
            assertThat(verifier.verifyPasswordReset(issuer.issueAccess(user).value())).isEmpty();
            assertThat(verifier.verifyPasswordReset("garbage")).isEmpty();
        }

        @Test
        @DisplayName("raises only for null input")
        void nullInput() {
            assertThatThrownBy(() -> verifier.verifyPasswordReset(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
