package com.voucherpay.security;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Issues access, refresh and password-reset tokens.
 * <p>
 * Each token gets its {@code type} discriminator and an {@code exp} computed from the
 * injected clock. Nothing is stored; a token is valid purely by signature and expiry.
 */
public class SessionTokenIssuer {

    private static final Logger log = LoggerFactory.getLogger(SessionTokenIssuer.class);

    private final TokenCodec codec;
    private final TokenSettings settings;
    private final ClockSource clock;

    public SessionTokenIssuer(TokenCodec codec, TokenSettings settings, ClockSource clock) {
        this.codec = codec;
        this.settings = settings;
        this.clock = clock;
    }

    /** Issues an access token with the configured default lifetime. */
    public IssuedToken issueAccess(SubjectClaims subject) {
        return issueAccess(subject, settings.accessTokenTtl());
    }

    /**
     * Issues an access token.
     *
     * @param subject identity claims
     * @param ttl     lifetime; must be positive
     */
    public IssuedToken issueAccess(SubjectClaims subject, Duration ttl) {
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        return issueForSubject(subject, TokenType.ACCESS, ttl);
    }

    /** Issues a refresh token with the configured refresh lifetime. */
    public IssuedToken issueRefresh(SubjectClaims subject) {
        return issueForSubject(subject, TokenType.REFRESH, settings.refreshTokenTtl());
    }

    /**
     * Issues a password-reset token whose subject is the email address.
     * The token carries {@code nbf = now}.
     *
     * @param email the account email
     */
    public IssuedToken issuePasswordReset(String email) {
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("email must not be null or blank");
        }
        Instant now = issuedAt();
        Instant exp = now.plus(settings.passwordResetTtl());
        var claims = new ClaimSet(email, null, null, TokenType.PASSWORD_RESET, exp, now, Map.of());
        String value = codec.encode(claims);
        log.debug("Issued password_reset token exp={}", exp);
        return new IssuedToken(value, TokenType.PASSWORD_RESET, now, exp);
    }

    private IssuedToken issueForSubject(SubjectClaims subject, TokenType type, Duration ttl) {
        if (subject == null) {
            throw new IllegalArgumentException("subject must not be null");
        }
        Instant now = issuedAt();
        Instant exp = now.plus(ttl);
        String value = codec.encode(ClaimSet.forSubject(subject, type, exp));
        log.debug("Issued {} token sub={} exp={}", type.claimValue(), subject.subject(), exp);
        return new IssuedToken(value, type, now, exp);
    }

    // exp and nbf travel as whole seconds
    private Instant issuedAt() {
        return clock.now().truncatedTo(ChronoUnit.SECONDS);
    }
}
