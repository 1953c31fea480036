package com.voucherpay.security;

import com.nimbusds.jose.JWSAlgorithm;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;

/**
 * Process-wide token configuration: signing secret, HMAC algorithm and lifetimes.
 * <p>
 * Built once at startup and handed to {@link TokenCodec} and {@link SessionTokenIssuer}; the
 * core never reads configuration from anywhere else.
 *
 * @param secret             shared HMAC secret; must be at least as long as the algorithm's digest
 * @param algorithm          "HS256", "HS384" or "HS512"
 * @param accessTokenTtl     default access token lifetime
 * @param refreshTokenTtl    refresh token lifetime; must exceed the access lifetime
 * @param passwordResetTtl   password-reset token lifetime
 */
public record TokenSettings(
        String secret,
        String algorithm,
        Duration accessTokenTtl,
        Duration refreshTokenTtl,
        Duration passwordResetTtl
) {

    public static final String DEFAULT_ALGORITHM = "HS256";
    public static final Duration DEFAULT_ACCESS_TTL = Duration.ofMinutes(30);
    public static final Duration DEFAULT_REFRESH_TTL = Duration.ofDays(7);
    public static final Duration DEFAULT_PASSWORD_RESET_TTL = Duration.ofHours(1);

    private static final Map<String, Integer> MIN_SECRET_BYTES = Map.of(
            "HS256", 32,
            "HS384", 48,
            "HS512", 64);

    public TokenSettings {
        if (algorithm == null || algorithm.isBlank()) {
            algorithm = DEFAULT_ALGORITHM;
        }
        algorithm = algorithm.strip().toUpperCase();
        Integer minBytes = MIN_SECRET_BYTES.get(algorithm);
        if (minBytes == null) {
            throw new IllegalArgumentException("Unsupported token algorithm: " + algorithm);
        }
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < minBytes) {
            throw new IllegalArgumentException(
                    "secret must be at least %d bytes for %s".formatted(minBytes, algorithm));
        }
        accessTokenTtl = positiveOr(accessTokenTtl, DEFAULT_ACCESS_TTL);
        refreshTokenTtl = positiveOr(refreshTokenTtl, DEFAULT_REFRESH_TTL);
        passwordResetTtl = positiveOr(passwordResetTtl, DEFAULT_PASSWORD_RESET_TTL);
        if (refreshTokenTtl.compareTo(accessTokenTtl) <= 0) {
            throw new IllegalArgumentException("refreshTokenTtl must be longer than accessTokenTtl");
        }
    }

    /** Settings with default algorithm and lifetimes. */
    public static TokenSettings withSecret(String secret) {
        return new TokenSettings(secret, null, null, null, null);
    }

    /** The Nimbus algorithm constant for {@link #algorithm()}. */
    public JWSAlgorithm jwsAlgorithm() {
        return JWSAlgorithm.parse(algorithm);
    }

    byte[] secretBytes() {
        return secret.getBytes(StandardCharsets.UTF_8);
    }

    /** Keeps the secret out of logs. */
    @Override
    public String toString() {
        return "TokenSettings[algorithm=%s, accessTokenTtl=%s, refreshTokenTtl=%s, passwordResetTtl=%s]"
                .formatted(algorithm, accessTokenTtl, refreshTokenTtl, passwordResetTtl);
    }

    private static Duration positiveOr(Duration value, Duration fallback) {
        return value == null || value.isZero() || value.isNegative() ? fallback : value;
    }
}
