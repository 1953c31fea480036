package com.voucherpay.api.config;

import com.voucherpay.security.TokenSettings;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Token signing configuration, bound from {@code voucherpay.security.jwt.*}.
 *
 * <pre>
 * voucherpay:
 *   security:
 *     jwt:
 *       secret: ${JWT_SECRET}
 *       algorithm: HS256
 *       access-token-ttl: PT30M
 *       refresh-token-ttl: P7D
 * </pre>
 *
 * @param secret           HMAC secret; at least 32 bytes for HS256, 48 for HS384, 64 for HS512
 * @param algorithm        HS256, HS384 or HS512 (default HS256)
 * @param accessTokenTtl   access token lifetime (default 30 minutes)
 * @param refreshTokenTtl  refresh token lifetime (default 7 days)
 * @param passwordResetTtl password-reset token lifetime (default 1 hour)
 */
@ConfigurationProperties(prefix = "voucherpay.security.jwt")
@Validated
public record JwtProperties(
        @NotBlank String secret,
        String algorithm,
        Duration accessTokenTtl,
        Duration refreshTokenTtl,
        Duration passwordResetTtl) {

    /** Builds the immutable settings handed to the token classes; fails fast on a weak secret. */
    public TokenSettings toSettings() {
        return new TokenSettings(secret, algorithm, accessTokenTtl, refreshTokenTtl, passwordResetTtl);
    }

    @Override
    public String toString() {
        return "JwtProperties[algorithm=%s, accessTokenTtl=%s, refreshTokenTtl=%s]"
                .formatted(algorithm, accessTokenTtl, refreshTokenTtl);
    }
}
