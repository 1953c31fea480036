package com.voucherpay.security.totp;

import java.time.Duration;

/**
 * TOTP parameters shared by secret generation, provisioning and verification.
 *
 * @param issuer       issuer label shown by authenticator apps
 * @param digits       code length (6 or 8)
 * @param period       time step
 * @param window       accepted steps either side of the current one
 * @param secretLength base32 secret length in characters; a multiple of 8
 */
public record TotpSettings(String issuer, int digits, Duration period, int window, int secretLength) {

    public static final String DEFAULT_ISSUER = "VoucherPay Enterprise";
    public static final int DEFAULT_DIGITS = 6;
    public static final Duration DEFAULT_PERIOD = Duration.ofSeconds(30);
    public static final int DEFAULT_WINDOW = 1;
    public static final int DEFAULT_SECRET_LENGTH = 32;

    public TotpSettings {
        if (issuer == null || issuer.isBlank()) {
            issuer = DEFAULT_ISSUER;
        }
        if (digits <= 0) {
            digits = DEFAULT_DIGITS;
        }
        if (digits != 6 && digits != 8) {
            throw new IllegalArgumentException("digits must be 6 or 8");
        }
        if (period == null || period.getSeconds() <= 0) {
            period = DEFAULT_PERIOD;
        }
        if (window < 0) {
            throw new IllegalArgumentException("window must not be negative");
        }
        if (secretLength <= 0) {
            secretLength = DEFAULT_SECRET_LENGTH;
        }
        if (secretLength % 8 != 0) {
            throw new IllegalArgumentException("secretLength must be a multiple of 8");
        }
    }

    /** 30 s steps, 6 digits, one step of tolerance, 32-character secrets. */
    public static TotpSettings defaults() {
        return new TotpSettings(DEFAULT_ISSUER, DEFAULT_DIGITS, DEFAULT_PERIOD, DEFAULT_WINDOW, DEFAULT_SECRET_LENGTH);
    }
}
