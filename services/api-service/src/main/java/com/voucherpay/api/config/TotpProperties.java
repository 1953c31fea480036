package com.voucherpay.api.config;

import com.voucherpay.security.totp.TotpSettings;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Two-factor settings, bound from {@code voucherpay.security.totp.*}. Unset values take the
 * {@link TotpSettings} defaults.
 */
@ConfigurationProperties(prefix = "voucherpay.security.totp")
public record TotpProperties(String issuer, Integer digits, Duration period, Integer window, Integer secretLength) {

    public TotpSettings toSettings() {
        return new TotpSettings(
                issuer,
                digits == null ? TotpSettings.DEFAULT_DIGITS : digits,
                period,
                window == null ? TotpSettings.DEFAULT_WINDOW : window,
                secretLength == null ? TotpSettings.DEFAULT_SECRET_LENGTH : secretLength);
    }
}
