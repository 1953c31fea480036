package com.voucherpay.api.config;

import com.voucherpay.security.ClockSource;
import com.voucherpay.security.SessionTokenIssuer;
import com.voucherpay.security.SessionTokenVerifier;
import com.voucherpay.security.TokenCodec;
import com.voucherpay.security.TokenSettings;
import com.voucherpay.security.totp.TotpService;
import java.time.Clock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * Wires the token and two-factor classes from validated configuration. Settings are built
 * once here; nothing below reads configuration again.
 */
@Configuration
public class SecurityConfig {

    private static final Logger log = LoggerFactory.getLogger(SecurityConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ClockSource clockSource(Clock clock) {
        return ClockSource.fromClock(clock);
    }

    @Bean
    public TokenSettings tokenSettings(JwtProperties properties) {
        TokenSettings settings = properties.toSettings();
        log.info("Token signing configured: {}", settings);
        return settings;
    }

    @Bean
    public TokenCodec tokenCodec(TokenSettings settings, ClockSource clock) {
        return new TokenCodec(settings, clock);
    }

    @Bean
    public SessionTokenIssuer sessionTokenIssuer(TokenCodec codec, TokenSettings settings, ClockSource clock) {
        return new SessionTokenIssuer(codec, settings, clock);
    }

    @Bean
    public SessionTokenVerifier sessionTokenVerifier(TokenCodec codec) {
        return new SessionTokenVerifier(codec);
    }

    @Bean
    public TotpService totpService(TotpProperties properties, ClockSource clock) {
        return new TotpService(properties.toSettings(), clock);
    }

    @Bean
    public PasswordEncoder passwordEncoder() {
        return new BCryptPasswordEncoder();
    }
}
