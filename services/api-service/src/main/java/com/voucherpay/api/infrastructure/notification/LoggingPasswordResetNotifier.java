package com.voucherpay.api.infrastructure.notification;

import com.voucherpay.api.domain.PasswordResetNotifier;
import com.voucherpay.security.IssuedToken;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Stands in for email delivery: records that a reset link was issued, never the token itself.
 */
@Component
public class LoggingPasswordResetNotifier implements PasswordResetNotifier {

    private static final Logger log = LoggerFactory.getLogger(LoggingPasswordResetNotifier.class);

    @Override
    public void sendResetLink(String email, IssuedToken resetToken) {
        log.info("Password reset link issued for {} (expires {})", email, resetToken.expiresAt());
    }
}
