package com.voucherpay.api.domain;

import com.voucherpay.security.IssuedToken;

/**
 * Outbound delivery of password-reset links.
 */
@FunctionalInterface
public interface PasswordResetNotifier {

    void sendResetLink(String email, IssuedToken resetToken);
}
