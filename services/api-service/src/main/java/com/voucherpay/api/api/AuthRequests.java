package com.voucherpay.api.api;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Request bodies of the {@code /api/v1/auth} endpoints (snake_case JSON).
 */
public final class AuthRequests {

    private AuthRequests() {
        // namespace
    }

    /**
     * @param username email or username
     * @param totpCode one-time code, required once two-factor login is on
     */
    public record Login(@NotBlank String username, @NotBlank String password, String totpCode) {

        @Override
        public String toString() {
            return "Login[username=" + username + "]";
        }
    }

    public record Refresh(@NotBlank String refreshToken) {

        @Override
        public String toString() {
            return "Refresh[]";
        }
    }

    /**
     * @param code   one-time code from the authenticator app
     * @param secret pending secret returned by setup; the stored secret is used when absent
     */
    public record VerifyTwoFactor(@NotBlank String code, String secret) {

        @Override
        public String toString() {
            return "VerifyTwoFactor[]";
        }
    }

    public record ForgotPassword(@NotBlank @Email String email) {
    }

    public record ResetPassword(@NotBlank String token, @NotBlank @Size(min = 8, max = 128) String newPassword) {

        @Override
        public String toString() {
            return "ResetPassword[]";
        }
    }
}
