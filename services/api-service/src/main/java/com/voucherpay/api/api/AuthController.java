package com.voucherpay.api.api;

import com.voucherpay.api.domain.PasswordHasher;
import com.voucherpay.api.domain.PasswordResetNotifier;
import com.voucherpay.api.domain.UserDirectory;
import com.voucherpay.api.domain.UserRecord;
import com.voucherpay.security.AuthenticatedUser;
import com.voucherpay.security.ClaimSet;
import com.voucherpay.security.IssuedToken;
import com.voucherpay.security.SessionTokenIssuer;
import com.voucherpay.security.SessionTokenVerifier;
import com.voucherpay.security.SubjectClaims;
import com.voucherpay.security.TokenType;
import com.voucherpay.security.totp.ProvisioningArtifact;
import com.voucherpay.security.totp.TotpService;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

/**
 * Login, token refresh, two-factor enrolment and password reset.
 *
 * <p>Two-factor enrolment is two-phase: {@code /2fa/setup} returns a fresh secret without
 * storing it, and {@code /2fa/verify} stores it only after a code generated from it checks out.
 */
@RestController
@RequestMapping("/api/v1/auth")
public class AuthController {

    private static final Logger log = LoggerFactory.getLogger(AuthController.class);

    static final String INVALID_CREDENTIALS = "Incorrect username or password";
    static final String INVALID_CODE = "Invalid verification code";
    static final String INVALID_RESET_TOKEN = "Invalid or expired reset token";

    private final UserDirectory users;
    private final PasswordHasher passwordHasher;
    private final PasswordResetNotifier resetNotifier;
    private final SessionTokenIssuer issuer;
    private final SessionTokenVerifier verifier;
    private final TotpService totp;

    public AuthController(
            UserDirectory users,
            PasswordHasher passwordHasher,
            PasswordResetNotifier resetNotifier,
            SessionTokenIssuer issuer,
            SessionTokenVerifier verifier,
            TotpService totp) {
        this.users = users;
        this.passwordHasher = passwordHasher;
        this.resetNotifier = resetNotifier;
        this.issuer = issuer;
        this.verifier = verifier;
        this.totp = totp;
    }

    @PostMapping("/login")
    public TokenResponse login(@Valid @RequestBody AuthRequests.Login request) {
        UserRecord user = users.findByIdentifier(request.username())
                .filter(u -> passwordHasher.verify(request.password(), u.passwordHash()))
                .orElseThrow(() -> {
                    log.info("Login rejected for {}", request.username());
                    return new ResponseStatusException(HttpStatus.UNAUTHORIZED, INVALID_CREDENTIALS);
                });

        if (user.twoFactorEnabled()) {
            if (request.totpCode() == null || request.totpCode().isBlank()) {
                throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Two-factor code required");
            }
            if (!totp.verifyCode(user.totpSecret(), request.totpCode())) {
                throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, INVALID_CODE);
            }
        }

        SubjectClaims subject = user.subjectClaims();
        log.info("User {} logged in", user.id());
        return TokenResponse.of(issuer.issueAccess(subject), issuer.issueRefresh(subject), userView(subject));
    }

    @PostMapping("/register")
    public Map<String, Object> register() {
        return Map.of(
                "message", "Registration successful",
                "next_steps", List.of(
                        "Verify your email address",
                        "Complete your accessibility profile",
                        "Set up two-factor authentication (optional)",
                        "Explore empowerment features"),
                "accessibility", Map.of(
                        "profile_setup_available", true,
                        "wcag_compliant_forms", true,
                        "screen_reader_instructions",
                        "Use tab to navigate through registration form. All fields have descriptive labels."));
    }

    /** Issues a new access token carrying the refresh token's subject claims. */
    @PostMapping("/refresh")
    public TokenResponse refresh(@Valid @RequestBody AuthRequests.Refresh request) {
        ClaimSet claims = verifier.verify(request.refreshToken(), TokenType.REFRESH);
        SubjectClaims subject = SubjectClaims.from(claims);
        return TokenResponse.of(issuer.issueAccess(subject), null, userView(subject));
    }

    @PostMapping("/2fa/setup")
    public Map<String, Object> setupTwoFactor(AuthenticatedUser user) {
        String secret = totp.generateSecret();
        String account = user.email() != null ? user.email() : user.userId();
        ProvisioningArtifact artifact = totp.provisioningArtifact(account, secret);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("secret", secret);
        body.put("qr_code", artifact.qrCodeBase64());
        body.put("manual_entry_key", artifact.manualEntryKey());
        body.put("provisioning_uri", artifact.uri());
        body.put("instructions", Map.of(
                "step_1", "Install an authenticator app (Google Authenticator, Authy, etc.)",
                "step_2", "Scan the QR code or enter the manual key",
                "step_3", "Enter the 6-digit code from your app to verify setup",
                "accessibility_note", "QR code alternative: Use the manual entry key provided above"));
        body.put("accessibility", Map.of(
                "qr_code_alt_text", "QR code for two-factor authentication setup",
                "manual_entry_available", true,
                "screen_reader_instructions",
                "QR code image is provided. For manual entry, use the secret key displayed above."));
        return body;
    }

    @PostMapping("/2fa/verify")
    public Map<String, Object> verifyTwoFactor(
            AuthenticatedUser user, @Valid @RequestBody AuthRequests.VerifyTwoFactor request) {
        Optional<UserRecord> stored = users.findByIdentifier(user.userId());
        String secret = request.secret() != null && !request.secret().isBlank()
                ? request.secret()
                : stored.map(UserRecord::totpSecret)
                        .orElseThrow(() -> new IllegalArgumentException("no pending two-factor secret"));

        if (!totp.verifyCode(secret, request.code())) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, INVALID_CODE);
        }

        if (stored.isPresent()) {
            users.activateTwoFactor(user.userId(), secret);
            log.info("Two-factor authentication enabled for {}", user.userId());
        } else {
            log.warn("Two-factor code verified for {} but no stored user to activate", user.userId());
        }
        return Map.of(
                "message", "Two-factor authentication verified successfully",
                "two_factor_enabled", stored.isPresent(),
                "accessibility", Map.of(
                        "screen_reader_message", "Two-factor authentication is now active on your account."));
    }

    /** Always answers the same way so the response does not reveal whether the account exists. */
    @PostMapping("/forgot-password")
    public Map<String, Object> forgotPassword(@Valid @RequestBody AuthRequests.ForgotPassword request) {
        Optional<UserRecord> user = users.findByIdentifier(request.email());
        if (user.isPresent()) {
            IssuedToken token = issuer.issuePasswordReset(user.get().email());
            resetNotifier.sendResetLink(user.get().email(), token);
        } else {
            log.debug("Password reset requested for an unknown address");
        }
        return Map.of(
                "message", "Password reset instructions sent to your email",
                "email", request.email(),
                "accessibility", Map.of(
                        "email_format", "HTML and plain text versions available",
                        "screen_reader_optimized", true,
                        "clear_instructions", "Email contains step-by-step instructions with clear headings"),
                "next_steps", List.of(
                        "Check your email inbox (and spam folder)",
                        "Click the reset link or copy it to your browser",
                        "Create a new secure password",
                        "Log in with your new password"));
    }

    @PostMapping("/reset-password")
    public Map<String, Object> resetPassword(@Valid @RequestBody AuthRequests.ResetPassword request) {
        String email = verifier.verifyPasswordReset(request.token())
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST, INVALID_RESET_TOKEN));
        UserRecord user = users.findByIdentifier(email)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST, INVALID_RESET_TOKEN));

        users.updatePasswordHash(user.id(), passwordHasher.hash(request.newPassword()));
        log.info("Password reset for {}", user.id());
        return Map.of(
                "message", "Password reset successfully",
                "email", email,
                "accessibility", Map.of(
                        "login_ready", true,
                        "screen_reader_message",
                        "Your password has been reset successfully. You can now log in with your new password."),
                "next_steps", List.of(
                        "Log in with your new password",
                        "Consider enabling two-factor authentication for added security"));
    }

    @PostMapping("/logout")
    public Map<String, Object> logout(AuthenticatedUser user) {
        log.info("User {} logged out", user.userId());
        return Map.of(
                "message", "Logged out successfully",
                "accessibility", Map.of(
                        "screen_reader_message",
                        "You have been logged out successfully. Thank you for using VoucherPay Enterprise.",
                        "redirect_suggestion", "You will be redirected to the login page"));
    }

    @GetMapping("/me")
    public Map<String, Object> me(AuthenticatedUser user) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("user", userView(SubjectClaims.from(user.claims())));
        body.put("two_factor_enabled", users.findByIdentifier(user.userId())
                .map(UserRecord::twoFactorEnabled)
                .orElse(false));
        return body;
    }

    private static Map<String, Object> userView(SubjectClaims subject) {
        Map<String, Object> view = new LinkedHashMap<>();
        view.put("id", subject.subject());
        view.put("email", subject.email());
        view.put("role", subject.role());
        return view;
    }
}
