package com.voucherpay.security;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies tokens for a specific operation.
 * <p>
 * {@link #verify(String, TokenType)} fails closed with {@link UnauthenticatedException};
 * {@link #verifyPasswordReset(String)} reports an unusable reset link as an empty result,
 * because the reset flow treats it as an ordinary negative outcome.
 */
public class SessionTokenVerifier {

    private static final Logger log = LoggerFactory.getLogger(SessionTokenVerifier.class);

    private final TokenCodec codec;

    public SessionTokenVerifier(TokenCodec codec) {
        this.codec = codec;
    }

    /**
     * Decodes the token and checks that it was issued as {@code expected}.
     *
     * @param token    compact serialized token
     * @param expected the type this operation accepts
     * @return the verified claims
     * @throws UnauthenticatedException on any decode failure or type mismatch
     */
    public ClaimSet verify(String token, TokenType expected) {
        if (expected == null) {
            throw new IllegalArgumentException("expected type must not be null");
        }
        if (token == null || token.isBlank()) {
            throw new UnauthenticatedException(UnauthenticatedException.Reason.MISSING_TOKEN);
        }
        ClaimSet claims;
        try {
            claims = codec.decode(token);
        } catch (TokenException e) {
            UnauthenticatedException.Reason reason = reasonFor(e);
            log.warn("Rejected {} token: {} ({})", expected.claimValue(), reason, e.getMessage());
            throw new UnauthenticatedException(reason, e);
        }
        if (claims.type() != expected) {
            var mismatch = new TokenTypeMismatchException(expected, claims.type());
            log.warn("Rejected token: {}", mismatch.getMessage());
            throw new UnauthenticatedException(UnauthenticatedException.Reason.TYPE_MISMATCH, mismatch);
        }
        return claims;
    }

    /**
     * Resolves a password-reset token to the email it was issued for.
     *
     * @param token the reset token from the reset link
     * @return the email, or empty if the token is invalid, expired or not a reset token
     * @throws IllegalArgumentException if {@code token} is null
     */
    public Optional<String> verifyPasswordReset(String token) {
        if (token == null) {
            throw new IllegalArgumentException("token must not be null");
        }
        try {
            ClaimSet claims = codec.decode(token);
            if (claims.type() != TokenType.PASSWORD_RESET) {
                log.info("Password reset attempted with a {} token", claims.type().claimValue());
                return Optional.empty();
            }
            return Optional.ofNullable(claims.subject());
        } catch (TokenException e) {
            log.info("Password reset token rejected: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private static UnauthenticatedException.Reason reasonFor(TokenException e) {
        if (e instanceof TokenExpiredException) {
            return UnauthenticatedException.Reason.EXPIRED;
        }
        if (e instanceof InvalidSignatureException) {
            return UnauthenticatedException.Reason.INVALID_SIGNATURE;
        }
        return UnauthenticatedException.Reason.MALFORMED;
    }
}
