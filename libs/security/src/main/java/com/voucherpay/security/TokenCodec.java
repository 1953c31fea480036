package com.voucherpay.security;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSHeader;
import com.nimbusds.jose.JWSSigner;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACSigner;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import java.text.ParseException;
import java.time.Instant;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Encodes {@link ClaimSet}s as compact HMAC-signed JWTs and decodes them back.
 * <p>
 * Wire format: {@code base64url(header).base64url(claims).base64url(signature)}; {@code exp}
 * and {@code nbf} are NumericDate seconds. Decoding checks, in order: structure, algorithm,
 * signature, expiry. {@code nbf} is read but not enforced.
 * <p>
 * Thread-safe: the signer and verifier are created once and only read afterwards.
 */
public final class TokenCodec {

    private final TokenSettings settings;
    private final ClockSource clock;
    private final JWSSigner signer;
    private final JWSVerifier verifier;

    public TokenCodec(TokenSettings settings, ClockSource clock) {
        if (settings == null || clock == null) {
            throw new IllegalArgumentException("settings and clock must not be null");
        }
        this.settings = settings;
        this.clock = clock;
        try {
            this.signer = new MACSigner(settings.secretBytes());
            this.verifier = new MACVerifier(settings.secretBytes());
        } catch (JOSEException e) {
            throw new IllegalArgumentException("Secret is not usable for " + settings.algorithm(), e);
        }
    }

    /**
     * Signs the claim set.
     *
     * @param claims the claims to encode
     * @return the compact serialized token
     */
    public String encode(ClaimSet claims) {
        if (claims == null) {
            throw new IllegalArgumentException("claims must not be null");
        }
        JWTClaimsSet.Builder builder = new JWTClaimsSet.Builder();
        claims.additional().forEach(builder::claim);
        builder.subject(claims.subject())
                .expirationTime(Date.from(claims.expiresAt()))
                .claim(ClaimNames.TYPE, claims.type().claimValue());
        if (claims.email() != null) {
            builder.claim(ClaimNames.EMAIL, claims.email());
        }
        if (claims.role() != null) {
            builder.claim(ClaimNames.ROLE, claims.role());
        }
        if (claims.notBefore() != null) {
            builder.notBeforeTime(Date.from(claims.notBefore()));
        }

        SignedJWT jwt = new SignedJWT(new JWSHeader(settings.jwsAlgorithm()), builder.build());
        try {
            jwt.sign(signer);
        } catch (JOSEException e) {
            throw new IllegalStateException("Failed to sign token", e);
        }
        return jwt.serialize();
    }

    /**
     * Verifies and decodes a token.
     *
     * @param token compact serialized token
     * @return the decoded claims
     * @throws MalformedTokenException   if the token cannot be parsed or lacks required claims
     * @throws InvalidSignatureException if the algorithm differs or the signature does not verify
     * @throws TokenExpiredException     if {@code exp} is before the current instant
     */
    public ClaimSet decode(String token) {
        if (token == null || token.isBlank()) {
            throw new MalformedTokenException("Token is empty");
        }
        SignedJWT jwt;
        JWTClaimsSet raw;
        try {
            jwt = SignedJWT.parse(token.strip());
            raw = jwt.getJWTClaimsSet();
        } catch (ParseException e) {
            throw new MalformedTokenException("Token is not a signed JWT", e);
        }

        if (!settings.jwsAlgorithm().equals(jwt.getHeader().getAlgorithm())) {
            throw new InvalidSignatureException("Unexpected algorithm " + jwt.getHeader().getAlgorithm());
        }
        try {
            if (!jwt.verify(verifier)) {
                throw new InvalidSignatureException("Signature does not verify");
            }
        } catch (JOSEException e) {
            throw new InvalidSignatureException("Signature could not be verified", e);
        }

        ClaimSet claims = toClaimSet(raw);
        Instant now = clock.now();
        if (claims.isExpiredAt(now)) {
            throw new TokenExpiredException(claims.expiresAt(), now);
        }
        return claims;
    }

    private static ClaimSet toClaimSet(JWTClaimsSet raw) {
        Date exp = raw.getExpirationTime();
        if (exp == null) {
            throw new MalformedTokenException("Token has no exp claim");
        }
        String typeValue;
        String email;
        String role;
        try {
            typeValue = raw.getStringClaim(ClaimNames.TYPE);
            email = raw.getStringClaim(ClaimNames.EMAIL);
            role = raw.getStringClaim(ClaimNames.ROLE);
        } catch (ParseException e) {
            throw new MalformedTokenException("Token has a non-string claim where a string is required", e);
        }
        TokenType type = TokenType.fromClaimValue(typeValue)
                .orElseThrow(() -> new MalformedTokenException("Token has unknown type '" + typeValue + "'"));

        Map<String, Object> additional = new LinkedHashMap<>();
        raw.getClaims().forEach((name, value) -> {
            if (!ClaimNames.RESERVED.contains(name) && value != null) {
                additional.put(name, value);
            }
        });
        Date nbf = raw.getNotBeforeTime();
        return new ClaimSet(
                raw.getSubject(),
                email,
                role,
                type,
                exp.toInstant(),
                nbf == null ? null : nbf.toInstant(),
                additional);
    }
}
