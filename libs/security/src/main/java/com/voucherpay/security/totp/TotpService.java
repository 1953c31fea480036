package com.voucherpay.security.totp;

import com.voucherpay.security.ClockSource;
import java.net.URLEncoder;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Instant;
import java.util.Locale;
import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import org.apache.commons.codec.binary.Base32;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * RFC 6238 time-based one-time passwords (HMAC-SHA1).
 * <p>
 * Two-factor enrolment is two-phase: {@link #generateSecret()} and
 * {@link #provisioningArtifact(String, String)} hand a new secret to the user, then
 * {@link #verifyCode(String, String)} must succeed against that secret before the caller
 * stores it and marks 2FA active. This class stores nothing.
 */
public class TotpService {

    private static final Logger log = LoggerFactory.getLogger(TotpService.class);

    private static final String HMAC_ALGORITHM = "HmacSHA1";
    private static final int[] POWERS_OF_TEN = {1, 10, 100, 1_000, 10_000, 100_000, 1_000_000, 10_000_000, 100_000_000};

    private final TotpSettings settings;
    private final ClockSource clock;
    private final SecureRandom random;
    private final QrCodeRenderer qrCodeRenderer;
    private final Base32 base32 = new Base32();

    public TotpService(TotpSettings settings, ClockSource clock) {
        this(settings, clock, new SecureRandom(), new QrCodeRenderer());
    }

    public TotpService(TotpSettings settings, ClockSource clock, SecureRandom random, QrCodeRenderer qrCodeRenderer) {
        this.settings = settings;
        this.clock = clock;
        this.random = random;
        this.qrCodeRenderer = qrCodeRenderer;
    }

    /**
     * Generates a new random base32 secret of {@link TotpSettings#secretLength()} characters.
     */
    public String generateSecret() {
        byte[] bytes = new byte[settings.secretLength() * 5 / 8];
        random.nextBytes(bytes);
        return base32.encodeAsString(bytes);
    }

    /**
     * Builds the {@code otpauth://totp/{issuer}:{account}?secret={secret}&issuer={issuer}} URI.
     * Label parts are percent-encoded; {@code digits} and {@code period} are appended only when
     * they differ from 6 and 30 s.
     *
     * @param accountLabel account name shown in the app, usually the email
     * @param secret       base32 secret
     */
    public String provisioningUri(String accountLabel, String secret) {
        requireSecret(secret);
        if (accountLabel == null || accountLabel.isBlank()) {
            throw new IllegalArgumentException("accountLabel must not be null or blank");
        }
        String issuer = encode(settings.issuer());
        var uri = new StringBuilder("otpauth://totp/")
                .append(issuer).append(':').append(encode(accountLabel))
                .append("?secret=").append(secret)
                .append("&issuer=").append(issuer);
        if (settings.digits() != TotpSettings.DEFAULT_DIGITS) {
            uri.append("&digits=").append(settings.digits());
        }
        if (!settings.period().equals(TotpSettings.DEFAULT_PERIOD)) {
            uri.append("&period=").append(settings.period().getSeconds());
        }
        return uri.toString();
    }

    /**
     * Builds the provisioning URI and its QR rendering.
     *
     * @throws ProvisioningException if the QR code cannot be rendered
     */
    public ProvisioningArtifact provisioningArtifact(String accountLabel, String secret) {
        String uri = provisioningUri(accountLabel, secret);
        return new ProvisioningArtifact(uri, secret, qrCodeRenderer.renderPng(uri));
    }

    /**
     * Checks a submitted code against the current step and {@link TotpSettings#window()} steps
     * either side. Every candidate is compared in constant time.
     *
     * @param secret        base32 secret
     * @param submittedCode the code typed by the user; whitespace is ignored
     * @return true if the code matches any step in the window
     * @throws IllegalArgumentException if the secret is not valid base32
     */
    public boolean verifyCode(String secret, String submittedCode) {
        byte[] key = requireSecret(secret);
        if (submittedCode == null) {
            return false;
        }
        String normalized = submittedCode.replaceAll("\\s", "");
        if (normalized.length() != settings.digits() || !normalized.chars().allMatch(Character::isDigit)) {
            log.debug("TOTP code rejected: wrong format");
            return false;
        }
        byte[] submitted = normalized.getBytes(StandardCharsets.US_ASCII);
        long current = stepAt(clock.now());
        boolean matched = false;
        for (long offset = -settings.window(); offset <= settings.window(); offset++) {
            byte[] expected = codeForStep(key, current + offset).getBytes(StandardCharsets.US_ASCII);
            matched |= MessageDigest.isEqual(expected, submitted);
        }
        return matched;
    }

    /**
     * Computes the code for the step containing {@code instant}.
     *
     * @param secret  base32 secret
     * @param instant the point in time
     */
    public String generateCode(String secret, Instant instant) {
        return codeForStep(requireSecret(secret), stepAt(instant));
    }

    /** Computes the code for the current step. */
    public String currentCode(String secret) {
        return generateCode(secret, clock.now());
    }

    private long stepAt(Instant instant) {
        return Math.floorDiv(instant.getEpochSecond(), settings.period().getSeconds());
    }

    private String codeForStep(byte[] key, long step) {
        byte[] hash;
        try {
            Mac mac = Mac.getInstance(HMAC_ALGORITHM);
            mac.init(new SecretKeySpec(key, HMAC_ALGORITHM));
            hash = mac.doFinal(ByteBuffer.allocate(Long.BYTES).putLong(step).array());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(HMAC_ALGORITHM + " is not available", e);
        }
        int offset = hash[hash.length - 1] & 0x0F;
        int binary = ((hash[offset] & 0x7F) << 24)
                | ((hash[offset + 1] & 0xFF) << 16)
                | ((hash[offset + 2] & 0xFF) << 8)
                | (hash[offset + 3] & 0xFF);
        int code = binary % POWERS_OF_TEN[settings.digits()];
        return String.format("%0" + settings.digits() + "d", code);
    }

    private byte[] requireSecret(String secret) {
        if (secret == null || secret.isBlank()) {
            throw new IllegalArgumentException("secret must not be null or blank");
        }
        String upper = secret.strip().toUpperCase(Locale.ROOT);
        if (!base32.isInAlphabet(upper)) {
            throw new IllegalArgumentException("secret is not valid base32");
        }
        byte[] key = base32.decode(upper);
        if (key.length == 0) {
            throw new IllegalArgumentException("secret decodes to an empty key");
        }
        return key;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
