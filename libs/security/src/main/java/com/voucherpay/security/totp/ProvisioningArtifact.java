package com.voucherpay.security.totp;

import java.util.Base64;

/**
 * Everything a client needs to enrol an authenticator app.
 * <p>
 * The manual entry key is always present so the credential can be configured without
 * scanning the image.
 *
 * @param uri            {@code otpauth://totp/...} provisioning URI
 * @param manualEntryKey the base32 secret, for typing into the app
 * @param qrCodePng      PNG rendering of {@code uri}
 */
public record ProvisioningArtifact(String uri, String manualEntryKey, byte[] qrCodePng) {

    public ProvisioningArtifact {
        qrCodePng = qrCodePng.clone();
    }

    @Override
    public byte[] qrCodePng() {
        return qrCodePng.clone();
    }

    /** The PNG as standard base64, as returned in JSON responses. */
    public String qrCodeBase64() {
        return Base64.getEncoder().encodeToString(qrCodePng);
    }

    @Override
    public String toString() {
        return "ProvisioningArtifact[pngBytes=%d]".formatted(qrCodePng.length);
    }
}
