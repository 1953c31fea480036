package com.voucherpay.security.totp;

/** Rendering the provisioning QR code failed. */
public class ProvisioningException extends RuntimeException {

    public ProvisioningException(String message, Throwable cause) {
        super(message, cause);
    }
}
