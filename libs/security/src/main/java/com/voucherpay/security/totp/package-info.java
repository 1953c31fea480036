/** TOTP two-factor secrets, provisioning URIs and QR codes, and code verification. */
package com.voucherpay.security.totp;
