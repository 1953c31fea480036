/**
 * Stateless session tokens.
 *
 * <p>{@link com.voucherpay.security.TokenCodec} signs and verifies compact JWTs;
 * {@link com.voucherpay.security.SessionTokenIssuer} and
 * {@link com.voucherpay.security.SessionTokenVerifier} layer the access / refresh /
 * password-reset lifecycle on top, keyed by the {@code type} claim.
 */
package com.voucherpay.security;
