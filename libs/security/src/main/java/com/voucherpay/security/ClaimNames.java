package com.voucherpay.security;

import java.util.Set;

/**
 * Stable claim names shared by every token issuer and verifier.
 */
public final class ClaimNames {

    public static final String SUBJECT = "sub";
    public static final String EMAIL = "email";
    public static final String ROLE = "role";
    public static final String TYPE = "type";
    public static final String EXPIRES_AT = "exp";
    public static final String NOT_BEFORE = "nbf";

    /** Names owned by {@link ClaimSet}'s typed fields; never allowed in the extension map. */
    public static final Set<String> RESERVED = Set.of(SUBJECT, EMAIL, ROLE, TYPE, EXPIRES_AT, NOT_BEFORE);

    private ClaimNames() {
        // constants
    }
}
