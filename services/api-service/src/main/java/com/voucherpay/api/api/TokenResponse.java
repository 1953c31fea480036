package com.voucherpay.api.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.voucherpay.security.IssuedToken;
import java.util.Map;

/**
 * Tokens returned by login and refresh. {@code refreshToken} is null on refresh.
 *
 * @param expiresIn access token lifetime in seconds
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TokenResponse(
        String accessToken,
        String refreshToken,
        String tokenType,
        long expiresIn,
        Map<String, Object> user) {

    public static final String BEARER = "bearer";

    public static TokenResponse of(IssuedToken access, IssuedToken refresh, Map<String, Object> user) {
        return new TokenResponse(
                access.value(),
                refresh != null ? refresh.value() : null,
                BEARER,
                access.expiresInSeconds(),
                user);
    }
}
