package com.faceblog.gateway.dto;

import com.faceblog.gateway.model.IssuedToken;

import java.time.Instant;

/**
 * Response DTO for a freshly minted access token.
 */
public record TokenResponse(
        String accessToken,
        String tokenType,
        Instant expiresAt
) {
    public static TokenResponse bearer(IssuedToken token) {
        return new TokenResponse(token.token(), "Bearer", token.expiresAt());
    }
}
