package com.faceblog.gateway.dto;

/**
 * Optional body of a logout call. The refresh token, when given, is revoked too.
 */
public record LogoutRequest(
        String refreshToken
) {
}
