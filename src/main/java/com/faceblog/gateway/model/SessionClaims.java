package com.faceblog.gateway.model;

import java.time.Instant;

/**
 * Verified claims of a session token. Refresh tokens leave email, role and permissions empty.
 */
public record SessionClaims(
        String userId,
        String tenantId,
        String email,
        String role,
        PermissionSet permissions,
        String tokenId,
        Instant issuedAt,
        Instant expiresAt,
        TokenType type
) {
}
