package com.faceblog.gateway.model;

import com.faceblog.gateway.entity.ApiKeyEntity;

import java.time.Instant;

/**
 * Lightweight value object for API key metadata.
 */
public record ApiKeyRecord(
        String keyId,
        String tenantId,
        String name,
        PermissionSet permissions,
        Integer rateLimitPerHour,
        boolean active,
        Instant expiresAt,
        Instant lastUsedAt
) {

    /**
     * Create from database entity, normalizing the stored permission column.
     */
    public static ApiKeyRecord fromEntity(ApiKeyEntity entity) {
        return new ApiKeyRecord(
                entity.getKeyId(),
                entity.getTenantId(),
                entity.getName(),
                PermissionSet.fromStored(entity.getPermissions()),
                entity.getRateLimitPerHour(),
                entity.isActive(),
                entity.getExpiresAt(),
                entity.getLastUsedAt()
        );
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    /**
     * Effective hourly limit, falling back to the given default when none is stored.
     */
    public int rateLimitOr(int defaultLimit) {
        return rateLimitPerHour != null && rateLimitPerHour > 0 ? rateLimitPerHour : defaultLimit;
    }
}
