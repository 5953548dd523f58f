package com.faceblog.gateway.model;

import com.faceblog.gateway.entity.UserEntity;

/**
 * Current state of a user, the input for minting access tokens.
 */
public record SessionUser(
        String userId,
        String tenantId,
        String email,
        String role,
        PermissionSet permissions
) {

    public static SessionUser fromEntity(UserEntity entity) {
        return new SessionUser(
                entity.getId(),
                entity.getTenantId(),
                entity.getEmail(),
                entity.getRole(),
                PermissionSet.fromStored(entity.getPermissions())
        );
    }
}
