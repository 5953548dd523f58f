package com.faceblog.gateway.model;

import com.faceblog.gateway.entity.TenantEntity;

/**
 * Immutable, cacheable view of a tenant row.
 */
public record Tenant(
        String id,
        String slug,
        String name,
        String subdomain,
        String customDomain,
        TenantStatus status,
        String plan,
        String settingsJson
) {

    public static Tenant fromEntity(TenantEntity entity) {
        return new Tenant(
                entity.getTenantId(),
                entity.getSlug(),
                entity.getName(),
                entity.getSubdomain(),
                entity.getCustomDomain(),
                TenantStatus.fromStored(entity.getStatus()),
                entity.getPlan() != null ? entity.getPlan() : "basic",
                entity.getSettingsJson()
        );
    }

    public boolean isActive() {
        return status == TenantStatus.ACTIVE;
    }
}
