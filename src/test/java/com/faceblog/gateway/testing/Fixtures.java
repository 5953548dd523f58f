package com.faceblog.gateway.testing;

import com.faceblog.gateway.config.GwProperties;
import com.faceblog.gateway.entity.ApiKeyEntity;
import com.faceblog.gateway.entity.PlanLimitsEntity;
import com.faceblog.gateway.entity.SubscriptionEntity;
import com.faceblog.gateway.entity.TenantEntity;
import com.faceblog.gateway.entity.TenantUsageEntity;
import com.faceblog.gateway.entity.UserEntity;

import java.time.Instant;

/**
 * Entity and configuration builders shared by the unit tests.
 */
public final class Fixtures {

    public static final String ACCESS_SECRET = "access-secret-for-tests-0123456789abcdef";
    public static final String REFRESH_SECRET = "refresh-secret-for-tests-0123456789abcdef";

    /** A well-formed key for tenant slug {@code acme}. */
    public static final String ACME_KEY = "fb_acme_" + "0123456789abcdef".repeat(4);

    private Fixtures() {
    }

    public static GwProperties properties() {
        GwProperties properties = new GwProperties();
        properties.getJwt().setAccessSecret(ACCESS_SECRET);
        properties.getJwt().setRefreshSecret(REFRESH_SECRET);
        return properties;
    }

    public static TenantEntity tenant(String id, String status) {
        TenantEntity entity = new TenantEntity();
        entity.setTenantId(id);
        entity.setSlug(id);
        entity.setName(id + " blog");
        entity.setSubdomain(id);
        entity.setPlan("basic");
        entity.setStatus(status);
        entity.setCreatedAt(Instant.parse("2025-01-01T00:00:00Z"));
        entity.setUpdatedAt(Instant.parse("2025-01-01T00:00:00Z"));
        return entity;
    }

    public static ApiKeyEntity apiKey(String keyId, String tenantId, String permissions, Integer rateLimitPerHour) {
        ApiKeyEntity entity = new ApiKeyEntity();
        entity.setKeyId(keyId);
        entity.setTenantId(tenantId);
        entity.setName("integration");
        entity.setKeyHash("hash-" + keyId);
        entity.setPermissions(permissions);
        entity.setRateLimitPerHour(rateLimitPerHour);
        entity.setActive(true);
        entity.setCreatedAt(Instant.parse("2025-01-01T00:00:00Z"));
        return entity;
    }

    public static UserEntity user(String id, String tenantId, String role) {
        UserEntity entity = new UserEntity();
        entity.setId(id);
        entity.setTenantId(tenantId);
        entity.setEmail(id + "@example.com");
        entity.setRole(role);
        entity.setPermissions("[]");
        entity.setActive(true);
        return entity;
    }

    public static PlanLimitsEntity planLimits(String plan, long maxArticles) {
        PlanLimitsEntity entity = new PlanLimitsEntity();
        entity.setPlan(plan);
        entity.setMaxArticles(maxArticles);
        entity.setMaxCategories(-1);
        entity.setMaxTags(-1);
        entity.setMaxUsers(-1);
        entity.setMaxApiKeys(-1);
        entity.setMaxApiRequests(-1);
        return entity;
    }

    public static TenantUsageEntity usage(String tenantId, long articles) {
        TenantUsageEntity entity = new TenantUsageEntity();
        entity.setTenantId(tenantId);
        entity.setArticlesCount(articles);
        return entity;
    }

    public static SubscriptionEntity subscription(String tenantId, String plan, String status, Instant periodEnd) {
        SubscriptionEntity entity = new SubscriptionEntity();
        entity.setTenantId(tenantId);
        entity.setPlan(plan);
        entity.setStatus(status);
        entity.setCurrentPeriodEnd(periodEnd);
        entity.setUpdatedAt(Instant.parse("2025-01-01T00:00:00Z"));
        return entity;
    }
}
