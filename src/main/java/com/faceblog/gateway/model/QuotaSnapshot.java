package com.faceblog.gateway.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Cached per-tenant view of usage against plan limits.
 */
public record QuotaSnapshot(
        String tenantId,
        String plan,
        Map<ResourceType, Long> usage,
        Map<ResourceType, Long> limits,
        List<QuotaViolation> violations,
        Instant computedAt
) {

    public long usageOf(ResourceType type) {
        return usage.getOrDefault(type, 0L);
    }

    public long limitOf(ResourceType type) {
        return limits.getOrDefault(type, ResourceType.UNLIMITED);
    }

    public boolean isFresh(Instant now, Duration ttl) {
        return computedAt != null && computedAt.plus(ttl).isAfter(now);
    }
}
