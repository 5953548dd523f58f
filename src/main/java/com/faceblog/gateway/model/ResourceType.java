package com.faceblog.gateway.model;

import com.faceblog.gateway.entity.PlanLimitsEntity;
import com.faceblog.gateway.entity.TenantUsageEntity;

import java.util.Locale;
import java.util.function.ToLongFunction;

/**
 * Countable, plan-limited resources.
 */
public enum ResourceType {
    ARTICLES(TenantUsageEntity::getArticlesCount, PlanLimitsEntity::getMaxArticles),
    CATEGORIES(TenantUsageEntity::getCategoriesCount, PlanLimitsEntity::getMaxCategories),
    TAGS(TenantUsageEntity::getTagsCount, PlanLimitsEntity::getMaxTags),
    USERS(TenantUsageEntity::getUsersCount, PlanLimitsEntity::getMaxUsers),
    API_KEYS(TenantUsageEntity::getApiKeysCount, PlanLimitsEntity::getMaxApiKeys),
    API_REQUESTS(TenantUsageEntity::getApiRequestsCount, PlanLimitsEntity::getMaxApiRequests);

    /** Plan limit value meaning "no cap". */
    public static final long UNLIMITED = -1;

    private final ToLongFunction<TenantUsageEntity> usage;
    private final ToLongFunction<PlanLimitsEntity> limit;

    ResourceType(ToLongFunction<TenantUsageEntity> usage, ToLongFunction<PlanLimitsEntity> limit) {
        this.usage = usage;
        this.limit = limit;
    }

    public long usageOf(TenantUsageEntity entity) {
        return entity != null ? usage.applyAsLong(entity) : 0;
    }

    public long limitOf(PlanLimitsEntity entity) {
        return entity != null ? limit.applyAsLong(entity) : UNLIMITED;
    }

    /**
     * Lowercase name as used in denial bodies and route configuration ({@code api_keys}).
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ResourceType fromKey(String key) {
        return valueOf(key.trim().toUpperCase(Locale.ROOT));
    }
}
