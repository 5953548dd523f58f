package com.faceblog.gateway.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.faceblog.gateway.config.GwProperties;
import com.faceblog.gateway.model.QuotaSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;

/**
 * Redis cache service for quota snapshots and the session token revocation set.
 * Provides reactive cache operations with configurable TTLs.
 */
@Service
public class CacheService {
    private static final Logger log = LoggerFactory.getLogger(CacheService.class);

    private final ReactiveStringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private final Duration quotaTtl;

    public CacheService(ReactiveStringRedisTemplate redisTemplate,
                        ObjectMapper objectMapper,
                        GwProperties properties) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;

        GwProperties.CacheConfig cacheConfig = properties.getCache();
        if (cacheConfig != null) {
            this.keyPrefix = cacheConfig.getKeyPrefix() != null ? cacheConfig.getKeyPrefix() : "gw:";
            this.quotaTtl = cacheConfig.getQuotaTtl();
        } else {
            this.keyPrefix = "gw:";
            this.quotaTtl = Duration.ofMinutes(5);
        }
    }

    // ==================== Quota Snapshot Cache ====================

    /**
     * Get quota snapshot from cache.
     *
     * @param tenantId Tenant ID
     * @return QuotaSnapshot if found, empty Mono otherwise
     */
    public Mono<QuotaSnapshot> getQuotaSnapshot(String tenantId) {
        String cacheKey = keyPrefix + "quota:" + tenantId;
        return redisTemplate.opsForValue().get(cacheKey)
                .flatMap(json -> deserialize(json, QuotaSnapshot.class))
                .doOnNext(snapshot -> log.debug("Cache hit for quota snapshot: {}", tenantId));
    }

    /**
     * Cache quota snapshot.
     *
     * @return true if cached successfully
     */
    public Mono<Boolean> cacheQuotaSnapshot(String tenantId, QuotaSnapshot snapshot) {
        String cacheKey = keyPrefix + "quota:" + tenantId;
        return serialize(snapshot)
                .flatMap(json -> redisTemplate.opsForValue().set(cacheKey, json, quotaTtl))
                .doOnSuccess(result -> log.debug("Cached quota snapshot: {}", tenantId))
                .onErrorResume(e -> {
                    log.warn("Failed to cache quota snapshot: {}", e.getMessage());
                    return Mono.just(false);
                });
    }

    /**
     * Invalidate quota snapshot cache entry.
     *
     * @return number of keys deleted
     */
    public Mono<Long> invalidateQuotaSnapshot(String tenantId) {
        String cacheKey = keyPrefix + "quota:" + tenantId;
        return redisTemplate.delete(cacheKey)
                .doOnSuccess(count -> log.debug("Invalidated quota snapshot cache: {} (deleted={})",
                        tenantId, count));
    }

    // ==================== Token Revocation Set ====================

    /**
     * Record a revoked token id. The entry expires together with the token.
     *
     * @param tokenId   JWT id claim
     * @param revokedAt revocation timestamp, stored as the value
     * @param ttl       remaining lifetime of the token
     */
    public Mono<Boolean> revokeToken(String tokenId, Instant revokedAt, Duration ttl) {
        String cacheKey = keyPrefix + "revoked:" + tokenId;
        return redisTemplate.opsForValue()
                .set(cacheKey, String.valueOf(revokedAt.getEpochSecond()), ttl)
                .doOnSuccess(result -> log.debug("Revoked token {} (ttl={}s)", tokenId, ttl.toSeconds()));
    }

    /**
     * Errors are propagated: callers verifying credentials must fail closed.
     */
    public Mono<Boolean> isTokenRevoked(String tokenId) {
        String cacheKey = keyPrefix + "revoked:" + tokenId;
        return redisTemplate.hasKey(cacheKey);
    }

    // ==================== Helper Methods ====================

    private <T> Mono<T> deserialize(String json, Class<T> clazz) {
        try {
            return Mono.just(objectMapper.readValue(json, clazz));
        } catch (JsonProcessingException e) {
            log.warn("Failed to deserialize cache value: {}", e.getMessage());
            return Mono.empty();
        }
    }

    private Mono<String> serialize(Object obj) {
        try {
            return Mono.just(objectMapper.writeValueAsString(obj));
        } catch (JsonProcessingException e) {
            return Mono.error(new IllegalStateException("Failed to serialize for cache", e));
        }
    }
}
