package com.faceblog.gateway.service;

import com.faceblog.gateway.config.GwProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.time.Duration;

/**
 * Periodic eviction of in-process rate-limit windows and tenant cache entries, plus pruning
 * of persisted windows. Each sweep removes entries one by one, so request handling is never
 * blocked while it runs.
 */
@Component
public class CacheSweeper {
    private static final Logger log = LoggerFactory.getLogger(CacheSweeper.class);

    private final RateLimiter rateLimiter;
    private final TenantDirectory tenantDirectory;
    private final Duration rateLimitInterval;
    private final Duration tenantCacheInterval;

    private Disposable rateLimitSweep;
    private Disposable tenantCacheSweep;

    public CacheSweeper(RateLimiter rateLimiter, TenantDirectory tenantDirectory, GwProperties properties) {
        this.rateLimiter = rateLimiter;
        this.tenantDirectory = tenantDirectory;
        this.rateLimitInterval = properties.getRateLimit().getSweepInterval();
        this.tenantCacheInterval = properties.getCache().getSweepInterval();
    }

    @PostConstruct
    public void start() {
        rateLimitSweep = Flux.interval(rateLimitInterval, rateLimitInterval)
                .subscribe(tick -> sweepRateLimits());
        tenantCacheSweep = Flux.interval(tenantCacheInterval, tenantCacheInterval)
                .subscribe(tick -> sweepTenantCache());
        log.info("CacheSweeper started: rateLimitInterval={}, tenantCacheInterval={}",
                rateLimitInterval, tenantCacheInterval);
    }

    @PreDestroy
    public void stop() {
        if (rateLimitSweep != null) {
            rateLimitSweep.dispose();
        }
        if (tenantCacheSweep != null) {
            tenantCacheSweep.dispose();
        }
    }

    public void sweepRateLimits() {
        try {
            int evicted = rateLimiter.evictStale();
            log.debug("Rate limit sweep evicted {} windows ({} tracked)", evicted, rateLimiter.trackedWindows());
        } catch (RuntimeException e) {
            log.error("Rate limit sweep failed", e);
        }
        rateLimiter.pruneStore()
                .subscribe(
                        deleted -> log.debug("Pruned {} persisted rate limit windows", deleted),
                        e -> log.warn("Failed to prune persisted rate limit windows: {}", e.getMessage())
                );
    }

    public void sweepTenantCache() {
        try {
            int evicted = tenantDirectory.evictExpired();
            log.debug("Tenant cache sweep evicted {} entries ({} cached)", evicted, tenantDirectory.cachedEntries());
        } catch (RuntimeException e) {
            log.error("Tenant cache sweep failed", e);
        }
    }
}
