package com.faceblog.gateway.service;

import com.faceblog.gateway.config.GwProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.connection.ReactiveSubscription;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * Listens for tenant changes published by tenant management (status, plan, domains) and drops
 * the gateway's cached view of that tenant: every tenant cache signal and the quota snapshot.
 * The message body is the tenant id.
 */
@Component
public class TenantInvalidationListener {
    private static final Logger log = LoggerFactory.getLogger(TenantInvalidationListener.class);

    private static final Duration RESUBSCRIBE_MIN_BACKOFF = Duration.ofSeconds(1);
    private static final Duration RESUBSCRIBE_MAX_BACKOFF = Duration.ofSeconds(30);

    private final ReactiveStringRedisTemplate redisTemplate;
    private final TenantDirectory tenantDirectory;
    private final BillingQuotaGate billingQuotaGate;
    private final String channel;

    private Disposable subscription;

    public TenantInvalidationListener(ReactiveStringRedisTemplate redisTemplate,
                                      TenantDirectory tenantDirectory,
                                      BillingQuotaGate billingQuotaGate,
                                      GwProperties properties) {
        this.redisTemplate = redisTemplate;
        this.tenantDirectory = tenantDirectory;
        this.billingQuotaGate = billingQuotaGate;
        this.channel = properties.getCache().getInvalidationChannel();
    }

    @PostConstruct
    public void start() {
        subscription = redisTemplate.listenToChannel(channel)
                .map(ReactiveSubscription.Message::getMessage)
                .concatMap(this::onTenantChanged)
                .doOnError(e -> log.warn("Tenant invalidation subscription on {} failed: {}", channel, e.getMessage()))
                .retryWhen(Retry.backoff(Long.MAX_VALUE, RESUBSCRIBE_MIN_BACKOFF).maxBackoff(RESUBSCRIBE_MAX_BACKOFF))
                .subscribe();
        log.info("TenantInvalidationListener subscribed to {}", channel);
    }

    @PreDestroy
    public void stop() {
        if (subscription != null) {
            subscription.dispose();
        }
    }

    Mono<Void> onTenantChanged(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            return Mono.empty();
        }
        String id = tenantId.trim();
        log.info("Tenant {} changed, dropping cached state", id);
        tenantDirectory.invalidate(id);
        return billingQuotaGate.invalidate(id);
    }
}
