package com.faceblog.gateway.service;

import com.faceblog.gateway.config.GwProperties;
import com.faceblog.gateway.entity.PlanLimitsEntity;
import com.faceblog.gateway.entity.SubscriptionEntity;
import com.faceblog.gateway.entity.TenantEntity;
import com.faceblog.gateway.entity.TenantUsageEntity;
import com.faceblog.gateway.exception.AuthPipelineException;
import com.faceblog.gateway.exception.BillingException;
import com.faceblog.gateway.exception.ErrorCode;
import com.faceblog.gateway.exception.InfrastructureException;
import com.faceblog.gateway.model.QuotaCheck;
import com.faceblog.gateway.model.QuotaSnapshot;
import com.faceblog.gateway.model.QuotaViolation;
import com.faceblog.gateway.model.ResourceType;
import com.faceblog.gateway.model.Subscription;
import com.faceblog.gateway.model.UsageWarning;
import com.faceblog.gateway.repository.PlanLimitsRepository;
import com.faceblog.gateway.repository.SubscriptionRepository;
import com.faceblog.gateway.repository.TenantRepository;
import com.faceblog.gateway.repository.TenantUsageRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Plan limit checks for metered resources, and subscription gates for paid features.
 *
 * <p>Usage and limits are read as one snapshot per tenant, cached in Redis for the quota TTL.
 * Quota is a business limit, not a security boundary: when neither the cache nor the store
 * can answer in time the request is allowed and a warning is logged.
 *
 * <p>Subscription and feature gates are different: a route that sells a feature must not be
 * served for free because the billing store is slow, so their lookups fail closed.
 */
@Service
public class BillingQuotaGate {
    private static final Logger log = LoggerFactory.getLogger(BillingQuotaGate.class);

    private static final String DEFAULT_PLAN = "basic";

    private final CacheService cacheService;
    private final TenantRepository tenantRepository;
    private final PlanLimitsRepository planLimitsRepository;
    private final TenantUsageRepository tenantUsageRepository;
    private final SubscriptionRepository subscriptionRepository;
    private final Clock clock;
    private final Duration storeTimeout;
    private final Duration quotaTtl;
    private final double warningThreshold;

    public BillingQuotaGate(CacheService cacheService,
                            TenantRepository tenantRepository,
                            PlanLimitsRepository planLimitsRepository,
                            TenantUsageRepository tenantUsageRepository,
                            SubscriptionRepository subscriptionRepository,
                            Clock clock,
                            GwProperties properties) {
        this.cacheService = cacheService;
        this.tenantRepository = tenantRepository;
        this.planLimitsRepository = planLimitsRepository;
        this.tenantUsageRepository = tenantUsageRepository;
        this.subscriptionRepository = subscriptionRepository;
        this.clock = clock;
        this.storeTimeout = properties.getStore().getTimeout();
        this.quotaTtl = properties.getCache().getQuotaTtl();
        this.warningThreshold = properties.getQuota().getWarningThreshold();
    }

    /**
     * Compare current usage of a resource with the tenant's plan limit.
     * A limit of -1 is unlimited; otherwise usage at or above the limit is exceeded.
     */
    public Mono<QuotaCheck> checkQuota(String tenantId, ResourceType resource) {
        return snapshot(tenantId)
                .map(snapshot -> toCheck(snapshot, resource))
                .onErrorResume(e -> {
                    log.warn("Quota check unavailable for tenant {} ({}), allowing request: {}",
                            tenantId, resource.key(), e.getMessage());
                    return Mono.just(QuotaCheck.unknown(resource));
                });
    }

    /**
     * Usage against a fixed trial allowance for tenants without a paying subscription.
     * Paying tenants get the regular plan check. Fails open like {@link #checkQuota}.
     */
    public Mono<QuotaCheck> checkTrialQuota(String tenantId, ResourceType resource, int trialLimit) {
        return findSubscription(tenantId)
                .map(Optional::of)
                .defaultIfEmpty(Optional.empty())
                .flatMap(subscription -> {
                    if (subscription.map(Subscription::isPaid).orElse(false)) {
                        return checkQuota(tenantId, resource);
                    }
                    return snapshot(tenantId)
                            .map(snapshot -> QuotaCheck.forTrial(resource, snapshot.usageOf(resource), trialLimit));
                })
                .onErrorResume(e -> {
                    log.warn("Trial check unavailable for tenant {} ({}), allowing request: {}",
                            tenantId, resource.key(), e.getMessage());
                    return Mono.just(QuotaCheck.unknown(resource));
                });
    }

    /**
     * Require an active or trialing subscription whose current period has not ended.
     *
     * @return the subscription, or {@code NO_SUBSCRIPTION}, {@code SUBSCRIPTION_INACTIVE},
     *         {@code SUBSCRIPTION_EXPIRED}
     */
    public Mono<Subscription> requireActiveSubscription(String tenantId) {
        return findSubscription(tenantId)
                .switchIfEmpty(Mono.error(() -> new BillingException(ErrorCode.NO_SUBSCRIPTION, null)))
                .flatMap(subscription -> {
                    if (!subscription.isActive()) {
                        Map<String, Object> details = new LinkedHashMap<>();
                        details.put("status", subscription.status());
                        return Mono.<Subscription>error(new BillingException(ErrorCode.SUBSCRIPTION_INACTIVE, details));
                    }
                    if (subscription.isExpired(clock.instant())) {
                        Map<String, Object> details = new LinkedHashMap<>();
                        details.put("expiredAt", subscription.currentPeriodEnd().toString());
                        return Mono.<Subscription>error(new BillingException(ErrorCode.SUBSCRIPTION_EXPIRED, details));
                    }
                    return Mono.just(subscription);
                });
    }

    /**
     * Require the tenant's plan to include a feature flag.
     *
     * @return the subscription, or {@code NO_SUBSCRIPTION}, {@code FEATURE_NOT_AVAILABLE}
     */
    public Mono<Subscription> requireFeature(String tenantId, String feature) {
        return findSubscription(tenantId)
                .switchIfEmpty(Mono.error(() -> new BillingException(ErrorCode.NO_SUBSCRIPTION, null)))
                .flatMap(subscription -> {
                    if (subscription.hasFeature(feature)) {
                        return Mono.just(subscription);
                    }
                    log.debug("Tenant {} on plan {} lacks feature {}", tenantId, subscription.plan(), feature);
                    Map<String, Object> details = new LinkedHashMap<>();
                    details.put("feature", feature);
                    details.put("currentPlan", subscription.plan());
                    details.put("upgradeRequired", true);
                    return Mono.<Subscription>error(new BillingException(ErrorCode.FEATURE_NOT_AVAILABLE, details));
                });
    }

    /**
     * The tenant's subscription with its plan features, empty when none is on file.
     * Store failures surface as {@link InfrastructureException}.
     */
    public Mono<Subscription> findSubscription(String tenantId) {
        return subscriptionRepository.findById(tenantId)
                .flatMap(this::withPlanFeatures)
                .timeout(storeTimeout)
                .onErrorMap(e -> !(e instanceof AuthPipelineException),
                        e -> new InfrastructureException("SUBSCRIPTION_LOOKUP", e));
    }

    private Mono<Subscription> withPlanFeatures(SubscriptionEntity entity) {
        if (entity.getPlan() == null) {
            return Mono.just(Subscription.from(entity, null));
        }
        return planLimitsRepository.findById(entity.getPlan())
                .map(limits -> Subscription.from(entity, limits))
                .defaultIfEmpty(Subscription.from(entity, null));
    }

    /**
     * Advisory warning when usage of a resource reached the warning threshold of its limit.
     * Empty when below the threshold, unlimited, or unknown.
     */
    public Mono<UsageWarning> checkSoftLimit(String tenantId, ResourceType resource) {
        return snapshot(tenantId)
                .flatMap(snapshot -> Mono.justOrEmpty(warningFor(toCheck(snapshot, resource))))
                .onErrorResume(e -> {
                    log.debug("Soft limit check skipped for tenant {}: {}", tenantId, e.getMessage());
                    return Mono.empty();
                });
    }

    public Optional<UsageWarning> warningFor(QuotaCheck check) {
        if (check.isUnlimited() || check.limit() <= 0) {
            return Optional.empty();
        }
        double ratio = (double) check.current() / check.limit();
        if (ratio < warningThreshold) {
            return Optional.empty();
        }
        int percentage = (int) Math.round(ratio * 100);
        return Optional.of(new UsageWarning(check.resource(), check.current(), check.limit(), percentage));
    }

    /**
     * Drop the cached snapshot, e.g. after a metered resource was created. Never errors.
     */
    public Mono<Void> invalidate(String tenantId) {
        return cacheService.invalidateQuotaSnapshot(tenantId)
                .timeout(storeTimeout)
                .doOnNext(deleted -> log.debug("Invalidated quota snapshot for tenant {}", tenantId))
                .onErrorResume(e -> {
                    log.warn("Failed to invalidate quota snapshot for tenant {}: {}", tenantId, e.getMessage());
                    return Mono.empty();
                })
                .then();
    }

    Mono<QuotaSnapshot> snapshot(String tenantId) {
        return cacheService.getQuotaSnapshot(tenantId)
                .timeout(storeTimeout)
                .onErrorResume(e -> {
                    log.debug("Quota cache read failed for tenant {}: {}", tenantId, e.getMessage());
                    return Mono.empty();
                })
                .filter(snapshot -> snapshot.isFresh(clock.instant(), quotaTtl))
                .switchIfEmpty(Mono.defer(() -> recompute(tenantId)
                        .flatMap(snapshot -> cacheService.cacheQuotaSnapshot(tenantId, snapshot)
                                .timeout(storeTimeout)
                                .onErrorReturn(false)
                                .thenReturn(snapshot))));
    }

    private Mono<QuotaSnapshot> recompute(String tenantId) {
        Mono<String> plan = tenantRepository.findById(tenantId)
                .mapNotNull(TenantEntity::getPlan)
                .defaultIfEmpty(DEFAULT_PLAN);

        return plan.flatMap(planName -> Mono.zip(
                        planLimitsRepository.findById(planName).map(Optional::of).defaultIfEmpty(Optional.empty()),
                        tenantUsageRepository.findById(tenantId).map(Optional::of).defaultIfEmpty(Optional.empty()))
                        .map(t -> buildSnapshot(tenantId, planName, t.getT1().orElse(null), t.getT2().orElse(null))))
                .timeout(storeTimeout);
    }

    private QuotaSnapshot buildSnapshot(String tenantId, String plan,
                                        PlanLimitsEntity limitsEntity, TenantUsageEntity usageEntity) {
        Map<ResourceType, Long> usage = new EnumMap<>(ResourceType.class);
        Map<ResourceType, Long> limits = new EnumMap<>(ResourceType.class);
        List<QuotaViolation> violations = new ArrayList<>();
        for (ResourceType type : ResourceType.values()) {
            long current = type.usageOf(usageEntity);
            long limit = type.limitOf(limitsEntity);
            usage.put(type, current);
            limits.put(type, limit);
            if (isExceeded(current, limit)) {
                violations.add(new QuotaViolation(type.key(), current, limit));
            }
        }
        if (limitsEntity == null) {
            log.warn("No limits configured for plan {}, treating tenant {} as unlimited", plan, tenantId);
        }
        Instant now = clock.instant();
        return new QuotaSnapshot(tenantId, plan, usage, limits, violations, now);
    }

    private QuotaCheck toCheck(QuotaSnapshot snapshot, ResourceType resource) {
        long current = snapshot.usageOf(resource);
        long limit = snapshot.limitOf(resource);
        return new QuotaCheck(resource, isExceeded(current, limit), current, limit,
                snapshot.plan(), snapshot.violations());
    }

    private static boolean isExceeded(long current, long limit) {
        return limit != ResourceType.UNLIMITED && current >= limit;
    }
}
