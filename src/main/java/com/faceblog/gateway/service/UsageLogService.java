package com.faceblog.gateway.service;

import com.faceblog.gateway.config.GwProperties;
import com.faceblog.gateway.entity.ApiUsageLogEntity;
import com.faceblog.gateway.model.AuthContext;
import com.faceblog.gateway.model.RequestSummary;
import com.faceblog.gateway.repository.ApiUsageLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.Set;

/**
 * Post-handler bookkeeping for successful authenticated requests: one usage log row, and
 * quota snapshot invalidation when a metered resource was just created or changed.
 * Failures are logged and never reach the caller.
 */
@Service
public class UsageLogService {
    private static final Logger log = LoggerFactory.getLogger(UsageLogService.class);

    private static final Set<String> MUTATING_METHODS = Set.of("POST", "PUT", "PATCH", "DELETE");
    private static final int MAX_USER_AGENT_LENGTH = 512;

    private final ApiUsageLogRepository usageLogRepository;
    private final BillingQuotaGate billingQuotaGate;
    private final Clock clock;
    private final Duration storeTimeout;

    public UsageLogService(ApiUsageLogRepository usageLogRepository,
                           BillingQuotaGate billingQuotaGate,
                           Clock clock,
                           GwProperties properties) {
        this.usageLogRepository = usageLogRepository;
        this.billingQuotaGate = billingQuotaGate;
        this.clock = clock;
        this.storeTimeout = properties.getStore().getTimeout();
    }

    /**
     * Fire-and-forget variant used by the request filter.
     */
    public void recordAsync(AuthContext context, RequestSummary request) {
        record(context, request)
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe();
    }

    /**
     * @return completes once the row is written (or the write failed); never errors
     */
    public Mono<Void> record(AuthContext context, RequestSummary request) {
        if (!request.isSuccessful()) {
            return Mono.empty();
        }

        ApiUsageLogEntity entity = new ApiUsageLogEntity();
        entity.setTenantId(context.getTenantId());
        entity.setApiKeyId(context.getApiKeyId());
        entity.setUserId(context.getUserId());
        entity.setMethod(request.method());
        entity.setEndpoint(request.path());
        entity.setStatusCode(request.statusCode());
        entity.setIpAddress(request.clientIp());
        entity.setUserAgent(truncate(request.userAgent()));
        entity.setCreatedAt(clock.instant());

        Mono<Void> write = usageLogRepository.save(entity)
                .timeout(storeTimeout)
                .doOnSuccess(saved -> log.debug("Usage: {} {} {} by {}",
                        request.method(), request.path(), request.statusCode(), context.getCredentialId()))
                .onErrorResume(e -> {
                    log.warn("Failed to save usage log for tenant {}: {}", context.getTenantId(), e.getMessage());
                    return Mono.empty();
                })
                .then();

        if (context.getRequirement() != null && context.getRequirement().isMetered()
                && MUTATING_METHODS.contains(request.method())) {
            return write.then(billingQuotaGate.invalidate(context.getTenantId()));
        }
        return write;
    }

    private String truncate(String userAgent) {
        if (userAgent == null || userAgent.length() <= MAX_USER_AGENT_LENGTH) {
            return userAgent;
        }
        return userAgent.substring(0, MAX_USER_AGENT_LENGTH);
    }
}
