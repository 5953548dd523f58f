package com.faceblog.gateway.service;

import com.faceblog.gateway.config.GwProperties;
import com.faceblog.gateway.exception.AuthPipelineException;
import com.faceblog.gateway.exception.InfrastructureException;
import com.faceblog.gateway.model.ApiKeyRecord;
import com.faceblog.gateway.model.ApiKeyValidation;
import com.faceblog.gateway.repository.ApiKeyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Looks up hashed API keys and classifies them.
 *
 * Validation chain:
 * 1. Indexed lookup by key hash (bounded by the store timeout)
 * 2. Active flag
 * 3. Expiry, when set
 * 4. Fire-and-forget last_used_at bump on success
 */
@Service
public class ApiKeyValidator {
    private static final Logger log = LoggerFactory.getLogger(ApiKeyValidator.class);

    private final ApiKeyRepository apiKeyRepository;
    private final Clock clock;
    private final Duration storeTimeout;

    public ApiKeyValidator(ApiKeyRepository apiKeyRepository, Clock clock, GwProperties properties) {
        this.apiKeyRepository = apiKeyRepository;
        this.clock = clock;
        this.storeTimeout = properties.getStore().getTimeout();
    }

    /**
     * Validate a hashed key.
     *
     * @param keyHash SHA-256 hex digest of the presented key
     * @return the validation outcome; errors only with {@link InfrastructureException}
     */
    public Mono<ApiKeyValidation> validate(String keyHash) {
        return apiKeyRepository.findByKeyHash(keyHash)
                .timeout(storeTimeout)
                .onErrorMap(e -> !(e instanceof AuthPipelineException),
                        e -> new InfrastructureException("API_KEY_LOOKUP", e))
                .map(ApiKeyRecord::fromEntity)
                .map(this::evaluate)
                .defaultIfEmpty(ApiKeyValidation.rejected(ApiKeyValidation.Outcome.NOT_FOUND))
                .doOnNext(result -> {
                    if (result.isValid()) {
                        scheduleLastUsedUpdate(result.key().keyId());
                    } else {
                        log.debug("API key rejected: {} ({})", maskHash(keyHash), result.outcome());
                    }
                });
    }

    private ApiKeyValidation evaluate(ApiKeyRecord key) {
        if (!key.active()) {
            return ApiKeyValidation.rejected(ApiKeyValidation.Outcome.INACTIVE);
        }
        if (key.isExpired(clock.instant())) {
            return ApiKeyValidation.rejected(ApiKeyValidation.Outcome.EXPIRED);
        }
        return ApiKeyValidation.valid(key);
    }

    /**
     * Never blocks or fails the calling request.
     */
    private void scheduleLastUsedUpdate(String keyId) {
        Instant usedAt = clock.instant();
        apiKeyRepository.touchLastUsed(keyId, usedAt)
                .timeout(storeTimeout)
                .subscribeOn(Schedulers.boundedElastic())
                .subscribe(
                        updated -> log.trace("Updated last_used_at for key {}", keyId),
                        e -> log.warn("Failed to update last_used_at for key {}: {}", keyId, e.getMessage())
                );
    }

    private String maskHash(String hash) {
        if (hash == null || hash.length() < 16) {
            return "****";
        }
        return hash.substring(0, 8) + "..." + hash.substring(hash.length() - 4);
    }
}
