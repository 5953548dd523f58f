package com.faceblog.gateway.service;

import com.faceblog.gateway.config.GwProperties;
import com.faceblog.gateway.crypto.CredentialHasher;
import com.faceblog.gateway.exception.CredentialException;
import com.faceblog.gateway.exception.ErrorCode;
import com.faceblog.gateway.exception.PermissionException;
import com.faceblog.gateway.exception.QuotaException;
import com.faceblog.gateway.exception.RateLimitExceededException;
import com.faceblog.gateway.exception.TenantException;
import com.faceblog.gateway.model.ApiKeyRecord;
import com.faceblog.gateway.model.ApiKeyValidation;
import com.faceblog.gateway.model.AuthContext;
import com.faceblog.gateway.model.AuthRequest;
import com.faceblog.gateway.model.QuotaCheck;
import com.faceblog.gateway.model.RateLimitDecision;
import com.faceblog.gateway.model.RouteRequirement;
import com.faceblog.gateway.model.SessionClaims;
import com.faceblog.gateway.model.Tenant;
import com.faceblog.gateway.model.TenantSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Runs every protected request through the same ordered stages:
 *
 * <pre>
 * credential -> tenant -> tenant status -> rate limit -> permission -> subscription -> plan quota
 * </pre>
 *
 * Each stage either passes the accumulated context on or fails with an
 * {@link com.faceblog.gateway.exception.AuthPipelineException}; later stages never run once
 * one has failed. Machine callers (API keys) are attributed to the key's tenant regardless of
 * the host they call; session callers must match any tenant the request names.
 */
@Service
public class AuthPipeline {
    private static final Logger log = LoggerFactory.getLogger(AuthPipeline.class);

    private final CredentialHasher credentialHasher;
    private final ApiKeyValidator apiKeyValidator;
    private final JwtSessionService jwtSessionService;
    private final TenantDirectory tenantDirectory;
    private final RateLimiter rateLimiter;
    private final PermissionEngine permissionEngine;
    private final BillingQuotaGate billingQuotaGate;
    private final int defaultKeyLimit;
    private final int defaultUserLimit;

    public AuthPipeline(CredentialHasher credentialHasher,
                        ApiKeyValidator apiKeyValidator,
                        JwtSessionService jwtSessionService,
                        TenantDirectory tenantDirectory,
                        RateLimiter rateLimiter,
                        PermissionEngine permissionEngine,
                        BillingQuotaGate billingQuotaGate,
                        GwProperties properties) {
        this.credentialHasher = credentialHasher;
        this.apiKeyValidator = apiKeyValidator;
        this.jwtSessionService = jwtSessionService;
        this.tenantDirectory = tenantDirectory;
        this.rateLimiter = rateLimiter;
        this.permissionEngine = permissionEngine;
        this.billingQuotaGate = billingQuotaGate;
        this.defaultKeyLimit = properties.getRateLimit().getDefaultKeyLimit();
        this.defaultUserLimit = properties.getRateLimit().getDefaultUserLimit();
    }

    public Mono<AuthContext> authenticate(AuthRequest request) {
        Mono<AuthContext> authenticated;
        switch (request.credential().type()) {
            case API_KEY:
                authenticated = authenticateApiKey(request);
                break;
            case SESSION:
                authenticated = authenticateSession(request);
                break;
            default:
                return Mono.error(new CredentialException(ErrorCode.MISSING_API_KEY));
        }
        return authenticated
                .flatMap(this::authorize)
                .flatMap(this::enforceSubscription)
                .flatMap(this::enforceQuota)
                .doOnNext(context -> log.debug("Authenticated {}", context));
    }

    // ==================== Machine Path ====================

    private Mono<AuthContext> authenticateApiKey(AuthRequest request) {
        String rawKey = request.credential().value();
        if (!credentialHasher.isValidKeyFormat(rawKey)) {
            log.debug("Rejected key with invalid format: {}", credentialHasher.extractPrefix(rawKey));
            return Mono.error(new CredentialException(ErrorCode.INVALID_FORMAT, "KEY_FORMAT"));
        }
        return Mono.fromCallable(() -> credentialHasher.hash(rawKey))
                .flatMap(apiKeyValidator::validate)
                .flatMap(this::requireValidKey)
                .flatMap(key -> tenantDirectory.resolve(TenantSignal.credential(key.tenantId()))
                        .map(tenantDirectory::checkStatus)
                        .flatMap(tenant -> rateLimiter.check(key.keyId(), key.rateLimitOr(defaultKeyLimit))
                                .map(this::requireAllowed)
                                .map(decision -> AuthContext.forApiKey(
                                        tenant, key, request.requirement(), decision))));
    }

    private Mono<ApiKeyRecord> requireValidKey(ApiKeyValidation validation) {
        switch (validation.outcome()) {
            case VALID:
                return Mono.just(validation.key());
            case INACTIVE:
                return Mono.error(new CredentialException(ErrorCode.INVALID_KEY,
                        CredentialException.REASON_KEY_INACTIVE));
            case EXPIRED:
                return Mono.error(new CredentialException(ErrorCode.INVALID_KEY,
                        CredentialException.REASON_KEY_EXPIRED));
            default:
                return Mono.error(new CredentialException(ErrorCode.INVALID_KEY,
                        CredentialException.REASON_KEY_NOT_FOUND));
        }
    }

    // ==================== Session Path ====================

    private Mono<AuthContext> authenticateSession(AuthRequest request) {
        return jwtSessionService.verify(request.credential().value())
                .flatMap(claims -> resolveSessionTenant(claims, request)
                        .map(tenantDirectory::checkStatus)
                        .flatMap(tenant -> rateLimiter.check("user:" + claims.userId(), defaultUserLimit)
                                .map(this::requireAllowed)
                                .map(decision -> AuthContext.forSession(
                                        tenant, claims, request.requirement(), decision))));
    }

    /**
     * The token's tenant is authoritative; a tenant named by header or host must agree with it.
     */
    private Mono<Tenant> resolveSessionTenant(SessionClaims claims, AuthRequest request) {
        return tenantDirectory.resolveHint(request.tenantHeader(), request.host())
                .flatMap(hinted -> {
                    if (!hinted.id().equals(claims.tenantId())) {
                        log.warn("Token tenant {} does not match request tenant {} (user {})",
                                claims.tenantId(), hinted.id(), claims.userId());
                        return Mono.<Tenant>error(new TenantException(ErrorCode.TENANT_MISMATCH,
                                "TOKEN_TENANT_MISMATCH"));
                    }
                    return Mono.just(hinted);
                })
                .switchIfEmpty(Mono.defer(() ->
                        tenantDirectory.resolve(TenantSignal.credential(claims.tenantId()))));
    }

    // ==================== Shared Stages ====================

    private RateLimitDecision requireAllowed(RateLimitDecision decision) {
        if (!decision.allowed()) {
            throw new RateLimitExceededException(decision);
        }
        return decision;
    }

    private Mono<AuthContext> authorize(AuthContext context) {
        RouteRequirement requirement = context.getRequirement();
        if (requirement == null || !requirement.hasCapability()) {
            return Mono.just(context);
        }
        String capability = requirement.capability();
        if (permissionEngine.authorize(context.getPermissions(), context.getRole(), capability)) {
            return Mono.just(context);
        }
        return Mono.error(new PermissionException(capability, context.getCredentialType().name()));
    }

    private Mono<AuthContext> enforceSubscription(AuthContext context) {
        RouteRequirement requirement = context.getRequirement();
        if (requirement == null) {
            return Mono.just(context);
        }
        Mono<AuthContext> checked = Mono.just(context);
        if (requirement.subscriptionRequired()) {
            checked = checked.flatMap(ctx -> billingQuotaGate.requireActiveSubscription(ctx.getTenantId())
                    .thenReturn(ctx));
        }
        if (requirement.hasFeature()) {
            checked = checked.flatMap(ctx -> billingQuotaGate.requireFeature(ctx.getTenantId(), requirement.feature())
                    .thenReturn(ctx));
        }
        return checked;
    }

    private Mono<AuthContext> enforceQuota(AuthContext context) {
        RouteRequirement requirement = context.getRequirement();
        if (requirement == null || !requirement.isMetered()) {
            return Mono.just(context);
        }
        Mono<QuotaCheck> quota = requirement.hasTrialLimit()
                ? billingQuotaGate.checkTrialQuota(context.getTenantId(), requirement.resource(),
                        requirement.trialLimit())
                : billingQuotaGate.checkQuota(context.getTenantId(), requirement.resource());
        return quota
                .flatMap(check -> {
                    if (check.exceeded()) {
                        return Mono.<AuthContext>error(check.trial() ? trialLimitExceeded(check) : limitExceeded(check));
                    }
                    return Mono.just(billingQuotaGate.warningFor(check)
                            .map(context::withUsageWarning)
                            .orElse(context));
                });
    }

    private QuotaException trialLimitExceeded(QuotaCheck check) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("resource", check.resource().key());
        details.put("currentUsage", check.current());
        details.put("trialLimit", check.limit());
        details.put("upgradeRequired", true);
        return new QuotaException(ErrorCode.TRIAL_LIMIT_EXCEEDED,
                "Trial limit reached for " + check.resource().key(), details);
    }

    private QuotaException limitExceeded(QuotaCheck check) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("resource", check.resource().key());
        details.put("current", check.current());
        details.put("limit", check.limit());
        details.put("plan", check.plan());
        details.put("violations", check.violations());
        return new QuotaException(ErrorCode.LIMIT_EXCEEDED,
                "Plan limit reached for " + check.resource().key(), details);
    }
}
