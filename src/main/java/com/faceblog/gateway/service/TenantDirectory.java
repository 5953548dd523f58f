package com.faceblog.gateway.service;

import com.faceblog.gateway.config.GwProperties;
import com.faceblog.gateway.entity.TenantEntity;
import com.faceblog.gateway.exception.AuthPipelineException;
import com.faceblog.gateway.exception.ErrorCode;
import com.faceblog.gateway.exception.InfrastructureException;
import com.faceblog.gateway.exception.TenantException;
import com.faceblog.gateway.model.Tenant;
import com.faceblog.gateway.model.TenantSignal;
import com.faceblog.gateway.repository.TenantRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Tenant resolution service.
 *
 * Resolution chain (first signal present wins):
 * 1. Tenant id derived from an authenticated credential
 * 2. X-Tenant-ID header
 * 3. Custom domain (any host outside the base domain)
 * 4. Subdomain of the base domain
 *
 * Each signal value is cached in-process for the tenant TTL. Store failures are surfaced as
 * {@link InfrastructureException}: a request is never attributed to a tenant by guess.
 */
@Service
public class TenantDirectory {
    private static final Logger log = LoggerFactory.getLogger(TenantDirectory.class);

    private static final Pattern IP_LITERAL = Pattern.compile("^[0-9.]+$|^\\[.*]$");

    private final TenantRepository tenantRepository;
    private final LocalTtlCache<String, Tenant> cache;
    private final Duration storeTimeout;
    private final String baseDomain;
    private final Set<String> reservedSubdomains;

    public TenantDirectory(TenantRepository tenantRepository, Clock clock, GwProperties properties) {
        this.tenantRepository = tenantRepository;
        this.cache = new LocalTtlCache<>(properties.getCache().getTenantTtl(), clock);
        this.storeTimeout = properties.getStore().getTimeout();

        GwProperties.TenancyConfig tenancy = properties.getTenancy();
        this.baseDomain = tenancy.getBaseDomain().toLowerCase(Locale.ROOT);
        this.reservedSubdomains = tenancy.getReservedSubdomains().stream()
                .map(s -> s.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());

        log.info("TenantDirectory initialized: baseDomain={}, tenantTtl={}",
                baseDomain, properties.getCache().getTenantTtl());
    }

    /**
     * Resolve a single signal through the cache.
     *
     * @return the tenant, or {@code TENANT_NOT_FOUND}; status is not checked here
     */
    public Mono<Tenant> resolve(TenantSignal signal) {
        Tenant cached = cache.get(signal.cacheKey());
        if (cached != null) {
            log.debug("Tenant cache hit: {}", signal.cacheKey());
            return Mono.just(cached);
        }
        return lookup(signal)
                .timeout(storeTimeout)
                .onErrorMap(e -> !(e instanceof AuthPipelineException),
                        e -> new InfrastructureException("TENANT_LOOKUP", e))
                .map(Tenant::fromEntity)
                .doOnNext(tenant -> {
                    cache.put(signal.cacheKey(), tenant);
                    log.debug("Resolved tenant {} from {}", tenant.id(), signal.source());
                })
                .switchIfEmpty(Mono.error(() ->
                        new TenantException(ErrorCode.TENANT_NOT_FOUND, "NOT_FOUND_BY_" + signal.source())));
    }

    /**
     * Resolve the tenant a request claims through headers only (no credential). Empty when
     * the request carries no tenant hint at all.
     */
    public Mono<Tenant> resolveHint(String tenantHeader, String host) {
        return signals(null, tenantHeader, host).stream()
                .findFirst()
                .map(this::resolve)
                .orElseGet(Mono::empty);
    }

    /**
     * All signals present on a request, in priority order.
     */
    List<TenantSignal> signals(String credentialTenantId, String tenantHeader, String host) {
        List<TenantSignal> signals = new ArrayList<>(3);
        if (credentialTenantId != null && !credentialTenantId.isBlank()) {
            signals.add(TenantSignal.credential(credentialTenantId));
        }
        if (tenantHeader != null && !tenantHeader.isBlank()) {
            signals.add(new TenantSignal(TenantSignal.Source.HEADER, tenantHeader.trim()));
        }
        hostSignal(host).ifPresent(signals::add);
        return signals;
    }

    /**
     * Turn a Host header into a custom domain or subdomain signal. System subdomains, the
     * bare base domain, localhost and IP literals carry no tenant.
     */
    Optional<TenantSignal> hostSignal(String host) {
        if (host == null || host.isBlank()) {
            return Optional.empty();
        }
        String normalized = stripPort(host.trim().toLowerCase(Locale.ROOT));
        if (normalized.equals("localhost") || IP_LITERAL.matcher(normalized).matches()
                || normalized.equals(baseDomain)) {
            return Optional.empty();
        }
        String suffix = "." + baseDomain;
        if (!normalized.endsWith(suffix)) {
            return Optional.of(new TenantSignal(TenantSignal.Source.CUSTOM_DOMAIN, normalized));
        }
        String subdomain = normalized.substring(0, normalized.length() - suffix.length());
        if (subdomain.isEmpty() || subdomain.contains(".") || reservedSubdomains.contains(subdomain)) {
            return Optional.empty();
        }
        return Optional.of(new TenantSignal(TenantSignal.Source.SUBDOMAIN, subdomain));
    }

    /**
     * Reject tenants that may not receive traffic.
     *
     * @return the same tenant when active
     */
    public Tenant checkStatus(Tenant tenant) {
        switch (tenant.status()) {
            case ACTIVE:
                return tenant;
            case SUSPENDED:
                throw new TenantException(ErrorCode.TENANT_SUSPENDED, "SUSPENDED:" + tenant.id());
            case EXPIRED:
                throw new TenantException(ErrorCode.TENANT_EXPIRED, "EXPIRED:" + tenant.id());
            default:
                throw new TenantException(ErrorCode.TENANT_DELETED, "DELETED:" + tenant.id());
        }
    }

    /**
     * Drop every cached signal that points at the tenant. Driven by
     * {@link TenantInvalidationListener} when tenant management changes a tenant.
     */
    public void invalidate(String tenantId) {
        int removed = cache.invalidateIf(tenant -> tenant.id().equals(tenantId));
        log.debug("Invalidated {} cached signals for tenant {}", removed, tenantId);
    }

    public int evictExpired() {
        return cache.evictExpired();
    }

    public int cachedEntries() {
        return cache.size();
    }

    private Mono<TenantEntity> lookup(TenantSignal signal) {
        switch (signal.source()) {
            case CUSTOM_DOMAIN:
                return tenantRepository.findByCustomDomain(signal.value());
            case SUBDOMAIN:
                return tenantRepository.findBySubdomain(signal.value());
            default:
                return tenantRepository.findById(signal.value());
        }
    }

    private String stripPort(String host) {
        if (host.startsWith("[")) {
            int end = host.indexOf(']');
            return end > 0 ? host.substring(0, end + 1) : host;
        }
        int colon = host.indexOf(':');
        return colon >= 0 ? host.substring(0, colon) : host;
    }
}
