package com.faceblog.gateway.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@ConfigurationProperties(prefix = "gw")
@Validated
public class GwProperties {

    private StoreConfig store = new StoreConfig();
    private CacheConfig cache = new CacheConfig();
    private RateLimitConfig rateLimit = new RateLimitConfig();
    private ApiKeyConfig apiKey = new ApiKeyConfig();
    private JwtConfig jwt = new JwtConfig();
    private TenancyConfig tenancy = new TenancyConfig();
    private QuotaConfig quota = new QuotaConfig();
    private RoutesConfig routes = new RoutesConfig();

    public StoreConfig getStore() {
        return store;
    }

    public void setStore(StoreConfig store) {
        this.store = store;
    }

    public CacheConfig getCache() {
        return cache;
    }

    public void setCache(CacheConfig cache) {
        this.cache = cache;
    }

    public RateLimitConfig getRateLimit() {
        return rateLimit;
    }

    public void setRateLimit(RateLimitConfig rateLimit) {
        this.rateLimit = rateLimit;
    }

    public ApiKeyConfig getApiKey() {
        return apiKey;
    }

    public void setApiKey(ApiKeyConfig apiKey) {
        this.apiKey = apiKey;
    }

    public JwtConfig getJwt() {
        return jwt;
    }

    public void setJwt(JwtConfig jwt) {
        this.jwt = jwt;
    }

    public TenancyConfig getTenancy() {
        return tenancy;
    }

    public void setTenancy(TenancyConfig tenancy) {
        this.tenancy = tenancy;
    }

    public QuotaConfig getQuota() {
        return quota;
    }

    public void setQuota(QuotaConfig quota) {
        this.quota = quota;
    }

    public RoutesConfig getRoutes() {
        return routes;
    }

    public void setRoutes(RoutesConfig routes) {
        this.routes = routes;
    }

    // ==================== Nested Config Classes ====================

    /**
     * Backing store (MySQL / Redis) call limits.
     */
    public static class StoreConfig {
        // Upper bound for any single store call made on the request path
        private Duration timeout = Duration.ofMillis(250);

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    /**
     * Cache configuration for the in-process tenant cache and Redis.
     */
    public static class CacheConfig {
        // Redis key prefix
        private String keyPrefix = "gw:";

        private Duration tenantTtl = Duration.ofHours(1);

        private Duration quotaTtl = Duration.ofMinutes(5);

        // How often expired tenant cache entries are swept
        private Duration sweepInterval = Duration.ofMinutes(5);

        // Pub/sub channel on which tenant management publishes changed tenant ids
        private String invalidationChannel = "gw:tenant-invalidation";

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }

        public Duration getTenantTtl() {
            return tenantTtl;
        }

        public void setTenantTtl(Duration tenantTtl) {
            this.tenantTtl = tenantTtl;
        }

        public Duration getQuotaTtl() {
            return quotaTtl;
        }

        public void setQuotaTtl(Duration quotaTtl) {
            this.quotaTtl = quotaTtl;
        }

        public Duration getSweepInterval() {
            return sweepInterval;
        }

        public void setSweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
        }

        public String getInvalidationChannel() {
            return invalidationChannel;
        }

        public void setInvalidationChannel(String invalidationChannel) {
            this.invalidationChannel = invalidationChannel;
        }
    }

    /**
     * Fixed-window rate limiting.
     */
    public static class RateLimitConfig {
        private Duration window = Duration.ofHours(1);

        // Used when an API key record carries no limit of its own
        private int defaultKeyLimit = 1000;

        // Per-hour limit applied to JWT (human) callers
        private int defaultUserLimit = 1000;

        private Duration sweepInterval = Duration.ofHours(1);

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }

        public int getDefaultKeyLimit() {
            return defaultKeyLimit;
        }

        public void setDefaultKeyLimit(int defaultKeyLimit) {
            this.defaultKeyLimit = defaultKeyLimit;
        }

        public int getDefaultUserLimit() {
            return defaultUserLimit;
        }

        public void setDefaultUserLimit(int defaultUserLimit) {
            this.defaultUserLimit = defaultUserLimit;
        }

        public Duration getSweepInterval() {
            return sweepInterval;
        }

        public void setSweepInterval(Duration sweepInterval) {
            this.sweepInterval = sweepInterval;
        }
    }

    /**
     * Machine credential carriers and format.
     */
    public static class ApiKeyConfig {
        @NotBlank
        private String prefix = "fb_";

        private String header = "X-API-Key";

        private String queryParam = "api_key";

        public String getPrefix() {
            return prefix;
        }

        public void setPrefix(String prefix) {
            this.prefix = prefix;
        }

        public String getHeader() {
            return header;
        }

        public void setHeader(String header) {
            this.header = header;
        }

        public String getQueryParam() {
            return queryParam;
        }

        public void setQueryParam(String queryParam) {
            this.queryParam = queryParam;
        }
    }

    /**
     * Session token signing.
     */
    public static class JwtConfig {
        private String accessSecret;

        private String refreshSecret;

        private Duration accessTtl = Duration.ofHours(2);

        private Duration refreshTtl = Duration.ofDays(30);

        private String issuer = "faceblog-api";

        private String audience = "faceblog-client";

        public String getAccessSecret() {
            return accessSecret;
        }

        public void setAccessSecret(String accessSecret) {
            this.accessSecret = accessSecret;
        }

        public String getRefreshSecret() {
            return refreshSecret;
        }

        public void setRefreshSecret(String refreshSecret) {
            this.refreshSecret = refreshSecret;
        }

        public Duration getAccessTtl() {
            return accessTtl;
        }

        public void setAccessTtl(Duration accessTtl) {
            this.accessTtl = accessTtl;
        }

        public Duration getRefreshTtl() {
            return refreshTtl;
        }

        public void setRefreshTtl(Duration refreshTtl) {
            this.refreshTtl = refreshTtl;
        }

        public String getIssuer() {
            return issuer;
        }

        public void setIssuer(String issuer) {
            this.issuer = issuer;
        }

        public String getAudience() {
            return audience;
        }

        public void setAudience(String audience) {
            this.audience = audience;
        }
    }

    /**
     * Host based tenant inference.
     */
    public static class TenancyConfig {
        // Hosts under this domain are resolved by subdomain, anything else as a custom domain
        private String baseDomain = "faceblog.com.br";

        private List<String> reservedSubdomains = new ArrayList<>(List.of("api", "admin", "www"));

        private String tenantHeader = "X-Tenant-ID";

        public String getBaseDomain() {
            return baseDomain;
        }

        public void setBaseDomain(String baseDomain) {
            this.baseDomain = baseDomain;
        }

        public List<String> getReservedSubdomains() {
            return reservedSubdomains;
        }

        public void setReservedSubdomains(List<String> reservedSubdomains) {
            this.reservedSubdomains = reservedSubdomains;
        }

        public String getTenantHeader() {
            return tenantHeader;
        }

        public void setTenantHeader(String tenantHeader) {
            this.tenantHeader = tenantHeader;
        }
    }

    /**
     * Billing quota checks.
     */
    public static class QuotaConfig {
        // Usage ratio from which advisory headers are attached
        private double warningThreshold = 0.8;

        public double getWarningThreshold() {
            return warningThreshold;
        }

        public void setWarningThreshold(double warningThreshold) {
            this.warningThreshold = warningThreshold;
        }
    }

    /**
     * Which paths run through the pipeline and what each route requires.
     */
    public static class RoutesConfig {
        private List<String> protectedPrefixes = new ArrayList<>(List.of("/api/"));

        private List<RouteRule> rules = new ArrayList<>();

        public List<String> getProtectedPrefixes() {
            return protectedPrefixes;
        }

        public void setProtectedPrefixes(List<String> protectedPrefixes) {
            this.protectedPrefixes = protectedPrefixes;
        }

        public List<RouteRule> getRules() {
            return rules;
        }

        public void setRules(List<RouteRule> rules) {
            this.rules = rules;
        }
    }

    /**
     * A route declaration. Empty methods match every method; a missing capability falls
     * back to the HTTP verb mapping.
     */
    public static class RouteRule {
        @NotBlank
        private String pattern;

        private List<String> methods = new ArrayList<>();

        private String capability;

        private String resource;

        // Plan feature flag the tenant must have
        private String feature;

        private boolean subscriptionRequired;

        // Allowance of the resource for tenants without a paying subscription
        @Positive
        private Integer trialLimit;

        private boolean optionalAuth;

        public String getPattern() {
            return pattern;
        }

        public void setPattern(String pattern) {
            this.pattern = pattern;
        }

        public List<String> getMethods() {
            return methods;
        }

        public void setMethods(List<String> methods) {
            this.methods = methods;
        }

        public String getCapability() {
            return capability;
        }

        public void setCapability(String capability) {
            this.capability = capability;
        }

        public String getResource() {
            return resource;
        }

        public void setResource(String resource) {
            this.resource = resource;
        }

        public String getFeature() {
            return feature;
        }

        public void setFeature(String feature) {
            this.feature = feature;
        }

        public boolean isSubscriptionRequired() {
            return subscriptionRequired;
        }

        public void setSubscriptionRequired(boolean subscriptionRequired) {
            this.subscriptionRequired = subscriptionRequired;
        }

        public Integer getTrialLimit() {
            return trialLimit;
        }

        public void setTrialLimit(Integer trialLimit) {
            this.trialLimit = trialLimit;
        }

        public boolean isOptionalAuth() {
            return optionalAuth;
        }

        public void setOptionalAuth(boolean optionalAuth) {
            this.optionalAuth = optionalAuth;
        }
    }
}
