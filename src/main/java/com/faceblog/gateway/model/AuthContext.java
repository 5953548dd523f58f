package com.faceblog.gateway.model;

/**
 * Immutable result of a request that passed the auth pipeline.
 * Attached to the exchange for downstream handlers and the post-handler usage hook.
 */
public class AuthContext {

    /** Exchange attribute and Reactor context key under which the context is published. */
    public static final String ATTRIBUTE = AuthContext.class.getName();

    private final Tenant tenant;
    private final CredentialType credentialType;
    private final String apiKeyId;    // null for session callers
    private final String userId;      // null for API key callers
    private final String role;        // null for API key callers
    private final PermissionSet permissions;
    private final RouteRequirement requirement;
    private final RateLimitDecision rateLimit;
    private final UsageWarning usageWarning;  // may be null

    public AuthContext(Tenant tenant,
                       CredentialType credentialType,
                       String apiKeyId,
                       String userId,
                       String role,
                       PermissionSet permissions,
                       RouteRequirement requirement,
                       RateLimitDecision rateLimit,
                       UsageWarning usageWarning) {
        this.tenant = tenant;
        this.credentialType = credentialType;
        this.apiKeyId = apiKeyId;
        this.userId = userId;
        this.role = role;
        this.permissions = permissions;
        this.requirement = requirement;
        this.rateLimit = rateLimit;
        this.usageWarning = usageWarning;
    }

    public static AuthContext forApiKey(Tenant tenant, ApiKeyRecord key, RouteRequirement requirement,
                                        RateLimitDecision rateLimit) {
        return new AuthContext(tenant, CredentialType.API_KEY, key.keyId(), null, null,
                key.permissions(), requirement, rateLimit, null);
    }

    public static AuthContext forSession(Tenant tenant, SessionClaims claims, RouteRequirement requirement,
                                         RateLimitDecision rateLimit) {
        return new AuthContext(tenant, CredentialType.SESSION, null, claims.userId(), claims.role(),
                claims.permissions(), requirement, rateLimit, null);
    }

    public AuthContext withUsageWarning(UsageWarning warning) {
        return new AuthContext(tenant, credentialType, apiKeyId, userId, role, permissions,
                requirement, rateLimit, warning);
    }

    public Tenant getTenant() {
        return tenant;
    }

    public String getTenantId() {
        return tenant.id();
    }

    public CredentialType getCredentialType() {
        return credentialType;
    }

    public String getApiKeyId() {
        return apiKeyId;
    }

    public String getUserId() {
        return userId;
    }

    public String getRole() {
        return role;
    }

    public PermissionSet getPermissions() {
        return permissions;
    }

    public RouteRequirement getRequirement() {
        return requirement;
    }

    public RateLimitDecision getRateLimit() {
        return rateLimit;
    }

    public UsageWarning getUsageWarning() {
        return usageWarning;
    }

    /**
     * Identity used for rate-limit windows and usage logs.
     */
    public String getCredentialId() {
        return credentialType == CredentialType.API_KEY ? apiKeyId : "user:" + userId;
    }

    @Override
    public String toString() {
        return "AuthContext{" +
                "tenantId='" + tenant.id() + '\'' +
                ", credentialType=" + credentialType +
                ", apiKeyId='" + apiKeyId + '\'' +
                ", userId='" + userId + '\'' +
                ", role='" + role + '\'' +
                '}';
    }
}
