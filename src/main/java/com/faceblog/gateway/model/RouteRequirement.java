package com.faceblog.gateway.model;

/**
 * What a route demands beyond authentication. Any part may be null or false.
 *
 * @param capability           permission the caller must hold
 * @param resource             metered resource checked against the plan limit
 * @param feature              plan feature flag the tenant must have
 * @param subscriptionRequired tenant needs an active, unexpired subscription
 * @param trialLimit           allowance of {@code resource} for tenants without a paying
 *                             subscription; replaces the plan limit for them
 * @param optionalAuth         a missing or invalid credential lets the request through anonymously
 */
public record RouteRequirement(
        String capability,
        ResourceType resource,
        String feature,
        boolean subscriptionRequired,
        Integer trialLimit,
        boolean optionalAuth
) {

    public RouteRequirement(String capability, ResourceType resource) {
        this(capability, resource, null, false, null, false);
    }

    public boolean hasCapability() {
        return capability != null && !capability.isBlank();
    }

    public boolean isMetered() {
        return resource != null;
    }

    public boolean hasFeature() {
        return feature != null && !feature.isBlank();
    }

    public boolean hasTrialLimit() {
        return trialLimit != null && resource != null;
    }
}
