package com.faceblog.gateway.model;

import java.util.List;

/**
 * Quota verdict for one resource of one tenant. A trial check compares usage with the route's
 * trial allowance instead of the plan limit.
 */
public record QuotaCheck(
        ResourceType resource,
        boolean exceeded,
        long current,
        long limit,
        String plan,
        List<QuotaViolation> violations,
        boolean trial
) {

    public static final String TRIAL_PLAN = "trial";

    public QuotaCheck(ResourceType resource, boolean exceeded, long current, long limit,
                      String plan, List<QuotaViolation> violations) {
        this(resource, exceeded, current, limit, plan, violations, false);
    }

    public static QuotaCheck unknown(ResourceType resource) {
        return new QuotaCheck(resource, false, 0, ResourceType.UNLIMITED, null, List.of());
    }

    public static QuotaCheck forTrial(ResourceType resource, long current, long trialLimit) {
        return new QuotaCheck(resource, current >= trialLimit, current, trialLimit, TRIAL_PLAN, List.of(), true);
    }

    public boolean isUnlimited() {
        return limit == ResourceType.UNLIMITED;
    }
}
