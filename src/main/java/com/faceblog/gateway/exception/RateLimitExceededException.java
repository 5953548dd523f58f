package com.faceblog.gateway.exception;

import com.faceblog.gateway.model.RateLimitDecision;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Credential used up its current window. Carries the decision so the rate-limit headers
 * can be written on the denial too.
 */
public class RateLimitExceededException extends QuotaException {

    private final RateLimitDecision decision;

    public RateLimitExceededException(RateLimitDecision decision) {
        super(ErrorCode.RATE_LIMIT_EXCEEDED, null, details(decision));
        this.decision = decision;
    }

    public RateLimitDecision getDecision() {
        return decision;
    }

    private static Map<String, Object> details(RateLimitDecision decision) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("limit", decision.limit());
        details.put("remaining", decision.remaining());
        details.put("resetAt", decision.resetAt().toString());
        return details;
    }
}
