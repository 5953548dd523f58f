package com.faceblog.gateway.model;

import java.time.Instant;

/**
 * Outcome of a rate-limit check for one request.
 */
public record RateLimitDecision(
        boolean allowed,
        int limit,
        int remaining,
        Instant resetAt
) {

    public long resetEpochSeconds() {
        return resetAt.getEpochSecond();
    }
}
