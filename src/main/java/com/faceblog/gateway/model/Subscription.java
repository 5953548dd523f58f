package com.faceblog.gateway.model;

import com.faceblog.gateway.entity.PlanLimitsEntity;
import com.faceblog.gateway.entity.SubscriptionEntity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * A tenant's subscription joined with the feature flags of its plan.
 */
public record Subscription(
        String tenantId,
        String plan,
        String status,
        Instant currentPeriodEnd,
        Set<String> features
) {

    public static final String STATUS_ACTIVE = "active";
    public static final String STATUS_TRIALING = "trialing";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static Subscription from(SubscriptionEntity entity, PlanLimitsEntity planLimits) {
        String status = entity.getStatus() != null ? entity.getStatus().trim().toLowerCase(Locale.ROOT) : "";
        return new Subscription(
                entity.getTenantId(),
                entity.getPlan(),
                status,
                entity.getCurrentPeriodEnd(),
                planLimits != null ? parseFeatures(planLimits.getFeatures()) : Set.of()
        );
    }

    /**
     * Active or trialing. Other states (past_due, canceled, unpaid, ...) do not count.
     */
    public boolean isActive() {
        return STATUS_ACTIVE.equals(status) || STATUS_TRIALING.equals(status);
    }

    /**
     * Paying subscription: plan limits apply instead of trial limits.
     */
    public boolean isPaid() {
        return STATUS_ACTIVE.equals(status);
    }

    public boolean isExpired(Instant now) {
        return currentPeriodEnd != null && currentPeriodEnd.isBefore(now);
    }

    public boolean hasFeature(String feature) {
        return features.contains(feature);
    }

    // JSON array of strings; anything else unlocks nothing
    static Set<String> parseFeatures(String raw) {
        if (raw == null || raw.isBlank()) {
            return Set.of();
        }
        try {
            JsonNode node = MAPPER.readTree(raw);
            if (!node.isArray()) {
                return Set.of();
            }
            Set<String> features = new LinkedHashSet<>();
            node.forEach(element -> {
                if (element.isTextual() && !element.asText().isBlank()) {
                    features.add(element.asText().trim());
                }
            });
            return Collections.unmodifiableSet(features);
        } catch (JsonProcessingException e) {
            return Set.of();
        }
    }
}
