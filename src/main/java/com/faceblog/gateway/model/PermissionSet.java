package com.faceblog.gateway.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Set of capability strings held by a caller ({@code read}, {@code write}, {@code admin},
 * {@code articles:update:own}, ...).
 *
 * <p>Stored permission columns come in three shapes: a JSON array, a JSON object with a
 * {@code permissions} array, or a comma separated list. {@link #fromStored(String)} accepts
 * all of them so nothing past the repository boundary has to care.
 */
public final class PermissionSet {

    public static final String ADMIN = "admin";
    public static final String WILDCARD = "*";

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final PermissionSet EMPTY = new PermissionSet(Set.of());

    private final Set<String> capabilities;

    private PermissionSet(Set<String> capabilities) {
        this.capabilities = capabilities;
    }

    public static PermissionSet empty() {
        return EMPTY;
    }

    public static PermissionSet of(String... capabilities) {
        return of(Arrays.asList(capabilities));
    }

    public static PermissionSet of(Collection<String> capabilities) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String capability : capabilities) {
            if (capability != null && !capability.isBlank()) {
                normalized.add(capability.trim());
            }
        }
        return normalized.isEmpty() ? EMPTY : new PermissionSet(Collections.unmodifiableSet(normalized));
    }

    public static PermissionSet fromStored(String raw) {
        if (raw == null || raw.isBlank()) {
            return EMPTY;
        }
        String trimmed = raw.trim();
        if (!trimmed.startsWith("[") && !trimmed.startsWith("{")) {
            return of(trimmed.split(","));
        }
        try {
            JsonNode node = MAPPER.readTree(trimmed);
            if (node.isObject()) {
                node = node.path("permissions");
            }
            if (!node.isArray()) {
                return EMPTY;
            }
            Set<String> values = new LinkedHashSet<>();
            node.forEach(element -> {
                if (element.isTextual()) {
                    values.add(element.asText());
                }
            });
            return of(values);
        } catch (JsonProcessingException e) {
            return EMPTY;
        }
    }

    public boolean contains(String capability) {
        return capabilities.contains(capability);
    }

    /**
     * True when the set grants every capability.
     */
    public boolean isUnrestricted() {
        return capabilities.contains(ADMIN) || capabilities.contains(WILDCARD);
    }

    public boolean isEmpty() {
        return capabilities.isEmpty();
    }

    public Set<String> asSet() {
        return capabilities;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PermissionSet other)) {
            return false;
        }
        return capabilities.equals(other.capabilities);
    }

    @Override
    public int hashCode() {
        return capabilities.hashCode();
    }

    @Override
    public String toString() {
        return capabilities.toString();
    }
}
