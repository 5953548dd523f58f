package com.faceblog.gateway.service;

import com.faceblog.gateway.model.AuthContext;
import com.faceblog.gateway.model.PermissionSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Capability checks for authenticated callers.
 *
 * <p>A caller holds a capability when its permission set is unrestricted, its role is admin,
 * the set contains the capability, or the role's default set does. A verb grant ({@code read},
 * {@code write}) also covers the resource-scoped capability of the same verb, so a
 * {@code write} key may create {@code articles:write} resources. {@code write} does not
 * imply {@code read}.
 */
@Service
public class PermissionEngine {
    private static final Logger log = LoggerFactory.getLogger(PermissionEngine.class);

    public static final String READ = "read";
    public static final String WRITE = "write";
    public static final String ADMIN = "admin";

    private static final String OWN_SUFFIX = ":own";

    private static final Map<String, Set<String>> ROLE_DEFAULTS = Map.of(
            "editor", Set.of(READ, WRITE,
                    "articles:read", "articles:write", "articles:update", "categories:read", "tags:read"),
            "author", Set.of(READ, WRITE,
                    "articles:read", "articles:write", "articles:update:own"),
            "subscriber", Set.of(READ, "articles:read")
    );

    private final ResourceOwnershipLookup ownershipLookup;

    public PermissionEngine(ResourceOwnershipLookup ownershipLookup) {
        this.ownershipLookup = ownershipLookup;
    }

    /**
     * Machine callers carry no role.
     */
    public boolean authorize(PermissionSet permissions, String requiredCapability) {
        return authorize(permissions, null, requiredCapability);
    }

    public boolean authorize(PermissionSet permissions, String role, String requiredCapability) {
        if (requiredCapability == null || requiredCapability.isBlank()) {
            return true;
        }
        if (permissions != null && (permissions.isUnrestricted() || permissions.contains(requiredCapability)
                || grantedByVerb(permissions, requiredCapability))) {
            return true;
        }
        if (role == null) {
            return false;
        }
        String normalizedRole = role.toLowerCase(Locale.ROOT);
        return ADMIN.equals(normalizedRole)
                || ROLE_DEFAULTS.getOrDefault(normalizedRole, Set.of()).contains(requiredCapability);
    }

    /**
     * Check a capability on one specific resource. Holding the plain capability is enough;
     * holding only its {@code :own} variant additionally requires the caller to own the resource.
     *
     * @param capability   plain capability, e.g. {@code articles:update}
     * @param resourceType resource kind known to the ownership lookup
     * @param resourceId   id of the resource within the caller's tenant
     */
    public Mono<Boolean> authorizeOwned(AuthContext caller, String capability,
                                        String resourceType, String resourceId) {
        if (authorize(caller.getPermissions(), caller.getRole(), capability)) {
            return Mono.just(true);
        }
        if (caller.getUserId() == null
                || !authorize(caller.getPermissions(), caller.getRole(), capability + OWN_SUFFIX)) {
            return Mono.just(false);
        }
        return ownershipLookup.findOwner(caller.getTenantId(), resourceType, resourceId)
                .map(owner -> owner.equals(caller.getUserId()))
                .defaultIfEmpty(false)
                .doOnNext(owned -> {
                    if (!owned) {
                        log.debug("User {} does not own {} {}", caller.getUserId(), resourceType, resourceId);
                    }
                });
    }

    /**
     * {@code articles:write} is covered by {@code write}; {@code articles:update:own} and
     * other multi-part capabilities are not.
     */
    private static boolean grantedByVerb(PermissionSet permissions, String capability) {
        int colon = capability.indexOf(':');
        if (colon <= 0 || capability.indexOf(':', colon + 1) >= 0) {
            return false;
        }
        String verb = capability.substring(colon + 1);
        return (READ.equals(verb) || WRITE.equals(verb)) && permissions.contains(verb);
    }

    /**
     * Generic capability implied by an HTTP method.
     */
    public String capabilityFor(HttpMethod method) {
        switch (method.name()) {
            case "GET":
            case "HEAD":
            case "OPTIONS":
                return READ;
            case "DELETE":
                return ADMIN;
            default:
                return WRITE;
        }
    }
}
