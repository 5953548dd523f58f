package com.faceblog.gateway.service;

import reactor.core.publisher.Mono;

/**
 * Finds the user that owns a tenant-scoped resource.
 */
public interface ResourceOwnershipLookup {

    /**
     * @return the owning user id, or empty when the resource does not exist in the tenant
     */
    Mono<String> findOwner(String tenantId, String resourceType, String resourceId);
}
