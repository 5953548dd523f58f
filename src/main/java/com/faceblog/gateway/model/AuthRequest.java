package com.faceblog.gateway.model;

/**
 * Everything the pipeline needs to know about an inbound request.
 *
 * @param tenantHeader value of the tenant hint header, may be null
 * @param host         Host header, may be null
 */
public record AuthRequest(
        PresentedCredential credential,
        String tenantHeader,
        String host,
        RouteRequirement requirement
) {
}
