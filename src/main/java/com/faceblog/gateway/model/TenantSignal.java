package com.faceblog.gateway.model;

/**
 * One piece of evidence about which tenant a request belongs to. Sources are listed in
 * resolution priority: an authenticated credential outranks anything taken from headers.
 */
public record TenantSignal(Source source, String value) {

    public enum Source {
        CREDENTIAL,
        HEADER,
        CUSTOM_DOMAIN,
        SUBDOMAIN
    }

    public static TenantSignal credential(String tenantId) {
        return new TenantSignal(Source.CREDENTIAL, tenantId);
    }

    public String cacheKey() {
        return source.name() + ":" + value;
    }
}
