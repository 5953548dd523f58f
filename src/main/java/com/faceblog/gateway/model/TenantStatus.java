package com.faceblog.gateway.model;

import java.util.Locale;

public enum TenantStatus {
    ACTIVE,
    SUSPENDED,
    EXPIRED,
    DELETED;

    /**
     * Parse the stored status column. Unknown values are treated as deleted so that they
     * never admit traffic.
     */
    public static TenantStatus fromStored(String value) {
        if (value == null) {
            return DELETED;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return DELETED;
        }
    }
}
