package com.faceblog.gateway.exception;

import java.util.Map;

/**
 * Tenant's subscription does not cover the route: none on file, not active, expired, or the
 * plan lacks a required feature.
 */
public class BillingException extends AuthPipelineException {

    public BillingException(ErrorCode code, Map<String, Object> details) {
        super(code, code.name(), null, details, null);
    }
}
