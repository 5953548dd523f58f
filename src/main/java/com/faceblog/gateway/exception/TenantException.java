package com.faceblog.gateway.exception;

/**
 * Tenant could not be resolved, is not in a usable state, or does not match the token.
 */
public class TenantException extends AuthPipelineException {

    public TenantException(ErrorCode code, String reason) {
        super(code, reason, null, null, null);
    }
}
