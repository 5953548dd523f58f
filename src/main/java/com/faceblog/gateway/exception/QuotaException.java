package com.faceblog.gateway.exception;

import java.util.Map;

/**
 * Traffic (rate limit) or billing (plan limit) quota exhausted.
 */
public class QuotaException extends AuthPipelineException {

    public QuotaException(ErrorCode code, String message, Map<String, Object> details) {
        super(code, code.name(), message, details, null);
    }
}
