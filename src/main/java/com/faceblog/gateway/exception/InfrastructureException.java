package com.faceblog.gateway.exception;

/**
 * Backing store timed out or was unreachable. Whether this denies the request depends on
 * the stage: credential and tenant stages fail closed, rate limiting and logging fail open.
 */
public class InfrastructureException extends AuthPipelineException {

    public InfrastructureException(String reason, Throwable cause) {
        super(ErrorCode.INTERNAL_ERROR, reason, null, null, cause);
    }
}
