package com.faceblog.gateway.exception;

import java.util.Map;

/**
 * Caller is authenticated but lacks the capability the route requires.
 */
public class PermissionException extends AuthPipelineException {

    public PermissionException(String requiredCapability, String reason) {
        super(ErrorCode.INSUFFICIENT_PERMISSIONS, reason,
                "Permission '" + requiredCapability + "' required",
                Map.of("required", requiredCapability), null);
    }
}
