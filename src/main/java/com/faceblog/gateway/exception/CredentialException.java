package com.faceblog.gateway.exception;

/**
 * Missing, malformed, unknown, inactive, expired or revoked credential.
 */
public class CredentialException extends AuthPipelineException {

    public static final String REASON_KEY_NOT_FOUND = "KEY_NOT_FOUND";
    public static final String REASON_KEY_INACTIVE = "KEY_INACTIVE";
    public static final String REASON_KEY_EXPIRED = "KEY_EXPIRED";
    public static final String REASON_TOKEN_MALFORMED = "TOKEN_MALFORMED";
    public static final String REASON_TOKEN_SIGNATURE = "TOKEN_SIGNATURE";
    public static final String REASON_TOKEN_EXPIRED = "TOKEN_EXPIRED";
    public static final String REASON_TOKEN_REVOKED = "TOKEN_REVOKED";
    public static final String REASON_USER_INACTIVE = "USER_INACTIVE";

    public CredentialException(ErrorCode code) {
        this(code, null, null);
    }

    public CredentialException(ErrorCode code, String reason) {
        this(code, reason, null);
    }

    public CredentialException(ErrorCode code, String reason, String message) {
        super(code, reason, message, null, null);
    }

    public CredentialException(ErrorCode code, String reason, String message, Throwable cause) {
        super(code, reason, message, null, cause);
    }
}
