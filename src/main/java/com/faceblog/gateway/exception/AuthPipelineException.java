package com.faceblog.gateway.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base type for every outcome that stops a request inside the auth pipeline.
 *
 * <p>The {@link ErrorCode} and the public message end up in the denial body. The
 * reason is internal only: it is logged so that, for example, a forged token and an
 * expired token can be told apart even though both surface as {@code INVALID_TOKEN}.
 */
public abstract class AuthPipelineException extends RuntimeException {

    private final ErrorCode code;
    private final String reason;
    private final Map<String, Object> details;

    protected AuthPipelineException(ErrorCode code, String reason, String message,
                                    Map<String, Object> details, Throwable cause) {
        super(message != null ? message : code.getDefaultMessage(), cause);
        this.code = code;
        this.reason = reason != null ? reason : code.name();
        this.details = details != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(details))
                : Map.of();
    }

    public ErrorCode getCode() {
        return code;
    }

    /**
     * Internal reason code, never exposed in the response body.
     */
    public String getReason() {
        return reason;
    }

    /**
     * Extra public fields merged into the {@code error} object of the denial body.
     */
    public Map<String, Object> getDetails() {
        return details;
    }
}
