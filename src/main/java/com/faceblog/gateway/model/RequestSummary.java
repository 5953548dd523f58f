package com.faceblog.gateway.model;

/**
 * Request facts recorded in the usage log once the handler has responded.
 */
public record RequestSummary(
        String method,
        String path,
        int statusCode,
        String clientIp,
        String userAgent
) {

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }
}
