package com.faceblog.gateway.exception;

import org.springframework.http.HttpStatus;

/**
 * Public denial codes and the HTTP status each one maps to.
 */
public enum ErrorCode {
    MISSING_API_KEY(HttpStatus.UNAUTHORIZED, "API key required"),
    MISSING_TOKEN(HttpStatus.UNAUTHORIZED, "Authorization token required"),
    INVALID_FORMAT(HttpStatus.UNAUTHORIZED, "Invalid credential format"),
    INVALID_KEY(HttpStatus.UNAUTHORIZED, "Invalid or expired API key"),
    INVALID_TOKEN(HttpStatus.UNAUTHORIZED, "Invalid or expired token"),

    TENANT_NOT_FOUND(HttpStatus.NOT_FOUND, "Tenant not found"),
    TENANT_SUSPENDED(HttpStatus.FORBIDDEN, "Tenant account suspended"),
    TENANT_EXPIRED(HttpStatus.PAYMENT_REQUIRED, "Tenant subscription expired"),
    TENANT_DELETED(HttpStatus.GONE, "Tenant account deleted"),
    TENANT_MISMATCH(HttpStatus.FORBIDDEN, "Token does not match tenant"),

    RATE_LIMIT_EXCEEDED(HttpStatus.TOO_MANY_REQUESTS, "Rate limit exceeded"),
    LIMIT_EXCEEDED(HttpStatus.PAYMENT_REQUIRED, "Plan limit exceeded"),
    TRIAL_LIMIT_EXCEEDED(HttpStatus.PAYMENT_REQUIRED, "Trial limit reached"),
    NO_SUBSCRIPTION(HttpStatus.PAYMENT_REQUIRED, "Active subscription required"),
    SUBSCRIPTION_INACTIVE(HttpStatus.PAYMENT_REQUIRED, "Subscription is not active"),
    SUBSCRIPTION_EXPIRED(HttpStatus.PAYMENT_REQUIRED, "Subscription has expired"),
    FEATURE_NOT_AVAILABLE(HttpStatus.PAYMENT_REQUIRED, "Feature not available in current plan"),

    INSUFFICIENT_PERMISSIONS(HttpStatus.FORBIDDEN, "Insufficient permissions"),

    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR, "Authentication service error");

    private final HttpStatus status;
    private final String defaultMessage;

    ErrorCode(HttpStatus status, String defaultMessage) {
        this.status = status;
        this.defaultMessage = defaultMessage;
    }

    public HttpStatus getStatus() {
        return status;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
