package com.faceblog.gateway.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Instant;

/**
 * Persisted request count of one credential in one hour-aligned window.
 * {@code window_key} is {@code <credentialId>:<windowStartEpochSecond>}.
 */
@Table("rate_limit_window")
public class RateLimitWindowEntity {

    @Id
    @Column("window_key")
    private String windowKey;

    @Column("credential_id")
    private String credentialId;

    @Column("window_start")
    private Instant windowStart;

    @Column("request_count")
    private long requestCount;

    @Column("updated_at")
    private Instant updatedAt;

    public RateLimitWindowEntity() {
    }

    public String getWindowKey() {
        return windowKey;
    }

    public void setWindowKey(String windowKey) {
        this.windowKey = windowKey;
    }

    public String getCredentialId() {
        return credentialId;
    }

    public void setCredentialId(String credentialId) {
        this.credentialId = credentialId;
    }

    public Instant getWindowStart() {
        return windowStart;
    }

    public void setWindowStart(Instant windowStart) {
        this.windowStart = windowStart;
    }

    public long getRequestCount() {
        return requestCount;
    }

    public void setRequestCount(long requestCount) {
        this.requestCount = requestCount;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }
}
