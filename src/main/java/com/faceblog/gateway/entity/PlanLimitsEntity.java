package com.faceblog.gateway.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Per-plan resource caps. A value of -1 means unlimited.
 */
@Table("plan_limits")
public class PlanLimitsEntity {

    @Id
    @Column("plan")
    private String plan;

    @Column("max_articles")
    private long maxArticles;

    @Column("max_categories")
    private long maxCategories;

    @Column("max_tags")
    private long maxTags;

    @Column("max_users")
    private long maxUsers;

    @Column("max_api_keys")
    private long maxApiKeys;

    @Column("max_api_requests")
    private long maxApiRequests;

    // JSON array of feature flags the plan unlocks
    @Column("features")
    private String features;

    public PlanLimitsEntity() {
    }

    public String getPlan() {
        return plan;
    }

    public void setPlan(String plan) {
        this.plan = plan;
    }

    public long getMaxArticles() {
        return maxArticles;
    }

    public void setMaxArticles(long maxArticles) {
        this.maxArticles = maxArticles;
    }

    public long getMaxCategories() {
        return maxCategories;
    }

    public void setMaxCategories(long maxCategories) {
        this.maxCategories = maxCategories;
    }

    public long getMaxTags() {
        return maxTags;
    }

    public void setMaxTags(long maxTags) {
        this.maxTags = maxTags;
    }

    public long getMaxUsers() {
        return maxUsers;
    }

    public void setMaxUsers(long maxUsers) {
        this.maxUsers = maxUsers;
    }

    public long getMaxApiKeys() {
        return maxApiKeys;
    }

    public void setMaxApiKeys(long maxApiKeys) {
        this.maxApiKeys = maxApiKeys;
    }

    public long getMaxApiRequests() {
        return maxApiRequests;
    }

    public void setMaxApiRequests(long maxApiRequests) {
        this.maxApiRequests = maxApiRequests;
    }

    public String getFeatures() {
        return features;
    }

    public void setFeatures(String features) {
        this.features = features;
    }
}
