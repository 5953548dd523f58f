package com.faceblog.gateway.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

/**
 * Current resource counts per tenant, maintained by the content services.
 */
@Table("tenant_usage")
public class TenantUsageEntity {

    @Id
    @Column("tenant_id")
    private String tenantId;

    @Column("articles_count")
    private long articlesCount;

    @Column("categories_count")
    private long categoriesCount;

    @Column("tags_count")
    private long tagsCount;

    @Column("users_count")
    private long usersCount;

    @Column("api_keys_count")
    private long apiKeysCount;

    @Column("api_requests_count")
    private long apiRequestsCount;

    public TenantUsageEntity() {
    }

    public String getTenantId() {
        return tenantId;
    }

    public void setTenantId(String tenantId) {
        this.tenantId = tenantId;
    }

    public long getArticlesCount() {
        return articlesCount;
    }

    public void setArticlesCount(long articlesCount) {
        this.articlesCount = articlesCount;
    }

    public long getCategoriesCount() {
        return categoriesCount;
    }

    public void setCategoriesCount(long categoriesCount) {
        this.categoriesCount = categoriesCount;
    }

    public long getTagsCount() {
        return tagsCount;
    }

    public void setTagsCount(long tagsCount) {
        this.tagsCount = tagsCount;
    }

    public long getUsersCount() {
        return usersCount;
    }

    public void setUsersCount(long usersCount) {
        this.usersCount = usersCount;
    }

    public long getApiKeysCount() {
        return apiKeysCount;
    }

    public void setApiKeysCount(long apiKeysCount) {
        this.apiKeysCount = apiKeysCount;
    }

    public long getApiRequestsCount() {
        return apiRequestsCount;
    }

    public void setApiRequestsCount(long apiRequestsCount) {
        this.apiRequestsCount = apiRequestsCount;
    }
}
