package com.faceblog.gateway.service;

import com.faceblog.gateway.config.GwProperties;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Map;

/**
 * Ownership lookup against the content tables ({@code author_id} column).
 */
@Component
public class DatabaseOwnershipLookup implements ResourceOwnershipLookup {

    private static final Map<String, String> OWNER_QUERIES = Map.of(
            "article", "SELECT author_id FROM articles WHERE id = :id AND tenant_id = :tenantId",
            "comment", "SELECT author_id FROM comments WHERE id = :id AND tenant_id = :tenantId"
    );

    private final DatabaseClient databaseClient;
    private final Duration storeTimeout;

    public DatabaseOwnershipLookup(DatabaseClient databaseClient, GwProperties properties) {
        this.databaseClient = databaseClient;
        this.storeTimeout = properties.getStore().getTimeout();
    }

    @Override
    public Mono<String> findOwner(String tenantId, String resourceType, String resourceId) {
        String sql = OWNER_QUERIES.get(resourceType);
        if (sql == null) {
            return Mono.error(new IllegalArgumentException("Unsupported resource type: " + resourceType));
        }
        return databaseClient.sql(sql)
                .bind("id", resourceId)
                .bind("tenantId", tenantId)
                .map((row, metadata) -> row.get("author_id", String.class))
                .one()
                .timeout(storeTimeout);
    }
}
