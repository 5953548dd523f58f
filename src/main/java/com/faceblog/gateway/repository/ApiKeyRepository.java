package com.faceblog.gateway.repository;

import com.faceblog.gateway.entity.ApiKeyEntity;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.Instant;

@Repository
public interface ApiKeyRepository extends ReactiveCrudRepository<ApiKeyEntity, String> {

    Mono<ApiKeyEntity> findByKeyHash(String keyHash);

    @Modifying
    @Query("UPDATE api_key SET last_used_at = :usedAt WHERE key_id = :keyId")
    Mono<Integer> touchLastUsed(String keyId, Instant usedAt);
}
