package com.faceblog.gateway.repository;

import com.faceblog.gateway.entity.RateLimitWindowEntity;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.Instant;

@Repository
public interface RateLimitWindowRepository extends ReactiveCrudRepository<RateLimitWindowEntity, String> {

    @Query("SELECT request_count FROM rate_limit_window WHERE window_key = :windowKey")
    Mono<Long> findCount(String windowKey);

    @Modifying
    @Query("INSERT INTO rate_limit_window (window_key, credential_id, window_start, request_count, updated_at) "
            + "VALUES (:windowKey, :credentialId, :windowStart, 1, NOW(3)) "
            + "ON DUPLICATE KEY UPDATE request_count = request_count + 1, updated_at = NOW(3)")
    Mono<Integer> increment(String windowKey, String credentialId, Instant windowStart);

    @Modifying
    @Query("DELETE FROM rate_limit_window WHERE window_start < :before")
    Mono<Integer> deleteOlderThan(Instant before);
}
