package com.faceblog.gateway.repository;

import com.faceblog.gateway.entity.TenantEntity;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface TenantRepository extends ReactiveCrudRepository<TenantEntity, String> {

    // An active owner wins over older rows that released the same host
    @Query("SELECT * FROM tenant WHERE subdomain = :subdomain ORDER BY status = 'active' DESC, updated_at DESC LIMIT 1")
    Mono<TenantEntity> findBySubdomain(String subdomain);

    @Query("SELECT * FROM tenant WHERE custom_domain = :domain ORDER BY status = 'active' DESC, updated_at DESC LIMIT 1")
    Mono<TenantEntity> findByCustomDomain(String domain);
}
