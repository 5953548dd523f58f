package com.faceblog.gateway.repository;

import com.faceblog.gateway.entity.TenantUsageEntity;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface TenantUsageRepository extends ReactiveCrudRepository<TenantUsageEntity, String> {
}
