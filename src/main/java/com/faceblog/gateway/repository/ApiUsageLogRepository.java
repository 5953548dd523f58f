package com.faceblog.gateway.repository;

import com.faceblog.gateway.entity.ApiUsageLogEntity;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ApiUsageLogRepository extends ReactiveCrudRepository<ApiUsageLogEntity, Long> {
}
