package com.faceblog.gateway.repository;

import com.faceblog.gateway.entity.PlanLimitsEntity;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface PlanLimitsRepository extends ReactiveCrudRepository<PlanLimitsEntity, String> {
}
