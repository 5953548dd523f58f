package com.faceblog.gateway.repository;

import com.faceblog.gateway.entity.SubscriptionEntity;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SubscriptionRepository extends ReactiveCrudRepository<SubscriptionEntity, String> {
}
