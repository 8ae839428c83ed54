package org.lite.dispatch.repository;

import org.lite.dispatch.entity.AlertRule;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface AlertRuleRepository extends ReactiveMongoRepository<AlertRule, String> {

    Flux<AlertRule> findByEnabledTrue();
}
