package org.lite.dispatch.repository;

import org.lite.dispatch.entity.Alert;
import org.lite.dispatch.enums.AlertState;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

import java.util.Collection;

@Repository
public interface AlertRepository extends ReactiveMongoRepository<Alert, String> {

    Flux<Alert> findByStateIn(Collection<AlertState> states);

    Flux<Alert> findByRuleIdOrderByStartedAtDesc(String ruleId);

    @Query(value = "{ 'startedAt': { $gte: ?0 } }", sort = "{ 'startedAt': -1 }")
    Flux<Alert> findStartedSince(long since);
}
