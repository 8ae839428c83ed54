package org.lite.dispatch.repository;

import org.lite.dispatch.entity.RateLimitViolation;
import org.lite.dispatch.enums.ScopeType;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface RateLimitViolationRepository extends ReactiveMongoRepository<RateLimitViolation, String> {

    Flux<RateLimitViolation> findByScopeAndKeyOrderByTimestampDesc(ScopeType scope, String key);

    Flux<RateLimitViolation> findByScopeOrderByTimestampDesc(ScopeType scope);

    Mono<Long> deleteByTimestampLessThan(long cutoff);
}
