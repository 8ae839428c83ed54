package org.lite.dispatch.repository;

import org.lite.dispatch.entity.RateLimitBucketState;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface RateLimitBucketRepository extends ReactiveMongoRepository<RateLimitBucketState, String> {

    Mono<Long> deleteByLastAccessLessThan(long cutoff);
}
