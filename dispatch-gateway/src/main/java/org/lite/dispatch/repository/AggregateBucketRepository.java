package org.lite.dispatch.repository;

import org.lite.dispatch.entity.AggregateBucket;
import org.lite.dispatch.enums.AggregateResolution;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface AggregateBucketRepository extends ReactiveMongoRepository<AggregateBucket, String> {

    @Query(value = "{ 'resolution': ?0, 'metric': ?1, 'bucketStart': { $gte: ?2, $lt: ?3 } }",
            sort = "{ 'bucketStart': 1 }")
    Flux<AggregateBucket> findBuckets(AggregateResolution resolution, String metric, long start, long end);

    @Query(value = "{ 'resolution': ?0, 'bucketStart': { $gte: ?1 } }")
    Flux<AggregateBucket> findByResolutionSince(AggregateResolution resolution, long since);

    Mono<Long> deleteByResolutionAndBucketStartLessThan(AggregateResolution resolution, long cutoff);
}
