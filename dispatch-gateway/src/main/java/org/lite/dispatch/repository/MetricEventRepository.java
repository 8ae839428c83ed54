package org.lite.dispatch.repository;

import org.lite.dispatch.entity.MetricEvent;
import org.lite.dispatch.enums.MetricKind;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface MetricEventRepository extends ReactiveMongoRepository<MetricEvent, String> {

    @Query(value = "{ 'kind': ?0, 'timestamp': { $gte: ?1, $lt: ?2 } }", sort = "{ 'timestamp': -1 }")
    Flux<MetricEvent> findByKindAndTimestampRange(MetricKind kind, long start, long end);

    @Query(value = "{ 'timestamp': { $gte: ?0, $lt: ?1 } }", sort = "{ 'timestamp': -1 }")
    Flux<MetricEvent> findByTimestampRange(long start, long end);

    // Retention purge
    Mono<Long> deleteByTimestampLessThan(long cutoff);
}
