package org.lite.dispatch.repository;

import org.lite.dispatch.entity.UserQuota;
import org.springframework.data.mongodb.repository.ReactiveMongoRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface UserQuotaRepository extends ReactiveMongoRepository<UserQuota, String> {

    Flux<UserQuota> findByEnabledTrue();
}
