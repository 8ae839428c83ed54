package org.lite.dispatch.service;

import reactor.core.publisher.Mono;

import java.time.Duration;

public interface CacheService {

    // Pub/Sub
    Mono<Long> publish(String topic, String message);

    /**
     * Claims a cluster-wide lease for a background job. Emits true when this instance may run the
     * job, including when the backing store cannot be reached.
     */
    Mono<Boolean> acquireLease(String key, String owner, Duration ttl);
}
