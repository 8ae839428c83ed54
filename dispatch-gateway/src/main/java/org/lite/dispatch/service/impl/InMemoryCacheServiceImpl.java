package org.lite.dispatch.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.dispatch.service.CacheService;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single-node stand-in for Redis used by the remote-dev profile. Published messages are only logged
 * and leases are held in memory.
 */
@Service
@Slf4j
@Profile("remote-dev")
@RequiredArgsConstructor
public class InMemoryCacheServiceImpl implements CacheService {

    private final Map<String, Entry> store = new ConcurrentHashMap<>();
    private final Clock clock;

    private record Entry(String value, long expiresAt) {
        boolean expired(long now) {
            return expiresAt > 0 && now >= expiresAt;
        }
    }

    @Override
    public Mono<Long> publish(String topic, String message) {
        log.debug("In-memory publish on {}: {}", topic, message);
        return Mono.just(0L);
    }

    /**
     * Granted when the key is free, expired or already held by {@code owner}. A renewal by the
     * holder does not extend the expiry.
     */
    @Override
    public Mono<Boolean> acquireLease(String key, String owner, Duration ttl) {
        return Mono.fromSupplier(() -> {
            long now = clock.millis();
            Entry held = store.compute(key, (k, existing) -> existing == null || existing.expired(now)
                    ? new Entry(owner, now + ttl.toMillis())
                    : existing);
            return owner.equals(held.value());
        });
    }
}
