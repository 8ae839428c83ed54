package org.lite.dispatch.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.dispatch.service.CacheService;
import org.springframework.context.annotation.Profile;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;

@Service
@Slf4j
@Profile("!remote-dev")
@RequiredArgsConstructor
public class RedisCacheServiceImpl implements CacheService {

    private static final Duration TIMEOUT = Duration.ofMillis(500);

    private final ReactiveStringRedisTemplate redisTemplate;

    @Override
    public Mono<Long> publish(String topic, String message) {
        log.debug("Redis Publish: {} -> {}", topic, message);
        return redisTemplate.convertAndSend(topic, message)
                .timeout(TIMEOUT)
                .onErrorResume(e -> {
                    log.error("Redis Publish Failed: {}", e.getMessage());
                    return Mono.just(0L);
                });
    }

    @Override
    public Mono<Boolean> acquireLease(String key, String owner, Duration ttl) {
        return redisTemplate.opsForValue().setIfAbsent(key, owner, ttl)
                .timeout(TIMEOUT)
                .flatMap(acquired -> acquired
                        ? Mono.just(true)
                        : redisTemplate.opsForValue().get(key).map(owner::equals).defaultIfEmpty(false))
                .onErrorResume(e -> {
                    log.warn("Redis unavailable for lease {}, running locally: {}", key, e.getMessage());
                    return Mono.just(true);
                });
    }
}
