package org.lite.dispatch.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.dispatch.config.DispatchProperties;
import org.lite.dispatch.service.CacheService;
import org.lite.dispatch.service.RateLimiterService;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

@Component
@RequiredArgsConstructor
@Slf4j
public class RateLimitCleanupScheduler {

    private final RateLimiterService rateLimiterService;
    private final CacheService cacheService;
    private final DispatchProperties properties;

    @Scheduled(initialDelayString = "${dispatch.rate-limit.cleanup-interval-ms:3600000}",
            fixedDelayString = "${dispatch.rate-limit.cleanup-interval-ms:3600000}")
    public void cleanup() {
        int evicted = rateLimiterService.evictIdleBuckets();
        if (evicted > 0) {
            log.info("Evicted {} idle rate limit buckets", evicted);
        }
        DispatchProperties.RateLimit config = properties.getRateLimit();
        cacheService.acquireLease(config.getCleanupLeaseKey(), properties.getInstanceId(),
                    Duration.ofMillis(Math.max(1_000, config.getCleanupIntervalMs() - 1_000)))
            .filter(Boolean::booleanValue)
            .flatMap(held -> rateLimiterService.purgeDurable())
            .doOnNext(deleted -> log.info("Purged {} idle bucket states and expired violations", deleted))
            .doOnError(error -> log.error("Error purging rate limit state: {}", error.getMessage()))
            .onErrorResume(error -> Mono.empty())
            .subscribe();
    }
}
