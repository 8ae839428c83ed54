package org.lite.dispatch.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.dispatch.service.RateLimiterService;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Writes changed rate limit buckets to MongoDB, one batch per interval.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RateLimitFlushScheduler {

    private final RateLimiterService rateLimiterService;

    @Scheduled(fixedDelayString = "${dispatch.rate-limit.flush-interval-ms:1000}")
    public void flush() {
        rateLimiterService.flushBuckets()
            .doOnSuccess(count -> {
                if (count != null && count > 0) {
                    log.debug("Flushed {} rate limit buckets", count);
                }
            })
            .doOnError(error -> log.error("Error flushing rate limit buckets: {}", error.getMessage()))
            .onErrorResume(error -> Mono.empty())
            .subscribe();
    }
}
