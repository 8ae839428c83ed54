package org.lite.dispatch.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.dispatch.config.DispatchProperties;
import org.lite.dispatch.service.CacheService;
import org.lite.dispatch.service.MetricsStore;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Rolls completed minutes into aggregate buckets on every instance, then lets a single lease
 * holder purge expired raw events and buckets from storage.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsRollupScheduler {

    private final MetricsStore metricsStore;
    private final CacheService cacheService;
    private final DispatchProperties properties;

    @Scheduled(initialDelayString = "${dispatch.metrics.rollup-interval-ms:60000}",
            fixedDelayString = "${dispatch.metrics.rollup-interval-ms:60000}")
    public void rollup() {
        DispatchProperties.Metrics config = properties.getMetrics();
        metricsStore.rollup()
            .doOnSuccess(count -> log.debug("Persisted {} aggregate buckets", count))
            .onErrorResume(error -> {
                log.error("Error rolling up metrics: {}", error.getMessage());
                return Mono.just(0);
            })
            .doOnNext(count -> {
                int purged = metricsStore.purgeMemory();
                if (purged > 0) {
                    log.info("Purged {} expired metric entries from memory", purged);
                }
            })
            .then(cacheService.acquireLease(config.getRollupLeaseKey(), properties.getInstanceId(),
                    Duration.ofMillis(config.getRollupLeaseTtlMs())))
            .filter(Boolean::booleanValue)
            .flatMap(held -> metricsStore.purgeDurable())
            .doOnNext(deleted -> {
                if (deleted > 0) {
                    log.info("Purged {} expired metric documents", deleted);
                }
            })
            .doOnError(error -> log.error("Error purging expired metrics: {}", error.getMessage()))
            .onErrorResume(error -> Mono.empty())
            .subscribe();
    }
}
