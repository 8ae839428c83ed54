package org.lite.dispatch.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.dispatch.service.MetricsStore;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Writes buffered metric events to MongoDB even when traffic is too low to fill a batch.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsFlushScheduler {

    private final MetricsStore metricsStore;

    @Scheduled(fixedDelayString = "${dispatch.metrics.flush-interval-ms:5000}")
    public void flush() {
        if (metricsStore.getBufferedCount() == 0) {
            return;
        }
        metricsStore.flush()
            .doOnSuccess(count -> log.debug("Flushed {} metric events", count))
            .doOnError(error -> log.error("Error flushing metric events: {}", error.getMessage()))
            .onErrorResume(error -> Mono.empty())
            .subscribe();
    }
}
