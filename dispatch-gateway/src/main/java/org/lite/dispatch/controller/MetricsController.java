package org.lite.dispatch.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.dispatch.context.DispatchContext;
import org.lite.dispatch.dto.CacheEventRequest;
import org.lite.dispatch.entity.AggregateBucket;
import org.lite.dispatch.entity.MetricEvent;
import org.lite.dispatch.enums.AggregateResolution;
import org.lite.dispatch.enums.MetricKind;
import org.lite.dispatch.enums.MetricName;
import org.lite.dispatch.model.AggregatedMetrics;
import org.lite.dispatch.model.MetricFilter;
import org.lite.dispatch.model.TimeSeriesPoint;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;

/**
 * Read side of the metrics store. Ranges are epoch milliseconds, inclusive at both ends, and
 * default to the last hour.
 */
@RestController
@RequestMapping("/api/metrics")
@RequiredArgsConstructor
@Slf4j
public class MetricsController {

    private static final long DEFAULT_RANGE_MS = 3_600_000;

    private final DispatchContext dispatchContext;
    private final Clock clock;

    @GetMapping("/aggregate")
    public Mono<AggregatedMetrics> getAggregated(
        @RequestParam String metric,
        @RequestParam(required = false) Long start,
        @RequestParam(required = false) Long end,
        @RequestParam(required = false) String provider,
        @RequestParam(required = false) String model,
        @RequestParam(required = false) String userId
    ) {
        return Mono.fromCallable(() -> {
            long[] range = range(start, end);
            return dispatchContext.getMetricsStore().getAggregated(metricName(metric), range[0], range[1],
                filter(provider, model, userId));
        });
    }

    @GetMapping("/count")
    public Mono<Long> getCount(
        @RequestParam String metric,
        @RequestParam(required = false) Long start,
        @RequestParam(required = false) Long end,
        @RequestParam(required = false) String provider,
        @RequestParam(required = false) String model,
        @RequestParam(required = false) String userId
    ) {
        return Mono.fromCallable(() -> {
            long[] range = range(start, end);
            return dispatchContext.getMetricsStore().getCount(metricName(metric), range[0], range[1],
                filter(provider, model, userId));
        });
    }

    @GetMapping("/timeseries")
    public Mono<List<TimeSeriesPoint>> getTimeSeries(
        @RequestParam String metric,
        @RequestParam(required = false) Long start,
        @RequestParam(required = false) Long end,
        @RequestParam(defaultValue = "60000") long bucketMs,
        @RequestParam(required = false) String provider,
        @RequestParam(required = false) String model,
        @RequestParam(required = false) String userId
    ) {
        return Mono.fromCallable(() -> {
            long[] range = range(start, end);
            return dispatchContext.getMetricsStore().getTimeSeries(metricName(metric), range[0], range[1], bucketMs,
                filter(provider, model, userId));
        });
    }

    @GetMapping("/buckets")
    public Mono<List<AggregateBucket>> getBuckets(
        @RequestParam String metric,
        @RequestParam(defaultValue = "MINUTE") AggregateResolution resolution,
        @RequestParam(required = false) Long start,
        @RequestParam(required = false) Long end,
        @RequestParam(required = false) String provider,
        @RequestParam(required = false) String model
    ) {
        return Mono.fromCallable(() -> {
            long[] range = range(start, end);
            return dispatchContext.getMetricsStore().getBuckets(resolution, metricName(metric), range[0], range[1],
                MetricFilter.of(provider, model));
        });
    }

    /**
     * Raw events from MongoDB, newest first. Events still buffered in memory are not included.
     */
    @GetMapping("/events")
    public Flux<MetricEvent> queryEvents(
        @RequestParam(required = false) MetricKind kind,
        @RequestParam(required = false) Long start,
        @RequestParam(required = false) Long end,
        @RequestParam(required = false) String provider,
        @RequestParam(required = false) String model,
        @RequestParam(required = false) String userId,
        @RequestParam(defaultValue = "100") int limit,
        @RequestParam(defaultValue = "0") int offset
    ) {
        return Mono.fromCallable(() -> range(start, end))
            .flatMapMany(range -> dispatchContext.getMetricsStore().query(filter(provider, model, userId), kind,
                range[0], range[1], limit, offset));
    }

    /**
     * Records a cache hit, miss or store. Feeds the {@code cache_hit} dimension.
     */
    @PostMapping("/cache-events")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public Mono<Void> recordCacheEvent(@Valid @RequestBody CacheEventRequest request) {
        return Mono.fromRunnable(() -> dispatchContext.getMetricsStore().record(MetricEvent.builder()
            .timestamp(clock.millis())
            .kind(MetricKind.CACHE)
            .provider(request.getProvider())
            .model(request.getModel())
            .userId(request.getUserId())
            .cache(MetricEvent.CacheDetail.builder()
                .type(request.getType())
                .cacheKey(request.getCacheKey())
                .savedCost(request.getSavedCost())
                .savedTokens(request.getSavedTokens())
                .build())
            .build()));
    }

    private long[] range(Long start, Long end) {
        long to = end != null ? end : clock.millis();
        long from = start != null ? start : to - DEFAULT_RANGE_MS;
        if (from > to) {
            throw new IllegalArgumentException("start must not be after end");
        }
        return new long[]{from, to};
    }

    private static MetricName metricName(String metric) {
        return MetricName.fromKey(metric)
            .orElseThrow(() -> new IllegalArgumentException("Unknown metric: " + metric));
    }

    private static MetricFilter filter(String provider, String model, String userId) {
        return MetricFilter.builder().provider(provider).model(model).userId(userId).build();
    }
}
