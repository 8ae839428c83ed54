package org.lite.dispatch.service;

import org.lite.dispatch.entity.AggregateBucket;
import org.lite.dispatch.entity.MetricEvent;
import org.lite.dispatch.enums.AggregateResolution;
import org.lite.dispatch.enums.MetricKind;
import org.lite.dispatch.enums.MetricName;
import org.lite.dispatch.model.AggregatedMetrics;
import org.lite.dispatch.model.MetricFilter;
import org.lite.dispatch.model.ProviderHealth;
import org.lite.dispatch.model.TimeSeriesPoint;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Outcome metrics with an in-memory read side and a buffered durable write side.
 *
 * <p>Reads are answered from memory only. Writes reach MongoDB after at most one flush interval
 * plus retry backoff; that is the consistency window between {@link #query} and the other reads.
 * Time ranges are inclusive at both ends and expressed in epoch milliseconds.
 */
public interface MetricsStore {

    /**
     * Buffers an event. Never throws and never waits on storage.
     */
    void record(MetricEvent event);

    AggregatedMetrics getAggregated(MetricName metric, long startTime, long endTime, MetricFilter filter);

    List<TimeSeriesPoint> getTimeSeries(MetricName metric, long startTime, long endTime, long bucketMs,
                                        MetricFilter filter);

    List<AggregateBucket> getBuckets(AggregateResolution resolution, MetricName metric, long startTime,
                                     long endTime, MetricFilter filter);

    long getCount(MetricName metric, long startTime, long endTime, MetricFilter filter);

    /**
     * Raw events from durable storage, newest first.
     */
    Flux<MetricEvent> query(MetricFilter filter, MetricKind kind, long startTime, long endTime, int limit, int offset);

    Map<String, ProviderHealth> getProviderHealth();

    long getDroppedMetricsCount();

    int getBufferedCount();

    /**
     * Writes buffered events to storage in batches. Emits the number of events persisted.
     */
    Mono<Integer> flush();

    /**
     * Rolls completed minutes into minute buckets and refreshes the hour and day buckets they
     * belong to. Emits the number of buckets persisted.
     */
    Mono<Integer> rollup();

    /**
     * Drops expired raw events and buckets from memory. Emits the number of entries removed.
     */
    int purgeMemory();

    /**
     * Drops expired raw events and buckets from durable storage.
     */
    Mono<Long> purgeDurable();
}
