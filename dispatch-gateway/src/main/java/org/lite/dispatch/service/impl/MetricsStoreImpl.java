package org.lite.dispatch.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.lite.dispatch.config.DispatchProperties;
import org.lite.dispatch.entity.AggregateBucket;
import org.lite.dispatch.entity.MetricEvent;
import org.lite.dispatch.enums.AggregateResolution;
import org.lite.dispatch.enums.MetricKind;
import org.lite.dispatch.enums.MetricName;
import org.lite.dispatch.enums.ProviderHealthStatus;
import org.lite.dispatch.model.AggregatedMetrics;
import org.lite.dispatch.model.MetricFilter;
import org.lite.dispatch.model.ProviderHealth;
import org.lite.dispatch.model.TimeSeriesPoint;
import org.lite.dispatch.repository.AggregateBucketRepository;
import org.lite.dispatch.repository.MetricEventRepository;
import org.lite.dispatch.service.MetricsStore;
import org.lite.dispatch.service.metrics.AggregateBuckets;
import org.lite.dispatch.service.metrics.MetricWriteBuffer;
import org.lite.dispatch.service.metrics.Percentiles;
import org.lite.dispatch.service.metrics.QuantileSketch;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ConcurrentSkipListMap;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

@Service
@Slf4j
public class MetricsStoreImpl implements MetricsStore {

    private static final long MINUTE_MS = AggregateResolution.MINUTE.widthMs();
    private static final long HEALTH_WINDOW_MS = AggregateResolution.HOUR.widthMs();
    private static final int MAX_SERIES_POINTS = 10_000;

    private final MetricEventRepository metricEventRepository;
    private final AggregateBucketRepository aggregateBucketRepository;
    private final DispatchProperties.Metrics config;
    private final String instanceId;
    private final Clock clock;

    private final MetricWriteBuffer<MetricEvent> buffer;
    private final AtomicBoolean flushing = new AtomicBoolean(false);

    // raw events by minute start
    private final ConcurrentSkipListMap<Long, ConcurrentLinkedQueue<MetricEvent>> rawSlots = new ConcurrentSkipListMap<>();
    // bucket start -> bucket id -> bucket, per resolution; inner maps are replaced, never mutated
    private final Map<AggregateResolution, ConcurrentSkipListMap<Long, Map<String, AggregateBucket>>> buckets =
            new EnumMap<>(AggregateResolution.class);
    private final ConcurrentSkipListSet<Long> dirtyMinutes = new ConcurrentSkipListSet<>();
    private final ConcurrentLinkedQueue<AggregateBucket> unpersisted = new ConcurrentLinkedQueue<>();
    private final AtomicLong lastRolledMinute = new AtomicLong(Long.MIN_VALUE);
    // earliest minute whose raw events are all still held in memory
    private final AtomicLong rawFloor;
    // events for minutes below the floor, folded into their existing buckets on the next rollup
    private final ConcurrentLinkedQueue<MetricEvent> lateEvents = new ConcurrentLinkedQueue<>();

    public MetricsStoreImpl(MetricEventRepository metricEventRepository,
                            AggregateBucketRepository aggregateBucketRepository,
                            DispatchProperties properties,
                            Clock clock) {
        this.metricEventRepository = metricEventRepository;
        this.aggregateBucketRepository = aggregateBucketRepository;
        this.config = properties.getMetrics();
        this.instanceId = properties.getInstanceId();
        this.clock = clock;
        this.buffer = new MetricWriteBuffer<>(config.getBufferCapacity());
        this.rawFloor = new AtomicLong(AggregateResolution.MINUTE.bucketStart(clock.millis()));
        for (AggregateResolution resolution : AggregateResolution.values()) {
            buckets.put(resolution, new ConcurrentSkipListMap<>());
        }
    }

    @Override
    public void record(MetricEvent event) {
        if (event == null) {
            return;
        }
        try {
            MetricEvent stored = event.getId() == null ? event.withId(UUID.randomUUID().toString()) : event;
            long minute = AggregateResolution.MINUTE.bucketStart(stored.getTimestamp());
            if (minute < rawFloor.get()) {
                lateEvents.add(stored);
            } else {
                rawSlots.computeIfAbsent(minute, k -> new ConcurrentLinkedQueue<>()).add(stored);
                // read after the append so a concurrent rollup either sees the event or the dirty mark
                if (minute <= lastRolledMinute.get()) {
                    dirtyMinutes.add(minute);
                }
            }
            int size = buffer.offer(stored);
            if (size >= config.getBatchSize() && !flushing.get()) {
                flush().subscribeOn(Schedulers.boundedElastic()).subscribe();
            }
        } catch (RuntimeException e) {
            log.warn("Failed to record metric event of kind {}: {}", event.getKind(), e.getMessage());
        }
    }

    @Override
    public Mono<Integer> flush() {
        return Mono.defer(() -> {
            if (!flushing.compareAndSet(false, true)) {
                return Mono.just(0);
            }
            return flushBatches(0).doFinally(signal -> flushing.set(false));
        });
    }

    private Mono<Integer> flushBatches(int flushedSoFar) {
        return Mono.defer(() -> {
            List<MetricEvent> batch = buffer.drain(config.getBatchSize());
            if (batch.isEmpty()) {
                return Mono.just(flushedSoFar);
            }
            return persistBatch(batch)
                    .flatMap(persisted -> persisted
                            ? flushBatches(flushedSoFar + batch.size())
                            : Mono.just(flushedSoFar));
        });
    }

    private Mono<Boolean> persistBatch(List<MetricEvent> batch) {
        return Flux.defer(() -> metricEventRepository.saveAll(batch))
                .then(Mono.just(true))
                .retryWhen(Retry.backoff(config.getMaxRetries(), Duration.ofMillis(config.getMinBackoffMs()))
                        .maxBackoff(Duration.ofMillis(config.getMaxBackoffMs()))
                        .doBeforeRetry(signal -> log.warn("Metric flush attempt {} failed, retrying: {}",
                                signal.totalRetries() + 1, signal.failure().getMessage())))
                .onErrorResume(e -> {
                    log.error("Metric flush failed after {} retries, returning {} events to the buffer",
                            config.getMaxRetries(), batch.size(), e);
                    buffer.requeue(batch);
                    return Mono.just(false);
                });
    }

    @Override
    public Mono<Integer> rollup() {
        return Mono.fromCallable(this::rollupInMemory)
                .flatMap(changed -> {
                    List<AggregateBucket> toPersist = new ArrayList<>(changed);
                    AggregateBucket pending;
                    while ((pending = unpersisted.poll()) != null) {
                        toPersist.add(pending);
                    }
                    if (toPersist.isEmpty()) {
                        return Mono.just(0);
                    }
                    return aggregateBucketRepository.saveAll(toPersist)
                            .count()
                            .map(Long::intValue)
                            .onErrorResume(e -> {
                                log.error("Failed to persist {} aggregate buckets, will retry on next rollup: {}",
                                        toPersist.size(), e.getMessage());
                                unpersisted.addAll(toPersist);
                                return Mono.just(0);
                            });
                });
    }

    synchronized List<AggregateBucket> rollupInMemory() {
        long now = clock.millis();
        long currentMinute = AggregateResolution.MINUTE.bucketStart(now);
        long previous = lastRolledMinute.getAndAccumulate(currentMinute - MINUTE_MS, Math::max);

        TreeSet<Long> minutes = new TreeSet<>();
        if (previous < currentMinute) {
            minutes.addAll(rawSlots.subMap(previous, false, currentMinute, false).keySet());
        }
        Long dirty;
        while ((dirty = dirtyMinutes.pollFirst()) != null) {
            if (dirty < currentMinute) {
                minutes.add(dirty);
            }
        }
        Map<Long, List<MetricEvent>> late = new TreeMap<>();
        MetricEvent lateEvent;
        while ((lateEvent = lateEvents.poll()) != null) {
            late.computeIfAbsent(AggregateResolution.MINUTE.bucketStart(lateEvent.getTimestamp()),
                    k -> new ArrayList<>()).add(lateEvent);
        }
        if (minutes.isEmpty() && late.isEmpty()) {
            return List.of();
        }

        List<AggregateBucket> changed = new ArrayList<>();
        TreeSet<Long> hours = new TreeSet<>();
        for (Long minute : minutes) {
            Collection<MetricEvent> events = rawSlots.getOrDefault(minute, new ConcurrentLinkedQueue<>());
            Map<String, AggregateBucket> rolled = rollupMinute(minute, events, now);
            replaceOwn(AggregateResolution.MINUTE, minute, rolled);
            changed.addAll(rolled.values());
            hours.add(AggregateResolution.HOUR.bucketStart(minute));
        }
        // the raw events of these minutes are gone, so the late ones are added to what was rolled
        for (Map.Entry<Long, List<MetricEvent>> entry : late.entrySet()) {
            long minute = entry.getKey();
            Map<String, AggregateBucket> merged = foldInto(minute, rollupMinute(minute, entry.getValue(), now), now);
            replaceOwn(AggregateResolution.MINUTE, minute, merged);
            changed.addAll(merged.values());
            hours.add(AggregateResolution.HOUR.bucketStart(minute));
        }

        TreeSet<Long> days = new TreeSet<>();
        for (Long hour : hours) {
            Map<String, AggregateBucket> merged = mergeOwn(AggregateResolution.MINUTE, AggregateResolution.HOUR, hour, now);
            replaceOwn(AggregateResolution.HOUR, hour, merged);
            changed.addAll(merged.values());
            days.add(AggregateResolution.DAY.bucketStart(hour));
        }
        for (Long day : days) {
            Map<String, AggregateBucket> merged = mergeOwn(AggregateResolution.HOUR, AggregateResolution.DAY, day, now);
            replaceOwn(AggregateResolution.DAY, day, merged);
            changed.addAll(merged.values());
        }
        log.debug("Rolled up {} minutes and {} late minutes into {} buckets", minutes.size(), late.size(),
                changed.size());
        return changed;
    }

    private Map<String, AggregateBucket> rollupMinute(long minute, Collection<MetricEvent> events, long now) {
        Map<String, SampleGroup> groups = new LinkedHashMap<>();
        for (MetricEvent event : events) {
            for (MetricName metric : MetricName.values()) {
                OptionalDouble value = event.valueOf(metric);
                if (value.isPresent()) {
                    String key = AggregateBucket.idFor(instanceId, AggregateResolution.MINUTE, minute, metric.key(),
                            event.getProvider(), event.getModel());
                    groups.computeIfAbsent(key, k -> new SampleGroup(metric.key(), event.getProvider(), event.getModel()))
                            .add(value.getAsDouble());
                }
            }
        }
        Map<String, AggregateBucket> rolled = new HashMap<>();
        groups.forEach((id, group) -> rolled.put(id, AggregateBuckets.fromSamples(instanceId,
                AggregateResolution.MINUTE, minute, group.metric, group.provider, group.model,
                group.toArray(), config.getSketchRelativeAccuracy(), now)));
        return rolled;
    }

    private Map<String, AggregateBucket> foldInto(long minute, Map<String, AggregateBucket> additions, long now) {
        Map<String, AggregateBucket> existing = buckets.get(AggregateResolution.MINUTE).getOrDefault(minute, Map.of());
        Map<String, AggregateBucket> result = new HashMap<>();
        existing.values().stream()
                .filter(b -> instanceId.equals(b.getInstance()))
                .forEach(b -> result.put(b.getId(), b));
        additions.forEach((id, added) -> {
            AggregateBucket previous = result.get(id);
            result.put(id, previous == null ? added : AggregateBuckets.merge(AggregateResolution.MINUTE, minute,
                    List.of(previous, added), config.getSketchRelativeAccuracy(), now));
        });
        return result;
    }

    private Map<String, AggregateBucket> mergeOwn(AggregateResolution finer, AggregateResolution coarser,
                                                  long start, long now) {
        Map<String, List<AggregateBucket>> parts = new HashMap<>();
        buckets.get(finer).subMap(start, true, start + coarser.widthMs(), false).values().stream()
                .flatMap(m -> m.values().stream())
                .filter(b -> instanceId.equals(b.getInstance()))
                .forEach(b -> parts.computeIfAbsent(AggregateBucket.idFor(instanceId, coarser, start, b.getMetric(),
                        b.getProvider(), b.getModel()), k -> new ArrayList<>()).add(b));
        Map<String, AggregateBucket> merged = new HashMap<>();
        parts.forEach((id, list) -> merged.put(id,
                AggregateBuckets.merge(coarser, start, list, config.getSketchRelativeAccuracy(), now)));
        return merged;
    }

    private void replaceOwn(AggregateResolution resolution, long start, Map<String, AggregateBucket> own) {
        ConcurrentSkipListMap<Long, Map<String, AggregateBucket>> tier = buckets.get(resolution);
        Map<String, AggregateBucket> next = new HashMap<>(own);
        Map<String, AggregateBucket> existing = tier.get(start);
        if (existing != null) {
            existing.values().stream()
                    .filter(b -> !instanceId.equals(b.getInstance()))
                    .forEach(b -> next.put(b.getId(), b));
        }
        if (next.isEmpty()) {
            tier.remove(start);
        } else {
            tier.put(start, Map.copyOf(next));
        }
    }

    @Override
    public AggregatedMetrics getAggregated(MetricName metric, long startTime, long endTime, MetricFilter filter) {
        if (endTime < startTime) {
            throw new IllegalArgumentException("endTime must not precede startTime");
        }
        MetricFilter scope = filter == null ? MetricFilter.none() : filter;
        Accumulator acc = new Accumulator(config.getSketchRelativeAccuracy());
        long floor = rawFloor.get();

        long rawStart = Math.max(startTime, floor);
        if (rawStart <= endTime) {
            for (Collection<MetricEvent> slot : rawSlots.subMap(AggregateResolution.MINUTE.bucketStart(rawStart), true,
                    endTime, true).values()) {
                for (MetricEvent event : slot) {
                    long ts = event.getTimestamp();
                    if (ts < rawStart || ts > endTime
                            || !scope.matches(event.getProvider(), event.getModel(), event.getUserId())) {
                        continue;
                    }
                    OptionalDouble value = event.valueOf(metric);
                    if (value.isPresent()) {
                        acc.addSample(value.getAsDouble());
                    }
                }
            }
        }
        // buckets carry no user dimension, so user-scoped reads only see raw events
        if (startTime < floor && scope.getUserId() == null) {
            collectBuckets(metric, startTime, Math.min(endTime, floor - 1), scope, acc);
        }
        return acc.result();
    }

    private void collectBuckets(MetricName metric, long start, long end, MetricFilter filter, Accumulator acc) {
        long now = clock.millis();
        long minuteBoundary = ceil(AggregateResolution.HOUR, now - config.getRetention().getMinuteMs());
        long hourBoundary = ceil(AggregateResolution.DAY, now - config.getRetention().getHourMs());
        long dayBoundary = AggregateResolution.DAY.bucketStart(now - config.getRetention().getDayMs());

        addTier(AggregateResolution.MINUTE, metric, Math.max(start, minuteBoundary), end, filter, acc);
        addTier(AggregateResolution.HOUR, metric, Math.max(start, hourBoundary), Math.min(end, minuteBoundary - 1),
                filter, acc);
        addTier(AggregateResolution.DAY, metric, Math.max(start, dayBoundary), Math.min(end, hourBoundary - 1),
                filter, acc);
    }

    private void addTier(AggregateResolution resolution, MetricName metric, long start, long end,
                         MetricFilter filter, Accumulator acc) {
        if (start > end) {
            return;
        }
        bucketsIn(resolution, metric, start, end, filter).forEach(acc::addBucket);
    }

    private List<AggregateBucket> bucketsIn(AggregateResolution resolution, MetricName metric, long start, long end,
                                            MetricFilter filter) {
        return buckets.get(resolution).subMap(resolution.bucketStart(start), true, end, true).values().stream()
                .flatMap(m -> m.values().stream())
                .filter(b -> metric.key().equals(b.getMetric()))
                .filter(b -> filter.matches(b.getProvider(), b.getModel(), null))
                .sorted(Comparator.comparingLong(AggregateBucket::getBucketStart).thenComparing(AggregateBucket::getId))
                .collect(Collectors.toList());
    }

    @Override
    public List<TimeSeriesPoint> getTimeSeries(MetricName metric, long startTime, long endTime, long bucketMs,
                                               MetricFilter filter) {
        if (bucketMs <= 0) {
            throw new IllegalArgumentException("bucketMs must be positive");
        }
        if (endTime < startTime) {
            throw new IllegalArgumentException("endTime must not precede startTime");
        }
        if ((endTime - startTime) / bucketMs >= MAX_SERIES_POINTS) {
            throw new IllegalArgumentException("Time series would exceed " + MAX_SERIES_POINTS + " points");
        }
        List<TimeSeriesPoint> points = new ArrayList<>();
        for (long t = startTime; t <= endTime; t += bucketMs) {
            AggregatedMetrics window = getAggregated(metric, t, Math.min(t + bucketMs - 1, endTime), filter);
            points.add(new TimeSeriesPoint(t, window.getAvg(), window.getCount()));
        }
        return points;
    }

    @Override
    public List<AggregateBucket> getBuckets(AggregateResolution resolution, MetricName metric, long startTime,
                                            long endTime, MetricFilter filter) {
        return bucketsIn(resolution, metric, startTime, endTime, filter == null ? MetricFilter.none() : filter);
    }

    @Override
    public long getCount(MetricName metric, long startTime, long endTime, MetricFilter filter) {
        return getAggregated(metric, startTime, endTime, filter).getCount();
    }

    @Override
    public Flux<MetricEvent> query(MetricFilter filter, MetricKind kind, long startTime, long endTime,
                                   int limit, int offset) {
        MetricFilter scope = filter == null ? MetricFilter.none() : filter;
        Flux<MetricEvent> source = kind == null
                ? metricEventRepository.findByTimestampRange(startTime, endTime + 1)
                : metricEventRepository.findByKindAndTimestampRange(kind, startTime, endTime + 1);
        return source
                .filter(e -> scope.matches(e.getProvider(), e.getModel(), e.getUserId()))
                .skip(Math.max(0, offset))
                .take(Math.max(0, limit));
    }

    @Override
    public Map<String, ProviderHealth> getProviderHealth() {
        long now = clock.millis();
        Map<String, HealthTally> tallies = new TreeMap<>();
        for (Collection<MetricEvent> slot : rawSlots.tailMap(AggregateResolution.MINUTE.bucketStart(now - HEALTH_WINDOW_MS))
                .values()) {
            for (MetricEvent event : slot) {
                if (event.getKind() != MetricKind.REQUEST || event.getProvider() == null
                        || event.getStatus() == null || event.getTimestamp() < now - HEALTH_WINDOW_MS) {
                    continue;
                }
                tallies.computeIfAbsent(event.getProvider(), p -> new HealthTally()).add(event);
            }
        }
        Map<String, ProviderHealth> health = new LinkedHashMap<>();
        tallies.forEach((provider, tally) -> health.put(provider, tally.toHealth(provider)));
        return health;
    }

    @Override
    public long getDroppedMetricsCount() {
        return buffer.droppedCount();
    }

    @Override
    public int getBufferedCount() {
        return buffer.size();
    }

    @Override
    public int purgeMemory() {
        long now = clock.millis();
        int removed = 0;

        // raw minutes are dropped only once rolled up; storage keeps them for the full raw retention
        long rawLimit = Math.min(rawMemoryCutoff(now), lastRolledMinute.get() + MINUTE_MS);
        Map<Long, ConcurrentLinkedQueue<MetricEvent>> expiredRaw = rawSlots.headMap(rawLimit);
        removed += expiredRaw.size();
        expiredRaw.clear();
        if (rawLimit > rawFloor.get()) {
            rawFloor.accumulateAndGet(rawLimit, Math::max);
        }

        removed += purgeTier(AggregateResolution.MINUTE, now - config.getRetention().getMinuteMs());
        removed += purgeTier(AggregateResolution.HOUR, now - config.getRetention().getHourMs());
        removed += purgeTier(AggregateResolution.DAY, now - config.getRetention().getDayMs());
        if (removed > 0) {
            log.info("Purged {} expired metric slots from memory", removed);
        }
        return removed;
    }

    private int purgeTier(AggregateResolution resolution, long cutoff) {
        Map<Long, Map<String, AggregateBucket>> expired = buckets.get(resolution).headMap(resolution.bucketStart(cutoff));
        int size = expired.size();
        expired.clear();
        return size;
    }

    @Override
    public Mono<Long> purgeDurable() {
        long now = clock.millis();
        DispatchProperties.Retention retention = config.getRetention();
        return Flux.concat(
                        metricEventRepository.deleteByTimestampLessThan(now - retention.getRawMs()),
                        aggregateBucketRepository.deleteByResolutionAndBucketStartLessThan(AggregateResolution.MINUTE,
                                AggregateResolution.MINUTE.bucketStart(now - retention.getMinuteMs())),
                        aggregateBucketRepository.deleteByResolutionAndBucketStartLessThan(AggregateResolution.HOUR,
                                AggregateResolution.HOUR.bucketStart(now - retention.getHourMs())),
                        aggregateBucketRepository.deleteByResolutionAndBucketStartLessThan(AggregateResolution.DAY,
                                AggregateResolution.DAY.bucketStart(now - retention.getDayMs())))
                .reduce(0L, Long::sum)
                .doOnSuccess(count -> log.info("Purged {} expired metric documents", count))
                .doOnError(e -> log.error("Failed to purge expired metric documents: {}", e.getMessage()));
    }

    @EventListener(ApplicationReadyEvent.class)
    public void loadPersistedBuckets() {
        loadBuckets()
                .doOnSuccess(count -> log.info("Loaded {} aggregate buckets from storage", count))
                .doOnError(e -> log.error("Failed to load aggregate buckets: {}", e.getMessage()))
                .onErrorResume(e -> Mono.just(0L))
                .subscribe();
    }

    Mono<Long> loadBuckets() {
        long now = clock.millis();
        DispatchProperties.Retention retention = config.getRetention();
        Map<AggregateResolution, Long> since = Map.of(
                AggregateResolution.MINUTE, now - retention.getMinuteMs(),
                AggregateResolution.HOUR, now - retention.getHourMs(),
                AggregateResolution.DAY, now - retention.getDayMs());
        return Flux.fromArray(AggregateResolution.values())
                .concatMap(resolution -> aggregateBucketRepository.findByResolutionSince(resolution, since.get(resolution)))
                .doOnNext(this::putLoaded)
                .count();
    }

    private void putLoaded(AggregateBucket bucket) {
        buckets.get(bucket.getResolution()).compute(bucket.getBucketStart(), (start, existing) -> {
            Map<String, AggregateBucket> next = existing == null ? new HashMap<>() : new HashMap<>(existing);
            next.putIfAbsent(bucket.getId(), bucket);
            return Map.copyOf(next);
        });
    }

    private long rawMemoryCutoff(long now) {
        return AggregateResolution.MINUTE.bucketStart(now - config.getRawMemoryMs());
    }

    private static long ceil(AggregateResolution resolution, long timestamp) {
        long floor = resolution.bucketStart(timestamp);
        return floor == timestamp ? floor : floor + resolution.widthMs();
    }

    private static final class SampleGroup {
        private final String metric;
        private final String provider;
        private final String model;
        private double[] values = new double[8];
        private int size;

        private SampleGroup(String metric, String provider, String model) {
            this.metric = metric;
            this.provider = provider;
            this.model = model;
        }

        private void add(double value) {
            if (size == values.length) {
                double[] grown = new double[size * 2];
                System.arraycopy(values, 0, grown, 0, size);
                values = grown;
            }
            values[size++] = value;
        }

        private double[] toArray() {
            double[] out = new double[size];
            System.arraycopy(values, 0, out, 0, size);
            return out;
        }
    }

    /**
     * Combines raw samples and pre-aggregated buckets. Percentiles are exact when only raw samples
     * or a single bucket contribute, sketch-derived otherwise.
     */
    private static final class Accumulator {
        private final double relativeAccuracy;
        private final SampleGroup samples = new SampleGroup(null, null, null);
        private final List<AggregateBucket> parts = new ArrayList<>();

        private Accumulator(double relativeAccuracy) {
            this.relativeAccuracy = relativeAccuracy;
        }

        private void addSample(double value) {
            samples.add(value);
        }

        private void addBucket(AggregateBucket bucket) {
            if (bucket.getCount() > 0) {
                parts.add(bucket);
            }
        }

        private AggregatedMetrics result() {
            double[] raw = samples.toArray();
            if (parts.isEmpty()) {
                return exact(raw);
            }
            if (raw.length == 0 && parts.size() == 1) {
                AggregateBucket only = parts.get(0);
                return AggregatedMetrics.builder()
                        .count(only.getCount())
                        .sum(only.getSum())
                        .avg(only.avg())
                        .min(only.getMin())
                        .max(only.getMax())
                        .p50(only.getP50())
                        .p95(only.getP95())
                        .p99(only.getP99())
                        .build();
            }
            QuantileSketch sketch = new QuantileSketch(relativeAccuracy);
            long count = raw.length;
            double sum = 0;
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (double v : raw) {
                sketch.add(v);
                sum += v;
                min = Math.min(min, v);
                max = Math.max(max, v);
            }
            for (AggregateBucket part : parts) {
                sketch.merge(AggregateBuckets.sketchOf(part, relativeAccuracy));
                count += part.getCount();
                sum += part.getSum();
                min = Math.min(min, part.getMin());
                max = Math.max(max, part.getMax());
            }
            return AggregatedMetrics.builder()
                    .count(count)
                    .sum(sum)
                    .avg(sum / count)
                    .min(min)
                    .max(max)
                    .p50(AggregateBuckets.clampedQuantile(sketch, 0.50, min, max))
                    .p95(AggregateBuckets.clampedQuantile(sketch, 0.95, min, max))
                    .p99(AggregateBuckets.clampedQuantile(sketch, 0.99, min, max))
                    .build();
        }

        private static AggregatedMetrics exact(double[] raw) {
            if (raw.length == 0) {
                return AggregatedMetrics.empty();
            }
            double[] sorted = Percentiles.sortedCopy(raw);
            double sum = 0;
            for (double v : sorted) {
                sum += v;
            }
            return AggregatedMetrics.builder()
                    .count(sorted.length)
                    .sum(sum)
                    .avg(sum / sorted.length)
                    .min(sorted[0])
                    .max(sorted[sorted.length - 1])
                    .p50(Percentiles.of(sorted, 0.50))
                    .p95(Percentiles.of(sorted, 0.95))
                    .p99(Percentiles.of(sorted, 0.99))
                    .build();
        }
    }

    private static final class HealthTally {
        private long requests;
        private long successes;
        private double latencySum;
        private long latencyCount;
        private long lastRequestAt;

        private void add(MetricEvent event) {
            requests++;
            if (event.getStatus().isSuccess()) {
                successes++;
            }
            if (event.getLatencyMs() != null) {
                latencySum += event.getLatencyMs();
                latencyCount++;
            }
            lastRequestAt = Math.max(lastRequestAt, event.getTimestamp());
        }

        private ProviderHealth toHealth(String provider) {
            double successRate = requests == 0 ? 1.0 : (double) successes / requests;
            double avgLatency = latencyCount == 0 ? 0.0 : latencySum / latencyCount;
            return ProviderHealth.builder()
                    .provider(provider)
                    .status(ProviderHealthStatus.classify(successRate, avgLatency))
                    .successRate(successRate)
                    .avgLatencyMs(avgLatency)
                    .requestCount(requests)
                    .lastRequestAt(lastRequestAt)
                    .build();
        }
    }
}
