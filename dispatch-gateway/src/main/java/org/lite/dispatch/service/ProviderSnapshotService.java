package org.lite.dispatch.service;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import lombok.extern.slf4j.Slf4j;
import org.lite.dispatch.config.DispatchProperties;
import org.lite.dispatch.enums.MetricName;
import org.lite.dispatch.model.AggregatedMetrics;
import org.lite.dispatch.model.MetricFilter;
import org.lite.dispatch.model.ProviderCandidate;
import org.lite.dispatch.model.ProviderMetricsSnapshot;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.TimeUnit;

/**
 * Per provider/model telemetry snapshots derived from the metrics store.
 *
 * <p>Entries older than the TTL are still served while a single asynchronous refresh per key
 * recomputes them. A failed refresh keeps the previous entry, so an entry can outlive the maximum
 * staleness; callers treat such entries as unavailable telemetry. Entries are dropped at twice the
 * maximum staleness and recomputed on the next lookup.
 */
@Service
@Slf4j
public class ProviderSnapshotService {

    private final MetricsStore metricsStore;
    private final DispatchProperties.Router config;
    private final Clock clock;
    private final LoadingCache<SnapshotKey, ProviderMetricsSnapshot> cache;

    @Autowired
    public ProviderSnapshotService(MetricsStore metricsStore, DispatchProperties properties, Clock clock) {
        this(metricsStore, properties, clock, ForkJoinPool.commonPool());
    }

    public ProviderSnapshotService(MetricsStore metricsStore, DispatchProperties properties, Clock clock,
                                   Executor refreshExecutor) {
        this.metricsStore = metricsStore;
        this.config = properties.getRouter();
        this.clock = clock;
        this.cache = Caffeine.newBuilder()
                .maximumSize(10_000)
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .refreshAfterWrite(Duration.ofMillis(config.getSnapshotTtlMs()))
                .expireAfterWrite(Duration.ofMillis(maxStalenessMs() * 2))
                .executor(refreshExecutor)
                .build(this::compute);
    }

    /**
     * Cached snapshot for a candidate, or empty when it cannot be computed.
     */
    public Optional<ProviderMetricsSnapshot> lookup(ProviderCandidate candidate) {
        try {
            return Optional.ofNullable(cache.get(SnapshotKey.of(candidate)));
        } catch (RuntimeException e) {
            log.warn("Snapshot lookup failed for {}: {}", candidate.key(), e.getMessage());
            return Optional.empty();
        }
    }

    public void refresh(ProviderCandidate candidate) {
        cache.refresh(SnapshotKey.of(candidate));
    }

    public void invalidateAll() {
        cache.invalidateAll();
    }

    public Map<String, ProviderMetricsSnapshot> getSnapshots() {
        Map<String, ProviderMetricsSnapshot> snapshots = new TreeMap<>();
        cache.asMap().forEach((key, snapshot) -> snapshots.put(key.providerId() + "/" + key.modelId(), snapshot));
        return snapshots;
    }

    public long maxStalenessMs() {
        return config.getSnapshotTtlMs() * Math.max(1, config.getMaxStalenessFactor());
    }

    /**
     * Multiplier for confidence: 1 while fresh, ttl/age once past the TTL.
     */
    public double stalenessFactor(ProviderMetricsSnapshot snapshot, long now) {
        long age = snapshot.ageMs(now);
        if (age <= config.getSnapshotTtlMs()) {
            return 1.0;
        }
        return (double) config.getSnapshotTtlMs() / age;
    }

    private ProviderMetricsSnapshot compute(SnapshotKey key) {
        String provider = key.providerId();
        String model = key.modelId();
        long now = clock.millis();
        long from = now - config.getMetricsWindowMs();
        MetricFilter filter = MetricFilter.of(provider, model);

        AggregatedMetrics latency = metricsStore.getAggregated(MetricName.LATENCY, from, now, filter);
        AggregatedMetrics success = metricsStore.getAggregated(MetricName.SUCCESS, from, now, filter);
        AggregatedMetrics cost = metricsStore.getAggregated(MetricName.COST, from, now, filter);
        log.debug("Computed snapshot for {}/{} from {} outcomes", provider, model, success.getCount());
        return ProviderMetricsSnapshot.builder()
                .providerId(provider)
                .modelId(model)
                .avgLatencyMs(latency.getAvg())
                .p50LatencyMs(latency.getP50())
                .p95LatencyMs(latency.getP95())
                .p99LatencyMs(latency.getP99())
                .successRate(success.getCount() == 0 ? 1.0 : success.getAvg())
                .avgCost(cost.getAvg())
                .requestCount(success.getCount())
                .computedAt(now)
                .build();
    }

    private record SnapshotKey(String providerId, String modelId) {
        static SnapshotKey of(ProviderCandidate candidate) {
            return new SnapshotKey(candidate.getProviderId(), candidate.getModelId());
        }
    }
}
