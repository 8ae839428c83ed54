package org.lite.dispatch.enums;

import org.lite.dispatch.model.AggregatedMetrics;

import java.util.Arrays;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/**
 * Metric names an alert rule may reference, each resolved from one aggregated dimension.
 */
public enum AlertMetric {
    LATENCY("latency", MetricName.LATENCY, AggregatedMetrics::getAvg),
    AVG_LATENCY("avg_latency", MetricName.LATENCY, AggregatedMetrics::getAvg),
    P50_LATENCY("p50_latency", MetricName.LATENCY, AggregatedMetrics::getP50),
    P95_LATENCY("p95_latency", MetricName.LATENCY, AggregatedMetrics::getP95),
    P99_LATENCY("p99_latency", MetricName.LATENCY, AggregatedMetrics::getP99),
    ERROR_RATE("error_rate", MetricName.SUCCESS, agg -> agg.getCount() == 0 ? 0.0 : 1.0 - agg.getAvg()),
    SUCCESS_RATE("success_rate", MetricName.SUCCESS, agg -> agg.getCount() == 0 ? 1.0 : agg.getAvg()),
    CACHE_HIT_RATE("cache_hit_rate", MetricName.CACHE_HIT, AggregatedMetrics::getAvg),
    HOURLY_COST("hourly_cost", MetricName.COST, AggregatedMetrics::getSum),
    AVG_COST("avg_cost", MetricName.COST, AggregatedMetrics::getAvg),
    REQUEST_COUNT("request_count", MetricName.SUCCESS, agg -> (double) agg.getCount()),
    RATE_LIMIT_DENIAL_RATE("rate_limit_denial_rate", MetricName.RATE_LIMIT_DENIED, AggregatedMetrics::getAvg);

    private final String key;
    private final MetricName dimension;
    private final ToDoubleFunction<AggregatedMetrics> extractor;

    AlertMetric(String key, MetricName dimension, ToDoubleFunction<AggregatedMetrics> extractor) {
        this.key = key;
        this.dimension = dimension;
        this.extractor = extractor;
    }

    public String key() {
        return key;
    }

    public MetricName dimension() {
        return dimension;
    }

    public double extract(AggregatedMetrics aggregated) {
        return extractor.applyAsDouble(aggregated);
    }

    public static Optional<AlertMetric> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        String trimmed = key.trim();
        return Arrays.stream(values())
                .filter(m -> m.key.equalsIgnoreCase(trimmed))
                .findFirst();
    }
}
