package org.lite.dispatch.service.metrics;

import org.lite.dispatch.entity.AggregateBucket;
import org.lite.dispatch.enums.AggregateResolution;

import java.util.List;

/**
 * Builds and merges {@link AggregateBucket}s.
 */
public final class AggregateBuckets {

    private AggregateBuckets() {
    }

    /**
     * Bucket from retained samples. Percentiles are exact.
     */
    public static AggregateBucket fromSamples(String instance, AggregateResolution resolution, long bucketStart,
                                              String metric, String provider, String model,
                                              double[] samples, double relativeAccuracy, long now) {
        double[] sorted = Percentiles.sortedCopy(samples);
        QuantileSketch sketch = new QuantileSketch(relativeAccuracy);
        double sum = 0;
        for (double v : sorted) {
            sum += v;
            sketch.add(v);
        }
        return AggregateBucket.builder()
                .id(AggregateBucket.idFor(instance, resolution, bucketStart, metric, provider, model))
                .instance(instance)
                .resolution(resolution)
                .bucketStart(bucketStart)
                .metric(metric)
                .provider(provider)
                .model(model)
                .count(sorted.length)
                .sum(sum)
                .min(sorted.length == 0 ? 0 : sorted[0])
                .max(sorted.length == 0 ? 0 : sorted[sorted.length - 1])
                .p50(sorted.length == 0 ? 0 : Percentiles.of(sorted, 0.50))
                .p95(sorted.length == 0 ? 0 : Percentiles.of(sorted, 0.95))
                .p99(sorted.length == 0 ? 0 : Percentiles.of(sorted, 0.99))
                .sketchIndexes(sketch.indexes())
                .sketchCounts(sketch.counts())
                .sketchZeroCount(sketch.getZeroCount())
                .updatedAt(now)
                .build();
    }

    /**
     * Coarser bucket from finer ones of the same (instance, metric, provider, model). Percentiles
     * come from the merged sketch, clamped to the observed range.
     */
    public static AggregateBucket merge(AggregateResolution resolution, long bucketStart, List<AggregateBucket> parts,
                                        double relativeAccuracy, long now) {
        if (parts.isEmpty()) {
            throw new IllegalArgumentException("Nothing to merge");
        }
        AggregateBucket first = parts.get(0);
        QuantileSketch sketch = new QuantileSketch(relativeAccuracy);
        long count = 0;
        double sum = 0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (AggregateBucket part : parts) {
            if (part.getCount() == 0) {
                continue;
            }
            count += part.getCount();
            sum += part.getSum();
            min = Math.min(min, part.getMin());
            max = Math.max(max, part.getMax());
            sketch.merge(sketchOf(part, relativeAccuracy));
        }
        if (count == 0) {
            min = 0;
            max = 0;
        }
        return AggregateBucket.builder()
                .id(AggregateBucket.idFor(first.getInstance(), resolution, bucketStart, first.getMetric(),
                        first.getProvider(), first.getModel()))
                .instance(first.getInstance())
                .resolution(resolution)
                .bucketStart(bucketStart)
                .metric(first.getMetric())
                .provider(first.getProvider())
                .model(first.getModel())
                .count(count)
                .sum(sum)
                .min(min)
                .max(max)
                .p50(clampedQuantile(sketch, 0.50, min, max))
                .p95(clampedQuantile(sketch, 0.95, min, max))
                .p99(clampedQuantile(sketch, 0.99, min, max))
                .sketchIndexes(sketch.indexes())
                .sketchCounts(sketch.counts())
                .sketchZeroCount(sketch.getZeroCount())
                .updatedAt(now)
                .build();
    }

    public static QuantileSketch sketchOf(AggregateBucket bucket, double relativeAccuracy) {
        return QuantileSketch.fromBins(relativeAccuracy, bucket.getSketchIndexes(), bucket.getSketchCounts(),
                bucket.getSketchZeroCount());
    }

    public static double clampedQuantile(QuantileSketch sketch, double q, double min, double max) {
        if (sketch.getCount() == 0) {
            return 0;
        }
        return Math.min(max, Math.max(min, sketch.quantile(q)));
    }
}
