package org.lite.dispatch.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.dispatch.enums.AggregateResolution;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.List;

/**
 * Rolled-up statistics for one metric dimension over one time bucket. The id is derived from
 * (instance, resolution, bucketStart, metric, provider, model) so that re-running a rollup replaces the bucket.
 */
@Document(collection = "aggregate_buckets")
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@CompoundIndexes({
    @CompoundIndex(name = "resolution_metric_start_idx", def = "{'resolution': 1, 'metric': 1, 'bucketStart': 1}"),
    @CompoundIndex(name = "resolution_start_idx", def = "{'resolution': 1, 'bucketStart': 1}")
})
public class AggregateBucket {
    @Id
    private String id;
    private String instance;
    private AggregateResolution resolution;
    private long bucketStart;
    private String metric;
    private String provider;
    private String model;
    private long count;
    private double sum;
    private double min;
    private double max;
    // exact at MINUTE resolution, sketch-derived above it
    private double p50;
    private double p95;
    private double p99;
    private List<Integer> sketchIndexes;
    private List<Long> sketchCounts;
    private long sketchZeroCount;
    private long updatedAt;

    public static String idFor(String instance, AggregateResolution resolution, long bucketStart, String metric,
                               String provider, String model) {
        return String.join(":", instance, resolution.name(), Long.toString(bucketStart), metric,
                provider == null ? "-" : provider, model == null ? "-" : model);
    }

    public double avg() {
        return count == 0 ? 0.0 : sum / count;
    }
}
