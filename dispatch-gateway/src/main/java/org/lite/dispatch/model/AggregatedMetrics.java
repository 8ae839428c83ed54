package org.lite.dispatch.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AggregatedMetrics {
    long count;
    double sum;
    double avg;
    double min;
    double max;
    double p50;
    double p95;
    double p99;

    public static AggregatedMetrics empty() {
        return AggregatedMetrics.builder().build();
    }
}
