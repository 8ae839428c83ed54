package org.lite.dispatch.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class ProviderMetricsSnapshot {
    String providerId;
    String modelId;
    double avgLatencyMs;
    double p50LatencyMs;
    double p95LatencyMs;
    double p99LatencyMs;
    double successRate;
    double avgCost;
    long requestCount;
    long computedAt;

    public long ageMs(long now) {
        return Math.max(0, now - computedAt);
    }

    public boolean hasSamples() {
        return requestCount > 0;
    }

    public static ProviderMetricsSnapshot empty(String providerId, String modelId, long now) {
        return ProviderMetricsSnapshot.builder()
                .providerId(providerId)
                .modelId(modelId)
                .successRate(1.0)
                .computedAt(now)
                .build();
    }
}
