package org.lite.dispatch.entity;

import lombok.Builder;
import lombok.Value;
import lombok.With;
import org.lite.dispatch.enums.CacheEventType;
import org.lite.dispatch.enums.MetricKind;
import org.lite.dispatch.enums.MetricName;
import org.lite.dispatch.enums.OutcomeStatus;
import org.lite.dispatch.enums.RateLimitEventType;
import org.lite.dispatch.enums.ScopeType;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.CompoundIndexes;
import org.springframework.data.mongodb.core.mapping.Document;

import java.util.OptionalDouble;

/**
 * One recorded outcome. Written once and never updated.
 */
@Document(collection = "metric_events")
@Value
@Builder
@CompoundIndexes({
    @CompoundIndex(name = "kind_timestamp_idx", def = "{'kind': 1, 'timestamp': -1}"),
    @CompoundIndex(name = "provider_model_timestamp_idx", def = "{'provider': 1, 'model': 1, 'timestamp': -1}")
})
public class MetricEvent {
    @Id
    @With
    String id;
    long timestamp;
    MetricKind kind;
    String provider;
    String model;
    String userId;
    String decisionId;

    // request outcome
    OutcomeStatus status;
    Double latencyMs;
    Long inputTokens;
    Long outputTokens;
    Double cost;
    String errorMessage;

    CacheDetail cache;
    RateLimitDetail rateLimit;

    @Value
    @Builder
    public static class CacheDetail {
        CacheEventType type;
        String cacheKey;
        Double savedCost;
        Long savedTokens;
    }

    @Value
    @Builder
    public static class RateLimitDetail {
        RateLimitEventType type;
        ScopeType scope;
        String key;
        long remaining;
    }

    public long totalTokens() {
        long in = inputTokens == null ? 0 : inputTokens;
        long out = outputTokens == null ? 0 : outputTokens;
        return in + out;
    }

    /**
     * Value this event contributes to a metric dimension, empty when it does not contribute.
     */
    public OptionalDouble valueOf(MetricName metric) {
        if (kind == null || metric.source() != kind) {
            return OptionalDouble.empty();
        }
        switch (metric) {
            case LATENCY:
                return latencyMs == null ? OptionalDouble.empty() : OptionalDouble.of(latencyMs);
            case COST:
                return cost == null ? OptionalDouble.empty() : OptionalDouble.of(cost);
            case TOKENS:
                return inputTokens == null && outputTokens == null
                        ? OptionalDouble.empty() : OptionalDouble.of(totalTokens());
            case SUCCESS:
                return status == null ? OptionalDouble.empty() : OptionalDouble.of(status.isSuccess() ? 1.0 : 0.0);
            case CACHE_HIT:
                if (cache == null || cache.getType() == CacheEventType.STORE) {
                    return OptionalDouble.empty();
                }
                return OptionalDouble.of(cache.getType() == CacheEventType.HIT ? 1.0 : 0.0);
            case RATE_LIMIT_DENIED:
                if (rateLimit == null) {
                    return OptionalDouble.empty();
                }
                return OptionalDouble.of(rateLimit.getType() == RateLimitEventType.DENIED ? 1.0 : 0.0);
            default:
                return OptionalDouble.empty();
        }
    }
}
