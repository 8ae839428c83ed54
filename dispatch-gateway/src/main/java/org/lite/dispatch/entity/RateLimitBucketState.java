package org.lite.dispatch.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.dispatch.enums.ScopeType;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * Persisted copy of an in-memory token bucket.
 */
@Document(collection = "rate_limit_buckets")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RateLimitBucketState {
    @Id
    private String id;
    private ScopeType scope;
    private String key;
    private long limit;
    private long windowMs;
    private long burst;
    private double capacity;
    private double tokens;
    private double refillRatePerMs;
    private long lastRefill;
    @Indexed
    private long lastAccess;
}
