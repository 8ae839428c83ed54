package org.lite.dispatch.model;

import lombok.Builder;
import lombok.Value;
import org.lite.dispatch.enums.ScopeType;

@Value
@Builder
public class RateLimitStatus {
    String key;
    ScopeType scope;
    boolean limited;
    double tokens;
    double capacity;
    long limit;
    long windowMs;
    long resetAtMs;
    long lastAccess;
}
