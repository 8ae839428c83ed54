package org.lite.dispatch.model;

import lombok.Builder;
import lombok.Value;
import org.lite.dispatch.enums.ScopeType;

@Value
@Builder
public class RateLimitStatistics {
    String day;
    ScopeType scope;
    long total;
    long allowed;
    long denied;
    long uniqueKeys;
}
