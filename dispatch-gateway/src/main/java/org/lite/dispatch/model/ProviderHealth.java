package org.lite.dispatch.model;

import lombok.Builder;
import lombok.Value;
import org.lite.dispatch.enums.ProviderHealthStatus;

@Value
@Builder
public class ProviderHealth {
    String provider;
    ProviderHealthStatus status;
    double successRate;
    double avgLatencyMs;
    long requestCount;
    long lastRequestAt;
}
