package org.lite.dispatch.enums;

public enum ProviderHealthStatus {
    HEALTHY,
    DEGRADED,
    DOWN;

    public static ProviderHealthStatus classify(double successRate, double avgLatencyMs) {
        if (successRate >= 0.95 && avgLatencyMs < 2000) {
            return HEALTHY;
        }
        if (successRate >= 0.80 && avgLatencyMs < 5000) {
            return DEGRADED;
        }
        return DOWN;
    }
}
