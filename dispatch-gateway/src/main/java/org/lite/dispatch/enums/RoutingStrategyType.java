package org.lite.dispatch.enums;

public enum RoutingStrategyType {
    LATENCY_BASED,
    COST_BASED,
    WEIGHTED,
    MODEL_SPECIFIC,
    ROUND_ROBIN,
    FAILOVER;

    /**
     * Strategies whose ranking depends on live telemetry and therefore degrade when it is stale.
     */
    public boolean usesTelemetry() {
        return this == LATENCY_BASED || this == WEIGHTED || this == MODEL_SPECIFIC;
    }
}
