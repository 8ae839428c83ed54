package org.lite.dispatch.service.routing;

import lombok.Builder;
import lombok.Value;
import org.lite.dispatch.model.ProviderCandidate;
import org.lite.dispatch.model.ProviderMetricsSnapshot;

/**
 * An eligible candidate with the telemetry and estimates the strategies rank on.
 */
@Value
@Builder
public class EvaluatedCandidate {
    ProviderCandidate candidate;
    ProviderMetricsSnapshot snapshot;
    double estimatedCost;
    double estimatedLatencyMs;

    public String providerId() {
        return candidate.getProviderId();
    }

    public String key() {
        return candidate.key();
    }
}
