package org.lite.dispatch.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RankedCandidate {
    String providerId;
    String modelId;
    double score;
    double estimatedCost;
    double estimatedLatencyMs;
}
