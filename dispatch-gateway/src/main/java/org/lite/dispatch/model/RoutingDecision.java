package org.lite.dispatch.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import org.lite.dispatch.enums.RoutingStrategyType;

import java.util.List;

@Value
@Builder
public class RoutingDecision {
    String decisionId;
    String providerId;
    String modelId;
    RoutingStrategyType strategy;
    String reason;
    double estimatedCost;
    double estimatedLatencyMs;
    double confidence;
    @Singular
    List<RankedCandidate> alternatives;
    String userId;
    String tenantId;
    long createdAt;
}
