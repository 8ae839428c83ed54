package org.lite.dispatch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.dispatch.enums.RoutingStrategyType;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RoutingRequest {
    private boolean requiresVision;
    private boolean requiresToolUse;
    private Integer minContextTokens;
    private Integer maxTokens;
    private Long inputTokens;
    private Long outputTokens;
    private Integer promptChars;
    private Double maxCost;
    private Double maxLatencyMs;
    private String tenantId;
    private String userId;
    private RoutingStrategyType strategy;
}
