package org.lite.dispatch.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.dispatch.enums.OutcomeStatus;

/**
 * Outcome of a call dispatched under a routing decision. Token counts and cost are optional; the
 * router falls back to pricing and to the decision's estimate.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutcomeRequest {
    @NotBlank
    private String decisionId;
    @NotNull
    private OutcomeStatus status;
    @PositiveOrZero
    private Double latencyMs;
    @PositiveOrZero
    private Long inputTokens;
    @PositiveOrZero
    private Long outputTokens;
    @PositiveOrZero
    private Double cost;
}
