package org.lite.dispatch.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * USD price per one million tokens.
 */
@Value
@Builder
@AllArgsConstructor
public class ModelPricing {
    double inputPer1M;
    double outputPer1M;

    public double estimate(long inputTokens, long outputTokens) {
        return (inputTokens / 1_000_000.0) * inputPer1M + (outputTokens / 1_000_000.0) * outputPer1M;
    }
}
