package org.lite.dispatch.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class AlertEvaluation {
    String ruleId;
    boolean triggered;
    double currentValue;
    String message;
    /** Open alert id after the evaluation, if any. */
    String alertId;
}
