package org.lite.dispatch.model;

import lombok.Builder;
import lombok.Value;
import org.lite.dispatch.enums.AlertSeverity;
import org.lite.dispatch.enums.AlertState;

import java.util.Map;

@Value
@Builder
public class AlertStats {
    long total;
    Map<AlertState, Long> byState;
    Map<AlertSeverity, Long> bySeverity;
    long since;
}
