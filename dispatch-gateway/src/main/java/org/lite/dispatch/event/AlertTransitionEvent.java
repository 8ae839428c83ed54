package org.lite.dispatch.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.lite.dispatch.entity.Alert;
import org.lite.dispatch.enums.AlertState;

/**
 * Published whenever an alert is created, acknowledged or resolved. {@code from} is null for a
 * newly created alert. Sequence numbers increase by one per transition within a gateway instance.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertTransitionEvent {
    private long sequence;
    private Alert alert;
    private AlertState from;
    private AlertState to;
    private long timestamp;
}
