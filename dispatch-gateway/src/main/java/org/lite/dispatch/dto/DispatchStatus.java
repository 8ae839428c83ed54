package org.lite.dispatch.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Operational counters for the gateway instance.
 */
@Value
@Builder
public class DispatchStatus {
    String instanceId;
    int registeredCandidates;
    List<String> registryErrors;
    int bufferedMetrics;
    long droppedMetrics;
    long alertSequence;
}
