package org.lite.dispatch.service.routing;

import org.lite.dispatch.enums.RoutingStrategyType;
import org.lite.dispatch.model.RoutingRequest;

import java.util.List;

public interface RoutingStrategy {

    RoutingStrategyType type();

    /**
     * Orders a non-empty eligible set best first. Implementations must be deterministic for a
     * given input, apart from round-robin's shared counter.
     */
    Ranking rank(List<EvaluatedCandidate> eligible, RoutingRequest request);
}
