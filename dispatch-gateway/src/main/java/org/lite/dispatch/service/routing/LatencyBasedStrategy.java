package org.lite.dispatch.service.routing;

import org.lite.dispatch.enums.RoutingStrategyType;
import org.lite.dispatch.model.RoutingRequest;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class LatencyBasedStrategy implements RoutingStrategy {

    @Override
    public RoutingStrategyType type() {
        return RoutingStrategyType.LATENCY_BASED;
    }

    @Override
    public Ranking rank(List<EvaluatedCandidate> eligible, RoutingRequest request) {
        List<ScoredCandidate> entries = Scores.rankAscending(eligible, EvaluatedCandidate::getEstimatedLatencyMs);
        return new Ranking(entries, String.format("latency-based: lowest P95 latency %.0fms among %d eligible candidates",
                entries.get(0).getEvaluated().getEstimatedLatencyMs(), eligible.size()));
    }
}
