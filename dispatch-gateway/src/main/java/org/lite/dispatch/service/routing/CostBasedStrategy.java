package org.lite.dispatch.service.routing;

import org.lite.dispatch.enums.RoutingStrategyType;
import org.lite.dispatch.model.RoutingRequest;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class CostBasedStrategy implements RoutingStrategy {

    @Override
    public RoutingStrategyType type() {
        return RoutingStrategyType.COST_BASED;
    }

    @Override
    public Ranking rank(List<EvaluatedCandidate> eligible, RoutingRequest request) {
        List<ScoredCandidate> entries = Scores.rankAscending(eligible, EvaluatedCandidate::getEstimatedCost);
        return new Ranking(entries, String.format("cost-based: lowest estimated cost $%.6f among %d eligible candidates",
                entries.get(0).getEvaluated().getEstimatedCost(), eligible.size()));
    }
}
