package org.lite.dispatch.service.routing;

import lombok.RequiredArgsConstructor;
import org.lite.dispatch.config.DispatchProperties;
import org.lite.dispatch.enums.RoutingStrategyType;
import org.lite.dispatch.model.RoutingRequest;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Combines min-max normalised latency and cost, both scaled over the eligible set only.
 */
@Component
@RequiredArgsConstructor
public class WeightedStrategy implements RoutingStrategy {

    private final DispatchProperties properties;

    @Override
    public RoutingStrategyType type() {
        return RoutingStrategyType.WEIGHTED;
    }

    @Override
    public Ranking rank(List<EvaluatedCandidate> eligible, RoutingRequest request) {
        List<ScoredCandidate> entries = score(eligible).stream().sorted(Scores.BY_SCORE_DESC).toList();
        DispatchProperties.Weights weights = properties.getRouter().getWeights();
        return new Ranking(entries, String.format(
                "weighted: best combined score %.3f (latency %d%%, cost %d%%) among %d eligible candidates",
                entries.get(0).getScore(), weights.getLatency(), weights.getCost(), eligible.size()));
    }

    /**
     * Weighted scores in input order.
     */
    public List<ScoredCandidate> score(List<EvaluatedCandidate> eligible) {
        DispatchProperties.Weights weights = properties.getRouter().getWeights();
        int total = weights.getLatency() + weights.getCost();
        double latencyWeight = total <= 0 ? 0.5 : (double) weights.getLatency() / total;
        double costWeight = total <= 0 ? 0.5 : (double) weights.getCost() / total;

        double minLatency = Scores.min(eligible, EvaluatedCandidate::getEstimatedLatencyMs);
        double maxLatency = Scores.max(eligible, EvaluatedCandidate::getEstimatedLatencyMs);
        double minCost = Scores.min(eligible, EvaluatedCandidate::getEstimatedCost);
        double maxCost = Scores.max(eligible, EvaluatedCandidate::getEstimatedCost);

        return eligible.stream()
                .map(c -> new ScoredCandidate(c,
                        latencyWeight * Scores.lowerIsBetter(c.getEstimatedLatencyMs(), minLatency, maxLatency)
                                + costWeight * Scores.lowerIsBetter(c.getEstimatedCost(), minCost, maxCost)))
                .toList();
    }
}
