package org.lite.dispatch.service.routing;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.dispatch.config.DispatchProperties;
import org.lite.dispatch.enums.RoutingStrategyType;
import org.lite.dispatch.model.RoutingRequest;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Applies the first configured rule whose conditions all hold for the request. Rules are tried by
 * ascending priority value, then in configuration order. Unset conditions always hold.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ModelSpecificStrategy implements RoutingStrategy {

    private final DispatchProperties properties;
    private final WeightedStrategy weightedStrategy;

    @Override
    public RoutingStrategyType type() {
        return RoutingStrategyType.MODEL_SPECIFIC;
    }

    @Override
    public Ranking rank(List<EvaluatedCandidate> eligible, RoutingRequest request) {
        Optional<DispatchProperties.ModelRule> matched = firstMatchingRule(request);
        if (matched.isEmpty()) {
            Ranking weighted = weightedStrategy.rank(eligible, request);
            return new Ranking(weighted.getEntries(), "model-specific: no rule matched, " + weighted.getReason());
        }
        DispatchProperties.ModelRule rule = matched.get();
        Map<String, Integer> preferred = rule.getPreferredProviders() == null ? Map.of() : rule.getPreferredProviders();

        List<ScoredCandidate> weighted = weightedStrategy.score(eligible);
        List<ScoredCandidate> listed = new ArrayList<>();
        List<ScoredCandidate> unlisted = new ArrayList<>();
        for (ScoredCandidate scored : weighted) {
            (preferred.containsKey(scored.getEvaluated().providerId()) ? listed : unlisted).add(scored);
        }
        listed.sort(Comparator.<ScoredCandidate>comparingInt(s -> preferred.get(s.getEvaluated().providerId()))
                .reversed()
                .thenComparing(Scores.BY_SCORE_DESC));
        unlisted.sort(Scores.BY_SCORE_DESC);

        List<ScoredCandidate> entries = new ArrayList<>(listed);
        entries.addAll(unlisted);
        String reason = listed.isEmpty()
                ? String.format("model-specific: rule '%s' matched but no preferred provider is eligible, weighted order",
                        rule.getName())
                : String.format("model-specific: rule '%s' prefers %s (weight %d)", rule.getName(),
                        listed.get(0).getEvaluated().providerId(), preferred.get(listed.get(0).getEvaluated().providerId()));
        return new Ranking(entries, reason);
    }

    Optional<DispatchProperties.ModelRule> firstMatchingRule(RoutingRequest request) {
        return properties.getRouter().getModelRules().stream()
                .sorted(Comparator.comparingInt(DispatchProperties.ModelRule::getPriority))
                .filter(rule -> matches(rule, request))
                .findFirst();
    }

    static boolean matches(DispatchProperties.ModelRule rule, RoutingRequest request) {
        if (rule.getMaxCost() != null
                && (request.getMaxCost() == null || request.getMaxCost() > rule.getMaxCost())) {
            return false;
        }
        if (rule.getMaxLatencyMs() != null
                && (request.getMaxLatencyMs() == null || request.getMaxLatencyMs() > rule.getMaxLatencyMs())) {
            return false;
        }
        if (rule.getRequiresVision() != null && rule.getRequiresVision() != request.isRequiresVision()) {
            return false;
        }
        return rule.getMaxTokens() == null
                || (request.getMaxTokens() != null && request.getMaxTokens() <= rule.getMaxTokens());
    }
}
