package org.lite.dispatch.service.routing;

import lombok.RequiredArgsConstructor;
import org.lite.dispatch.enums.RoutingStrategyType;
import org.lite.dispatch.model.ProviderCandidate;
import org.lite.dispatch.model.RoutingRequest;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Orders the failover chain starting at the active entry, then the entries demoted before it, then
 * any other eligible candidate. Chain entries that are not eligible are skipped.
 */
@Component
@RequiredArgsConstructor
public class FailoverStrategy implements RoutingStrategy {

    private final FailoverTracker tracker;

    @Override
    public RoutingStrategyType type() {
        return RoutingStrategyType.FAILOVER;
    }

    @Override
    public Ranking rank(List<EvaluatedCandidate> eligible, RoutingRequest request) {
        Map<String, EvaluatedCandidate> byKey = new LinkedHashMap<>();
        eligible.stream()
                .sorted(Comparator.comparing(EvaluatedCandidate::getCandidate, ProviderCandidate.BY_ID))
                .forEach(c -> byKey.put(c.key(), c));

        List<String> chain = tracker.chain();
        int active = chain.isEmpty() ? 0 : Math.min(tracker.activeIndex(), chain.size() - 1);
        List<EvaluatedCandidate> ordered = new ArrayList<>();
        for (int i = 0; i < chain.size(); i++) {
            EvaluatedCandidate c = byKey.remove(chain.get((active + i) % chain.size()));
            if (c != null) {
                ordered.add(c);
            }
        }
        ordered.addAll(byKey.values());

        String winner = ordered.get(0).key();
        String reason;
        if (chain.isEmpty()) {
            reason = "failover: no chain configured, first eligible candidate";
        } else if (winner.equals(chain.get(0))) {
            reason = "failover: primary " + winner;
        } else if (chain.contains(winner)) {
            reason = String.format("failover: fallback %s (active chain entry %s)", winner, chain.get(active));
        } else {
            reason = "failover: no chain entry eligible, using " + winner;
        }
        return new Ranking(Scores.byPosition(ordered), reason);
    }
}
