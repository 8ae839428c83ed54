package org.lite.dispatch.service.routing;

import org.lite.dispatch.enums.RoutingStrategyType;
import org.lite.dispatch.model.ProviderCandidate;
import org.lite.dispatch.model.RoutingRequest;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Rotates through the eligible set. Each distinct set has its own counter, advanced with a single
 * {@code getAndIncrement}.
 */
@Component
public class RoundRobinStrategy implements RoutingStrategy {

    private static final int MAX_TRACKED_SETS = 10_000;

    private final Map<String, AtomicLong> counters = new ConcurrentHashMap<>();

    @Override
    public RoutingStrategyType type() {
        return RoutingStrategyType.ROUND_ROBIN;
    }

    @Override
    public Ranking rank(List<EvaluatedCandidate> eligible, RoutingRequest request) {
        List<EvaluatedCandidate> ordered = eligible.stream()
                .sorted(Comparator.comparing(EvaluatedCandidate::getCandidate, ProviderCandidate.BY_ID))
                .toList();
        String signature = ordered.stream().map(EvaluatedCandidate::key).collect(Collectors.joining(","));
        if (counters.size() >= MAX_TRACKED_SETS && !counters.containsKey(signature)) {
            counters.clear();
        }
        long ticket = counters.computeIfAbsent(signature, k -> new AtomicLong()).getAndIncrement();
        int start = (int) Math.floorMod(ticket, (long) ordered.size());

        List<EvaluatedCandidate> rotated = new ArrayList<>(ordered.size());
        for (int i = 0; i < ordered.size(); i++) {
            rotated.add(ordered.get((start + i) % ordered.size()));
        }
        return new Ranking(Scores.byPosition(rotated),
                String.format("round-robin: position %d of %d eligible candidates", start + 1, ordered.size()));
    }
}
