package org.lite.dispatch.service.routing;

import java.util.Comparator;
import java.util.List;
import java.util.function.ToDoubleFunction;
import java.util.stream.IntStream;

final class Scores {

    /** Best first, then provider id, then model id. */
    static final Comparator<ScoredCandidate> BY_SCORE_DESC = Comparator
            .comparingDouble(ScoredCandidate::getScore).reversed()
            .thenComparing(s -> s.getEvaluated().getCandidate().getProviderId())
            .thenComparing(s -> s.getEvaluated().getCandidate().getModelId());

    private Scores() {
    }

    /**
     * Min-max scaling where the lowest raw value scores 1 and the highest 0. All-equal inputs score 1.
     */
    static double lowerIsBetter(double value, double min, double max) {
        if (max - min <= 0) {
            return 1.0;
        }
        return (max - value) / (max - min);
    }

    static double min(List<EvaluatedCandidate> list, ToDoubleFunction<EvaluatedCandidate> f) {
        return list.stream().mapToDouble(f).min().orElse(0);
    }

    static double max(List<EvaluatedCandidate> list, ToDoubleFunction<EvaluatedCandidate> f) {
        return list.stream().mapToDouble(f).max().orElse(0);
    }

    /**
     * Scores each candidate on one lower-is-better dimension over the given set.
     */
    static List<ScoredCandidate> rankAscending(List<EvaluatedCandidate> eligible, ToDoubleFunction<EvaluatedCandidate> f) {
        double min = min(eligible, f);
        double max = max(eligible, f);
        return eligible.stream()
                .map(c -> new ScoredCandidate(c, lowerIsBetter(f.applyAsDouble(c), min, max)))
                .sorted(Comparator.<ScoredCandidate>comparingDouble(s -> f.applyAsDouble(s.getEvaluated()))
                        .thenComparing(s -> s.getEvaluated().getCandidate().getProviderId())
                        .thenComparing(s -> s.getEvaluated().getCandidate().getModelId()))
                .toList();
    }

    /**
     * Position-based scores for strategies that order without a numeric criterion.
     */
    static List<ScoredCandidate> byPosition(List<EvaluatedCandidate> ordered) {
        int n = ordered.size();
        return IntStream.range(0, n)
                .mapToObj(i -> new ScoredCandidate(ordered.get(i), n == 1 ? 1.0 : 1.0 - (double) i / n))
                .toList();
    }
}
