package org.lite.dispatch.service.routing;

import lombok.Value;

/**
 * Ranking entry; score is in [0, 1], higher is better.
 */
@Value
public class ScoredCandidate {
    EvaluatedCandidate evaluated;
    double score;
}
