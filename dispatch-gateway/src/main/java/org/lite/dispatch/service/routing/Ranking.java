package org.lite.dispatch.service.routing;

import lombok.Value;

import java.util.List;

/**
 * Eligible candidates best first, with the explanation for the winner.
 */
@Value
public class Ranking {
    List<ScoredCandidate> entries;
    String reason;

    public ScoredCandidate winner() {
        return entries.get(0);
    }
}
