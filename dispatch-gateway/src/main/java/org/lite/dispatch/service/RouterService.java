package org.lite.dispatch.service;

import org.lite.dispatch.enums.OutcomeStatus;
import org.lite.dispatch.model.ProviderCandidate;
import org.lite.dispatch.model.ProviderMetricsSnapshot;
import org.lite.dispatch.model.RoutingDecision;
import org.lite.dispatch.model.RoutingRequest;

import java.util.List;
import java.util.Map;

public interface RouterService {

    /**
     * Picks a provider and model for the request.
     *
     * @throws org.lite.dispatch.exception.NoEligibleProviderException when every registered
     *         candidate fails a capability, cost, latency or success-rate filter
     */
    RoutingDecision selectProvider(RoutingRequest request);

    /**
     * Records the outcome of a dispatched decision. Returns false when the decision was already
     * reported; duplicates are ignored.
     */
    boolean reportOutcome(RoutingDecision decision, OutcomeStatus status, Double latencyMs,
                          Long inputTokens, Long outputTokens, Double cost);

    default boolean reportOutcome(RoutingDecision decision, boolean success) {
        return reportOutcome(decision, success ? OutcomeStatus.SUCCESS : OutcomeStatus.FAILURE, null, null, null, null);
    }

    /**
     * Same as {@link #reportOutcome(RoutingDecision, OutcomeStatus, Double, Long, Long, Double)} for a
     * decision issued recently by this router. Returns false for unknown or already reported ids.
     */
    boolean reportOutcome(String decisionId, OutcomeStatus status, Double latencyMs,
                          Long inputTokens, Long outputTokens, Double cost);

    Map<String, ProviderMetricsSnapshot> getProviderSnapshots();

    List<ProviderCandidate> getCandidates();

    List<String> reloadRegistry();
}
