package org.lite.dispatch.exception;

/**
 * Thrown when no registered candidate passes the request's capability, cost, latency and
 * success-rate filters. Not retried by the router.
 */
public class NoEligibleProviderException extends RuntimeException {

    private final int registeredCandidates;

    public NoEligibleProviderException(String reason, int registeredCandidates) {
        super(String.format("No eligible provider among %d registered candidates: %s", registeredCandidates, reason));
        this.registeredCandidates = registeredCandidates;
    }

    public int getRegisteredCandidates() {
        return registeredCandidates;
    }
}
