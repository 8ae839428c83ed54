package org.lite.dispatch.service.routing;

import lombok.extern.slf4j.Slf4j;
import org.lite.dispatch.config.DispatchProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Tracks which entry of the failover chain is active. Consecutive failures of the active entry
 * demote it once they reach the threshold; a success resets the count. Outcomes for entries other
 * than the active one are ignored.
 */
@Component
@Slf4j
public class FailoverTracker {

    private final DispatchProperties.Failover config;
    private final Clock clock;
    private final AtomicReference<State> state;

    record State(int activeIndex, int consecutiveFailures, long demotedAt) {
    }

    public FailoverTracker(DispatchProperties properties, Clock clock) {
        this.config = properties.getRouter().getFailover();
        this.clock = clock;
        this.state = new AtomicReference<>(new State(0, 0, 0));
    }

    /**
     * Primary followed by the fallbacks, as candidate keys.
     */
    public List<String> chain() {
        List<String> chain = new ArrayList<>();
        if (config.getPrimary() != null) {
            chain.add(config.getPrimary());
        }
        if (config.getFallbacks() != null) {
            config.getFallbacks().stream().filter(f -> !chain.contains(f)).forEach(chain::add);
        }
        return chain;
    }

    public int activeIndex() {
        State current = state.updateAndGet(this::recoverIfDue);
        return current.activeIndex();
    }

    public int consecutiveFailures() {
        return state.get().consecutiveFailures();
    }

    public void recordOutcome(String candidateKey, boolean success) {
        List<String> chain = chain();
        if (chain.isEmpty()) {
            return;
        }
        State before = state.get();
        State after = state.updateAndGet(current -> apply(recoverIfDue(current), chain, candidateKey, success));
        if (after.activeIndex() != before.activeIndex() && after.consecutiveFailures() == 0 && !success) {
            log.warn("Failover: demoted {} after {} consecutive failures, now preferring {}",
                    candidateKey, config.getFailureThreshold(), chain.get(after.activeIndex()));
        }
    }

    private State apply(State current, List<String> chain, String candidateKey, boolean success) {
        int active = Math.min(current.activeIndex(), chain.size() - 1);
        if (!chain.get(active).equals(candidateKey)) {
            return current;
        }
        if (success) {
            return current.consecutiveFailures() == 0 ? current : new State(active, 0, current.demotedAt());
        }
        int failures = current.consecutiveFailures() + 1;
        if (failures < Math.max(1, config.getFailureThreshold())) {
            return new State(active, failures, current.demotedAt());
        }
        return new State((active + 1) % chain.size(), 0, clock.millis());
    }

    private State recoverIfDue(State current) {
        if (current.activeIndex() != 0 && config.getRecoveryMs() > 0
                && clock.millis() - current.demotedAt() >= config.getRecoveryMs()) {
            log.info("Failover: recovery period elapsed, preferring primary {} again", config.getPrimary());
            return new State(0, 0, 0);
        }
        return current;
    }

    public void reset() {
        state.set(new State(0, 0, 0));
    }
}
