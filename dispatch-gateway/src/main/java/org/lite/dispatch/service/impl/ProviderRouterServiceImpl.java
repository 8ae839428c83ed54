package org.lite.dispatch.service.impl;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.lite.dispatch.config.DispatchProperties;
import org.lite.dispatch.entity.MetricEvent;
import org.lite.dispatch.enums.MetricKind;
import org.lite.dispatch.enums.OutcomeStatus;
import org.lite.dispatch.enums.RoutingStrategyType;
import org.lite.dispatch.exception.NoEligibleProviderException;
import org.lite.dispatch.model.ProviderCandidate;
import org.lite.dispatch.model.ProviderCapabilities;
import org.lite.dispatch.model.ProviderMetricsSnapshot;
import org.lite.dispatch.model.RankedCandidate;
import org.lite.dispatch.model.RoutingDecision;
import org.lite.dispatch.model.RoutingRequest;
import org.lite.dispatch.service.MetricsStore;
import org.lite.dispatch.service.ProviderRegistry;
import org.lite.dispatch.service.ProviderSnapshotService;
import org.lite.dispatch.service.RouterService;
import org.lite.dispatch.service.routing.EvaluatedCandidate;
import org.lite.dispatch.service.routing.FailoverTracker;
import org.lite.dispatch.service.routing.Ranking;
import org.lite.dispatch.service.routing.RoutingStrategy;
import org.lite.dispatch.service.routing.ScoredCandidate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Service
@Slf4j
public class ProviderRouterServiceImpl implements RouterService {

    private final ProviderRegistry registry;
    private final ProviderSnapshotService snapshotService;
    private final MetricsStore metricsStore;
    private final FailoverTracker failoverTracker;
    private final DispatchProperties properties;
    private final DispatchProperties.Router config;
    private final Clock clock;
    private final Map<RoutingStrategyType, RoutingStrategy> strategies = new EnumMap<>(RoutingStrategyType.class);

    // decisions handed out recently, and the ids already reported
    private final Cache<String, RoutingDecision> issued;
    private final Cache<String, Boolean> reported;

    public ProviderRouterServiceImpl(ProviderRegistry registry,
                                     ProviderSnapshotService snapshotService,
                                     MetricsStore metricsStore,
                                     FailoverTracker failoverTracker,
                                     List<RoutingStrategy> strategyBeans,
                                     DispatchProperties properties,
                                     Clock clock) {
        this.registry = registry;
        this.snapshotService = snapshotService;
        this.metricsStore = metricsStore;
        this.failoverTracker = failoverTracker;
        this.properties = properties;
        this.config = properties.getRouter();
        this.clock = clock;
        strategyBeans.forEach(s -> strategies.put(s.type(), s));
        for (RoutingStrategyType type : RoutingStrategyType.values()) {
            if (!strategies.containsKey(type)) {
                throw new IllegalStateException("No routing strategy registered for " + type);
            }
        }
        DispatchProperties.Weights weights = config.getWeights();
        if (weights.getLatency() + weights.getCost() != 100) {
            log.warn("Routing weights latency={} cost={} do not sum to 100, they will be normalised",
                    weights.getLatency(), weights.getCost());
        }
        this.issued = Caffeine.newBuilder()
                .maximumSize(config.getDecisionMemoryMaxSize())
                .expireAfterWrite(Duration.ofMillis(config.getDecisionMemoryTtlMs()))
                .build();
        this.reported = Caffeine.newBuilder()
                .maximumSize(config.getDecisionMemoryMaxSize())
                .expireAfterWrite(Duration.ofMillis(config.getDecisionMemoryTtlMs()))
                .build();
    }

    @Override
    public RoutingDecision selectProvider(RoutingRequest request) {
        long now = clock.millis();
        List<ProviderCandidate> candidates = registry.getCandidates();
        if (candidates.isEmpty()) {
            throw new NoEligibleProviderException("no providers registered", 0);
        }

        long inputTokens = estimateInputTokens(request);
        long outputTokens = estimateOutputTokens(request);
        Exclusions exclusions = new Exclusions();
        List<EvaluatedCandidate> eligible = new ArrayList<>();
        boolean telemetryUnavailable = false;

        for (ProviderCandidate candidate : candidates) {
            if (!supports(candidate.getCapabilities(), request)) {
                exclusions.capability++;
                continue;
            }
            Optional<ProviderMetricsSnapshot> lookup = snapshotService.lookup(candidate);
            if (lookup.isEmpty() || lookup.get().ageMs(now) > snapshotService.maxStalenessMs()) {
                telemetryUnavailable = true;
            }
            ProviderMetricsSnapshot snapshot = lookup
                    .orElseGet(() -> ProviderMetricsSnapshot.empty(candidate.getProviderId(), candidate.getModelId(), now));

            double cost = candidate.getPricing().estimate(inputTokens, outputTokens);
            if (request.getMaxCost() != null && cost > request.getMaxCost()) {
                exclusions.cost++;
                continue;
            }
            if (request.getMaxLatencyMs() != null && snapshot.hasSamples()
                    && snapshot.getP95LatencyMs() > request.getMaxLatencyMs()) {
                exclusions.latency++;
                continue;
            }
            if (snapshot.hasSamples() && snapshot.getSuccessRate() < config.getMinSuccessRate()) {
                exclusions.successRate++;
                continue;
            }
            eligible.add(EvaluatedCandidate.builder()
                    .candidate(candidate)
                    .snapshot(snapshot)
                    .estimatedCost(cost)
                    .estimatedLatencyMs(snapshot.hasSamples() ? snapshot.getP95LatencyMs() : config.getDefaultLatencyMs())
                    .build());
        }

        if (eligible.isEmpty()) {
            log.info("No eligible provider for request (user={}, tenant={}): {}",
                    request.getUserId(), request.getTenantId(), exclusions);
            throw new NoEligibleProviderException(exclusions.toString(), candidates.size());
        }

        RoutingStrategyType requested = request.getStrategy() != null ? request.getStrategy() : config.getDefaultStrategy();
        RoutingStrategyType applied = requested;
        if (requested.usesTelemetry() && telemetryUnavailable) {
            log.warn("Telemetry unavailable or older than {}ms, degrading {} routing to round-robin",
                    snapshotService.maxStalenessMs(), requested);
            applied = RoutingStrategyType.ROUND_ROBIN;
        }

        Ranking ranking = strategies.get(applied).rank(eligible, request);
        ScoredCandidate winner = ranking.winner();
        EvaluatedCandidate chosen = winner.getEvaluated();
        String reason = applied == requested
                ? ranking.getReason()
                : String.format("%s (degraded from %s: telemetry unavailable)", ranking.getReason(), requested);

        RoutingDecision decision = RoutingDecision.builder()
                .decisionId(UUID.randomUUID().toString())
                .providerId(chosen.getCandidate().getProviderId())
                .modelId(chosen.getCandidate().getModelId())
                .strategy(applied)
                .reason(reason)
                .estimatedCost(chosen.getEstimatedCost())
                .estimatedLatencyMs(chosen.getEstimatedLatencyMs())
                .confidence(confidence(chosen.getSnapshot(), now))
                .alternatives(alternatives(ranking))
                .userId(request.getUserId())
                .tenantId(request.getTenantId())
                .createdAt(now)
                .build();
        issued.put(decision.getDecisionId(), decision);
        log.debug("Routed to {}/{} via {}: {}", decision.getProviderId(), decision.getModelId(), applied, reason);
        return decision;
    }

    @Override
    public boolean reportOutcome(RoutingDecision decision, OutcomeStatus status, Double latencyMs,
                                 Long inputTokens, Long outputTokens, Double cost) {
        if (decision == null || status == null) {
            throw new IllegalArgumentException("Decision and status are required");
        }
        if (reported.asMap().putIfAbsent(decision.getDecisionId(), Boolean.TRUE) != null) {
            log.debug("Ignoring duplicate outcome for decision {}", decision.getDecisionId());
            return false;
        }
        Double actualCost = cost;
        if (actualCost == null) {
            actualCost = registry.find(decision.getProviderId(), decision.getModelId())
                    .filter(c -> inputTokens != null || outputTokens != null)
                    .map(c -> c.getPricing().estimate(inputTokens == null ? 0 : inputTokens,
                            outputTokens == null ? 0 : outputTokens))
                    .orElse(decision.getEstimatedCost());
        }
        metricsStore.record(MetricEvent.builder()
                .timestamp(clock.millis())
                .kind(MetricKind.REQUEST)
                .provider(decision.getProviderId())
                .model(decision.getModelId())
                .userId(decision.getUserId())
                .decisionId(decision.getDecisionId())
                .status(status)
                .latencyMs(latencyMs)
                .inputTokens(inputTokens)
                .outputTokens(outputTokens)
                .cost(actualCost)
                .build());
        failoverTracker.recordOutcome(decision.getProviderId() + "/" + decision.getModelId(), status.isSuccess());
        return true;
    }

    @Override
    public boolean reportOutcome(String decisionId, OutcomeStatus status, Double latencyMs,
                                 Long inputTokens, Long outputTokens, Double cost) {
        RoutingDecision decision = decisionId == null ? null : issued.getIfPresent(decisionId);
        if (decision == null) {
            log.warn("Outcome reported for unknown or expired decision {}", decisionId);
            return false;
        }
        return reportOutcome(decision, status, latencyMs, inputTokens, outputTokens, cost);
    }

    @Override
    public Map<String, ProviderMetricsSnapshot> getProviderSnapshots() {
        registry.getCandidates().forEach(snapshotService::lookup);
        return snapshotService.getSnapshots();
    }

    @Override
    public List<ProviderCandidate> getCandidates() {
        return registry.getCandidates();
    }

    @Override
    public List<String> reloadRegistry() {
        List<String> errors = registry.reload(properties.getProviders());
        snapshotService.invalidateAll();
        return errors;
    }

    long estimateInputTokens(RoutingRequest request) {
        if (request.getInputTokens() != null) {
            return Math.max(0, request.getInputTokens());
        }
        if (request.getPromptChars() != null) {
            return (long) Math.ceil((double) Math.max(0, request.getPromptChars()) / Math.max(1, config.getCharsPerToken()));
        }
        return 0;
    }

    long estimateOutputTokens(RoutingRequest request) {
        if (request.getOutputTokens() != null) {
            return Math.max(0, request.getOutputTokens());
        }
        if (request.getMaxTokens() != null) {
            return Math.max(0, request.getMaxTokens());
        }
        return config.getDefaultOutputTokens();
    }

    private static boolean supports(ProviderCapabilities capabilities, RoutingRequest request) {
        if (request.isRequiresVision() && !capabilities.isVision()) {
            return false;
        }
        if (request.isRequiresToolUse() && !capabilities.isToolUse()) {
            return false;
        }
        if (request.getMinContextTokens() != null && capabilities.getMaxContextTokens() < request.getMinContextTokens()) {
            return false;
        }
        return request.getMaxTokens() == null || capabilities.getMaxOutputTokens() >= request.getMaxTokens();
    }

    private double confidence(ProviderMetricsSnapshot snapshot, long now) {
        double samples = config.getMinSampleSize() <= 0
                ? 1.0
                : Math.min(1.0, (double) snapshot.getRequestCount() / config.getMinSampleSize());
        return samples * snapshotService.stalenessFactor(snapshot, now);
    }

    private List<RankedCandidate> alternatives(Ranking ranking) {
        return ranking.getEntries().stream()
                .skip(1)
                .limit(Math.max(0, config.getAlternatives()))
                .map(s -> RankedCandidate.builder()
                        .providerId(s.getEvaluated().getCandidate().getProviderId())
                        .modelId(s.getEvaluated().getCandidate().getModelId())
                        .score(s.getScore())
                        .estimatedCost(s.getEvaluated().getEstimatedCost())
                        .estimatedLatencyMs(s.getEvaluated().getEstimatedLatencyMs())
                        .build())
                .toList();
    }

    private static final class Exclusions {
        private int capability;
        private int cost;
        private int latency;
        private int successRate;

        @Override
        public String toString() {
            return String.format("excluded by capability=%d, maxCost=%d, maxLatency=%d, successRate=%d",
                    capability, cost, latency, successRate);
        }
    }
}
