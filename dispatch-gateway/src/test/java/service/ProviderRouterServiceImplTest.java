package service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.lite.dispatch.config.DispatchProperties;
import org.lite.dispatch.entity.MetricEvent;
import org.lite.dispatch.enums.MetricKind;
import org.lite.dispatch.enums.MetricName;
import org.lite.dispatch.enums.OutcomeStatus;
import org.lite.dispatch.enums.RoutingStrategyType;
import org.lite.dispatch.exception.NoEligibleProviderException;
import org.lite.dispatch.model.AggregatedMetrics;
import org.lite.dispatch.model.MetricFilter;
import org.lite.dispatch.model.ModelPricing;
import org.lite.dispatch.model.ProviderCandidate;
import org.lite.dispatch.model.ProviderCapabilities;
import org.lite.dispatch.model.ProviderMetricsSnapshot;
import org.lite.dispatch.model.RoutingDecision;
import org.lite.dispatch.model.RoutingRequest;
import org.lite.dispatch.service.MetricsStore;
import org.lite.dispatch.service.ProviderRegistry;
import org.lite.dispatch.service.ProviderSnapshotService;
import org.lite.dispatch.service.impl.ProviderRouterServiceImpl;
import org.lite.dispatch.service.routing.CostBasedStrategy;
import org.lite.dispatch.service.routing.EvaluatedCandidate;
import org.lite.dispatch.service.routing.FailoverStrategy;
import org.lite.dispatch.service.routing.FailoverTracker;
import org.lite.dispatch.service.routing.LatencyBasedStrategy;
import org.lite.dispatch.service.routing.ModelSpecificStrategy;
import org.lite.dispatch.service.routing.RoundRobinStrategy;
import org.lite.dispatch.service.routing.RoutingStrategy;
import org.lite.dispatch.service.routing.ScoredCandidate;
import org.lite.dispatch.service.routing.WeightedStrategy;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ProviderRouterServiceImplTest {

    private static final long NOW = 1_700_000_000_000L;

    @Mock
    private ProviderSnapshotService snapshotService;
    @Mock
    private MetricsStore metricsStore;

    private DispatchProperties properties;
    private MutableClock clock;
    private final Map<String, ProviderMetricsSnapshot> snapshots = new HashMap<>();

    @BeforeEach
    void setUp() {
        properties = new DispatchProperties();
        clock = new MutableClock(NOW);
        lenient().when(snapshotService.lookup(any(ProviderCandidate.class))).thenAnswer(invocation -> {
            ProviderCandidate candidate = invocation.getArgument(0);
            return Optional.ofNullable(snapshots.get(candidate.key()));
        });
        lenient().when(snapshotService.maxStalenessMs()).thenReturn(300_000L);
        lenient().when(snapshotService.stalenessFactor(any(ProviderMetricsSnapshot.class), anyLong())).thenReturn(1.0);
    }

    private static DispatchProperties.ProviderEntry entry(String provider, String model, double inPrice, double outPrice,
                                                          boolean vision) {
        DispatchProperties.ProviderEntry entry = new DispatchProperties.ProviderEntry();
        entry.setProviderId(provider);
        entry.setModelId(model);
        entry.setInputPricePer1M(inPrice);
        entry.setOutputPricePer1M(outPrice);
        entry.setVision(vision);
        entry.setToolUse(true);
        return entry;
    }

    private void telemetry(String key, double p95LatencyMs, double successRate, long requests) {
        int slash = key.indexOf('/');
        snapshots.put(key, ProviderMetricsSnapshot.builder()
            .providerId(key.substring(0, slash))
            .modelId(key.substring(slash + 1))
            .avgLatencyMs(p95LatencyMs * 0.6)
            .p50LatencyMs(p95LatencyMs * 0.5)
            .p95LatencyMs(p95LatencyMs)
            .p99LatencyMs(p95LatencyMs * 1.2)
            .successRate(successRate)
            .requestCount(requests)
            .computedAt(NOW)
            .build());
    }

    private ProviderRouterServiceImpl newRouter() {
        return newRouter(snapshotService);
    }

    private ProviderRouterServiceImpl newRouter(ProviderSnapshotService snapshots) {
        ProviderRegistry registry = new ProviderRegistry(properties);
        FailoverTracker tracker = new FailoverTracker(properties, clock);
        WeightedStrategy weighted = new WeightedStrategy(properties);
        List<RoutingStrategy> strategies = List.of(
            new LatencyBasedStrategy(),
            new CostBasedStrategy(),
            weighted,
            new ModelSpecificStrategy(properties, weighted),
            new RoundRobinStrategy(),
            new FailoverStrategy(tracker));
        return new ProviderRouterServiceImpl(registry, snapshots, metricsStore, tracker, strategies, properties, clock);
    }

    private void registerCheapAndPremium() {
        properties.setProviders(List.of(
            entry("cheap", "mini", 0.25, 1.25, false),
            entry("premium", "large", 3.00, 15.00, false)));
        telemetry("cheap/mini", 1_500, 0.99, 100);
        telemetry("premium/large", 700, 0.99, 100);
    }

    @Test
    void testCostBasedSelectsCheaperProviderWithFormulaCost() {
        // Given
        registerCheapAndPremium();
        ProviderRouterServiceImpl router = newRouter();
        RoutingRequest request = RoutingRequest.builder()
            .inputTokens(1_000L)
            .outputTokens(500L)
            .strategy(RoutingStrategyType.COST_BASED)
            .build();

        // When
        RoutingDecision decision = router.selectProvider(request);

        // Then - 1000/1e6 * 0.25 + 500/1e6 * 1.25
        assertEquals("cheap", decision.getProviderId());
        assertEquals("mini", decision.getModelId());
        assertEquals(RoutingStrategyType.COST_BASED, decision.getStrategy());
        assertEquals(0.000875, decision.getEstimatedCost(), 1e-12);
        assertEquals(1, decision.getAlternatives().size());
        assertEquals("premium", decision.getAlternatives().get(0).getProviderId());
        assertEquals(0.0105, decision.getAlternatives().get(0).getEstimatedCost(), 1e-12);
        assertNotNull(decision.getDecisionId());
        assertFalse(decision.getReason().isBlank());
    }

    @Test
    void testVisionRequirementWithoutCapableCandidateFails() {
        // Given
        registerCheapAndPremium();
        ProviderRouterServiceImpl router = newRouter();
        RoutingRequest request = RoutingRequest.builder().requiresVision(true).build();

        // When
        NoEligibleProviderException error = assertThrows(NoEligibleProviderException.class,
            () -> router.selectProvider(request));

        // Then
        assertEquals(2, error.getRegisteredCandidates());
        assertTrue(error.getMessage().contains("capability=2"));
    }

    @Test
    void testLatencyBasedPicksLowestP95() {
        // Given
        registerCheapAndPremium();
        ProviderRouterServiceImpl router = newRouter();

        // When
        RoutingDecision decision = router.selectProvider(RoutingRequest.builder()
            .strategy(RoutingStrategyType.LATENCY_BASED).build());

        // Then
        assertEquals("premium", decision.getProviderId());
        assertEquals(700, decision.getEstimatedLatencyMs());
    }

    @Test
    void testLowSuccessRateCandidateIsExcluded() {
        // Given
        registerCheapAndPremium();
        telemetry("premium/large", 700, 0.5, 100);
        ProviderRouterServiceImpl router = newRouter();

        // When
        RoutingDecision decision = router.selectProvider(RoutingRequest.builder()
            .strategy(RoutingStrategyType.LATENCY_BASED).build());

        // Then
        assertEquals("cheap", decision.getProviderId());
        assertTrue(decision.getAlternatives().isEmpty());
    }

    @Test
    void testMaxCostAndMaxLatencyFilters() {
        // Given
        registerCheapAndPremium();
        ProviderRouterServiceImpl router = newRouter();
        RoutingRequest withinBudget = RoutingRequest.builder()
            .inputTokens(1_000L).outputTokens(500L).maxCost(0.001).build();
        RoutingRequest impossible = RoutingRequest.builder()
            .inputTokens(1_000L).outputTokens(500L).maxCost(0.001).maxLatencyMs(1_000.0).build();

        // When
        RoutingDecision decision = router.selectProvider(withinBudget);

        // Then - premium is over budget, cheap is too slow for the second request
        assertEquals("cheap", decision.getProviderId());
        NoEligibleProviderException error = assertThrows(NoEligibleProviderException.class,
            () -> router.selectProvider(impossible));
        assertTrue(error.getMessage().contains("maxCost=1"));
        assertTrue(error.getMessage().contains("maxLatency=1"));
    }

    @Test
    void testWeightedSelectionIsDeterministic() {
        // Given
        registerCheapAndPremium();
        properties.getRouter().getWeights().setLatency(80);
        properties.getRouter().getWeights().setCost(20);
        ProviderRouterServiceImpl router = newRouter();
        RoutingRequest request = RoutingRequest.builder().inputTokens(1_000L).outputTokens(500L).build();

        // When
        RoutingDecision first = router.selectProvider(request);
        RoutingDecision second = router.selectProvider(request);

        // Then - latency dominates, so the faster premium model wins every time
        assertEquals(RoutingStrategyType.WEIGHTED, first.getStrategy());
        assertEquals("premium", first.getProviderId());
        assertEquals(first.getProviderId(), second.getProviderId());
        assertEquals(first.getAlternatives(), second.getAlternatives());
    }

    @Test
    void testMissingTelemetryDegradesToRoundRobin() {
        // Given
        registerCheapAndPremium();
        snapshots.clear();
        ProviderRouterServiceImpl router = newRouter();

        // When
        RoutingDecision decision = router.selectProvider(RoutingRequest.builder()
            .strategy(RoutingStrategyType.LATENCY_BASED).build());

        // Then
        assertEquals(RoutingStrategyType.ROUND_ROBIN, decision.getStrategy());
        assertTrue(decision.getReason().contains("degraded"));
        assertEquals(properties.getRouter().getDefaultLatencyMs(), decision.getEstimatedLatencyMs());
        assertEquals(0.0, decision.getConfidence());
    }

    @Test
    void testRoundRobinSpreadsEvenly() {
        // Given
        properties.setProviders(List.of(
            entry("a", "m", 1, 1, false),
            entry("b", "m", 1, 1, false),
            entry("c", "m", 1, 1, false)));
        ProviderRouterServiceImpl router = newRouter();
        RoutingRequest request = RoutingRequest.builder().strategy(RoutingStrategyType.ROUND_ROBIN).build();
        Map<String, Integer> counts = new HashMap<>();

        // When
        for (int i = 0; i < 30; i++) {
            counts.merge(router.selectProvider(request).getProviderId(), 1, Integer::sum);
        }

        // Then
        assertEquals(Map.of("a", 10, "b", 10, "c", 10), counts);
    }

    @Test
    void testTelemetryOlderThanMaxStalenessDegradesToRoundRobin() {
        // Given - telemetry is computed once, then every refresh fails
        registerCheapAndPremium();
        AtomicBoolean failing = new AtomicBoolean(false);
        when(metricsStore.getAggregated(any(MetricName.class), anyLong(), anyLong(), any(MetricFilter.class)))
            .thenAnswer(invocation -> {
                if (failing.get()) {
                    throw new IllegalStateException("metrics store unavailable");
                }
                return AggregatedMetrics.builder().count(100).avg(0.99).p95(500).build();
            });
        ProviderSnapshotService realSnapshots = new ProviderSnapshotService(metricsStore, properties, clock, Runnable::run);
        ProviderRouterServiceImpl router = newRouter(realSnapshots);
        RoutingRequest request = RoutingRequest.builder().strategy(RoutingStrategyType.LATENCY_BASED).build();
        assertEquals(RoutingStrategyType.LATENCY_BASED, router.selectProvider(request).getStrategy());

        // When
        failing.set(true);
        clock.advance(realSnapshots.maxStalenessMs() + 1);
        RoutingDecision decision = router.selectProvider(request);

        // Then
        assertEquals(RoutingStrategyType.ROUND_ROBIN, decision.getStrategy());
        assertTrue(decision.getReason().contains("degraded from LATENCY_BASED"));
    }

    @Test
    void testConcurrentRoundRobinStaysFair() throws InterruptedException {
        // Given
        properties.setProviders(List.of(
            entry("a", "m", 1, 1, false),
            entry("b", "m", 1, 1, false),
            entry("c", "m", 1, 1, false)));
        ProviderRouterServiceImpl router = newRouter();
        RoutingRequest request = RoutingRequest.builder().strategy(RoutingStrategyType.ROUND_ROBIN).build();
        Map<String, AtomicInteger> counts = new ConcurrentHashMap<>();
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(8);

        // When - 8000 selections over three candidates
        for (int t = 0; t < 8; t++) {
            executor.submit(() -> {
                for (int i = 0; i < 1_000; i++) {
                    counts.computeIfAbsent(router.selectProvider(request).getProviderId(), k -> new AtomicInteger())
                        .incrementAndGet();
                }
                done.countDown();
            });
        }
        assertTrue(done.await(10, TimeUnit.SECONDS));
        executor.shutdownNow();

        // Then - every provider got floor(8000/3) or ceil(8000/3)
        assertEquals(3, counts.size());
        int total = 0;
        for (AtomicInteger count : counts.values()) {
            assertTrue(count.get() == 2_666 || count.get() == 2_667, "Unfair share " + count.get());
            total += count.get();
        }
        assertEquals(8_000, total);
    }

    @Test
    void testWeightedScoreNeverDropsWhenLatencyOrCostImproves() {
        // Given
        WeightedStrategy weighted = new WeightedStrategy(properties);
        Random random = new Random(42);

        for (int trial = 0; trial < 500; trial++) {
            List<EvaluatedCandidate> before = new ArrayList<>();
            for (int i = 0; i < 4; i++) {
                before.add(evaluated("p" + i, 100 + random.nextInt(2_000), random.nextDouble() / 100));
            }
            EvaluatedCandidate target = before.get(0);
            double betterLatency = target.getEstimatedLatencyMs() * random.nextDouble();
            double betterCost = target.getEstimatedCost() * random.nextDouble();

            // When - the first candidate gets faster, then cheaper
            List<EvaluatedCandidate> faster = new ArrayList<>(before);
            faster.set(0, evaluated("p0", betterLatency, target.getEstimatedCost()));
            List<EvaluatedCandidate> cheaper = new ArrayList<>(before);
            cheaper.set(0, evaluated("p0", target.getEstimatedLatencyMs(), betterCost));

            // Then
            double original = scoreOf(weighted.score(before), "p0");
            assertTrue(scoreOf(weighted.score(faster), "p0") >= original - 1e-12, "Faster scored lower in trial " + trial);
            assertTrue(scoreOf(weighted.score(cheaper), "p0") >= original - 1e-12, "Cheaper scored lower in trial " + trial);
        }
    }

    private static EvaluatedCandidate evaluated(String provider, double latencyMs, double cost) {
        ProviderCandidate candidate = ProviderCandidate.builder()
            .providerId(provider)
            .modelId("m")
            .capabilities(ProviderCapabilities.builder().maxContextTokens(128_000).maxOutputTokens(4_096).build())
            .pricing(new ModelPricing(1, 1))
            .build();
        return EvaluatedCandidate.builder()
            .candidate(candidate)
            .snapshot(ProviderMetricsSnapshot.empty(provider, "m", NOW))
            .estimatedLatencyMs(latencyMs)
            .estimatedCost(cost)
            .build();
    }

    private static double scoreOf(List<ScoredCandidate> scored, String provider) {
        return scored.stream()
            .filter(s -> s.getEvaluated().providerId().equals(provider))
            .findFirst()
            .orElseThrow()
            .getScore();
    }

    @Test
    void testFailoverDemotesPrimaryAfterConsecutiveFailuresAndRecovers() {
        // Given
        registerCheapAndPremium();
        properties.getRouter().getFailover().setPrimary("premium/large");
        properties.getRouter().getFailover().setFallbacks(List.of("cheap/mini"));
        properties.getRouter().getFailover().setFailureThreshold(3);
        properties.getRouter().getFailover().setRecoveryMs(60_000);
        ProviderRouterServiceImpl router = newRouter();
        RoutingRequest request = RoutingRequest.builder().strategy(RoutingStrategyType.FAILOVER).build();

        // When - two failures keep the primary, the third demotes it
        for (int i = 0; i < 2; i++) {
            RoutingDecision decision = router.selectProvider(request);
            assertEquals("premium", decision.getProviderId());
            router.reportOutcome(decision, false);
        }
        RoutingDecision third = router.selectProvider(request);
        assertEquals("premium", third.getProviderId());
        router.reportOutcome(third, false);

        // Then
        RoutingDecision afterDemotion = router.selectProvider(request);
        assertEquals("cheap", afterDemotion.getProviderId());
        assertTrue(afterDemotion.getReason().contains("fallback"));

        clock.advance(60_000);
        assertEquals("premium", router.selectProvider(request).getProviderId());
    }

    @Test
    void testSuccessResetsFailoverFailureCount() {
        // Given
        registerCheapAndPremium();
        properties.getRouter().getFailover().setPrimary("premium/large");
        properties.getRouter().getFailover().setFallbacks(List.of("cheap/mini"));
        ProviderRouterServiceImpl router = newRouter();
        RoutingRequest request = RoutingRequest.builder().strategy(RoutingStrategyType.FAILOVER).build();

        // When
        router.reportOutcome(router.selectProvider(request), false);
        router.reportOutcome(router.selectProvider(request), false);
        router.reportOutcome(router.selectProvider(request), true);
        router.reportOutcome(router.selectProvider(request), false);

        // Then
        assertEquals("premium", router.selectProvider(request).getProviderId());
    }

    @Test
    void testDuplicateOutcomeIsRecordedOnce() {
        // Given
        registerCheapAndPremium();
        ProviderRouterServiceImpl router = newRouter();
        RoutingDecision decision = router.selectProvider(RoutingRequest.builder().build());

        // When
        boolean first = router.reportOutcome(decision.getDecisionId(), OutcomeStatus.SUCCESS, 420.0, null, null, null);
        boolean second = router.reportOutcome(decision.getDecisionId(), OutcomeStatus.SUCCESS, 420.0, null, null, null);
        boolean unknown = router.reportOutcome("no-such-decision", OutcomeStatus.SUCCESS, 1.0, null, null, null);

        // Then
        assertTrue(first);
        assertFalse(second);
        assertFalse(unknown);
        verify(metricsStore, times(1)).record(any(MetricEvent.class));
    }

    @Test
    void testOutcomeCostIsDerivedFromPricingWhenTokensAreReported() {
        // Given
        registerCheapAndPremium();
        ProviderRouterServiceImpl router = newRouter();
        RoutingDecision decision = router.selectProvider(RoutingRequest.builder()
            .strategy(RoutingStrategyType.COST_BASED).build());

        // When
        router.reportOutcome(decision, OutcomeStatus.SUCCESS, 900.0, 2_000L, 1_000L, null);

        // Then
        ArgumentCaptor<MetricEvent> captor = ArgumentCaptor.forClass(MetricEvent.class);
        verify(metricsStore).record(captor.capture());
        MetricEvent event = captor.getValue();
        assertEquals(MetricKind.REQUEST, event.getKind());
        assertEquals("cheap", event.getProvider());
        assertEquals(decision.getDecisionId(), event.getDecisionId());
        assertEquals(0.00175, event.getCost(), 1e-12);
        assertEquals(NOW, event.getTimestamp());
    }

    @Test
    void testPromptCharsAreConvertedToTokenEstimate() {
        // Given
        registerCheapAndPremium();
        ProviderRouterServiceImpl router = newRouter();

        // When - 4001 characters at four per token round up to 1001 tokens
        RoutingDecision decision = router.selectProvider(RoutingRequest.builder()
            .promptChars(4_001)
            .strategy(RoutingStrategyType.COST_BASED)
            .build());

        // Then
        assertEquals(1_001 / 1e6 * 0.25 + 500 / 1e6 * 1.25, decision.getEstimatedCost(), 1e-12);
    }

    @Test
    void testModelSpecificRulePrefersListedProvider() {
        // Given
        properties.setProviders(List.of(
            entry("cheap", "mini", 0.25, 1.25, true),
            entry("premium", "large", 3.00, 15.00, true)));
        telemetry("cheap/mini", 500, 0.99, 100);
        telemetry("premium/large", 900, 0.99, 100);
        DispatchProperties.ModelRule rule = new DispatchProperties.ModelRule();
        rule.setName("vision-quality");
        rule.setPriority(1);
        rule.setRequiresVision(true);
        rule.setPreferredProviders(Map.of("premium", 5));
        properties.getRouter().setModelRules(List.of(rule));
        ProviderRouterServiceImpl router = newRouter();

        // When
        RoutingDecision matched = router.selectProvider(RoutingRequest.builder()
            .requiresVision(true).strategy(RoutingStrategyType.MODEL_SPECIFIC).build());
        RoutingDecision unmatched = router.selectProvider(RoutingRequest.builder()
            .strategy(RoutingStrategyType.MODEL_SPECIFIC).build());

        // Then
        assertEquals("premium", matched.getProviderId());
        assertTrue(matched.getReason().contains("vision-quality"));
        assertEquals("cheap", unmatched.getProviderId());
        assertTrue(unmatched.getReason().contains("no rule matched"));
    }

    @Test
    void testConfidenceScalesWithSampleSize() {
        // Given
        properties.setProviders(List.of(entry("cheap", "mini", 0.25, 1.25, false)));
        telemetry("cheap/mini", 500, 1.0, 10);
        ProviderRouterServiceImpl router = newRouter();

        // When
        RoutingDecision decision = router.selectProvider(RoutingRequest.builder().build());

        // Then - 10 of the 20 samples needed for full confidence
        assertEquals(0.5, decision.getConfidence(), 1e-9);
    }

    @Test
    void testInvalidRegistryEntriesAreSkipped() {
        // Given
        properties.setProviders(List.of(
            entry("cheap", "mini", 0.25, 1.25, false),
            entry("cheap", "mini", 0.25, 1.25, false),
            entry("broken", "model", -1, 1, false)));

        // When
        ProviderRegistry registry = new ProviderRegistry(properties);

        // Then
        assertEquals(1, registry.getCandidates().size());
        assertEquals(2, registry.getLoadErrors().size());
    }

    @Test
    void testProviderIdWithSlashIsRejectedButModelIdMayHaveOne() {
        // Given
        properties.setProviders(List.of(
            entry("together/eu", "llama", 0.5, 0.5, false),
            entry("together", "meta-llama/Llama-3-70b", 0.5, 0.5, false)));

        // When
        ProviderRegistry registry = new ProviderRegistry(properties);

        // Then
        assertEquals(1, registry.getCandidates().size());
        assertEquals("meta-llama/Llama-3-70b", registry.getCandidates().get(0).getModelId());
        assertTrue(registry.findByKey("together/meta-llama/Llama-3-70b").isPresent());
        assertTrue(registry.getLoadErrors().get(0).contains("together/eu"));
    }
}
