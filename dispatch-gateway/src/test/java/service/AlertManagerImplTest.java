package service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.lite.dispatch.config.DispatchProperties;
import org.lite.dispatch.entity.Alert;
import org.lite.dispatch.entity.AlertRule;
import org.lite.dispatch.enums.AlertSeverity;
import org.lite.dispatch.enums.AlertState;
import org.lite.dispatch.enums.MetricName;
import org.lite.dispatch.event.AlertTransitionEvent;
import org.lite.dispatch.exception.InvalidAlertRuleException;
import org.lite.dispatch.exception.ResourceNotFoundException;
import org.lite.dispatch.model.AggregatedMetrics;
import org.lite.dispatch.model.AlertEvaluation;
import org.lite.dispatch.model.MetricFilter;
import org.lite.dispatch.repository.AlertRepository;
import org.lite.dispatch.repository.AlertRuleRepository;
import org.lite.dispatch.service.AlertEventPublisher;
import org.lite.dispatch.service.MetricsStore;
import org.lite.dispatch.service.impl.AlertManagerImpl;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AlertManagerImplTest {

    private static final long NOW = 1_700_000_000_000L;

    @Mock
    private AlertRuleRepository alertRuleRepository;

    @Mock
    private AlertRepository alertRepository;

    @Mock
    private MetricsStore metricsStore;

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private MutableClock clock;
    private AlertEventPublisher alertEventPublisher;
    private AlertManagerImpl alertManager;
    private final List<AlertTransitionEvent> transitions = new ArrayList<>();

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        DispatchProperties properties = new DispatchProperties();
        alertEventPublisher = new AlertEventPublisher(applicationEventPublisher, properties, clock);
        alertEventPublisher.subscribe(0).subscribe(transitions::add);
        alertManager = new AlertManagerImpl(alertRuleRepository, alertRepository, metricsStore,
                alertEventPublisher, properties, clock);

        lenient().when(alertRepository.save(any(Alert.class)))
                .thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));
        lenient().when(alertRuleRepository.save(any(AlertRule.class)))
                .thenAnswer(invocation -> Mono.just(invocation.getArgument(0)));
    }

    private AlertRule p95Rule() {
        return AlertRule.builder()
                .id("rule-1")
                .name("High p95 latency")
                .metric("p95_latency")
                .operator(">")
                .threshold(2000)
                .durationSeconds(300)
                .severity(AlertSeverity.CRITICAL)
                .build();
    }

    private void stubLatencyP95(double p95) {
        AggregatedMetrics aggregated = AggregatedMetrics.builder()
                .count(50).sum(p95 * 50).avg(p95).min(p95).max(p95).p50(p95).p95(p95).p99(p95)
                .build();
        // re-stubbed within a test as the latency changes
        doReturn(aggregated).when(metricsStore)
                .getAggregated(eq(MetricName.LATENCY), anyLong(), anyLong(), any(MetricFilter.class));
    }

    @Test
    void testBreachFiresAndRecoveryResolves() {
        // Given
        AlertRule rule = p95Rule();
        stubLatencyP95(2500);

        // When
        AlertEvaluation firing = alertManager.evaluateRule(rule).block();

        // Then
        assertNotNull(firing);
        assertTrue(firing.isTriggered());
        assertEquals(2500, firing.getCurrentValue());
        assertNotNull(firing.getAlertId());
        verify(metricsStore).getAggregated(eq(MetricName.LATENCY), eq(NOW - 300_000), eq(NOW), any(MetricFilter.class));

        List<Alert> active = alertManager.getActiveAlerts(null).collectList().block();
        assertEquals(1, active.size());
        assertEquals(AlertState.FIRING, active.get(0).getState());
        assertEquals(2500, active.get(0).getCurrentValue());
        assertEquals(2000, active.get(0).getThresholdValue());
        assertEquals(AlertSeverity.CRITICAL, active.get(0).getSeverity());

        // When - latency recovers
        clock.advance(60_000);
        stubLatencyP95(1200);
        AlertEvaluation recovered = alertManager.evaluateRule(rule).block();

        // Then
        assertFalse(recovered.isTriggered());
        assertNull(recovered.getAlertId());
        assertTrue(alertManager.getActiveAlerts(null).collectList().block().isEmpty());

        ArgumentCaptor<Alert> saved = ArgumentCaptor.forClass(Alert.class);
        verify(alertRepository, times(2)).save(saved.capture());
        Alert resolved = saved.getAllValues().get(1);
        assertEquals(AlertState.RESOLVED, resolved.getState());
        assertEquals(NOW + 60_000, resolved.getResolvedAt());
        assertEquals(firing.getAlertId(), resolved.getId());

        assertEquals(2, transitions.size());
        assertNull(transitions.get(0).getFrom());
        assertEquals(AlertState.FIRING, transitions.get(0).getTo());
        assertEquals(AlertState.FIRING, transitions.get(1).getFrom());
        assertEquals(AlertState.RESOLVED, transitions.get(1).getTo());
        assertEquals(1, transitions.get(0).getSequence());
        assertEquals(2, transitions.get(1).getSequence());
        verify(applicationEventPublisher, times(2)).publishEvent(any(AlertTransitionEvent.class));
    }

    @Test
    void testContinuedBreachDoesNotDuplicateAlert() {
        // Given
        AlertRule rule = p95Rule();
        stubLatencyP95(2500);
        AlertEvaluation first = alertManager.evaluateRule(rule).block();

        // When
        stubLatencyP95(3100);
        AlertEvaluation second = alertManager.evaluateRule(rule).block();

        // Then
        assertEquals(first.getAlertId(), second.getAlertId());
        List<Alert> active = alertManager.getActiveAlerts(null).collectList().block();
        assertEquals(1, active.size());
        assertEquals(3100, active.get(0).getCurrentValue());
        verify(alertRepository, times(1)).save(any(Alert.class));
        assertEquals(1, transitions.size());
    }

    @Test
    void testConcurrentEvaluationsOpenOneAlert() throws InterruptedException {
        // Given
        AlertRule rule = p95Rule();
        stubLatencyP95(2500);
        ExecutorService executor = Executors.newFixedThreadPool(64);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(64);
        List<String> alertIds = Collections.synchronizedList(new ArrayList<>());

        // When
        for (int i = 0; i < 64; i++) {
            executor.submit(() -> {
                try {
                    start.await();
                    alertIds.add(alertManager.evaluateRule(rule).block().getAlertId());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }
        start.countDown();
        assertTrue(done.await(10, TimeUnit.SECONDS));
        executor.shutdownNow();

        // Then
        assertEquals(64, alertIds.size());
        assertEquals(1, alertIds.stream().distinct().count());
        assertEquals(1, alertManager.getActiveAlerts(null).collectList().block().size());
        verify(alertRepository, times(1)).save(any(Alert.class));
        assertEquals(1, transitions.size());
        assertEquals(AlertState.FIRING, transitions.get(0).getTo());
    }

    @Test
    void testResolveIsWrittenAfterSlowFiringWrite() {
        // Given - the FIRING write stays in flight until the test completes it
        AlertRule rule = p95Rule();
        Sinks.One<Alert> firingWrite = Sinks.one();
        List<AlertState> saveOrder = new ArrayList<>();
        doAnswer(invocation -> {
            saveOrder.add(invocation.<Alert>getArgument(0).getState());
            return firingWrite.asMono();
        }).doAnswer(invocation -> {
            saveOrder.add(invocation.<Alert>getArgument(0).getState());
            return Mono.just(invocation.getArgument(0));
        }).when(alertRepository).save(any(Alert.class));
        stubLatencyP95(2500);
        alertManager.evaluateRule(rule).subscribe();

        // When - the rule recovers before the first write lands
        clock.advance(60_000);
        stubLatencyP95(1200);
        List<AlertEvaluation> recovered = new ArrayList<>();
        alertManager.evaluateRule(rule).subscribe(recovered::add);

        // Then - the RESOLVED write waits for the FIRING one
        assertEquals(List.of(AlertState.FIRING), saveOrder);
        assertTrue(recovered.isEmpty());
        assertTrue(transitions.isEmpty());

        // When
        firingWrite.tryEmitValue(Alert.builder().build());

        // Then
        assertEquals(List.of(AlertState.FIRING, AlertState.RESOLVED), saveOrder);
        assertEquals(1, recovered.size());
        assertFalse(recovered.get(0).isTriggered());
        assertEquals(2, transitions.size());
        assertEquals(AlertState.FIRING, transitions.get(0).getTo());
        assertEquals(AlertState.RESOLVED, transitions.get(1).getTo());
    }

    @Test
    void testZeroDurationUsesLatestMinute() {
        // Given
        AlertRule rule = p95Rule().toBuilder().durationSeconds(0).build();
        stubLatencyP95(2100);

        // When
        AlertEvaluation evaluation = alertManager.evaluateRule(rule).block();

        // Then
        assertTrue(evaluation.isTriggered());
        verify(metricsStore).getAggregated(eq(MetricName.LATENCY), eq(NOW - 60_000), eq(NOW), any(MetricFilter.class));
    }

    @Test
    void testNoDataLeavesStateUnchanged() {
        // Given
        AlertRule rule = p95Rule();
        stubLatencyP95(2500);
        AlertEvaluation firing = alertManager.evaluateRule(rule).block();
        doReturn(AggregatedMetrics.empty()).when(metricsStore)
                .getAggregated(eq(MetricName.LATENCY), anyLong(), anyLong(), any(MetricFilter.class));

        // When
        AlertEvaluation evaluation = alertManager.evaluateRule(rule).block();

        // Then
        assertFalse(evaluation.isTriggered());
        assertEquals(firing.getAlertId(), evaluation.getAlertId());
        assertEquals(1, alertManager.getActiveAlerts(null).collectList().block().size());
        assertEquals(1, transitions.size());
    }

    @Test
    void testRequestCountEvaluatesWithoutSamples() {
        // Given
        AlertRule rule = AlertRule.builder()
                .id("rule-traffic")
                .name("Traffic stopped")
                .metric("request_count")
                .operator("<")
                .threshold(1)
                .durationSeconds(600)
                .provider("openai")
                .build();
        when(metricsStore.getAggregated(eq(MetricName.SUCCESS), anyLong(), anyLong(), any(MetricFilter.class)))
                .thenReturn(AggregatedMetrics.empty());

        // When
        AlertEvaluation evaluation = alertManager.evaluateRule(rule).block();

        // Then
        assertTrue(evaluation.isTriggered());
        assertEquals(0.0, evaluation.getCurrentValue());
        ArgumentCaptor<MetricFilter> filter = ArgumentCaptor.forClass(MetricFilter.class);
        verify(metricsStore).getAggregated(eq(MetricName.SUCCESS), anyLong(), anyLong(), filter.capture());
        assertEquals("openai", filter.getValue().getProvider());
        assertNull(filter.getValue().getModel());
    }

    @Test
    void testInvalidRuleIsMarkedAndSkipped() {
        // Given
        AlertRule rule = p95Rule().toBuilder().metric("p42_latency").build();

        // When
        AlertEvaluation evaluation = alertManager.evaluateRule(rule).block();

        // Then
        assertFalse(evaluation.isTriggered());
        assertTrue(Double.isNaN(evaluation.getCurrentValue()));
        assertFalse(rule.isValid());
        assertTrue(rule.getValidationError().contains("p42_latency"));
        verify(alertRuleRepository).save(rule);
        verifyNoInteractions(metricsStore);
    }

    @Test
    void testEvaluateAllRulesContinuesPastFailures() {
        // Given
        AlertRule failing = p95Rule().toBuilder().id("rule-broken").provider("broken").build();
        AlertRule healthy = p95Rule().toBuilder().id("rule-ok").provider("ok").build();
        when(alertRuleRepository.findByEnabledTrue()).thenReturn(Flux.just(failing, healthy));
        when(metricsStore.getAggregated(eq(MetricName.LATENCY), anyLong(), anyLong(), any(MetricFilter.class)))
                .thenAnswer(invocation -> {
                    MetricFilter filter = invocation.getArgument(3);
                    if ("broken".equals(filter.getProvider())) {
                        throw new IllegalStateException("store unavailable");
                    }
                    return AggregatedMetrics.builder().count(10).p95(2600).build();
                });

        // When / Then
        StepVerifier.create(alertManager.evaluateAllRules())
                .assertNext(results -> {
                    assertEquals(1, results.size());
                    assertEquals("rule-ok", results.get(0).getRuleId());
                    assertTrue(results.get(0).isTriggered());
                })
                .verifyComplete();
    }

    @Test
    void testAcknowledgeFiringAlert() {
        // Given
        stubLatencyP95(2500);
        String alertId = alertManager.evaluateRule(p95Rule()).block().getAlertId();
        clock.advance(5_000);

        // When
        Alert acknowledged = alertManager.acknowledge(alertId, "oncall").block();

        // Then
        assertEquals(AlertState.ACKNOWLEDGED, acknowledged.getState());
        assertEquals("oncall", acknowledged.getAcknowledgedBy());
        assertEquals(NOW + 5_000, acknowledged.getAcknowledgedAt());
        assertEquals(AlertState.ACKNOWLEDGED, transitions.get(1).getTo());

        // acknowledging twice is a no-op
        Alert again = alertManager.acknowledge(alertId, "someone-else").block();
        assertEquals("oncall", again.getAcknowledgedBy());
        assertEquals(2, transitions.size());

        // an acknowledged alert still resolves on recovery
        stubLatencyP95(900);
        alertManager.evaluateRule(p95Rule()).block();
        assertEquals(AlertState.ACKNOWLEDGED, transitions.get(2).getFrom());
        assertEquals(AlertState.RESOLVED, transitions.get(2).getTo());
    }

    @Test
    void testAcknowledgeResolvedOrMissingAlert() {
        // Given
        Alert resolved = Alert.builder().id("old").ruleId("rule-1").state(AlertState.RESOLVED).build();
        when(alertRepository.findById("old")).thenReturn(Mono.just(resolved));
        when(alertRepository.findById("missing")).thenReturn(Mono.empty());

        // When / Then
        StepVerifier.create(alertManager.acknowledge("old", "oncall"))
                .expectError(IllegalStateException.class)
                .verify();
        StepVerifier.create(alertManager.acknowledge("missing", "oncall"))
                .expectError(ResourceNotFoundException.class)
                .verify();
    }

    @Test
    void testSaveRuleValidatesAndNormalises() {
        // Given
        AlertRule rule = AlertRule.builder()
                .name("Error rate")
                .metric(" ERROR_RATE ")
                .operator("greater_than")
                .threshold(0.05)
                .build();

        // When
        AlertRule saved = alertManager.saveRule(rule).block();

        // Then
        assertNotNull(saved.getId());
        assertEquals("error_rate", saved.getMetric());
        assertEquals(">", saved.getOperator());
        assertEquals(NOW, saved.getCreatedAt());
        assertTrue(saved.isValid());

        StepVerifier.create(alertManager.saveRule(rule.toBuilder().id(null).operator("~").build()))
                .expectError(InvalidAlertRuleException.class)
                .verify();
        StepVerifier.create(alertManager.saveRule(rule.toBuilder().id(null).durationSeconds(-1).build()))
                .expectError(InvalidAlertRuleException.class)
                .verify();
    }

    @Test
    void testDisablingRuleResolvesOpenAlert() {
        // Given
        AlertRule rule = p95Rule();
        stubLatencyP95(2500);
        alertManager.evaluateRule(rule).block();
        when(alertRuleRepository.findById("rule-1")).thenReturn(Mono.just(rule));

        // When
        AlertRule toggled = alertManager.toggleRule("rule-1", false).block();

        // Then
        assertFalse(toggled.isEnabled());
        assertTrue(alertManager.getActiveAlerts(null).collectList().block().isEmpty());
        assertEquals(AlertState.RESOLVED, transitions.get(transitions.size() - 1).getTo());
    }

    @Test
    void testEvaluateMissingRule() {
        when(alertRuleRepository.findById("nope")).thenReturn(Mono.empty());

        StepVerifier.create(alertManager.evaluateRuleById("nope"))
                .expectError(ResourceNotFoundException.class)
                .verify();
    }

    @Test
    void testAlertStatsCountEveryStateAndSeverity() {
        // Given
        when(alertRepository.findStartedSince(NOW - 86_400_000)).thenReturn(Flux.just(
                Alert.builder().id("a").ruleId("r1").state(AlertState.RESOLVED).severity(AlertSeverity.WARNING).build(),
                Alert.builder().id("b").ruleId("r2").state(AlertState.FIRING).severity(AlertSeverity.CRITICAL).build()));

        // When / Then
        StepVerifier.create(alertManager.getAlertStats())
                .assertNext(stats -> {
                    assertEquals(2, stats.getTotal());
                    assertEquals(1L, stats.getByState().get(AlertState.RESOLVED));
                    assertEquals(0L, stats.getByState().get(AlertState.ACKNOWLEDGED));
                    assertEquals(1L, stats.getBySeverity().get(AlertSeverity.CRITICAL));
                    assertEquals(0L, stats.getBySeverity().get(AlertSeverity.INFO));
                })
                .verifyComplete();
    }
}
