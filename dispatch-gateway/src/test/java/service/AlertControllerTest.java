package service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.lite.dispatch.config.DispatchProperties;
import org.lite.dispatch.context.DispatchContext;
import org.lite.dispatch.controller.AlertController;
import org.lite.dispatch.controller.DispatchExceptionHandler;
import org.lite.dispatch.entity.Alert;
import org.lite.dispatch.entity.AlertRule;
import org.lite.dispatch.enums.AlertSeverity;
import org.lite.dispatch.enums.AlertState;
import org.lite.dispatch.exception.InvalidAlertRuleException;
import org.lite.dispatch.service.AlertEventPublisher;
import org.lite.dispatch.service.AlertManager;
import org.lite.dispatch.service.MetricsStore;
import org.lite.dispatch.service.RateLimiterService;
import org.lite.dispatch.service.RouterService;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.test.web.reactive.server.FluxExchangeResult;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AlertControllerTest {

    @Mock
    private RouterService router;

    @Mock
    private RateLimiterService rateLimiter;

    @Mock
    private MetricsStore metricsStore;

    @Mock
    private AlertManager alertManager;

    @Mock
    private ApplicationEventPublisher applicationEventPublisher;

    private AlertEventPublisher alertEventPublisher;
    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        DispatchContext context = new DispatchContext(router, rateLimiter, metricsStore, alertManager);
        alertEventPublisher = new AlertEventPublisher(applicationEventPublisher, new DispatchProperties(),
                new MutableClock(1_700_000_000_000L));
        webTestClient = WebTestClient.bindToController(new AlertController(context, alertEventPublisher))
                .controllerAdvice(new DispatchExceptionHandler())
                .build();
    }

    @Test
    void testCreateRuleIgnoresClientId() {
        // Given
        when(alertManager.saveRule(any(AlertRule.class)))
                .thenAnswer(invocation -> {
                    AlertRule rule = invocation.getArgument(0);
                    return Mono.just(rule.toBuilder().id("generated").build());
                });

        // When / Then
        webTestClient.post().uri("/api/alerts/rules")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("id", "client-chosen", "name", "High p95", "metric", "p95_latency",
                        "operator", ">", "threshold", 2000, "durationSeconds", 300, "severity", "CRITICAL"))
                .exchange()
                .expectStatus().isCreated()
                .expectBody()
                .jsonPath("$.id").isEqualTo("generated")
                .jsonPath("$.severity").isEqualTo("CRITICAL");

        ArgumentCaptor<AlertRule> submitted = ArgumentCaptor.forClass(AlertRule.class);
        verify(alertManager).saveRule(submitted.capture());
        assertNull(submitted.getValue().getId());
        assertEquals(300, submitted.getValue().getDurationSeconds());
    }

    @Test
    void testInvalidRuleIsBadRequest() {
        // Given
        when(alertManager.saveRule(any(AlertRule.class)))
                .thenReturn(Mono.error(new InvalidAlertRuleException("Broken", "unknown operator '~'")));

        // When / Then
        webTestClient.post().uri("/api/alerts/rules")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("name", "Broken", "metric", "p95_latency", "operator", "~", "threshold", 1))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("INVALID_ALERT_RULE");
    }

    @Test
    void testAcknowledgeResolvedAlertConflicts() {
        // Given
        when(alertManager.acknowledge("a-1", "oncall"))
                .thenReturn(Mono.error(new IllegalStateException("Alert a-1 is RESOLVED and cannot be acknowledged")));

        // When / Then
        webTestClient.post().uri("/api/alerts/a-1/acknowledge")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("acknowledgedBy", "oncall"))
                .exchange()
                .expectStatus().isEqualTo(HttpStatus.CONFLICT)
                .expectBody()
                .jsonPath("$.code").isEqualTo("CONFLICT");
    }

    @Test
    void testFeedResumesAfterLastEventId() {
        // Given
        Alert alert = Alert.builder().id("a-1").ruleId("rule-1").ruleName("High p95")
                .state(AlertState.FIRING).severity(AlertSeverity.CRITICAL).build();
        alertEventPublisher.publish(alert, null, AlertState.FIRING);
        alertEventPublisher.publish(alert.toBuilder().state(AlertState.RESOLVED).build(),
                AlertState.FIRING, AlertState.RESOLVED);

        // When
        FluxExchangeResult<ServerSentEvent<Map<String, Object>>> result = webTestClient.get()
                .uri("/api/alerts/feed")
                .accept(MediaType.TEXT_EVENT_STREAM)
                .header("Last-Event-ID", "1")
                .exchange()
                .expectStatus().isOk()
                .returnResult(new ParameterizedTypeReference<ServerSentEvent<Map<String, Object>>>() {
                });

        // Then
        StepVerifier.create(result.getResponseBody())
                .assertNext(event -> {
                    assertEquals("2", event.id());
                    assertEquals("alert.resolved", event.event());
                    assertEquals("FIRING", event.data().get("from"));
                })
                .thenCancel()
                .verify();
    }
}
