package service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.lite.dispatch.context.DispatchContext;
import org.lite.dispatch.controller.DispatchExceptionHandler;
import org.lite.dispatch.controller.MetricsController;
import org.lite.dispatch.entity.MetricEvent;
import org.lite.dispatch.enums.CacheEventType;
import org.lite.dispatch.enums.MetricKind;
import org.lite.dispatch.enums.MetricName;
import org.lite.dispatch.model.AggregatedMetrics;
import org.lite.dispatch.model.MetricFilter;
import org.lite.dispatch.service.AlertManager;
import org.lite.dispatch.service.MetricsStore;
import org.lite.dispatch.service.RateLimiterService;
import org.lite.dispatch.service.RouterService;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MetricsControllerTest {

    private static final long NOW = 1_700_000_000_000L;

    @Mock
    private RouterService router;

    @Mock
    private RateLimiterService rateLimiter;

    @Mock
    private MetricsStore metricsStore;

    @Mock
    private AlertManager alertManager;

    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        DispatchContext context = new DispatchContext(router, rateLimiter, metricsStore, alertManager);
        webTestClient = WebTestClient.bindToController(new MetricsController(context, new MutableClock(NOW)))
                .controllerAdvice(new DispatchExceptionHandler())
                .build();
    }

    @Test
    void testAggregateDefaultsToLastHour() {
        // Given
        when(metricsStore.getAggregated(eq(MetricName.LATENCY), eq(NOW - 3_600_000), eq(NOW), any(MetricFilter.class)))
                .thenReturn(AggregatedMetrics.builder().count(4).avg(300).p95(480).build());

        // When / Then
        webTestClient.get().uri("/api/metrics/aggregate?metric=latency&provider=openai")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.count").isEqualTo(4)
                .jsonPath("$.p95").isEqualTo(480.0);

        ArgumentCaptor<MetricFilter> filter = ArgumentCaptor.forClass(MetricFilter.class);
        verify(metricsStore).getAggregated(eq(MetricName.LATENCY), eq(NOW - 3_600_000), eq(NOW), filter.capture());
        assertEquals("openai", filter.getValue().getProvider());
    }

    @Test
    void testUnknownMetricIsBadRequest() {
        webTestClient.get().uri("/api/metrics/aggregate?metric=throughput")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("VALIDATION_ERROR");
        verifyNoInteractions(metricsStore);
    }

    @Test
    void testInvertedRangeIsBadRequest() {
        webTestClient.get().uri("/api/metrics/timeseries?metric=cost&start=2000&end=1000")
                .exchange()
                .expectStatus().isBadRequest();
        verifyNoInteractions(metricsStore);
    }

    @Test
    void testCacheEventIsRecorded() {
        // When
        webTestClient.post().uri("/api/metrics/cache-events")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("type", "HIT", "cacheKey", "prompt-hash", "provider", "openai",
                        "savedCost", 0.002, "savedTokens", 1500))
                .exchange()
                .expectStatus().isAccepted();

        // Then
        ArgumentCaptor<MetricEvent> recorded = ArgumentCaptor.forClass(MetricEvent.class);
        verify(metricsStore).record(recorded.capture());
        MetricEvent event = recorded.getValue();
        assertEquals(MetricKind.CACHE, event.getKind());
        assertEquals(NOW, event.getTimestamp());
        assertEquals(CacheEventType.HIT, event.getCache().getType());
        assertEquals(1.0, event.valueOf(MetricName.CACHE_HIT).getAsDouble());
    }
}
