package org.lite.dispatch.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.dispatch.config.DispatchProperties;
import org.lite.dispatch.context.DispatchContext;
import org.lite.dispatch.dto.DispatchStatus;
import org.lite.dispatch.dto.ErrorCode;
import org.lite.dispatch.dto.ErrorResponse;
import org.lite.dispatch.dto.OutcomeRequest;
import org.lite.dispatch.model.ProviderCandidate;
import org.lite.dispatch.model.ProviderHealth;
import org.lite.dispatch.model.ProviderMetricsSnapshot;
import org.lite.dispatch.model.RoutingDecision;
import org.lite.dispatch.model.RoutingRequest;
import org.lite.dispatch.service.AlertEventPublisher;
import org.lite.dispatch.service.ProviderRegistry;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;

/**
 * Routing decisions and outcome reports for LLM calls dispatched by the caller.
 */
@RestController
@RequestMapping("/api/dispatch")
@RequiredArgsConstructor
@Slf4j
public class DispatchController {

    private final DispatchContext dispatchContext;
    private final ProviderRegistry providerRegistry;
    private final AlertEventPublisher alertEventPublisher;
    private final DispatchProperties properties;

    /**
     * Selects a provider and model. Answers 422 when no registered candidate passes the filters.
     */
    @PostMapping("/route")
    public Mono<RoutingDecision> route(@RequestBody RoutingRequest request) {
        // snapshot loads may hit the metrics store on a cold cache
        return Mono.fromCallable(() -> dispatchContext.getRouter().selectProvider(request))
            .subscribeOn(Schedulers.boundedElastic())
            .doOnSuccess(decision -> log.debug("Routed user {} to {}/{} ({})", request.getUserId(),
                decision.getProviderId(), decision.getModelId(), decision.getReason()));
    }

    @PostMapping("/outcome")
    public Mono<ResponseEntity<?>> reportOutcome(@Valid @RequestBody OutcomeRequest request) {
        return Mono.fromCallable(() -> dispatchContext.getRouter().reportOutcome(request.getDecisionId(),
                request.getStatus(), request.getLatencyMs(), request.getInputTokens(), request.getOutputTokens(),
                request.getCost()))
            .map(recorded -> {
                if (recorded) {
                    return (ResponseEntity<?>) ResponseEntity.accepted().body(Map.of("decisionId", request.getDecisionId()));
                }
                return (ResponseEntity<?>) ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(ErrorResponse.fromErrorCode(ErrorCode.CONFLICT,
                        "Decision is unknown, expired or already reported: " + request.getDecisionId(),
                        HttpStatus.CONFLICT.value()));
            });
    }

    @GetMapping("/providers")
    public Mono<List<ProviderCandidate>> getCandidates() {
        return Mono.just(dispatchContext.getRouter().getCandidates());
    }

    @GetMapping("/providers/snapshots")
    public Mono<Map<String, ProviderMetricsSnapshot>> getSnapshots() {
        return Mono.fromCallable(() -> dispatchContext.getRouter().getProviderSnapshots())
            .subscribeOn(Schedulers.boundedElastic());
    }

    @GetMapping("/providers/health")
    public Mono<Map<String, ProviderHealth>> getProviderHealth() {
        return Mono.fromCallable(() -> dispatchContext.getMetricsStore().getProviderHealth());
    }

    /**
     * Re-reads the provider list from configuration. Invalid entries are skipped and reported.
     */
    @PostMapping("/providers/reload")
    public Mono<Map<String, Object>> reloadProviders() {
        return Mono.fromCallable(() -> {
            List<String> errors = dispatchContext.getRouter().reloadRegistry();
            log.info("Provider registry reloaded with {} candidates and {} errors",
                providerRegistry.getCandidates().size(), errors.size());
            return Map.<String, Object>of(
                "candidates", providerRegistry.getCandidates().size(),
                "errors", errors);
        });
    }

    @GetMapping("/status")
    public Mono<DispatchStatus> getStatus() {
        return Mono.fromCallable(() -> DispatchStatus.builder()
            .instanceId(properties.getInstanceId())
            .registeredCandidates(providerRegistry.getCandidates().size())
            .registryErrors(providerRegistry.getLoadErrors())
            .bufferedMetrics(dispatchContext.getMetricsStore().getBufferedCount())
            .droppedMetrics(dispatchContext.getMetricsStore().getDroppedMetricsCount())
            .alertSequence(alertEventPublisher.currentSequence())
            .build());
    }
}
