package org.lite.dispatch.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.dispatch.context.DispatchContext;
import org.lite.dispatch.dto.AcknowledgeRequest;
import org.lite.dispatch.dto.ToggleRuleRequest;
import org.lite.dispatch.entity.Alert;
import org.lite.dispatch.entity.AlertRule;
import org.lite.dispatch.enums.AlertSeverity;
import org.lite.dispatch.enums.AlertState;
import org.lite.dispatch.event.AlertTransitionEvent;
import org.lite.dispatch.model.AlertEvaluation;
import org.lite.dispatch.model.AlertStats;
import org.lite.dispatch.service.AlertEventPublisher;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/alerts")
@RequiredArgsConstructor
@Slf4j
public class AlertController {

    private final DispatchContext dispatchContext;
    private final AlertEventPublisher alertEventPublisher;

    @GetMapping("/rules")
    public Flux<AlertRule> getRules() {
        return dispatchContext.getAlertManager().getAllRules();
    }

    @GetMapping("/rules/{ruleId}")
    public Mono<AlertRule> getRule(@PathVariable String ruleId) {
        return dispatchContext.getAlertManager().getRule(ruleId);
    }

    @PostMapping("/rules")
    public Mono<ResponseEntity<AlertRule>> createRule(@RequestBody AlertRule rule) {
        rule.setId(null);
        return dispatchContext.getAlertManager().saveRule(rule)
            .map(saved -> ResponseEntity.status(HttpStatus.CREATED).body(saved));
    }

    @PutMapping("/rules/{ruleId}")
    public Mono<AlertRule> updateRule(@PathVariable String ruleId, @RequestBody AlertRule rule) {
        return dispatchContext.getAlertManager().getRule(ruleId)
            .flatMap(existing -> {
                rule.setId(ruleId);
                rule.setCreatedAt(existing.getCreatedAt());
                return dispatchContext.getAlertManager().saveRule(rule);
            });
    }

    @DeleteMapping("/rules/{ruleId}")
    public Mono<ResponseEntity<Void>> deleteRule(@PathVariable String ruleId) {
        return dispatchContext.getAlertManager().deleteRule(ruleId)
            .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    @PatchMapping("/rules/{ruleId}/enabled")
    public Mono<AlertRule> toggleRule(@PathVariable String ruleId, @RequestBody ToggleRuleRequest request) {
        return dispatchContext.getAlertManager().toggleRule(ruleId, request.isEnabled());
    }

    @PostMapping("/rules/{ruleId}/evaluate")
    public Mono<AlertEvaluation> evaluateRule(@PathVariable String ruleId) {
        return dispatchContext.getAlertManager().evaluateRuleById(ruleId);
    }

    @PostMapping("/evaluate")
    public Mono<List<AlertEvaluation>> evaluateAll() {
        return dispatchContext.getAlertManager().evaluateAllRules();
    }

    /**
     * Alert history, newest first. {@code active=true} answers from the open alerts only.
     */
    @GetMapping
    public Flux<Alert> getAlerts(
        @RequestParam(required = false) AlertState state,
        @RequestParam(required = false) AlertSeverity severity,
        @RequestParam(required = false) String ruleId,
        @RequestParam(defaultValue = "false") boolean active,
        @RequestParam(defaultValue = "100") int limit
    ) {
        if (active) {
            return dispatchContext.getAlertManager().getActiveAlerts(severity).take(Math.max(0, limit));
        }
        return dispatchContext.getAlertManager().getAlerts(state, severity, ruleId, limit);
    }

    @GetMapping("/stats")
    public Mono<AlertStats> getStats() {
        return dispatchContext.getAlertManager().getAlertStats();
    }

    @GetMapping("/{alertId}")
    public Mono<Alert> getAlert(@PathVariable String alertId) {
        return dispatchContext.getAlertManager().getAlert(alertId);
    }

    @PostMapping("/{alertId}/acknowledge")
    public Mono<Alert> acknowledge(@PathVariable String alertId, @Valid @RequestBody AcknowledgeRequest request) {
        return dispatchContext.getAlertManager().acknowledge(alertId, request.getAcknowledgedBy())
            .doOnSuccess(alert -> log.info("Alert {} acknowledged by {}", alertId, request.getAcknowledgedBy()));
    }

    /**
     * Live alert transitions. A client reconnecting with {@code Last-Event-ID} (or {@code after})
     * receives the transitions it missed that are still in the replay history.
     */
    @GetMapping(value = "/feed", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<AlertTransitionEvent>> feed(
        @RequestHeader(value = "Last-Event-ID", required = false) Long lastEventId,
        @RequestParam(required = false) Long after
    ) {
        long from = lastEventId != null ? lastEventId : after != null ? after : 0L;
        log.info("Alert feed subscriber connected after sequence {}", from);
        return alertEventPublisher.subscribe(from)
            .map(event -> ServerSentEvent.<AlertTransitionEvent>builder()
                .id(String.valueOf(event.getSequence()))
                .event("alert." + event.getTo().name().toLowerCase())
                .data(event)
                .build())
            .doOnCancel(() -> log.debug("Alert feed subscriber disconnected"));
    }
}
