package org.lite.dispatch.service;

import org.lite.dispatch.entity.Alert;
import org.lite.dispatch.entity.AlertRule;
import org.lite.dispatch.enums.AlertSeverity;
import org.lite.dispatch.enums.AlertState;
import org.lite.dispatch.model.AlertEvaluation;
import org.lite.dispatch.model.AlertStats;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Threshold rules over the metrics store, with at most one open alert per rule.
 */
public interface AlertManager {

    Mono<AlertEvaluation> evaluateRule(AlertRule rule);

    Mono<AlertEvaluation> evaluateRuleById(String ruleId);

    /**
     * Evaluates every enabled rule. A failing rule does not stop the others.
     */
    Mono<List<AlertEvaluation>> evaluateAllRules();

    Mono<AlertRule> saveRule(AlertRule rule);

    Mono<AlertRule> getRule(String ruleId);

    Flux<AlertRule> getAllRules();

    Mono<Void> deleteRule(String ruleId);

    Mono<AlertRule> toggleRule(String ruleId, boolean enabled);

    Mono<Alert> acknowledge(String alertId, String acknowledgedBy);

    Flux<Alert> getActiveAlerts(AlertSeverity severity);

    Flux<Alert> getAlerts(AlertState state, AlertSeverity severity, String ruleId, int limit);

    Mono<Alert> getAlert(String alertId);

    Mono<AlertStats> getAlertStats();
}
