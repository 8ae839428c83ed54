package org.lite.dispatch.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.lite.dispatch.entity.Alert;
import org.lite.dispatch.entity.AlertRule;
import org.lite.dispatch.enums.AlertMetric;
import org.lite.dispatch.enums.AlertOperator;
import org.lite.dispatch.enums.AlertSeverity;
import org.lite.dispatch.enums.AlertState;
import org.lite.dispatch.config.DispatchProperties;
import org.lite.dispatch.exception.InvalidAlertRuleException;
import org.lite.dispatch.exception.ResourceNotFoundException;
import org.lite.dispatch.model.AggregatedMetrics;
import org.lite.dispatch.model.AlertEvaluation;
import org.lite.dispatch.model.AlertStats;
import org.lite.dispatch.model.MetricFilter;
import org.lite.dispatch.repository.AlertRepository;
import org.lite.dispatch.repository.AlertRuleRepository;
import org.lite.dispatch.service.AlertEventPublisher;
import org.lite.dispatch.service.AlertManager;
import org.lite.dispatch.service.MetricsStore;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

@Service
@Slf4j
public class AlertManagerImpl implements AlertManager {

    private static final long LATEST_MINUTE_MS = 60_000;

    private final AlertRuleRepository alertRuleRepository;
    private final AlertRepository alertRepository;
    private final MetricsStore metricsStore;
    private final AlertEventPublisher alertEventPublisher;
    private final DispatchProperties.Alerts config;
    private final Clock clock;

    // open (firing or acknowledged) alert per rule id
    private final ConcurrentHashMap<String, Alert> openAlerts = new ConcurrentHashMap<>();
    // last pending transition write per rule id; a rule's writes run in the order its transitions happened
    private final ConcurrentHashMap<String, Mono<Void>> pendingWrites = new ConcurrentHashMap<>();

    public AlertManagerImpl(AlertRuleRepository alertRuleRepository,
                            AlertRepository alertRepository,
                            MetricsStore metricsStore,
                            AlertEventPublisher alertEventPublisher,
                            DispatchProperties properties,
                            Clock clock) {
        this.alertRuleRepository = alertRuleRepository;
        this.alertRepository = alertRepository;
        this.metricsStore = metricsStore;
        this.alertEventPublisher = alertEventPublisher;
        this.config = properties.getAlerts();
        this.clock = clock;
    }

    private record Transition(Alert alert, AlertState from, AlertState to) {
    }

    @EventListener(ApplicationReadyEvent.class)
    public void loadOpenAlerts() {
        alertRepository.findByStateIn(List.of(AlertState.FIRING, AlertState.ACKNOWLEDGED))
                .sort(Comparator.comparingLong(Alert::getStartedAt))
                .doOnNext(alert -> openAlerts.merge(alert.getRuleId(), alert,
                        (older, newer) -> newer.getStartedAt() >= older.getStartedAt() ? newer : older))
                .count()
                .doOnSuccess(count -> log.info("Restored {} open alerts", openAlerts.size()))
                .doOnError(e -> log.error("Failed to restore open alerts: {}", e.getMessage()))
                .onErrorResume(e -> Mono.empty())
                .subscribe();
    }

    @Override
    public Mono<AlertEvaluation> evaluateRule(AlertRule rule) {
        return Mono.defer(() -> {
            String error = validate(rule);
            if (error != null) {
                log.warn("Skipping invalid alert rule '{}' ({}): {}", rule.getName(), rule.getId(), error);
                return markInvalid(rule, error).thenReturn(AlertEvaluation.builder()
                        .ruleId(rule.getId())
                        .triggered(false)
                        .currentValue(Double.NaN)
                        .message("Rule is invalid: " + error)
                        .build());
            }
            AlertMetric metric = AlertMetric.fromKey(rule.getMetric()).orElseThrow();
            AlertOperator operator = AlertOperator.fromSymbol(rule.getOperator()).orElseThrow();
            long now = clock.millis();
            long window = rule.getDurationSeconds() > 0 ? rule.getDurationSeconds() * 1000 : LATEST_MINUTE_MS;
            AggregatedMetrics aggregated = metricsStore.getAggregated(metric.dimension(), now - window, now,
                    MetricFilter.of(rule.getProvider(), rule.getModel()));
            double value = metric.extract(aggregated);

            // without samples only request_count is meaningful; other metrics leave the state unchanged
            if (aggregated.getCount() == 0 && metric != AlertMetric.REQUEST_COUNT) {
                Alert open = openAlerts.get(rule.getId());
                return Mono.just(AlertEvaluation.builder()
                        .ruleId(rule.getId())
                        .triggered(false)
                        .currentValue(value)
                        .message(String.format("No %s data in the last %ds", metric.key(), window / 1000))
                        .alertId(open == null ? null : open.getId())
                        .build());
            }

            boolean triggered = operator.test(value, rule.getThreshold());
            String message = String.format("%s is %.4f (%s %s %.4f over %ds)", metric.key(), value,
                    triggered ? "breaches" : "within", operator.symbol(), rule.getThreshold(), window / 1000);
            Mono<Void> write = applyEvaluation(rule, triggered, value, message, now);
            Alert open = openAlerts.get(rule.getId());
            AlertEvaluation evaluation = AlertEvaluation.builder()
                    .ruleId(rule.getId())
                    .triggered(triggered)
                    .currentValue(value)
                    .message(message)
                    .alertId(open == null ? null : open.getId())
                    .build();
            return write.thenReturn(evaluation);
        });
    }

    /**
     * Creates or resolves the rule's alert atomically with respect to other evaluations of the same rule.
     */
    private Mono<Void> applyEvaluation(AlertRule rule, boolean triggered, double value, String message, long now) {
        List<Mono<Void>> write = new ArrayList<>(1);
        openAlerts.compute(rule.getId(), (ruleId, open) -> {
            if (triggered) {
                if (open == null) {
                    Alert created = Alert.fromRule(rule, UUID.randomUUID().toString(), value, message, now);
                    write.add(enqueue(new Transition(created, null, AlertState.FIRING)));
                    return created;
                }
                return open.toBuilder().currentValue(value).message(message).updatedAt(now).build();
            }
            if (open != null) {
                Alert resolved = open.toBuilder()
                        .state(AlertState.RESOLVED)
                        .resolvedAt(now)
                        .currentValue(value)
                        .message(message)
                        .updatedAt(now)
                        .build();
                write.add(enqueue(new Transition(resolved, open.getState(), AlertState.RESOLVED)));
                return null;
            }
            return null;
        });
        return write.isEmpty() ? Mono.empty() : write.get(0);
    }

    /**
     * Appends the transition's write to its rule's chain. Called inside the {@code openAlerts} update
     * that produced the transition, so the chain order is the transition order.
     */
    private Mono<Void> enqueue(Transition transition) {
        String ruleId = transition.alert().getRuleId();
        List<Mono<Void>> self = new ArrayList<>(1);
        return pendingWrites.compute(ruleId, (id, previous) -> {
            Mono<Void> after = previous == null ? Mono.empty() : previous.onErrorResume(e -> Mono.empty());
            Mono<Void> write = after
                    .then(persistAndPublish(transition))
                    .doFinally(signal -> pendingWrites.remove(id, self.get(0)))
                    .cache();
            self.add(write);
            return write;
        });
    }

    private Mono<Void> persistAndPublish(Transition transition) {
        return Mono.defer(() -> alertRepository.save(transition.alert()))
                .doOnError(e -> log.error("Failed to persist alert {} ({}): {}", transition.alert().getId(),
                        transition.to(), e.getMessage()))
                .onErrorResume(e -> Mono.empty())
                .then(Mono.fromRunnable(() ->
                        alertEventPublisher.publish(transition.alert(), transition.from(), transition.to())));
    }

    private Mono<Void> markInvalid(AlertRule rule, String error) {
        if (!rule.isValid() && error.equals(rule.getValidationError())) {
            return Mono.empty();
        }
        rule.setValid(false);
        rule.setValidationError(error);
        rule.setUpdatedAt(clock.millis());
        if (rule.getId() == null) {
            return Mono.empty();
        }
        return alertRuleRepository.save(rule)
                .doOnError(e -> log.error("Failed to mark rule {} invalid: {}", rule.getId(), e.getMessage()))
                .onErrorResume(e -> Mono.empty())
                .then();
    }

    @Override
    public Mono<AlertEvaluation> evaluateRuleById(String ruleId) {
        return alertRuleRepository.findById(ruleId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Alert rule", ruleId)))
                .flatMap(this::evaluateRule);
    }

    @Override
    public Mono<List<AlertEvaluation>> evaluateAllRules() {
        return alertRuleRepository.findByEnabledTrue()
                .concatMap(rule -> evaluateRule(rule)
                        .onErrorResume(e -> {
                            log.error("Evaluation of alert rule '{}' failed: {}", rule.getName(), e.getMessage());
                            return Mono.empty();
                        }))
                .collectList()
                .doOnSuccess(results -> log.debug("Evaluated {} alert rules, {} triggered", results.size(),
                        results.stream().filter(AlertEvaluation::isTriggered).count()));
    }

    @Override
    public Mono<AlertRule> saveRule(AlertRule rule) {
        return Mono.defer(() -> {
            String error = validate(rule);
            if (error != null) {
                return Mono.error(new InvalidAlertRuleException(rule.getName(), error));
            }
            long now = clock.millis();
            if (rule.getId() == null) {
                rule.setId(UUID.randomUUID().toString());
                rule.setCreatedAt(now);
            }
            rule.setUpdatedAt(now);
            rule.setValid(true);
            rule.setValidationError(null);
            // normalise so stored rules always carry the canonical names
            rule.setMetric(AlertMetric.fromKey(rule.getMetric()).orElseThrow().key());
            rule.setOperator(AlertOperator.fromSymbol(rule.getOperator()).orElseThrow().symbol());
            return alertRuleRepository.save(rule)
                    .flatMap(saved -> saved.isEnabled() ? Mono.just(saved) : resolveOpen(saved.getId()).thenReturn(saved))
                    .doOnSuccess(saved -> log.info("Saved alert rule '{}' ({} {} {})", saved.getName(),
                            saved.getMetric(), saved.getOperator(), saved.getThreshold()));
        });
    }

    @Override
    public Mono<AlertRule> getRule(String ruleId) {
        return alertRuleRepository.findById(ruleId)
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Alert rule", ruleId)));
    }

    @Override
    public Flux<AlertRule> getAllRules() {
        return alertRuleRepository.findAll(Sort.by(Sort.Direction.ASC, "name"));
    }

    @Override
    public Mono<Void> deleteRule(String ruleId) {
        return getRule(ruleId)
                .flatMap(rule -> alertRuleRepository.deleteById(ruleId))
                .then(resolveOpen(ruleId))
                .doOnSuccess(v -> log.info("Deleted alert rule {}", ruleId));
    }

    @Override
    public Mono<AlertRule> toggleRule(String ruleId, boolean enabled) {
        return getRule(ruleId)
                .flatMap(rule -> {
                    rule.setEnabled(enabled);
                    rule.setUpdatedAt(clock.millis());
                    return alertRuleRepository.save(rule);
                })
                .flatMap(saved -> enabled ? Mono.just(saved) : resolveOpen(ruleId).thenReturn(saved))
                .doOnSuccess(saved -> log.info("Alert rule '{}' {}", saved.getName(), enabled ? "enabled" : "disabled"));
    }

    private Mono<Void> resolveOpen(String ruleId) {
        return Mono.defer(() -> {
            long now = clock.millis();
            List<Mono<Void>> write = new ArrayList<>(1);
            openAlerts.computeIfPresent(ruleId, (id, open) -> {
                Alert resolved = open.toBuilder()
                        .state(AlertState.RESOLVED)
                        .resolvedAt(now)
                        .message("Rule removed or disabled")
                        .updatedAt(now)
                        .build();
                write.add(enqueue(new Transition(resolved, open.getState(), AlertState.RESOLVED)));
                return null;
            });
            return write.isEmpty() ? Mono.<Void>empty() : write.get(0);
        });
    }

    @Override
    public Mono<Alert> acknowledge(String alertId, String acknowledgedBy) {
        return Mono.defer(() -> {
            Optional<Alert> open = openAlerts.values().stream().filter(a -> a.getId().equals(alertId)).findFirst();
            if (open.isEmpty()) {
                return alertRepository.findById(alertId)
                        .switchIfEmpty(Mono.error(new ResourceNotFoundException("Alert", alertId)))
                        .flatMap(stored -> Mono.error(new IllegalStateException(
                                String.format("Alert %s is %s and cannot be acknowledged", alertId, stored.getState()))));
            }
            long now = clock.millis();
            Transition[] transition = new Transition[1];
            List<Mono<Void>> write = new ArrayList<>(1);
            Alert current = openAlerts.computeIfPresent(open.get().getRuleId(), (ruleId, alert) -> {
                if (!alert.getId().equals(alertId) || alert.getState() != AlertState.FIRING) {
                    return alert;
                }
                Alert acknowledged = alert.toBuilder()
                        .state(AlertState.ACKNOWLEDGED)
                        .acknowledgedAt(now)
                        .acknowledgedBy(acknowledgedBy)
                        .updatedAt(now)
                        .build();
                transition[0] = new Transition(acknowledged, AlertState.FIRING, AlertState.ACKNOWLEDGED);
                write.add(enqueue(transition[0]));
                return acknowledged;
            });
            if (transition[0] != null) {
                return write.get(0).thenReturn(transition[0].alert());
            }
            if (current != null && current.getId().equals(alertId)) {
                return Mono.just(current);
            }
            // resolved between the lookup and the update
            return Mono.error(new IllegalStateException(
                    String.format("Alert %s is resolved and cannot be acknowledged", alertId)));
        });
    }

    @Override
    public Flux<Alert> getActiveAlerts(AlertSeverity severity) {
        return Flux.fromIterable(openAlerts.values())
                .filter(alert -> severity == null || alert.getSeverity() == severity)
                .sort(Comparator.comparingLong(Alert::getStartedAt).reversed());
    }

    @Override
    public Flux<Alert> getAlerts(AlertState state, AlertSeverity severity, String ruleId, int limit) {
        Flux<Alert> source = ruleId != null
                ? alertRepository.findByRuleIdOrderByStartedAtDesc(ruleId)
                : alertRepository.findAll(Sort.by(Sort.Direction.DESC, "startedAt"));
        return source
                .map(this::withOpenState)
                .filter(alert -> state == null || alert.getState() == state)
                .filter(alert -> severity == null || alert.getSeverity() == severity)
                .take(Math.max(0, limit));
    }

    @Override
    public Mono<Alert> getAlert(String alertId) {
        return Flux.fromIterable(openAlerts.values())
                .filter(alert -> alert.getId().equals(alertId))
                .next()
                .switchIfEmpty(alertRepository.findById(alertId))
                .switchIfEmpty(Mono.error(new ResourceNotFoundException("Alert", alertId)));
    }

    @Override
    public Mono<AlertStats> getAlertStats() {
        long since = clock.millis() - config.getStatsWindowMs();
        return alertRepository.findStartedSince(since)
                .map(this::withOpenState)
                .collectList()
                .map(alerts -> {
                    Map<AlertState, Long> byState = new EnumMap<>(AlertState.class);
                    Map<AlertSeverity, Long> bySeverity = new EnumMap<>(AlertSeverity.class);
                    for (AlertState s : AlertState.values()) {
                        byState.put(s, 0L);
                    }
                    for (AlertSeverity s : AlertSeverity.values()) {
                        bySeverity.put(s, 0L);
                    }
                    for (Alert alert : alerts) {
                        byState.merge(alert.getState(), 1L, Long::sum);
                        if (alert.getSeverity() != null) {
                            bySeverity.merge(alert.getSeverity(), 1L, Long::sum);
                        }
                    }
                    return AlertStats.builder()
                            .total(alerts.size())
                            .byState(byState)
                            .bySeverity(bySeverity)
                            .since(since)
                            .build();
                });
    }

    // in-memory copy is authoritative for open alerts
    private Alert withOpenState(Alert stored) {
        Alert open = openAlerts.get(stored.getRuleId());
        return open != null && open.getId().equals(stored.getId()) ? open : stored;
    }

    static String validate(AlertRule rule) {
        if (rule == null) {
            return "rule is missing";
        }
        if (rule.getName() == null || rule.getName().isBlank()) {
            return "name is required";
        }
        if (AlertMetric.fromKey(rule.getMetric()).isEmpty()) {
            return String.format("unknown metric '%s'", rule.getMetric());
        }
        if (AlertOperator.fromSymbol(rule.getOperator()).isEmpty()) {
            return String.format("unknown operator '%s'", rule.getOperator());
        }
        if (rule.getDurationSeconds() < 0) {
            return "durationSeconds must not be negative";
        }
        if (Double.isNaN(rule.getThreshold()) || Double.isInfinite(rule.getThreshold())) {
            return "threshold must be a finite number";
        }
        if (rule.getSeverity() == null) {
            return "severity is required";
        }
        return null;
    }
}
