package org.lite.dispatch.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.dispatch.service.AlertManager;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class AlertEvaluationScheduler {

    private final AlertManager alertManager;

    @Scheduled(initialDelayString = "${dispatch.alerts.evaluation-interval-ms:60000}",
            fixedDelayString = "${dispatch.alerts.evaluation-interval-ms:60000}")
    public void evaluate() {
        alertManager.evaluateAllRules()
            .doOnSuccess(results -> log.debug("Alert evaluation finished for {} rules", results.size()))
            .doOnError(error -> log.error("Error evaluating alert rules: {}", error.getMessage(), error))
            .subscribe();
    }
}
