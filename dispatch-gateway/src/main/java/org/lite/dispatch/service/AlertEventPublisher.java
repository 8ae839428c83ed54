package org.lite.dispatch.service;

import lombok.extern.slf4j.Slf4j;
import org.lite.dispatch.config.DispatchProperties;
import org.lite.dispatch.entity.Alert;
import org.lite.dispatch.enums.AlertState;
import org.lite.dispatch.event.AlertTransitionEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Feed of alert transitions. The last {@code historySize} transitions are replayed to every new
 * subscriber, so a consumer that reconnects with the last sequence it saw misses nothing still in
 * the history. Transitions are also raised as Spring application events.
 */
@Component
@Slf4j
public class AlertEventPublisher {

    private final Sinks.Many<AlertTransitionEvent> sink;
    private final AtomicLong sequence = new AtomicLong();
    private final ApplicationEventPublisher applicationEventPublisher;
    private final Clock clock;

    public AlertEventPublisher(ApplicationEventPublisher applicationEventPublisher, DispatchProperties properties,
                               Clock clock) {
        this.applicationEventPublisher = applicationEventPublisher;
        this.clock = clock;
        this.sink = Sinks.many().replay().limit(Math.max(1, properties.getAlerts().getHistorySize()));
    }

    public synchronized AlertTransitionEvent publish(Alert alert, AlertState from, AlertState to) {
        AlertTransitionEvent event = AlertTransitionEvent.builder()
                .sequence(sequence.incrementAndGet())
                .alert(alert.toBuilder().build())
                .from(from)
                .to(to)
                .timestamp(clock.millis())
                .build();
        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result.isFailure()) {
            log.error("Failed to emit alert transition {} for rule {}: {}", event.getSequence(), alert.getRuleId(), result);
        }
        log.info("Alert {} for rule '{}' {} -> {}", alert.getId(), alert.getRuleName(), from, to);
        applicationEventPublisher.publishEvent(event);
        return event;
    }

    /**
     * Transitions with a sequence greater than {@code afterSequence} still in the history, followed by live ones.
     */
    public Flux<AlertTransitionEvent> subscribe(long afterSequence) {
        return sink.asFlux().filter(e -> e.getSequence() > afterSequence);
    }

    public long currentSequence() {
        return sequence.get();
    }
}
