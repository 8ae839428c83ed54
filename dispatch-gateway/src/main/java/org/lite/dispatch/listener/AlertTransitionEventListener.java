package org.lite.dispatch.listener;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.dispatch.config.DispatchProperties;
import org.lite.dispatch.event.AlertTransitionEvent;
import org.lite.dispatch.service.CacheService;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Forwards alert transitions to the Redis topic read by the notification system.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class AlertTransitionEventListener {

    private final CacheService cacheService;
    private final ObjectMapper objectMapper;
    private final DispatchProperties properties;

    @Async
    @EventListener
    public void handleAlertTransitionEvent(AlertTransitionEvent event) {
        String channel = properties.getAlerts().getTransitionsChannel();
        String payload;
        try {
            payload = objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize alert transition {}", event.getSequence(), e);
            return;
        }
        cacheService.publish(channel, payload)
                .doOnSuccess(receivers -> log.debug("Published alert transition {} to {} ({} receivers)",
                        event.getSequence(), channel, receivers))
                .doOnError(error -> log.error("Failed to publish alert transition {}", event.getSequence(), error))
                .subscribe();
    }
}
