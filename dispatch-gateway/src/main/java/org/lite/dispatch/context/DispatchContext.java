package org.lite.dispatch.context;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.lite.dispatch.service.AlertManager;
import org.lite.dispatch.service.MetricsStore;
import org.lite.dispatch.service.RateLimiterService;
import org.lite.dispatch.service.RouterService;
import org.springframework.stereotype.Component;

/**
 * The four dispatch components, built once by the container and passed to callers by reference.
 */
@Component
@Getter
@RequiredArgsConstructor
public class DispatchContext {
    private final RouterService router;
    private final RateLimiterService rateLimiter;
    private final MetricsStore metricsStore;
    private final AlertManager alertManager;
}
