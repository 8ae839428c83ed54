package org.lite.dispatch.controller;

import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.lite.dispatch.config.DispatchProperties;
import org.lite.dispatch.context.DispatchContext;
import org.lite.dispatch.dto.RateLimitCheckRequest;
import org.lite.dispatch.dto.UserQuotaRequest;
import org.lite.dispatch.entity.RateLimitViolation;
import org.lite.dispatch.entity.UserQuota;
import org.lite.dispatch.enums.ScopeType;
import org.lite.dispatch.exception.ResourceNotFoundException;
import org.lite.dispatch.model.RateLimitResult;
import org.lite.dispatch.model.RateLimitStatistics;
import org.lite.dispatch.model.RateLimitStatus;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/rate-limits")
@RequiredArgsConstructor
@Slf4j
public class RateLimitController {

    private static final long DEFAULT_STATISTICS_WINDOW_MS = 7L * 86_400_000;

    private final DispatchContext dispatchContext;
    private final Clock clock;

    /**
     * Consumes tokens from one scope's bucket. A denial answers 429 with a Retry-After header in
     * whole seconds; the body carries the exact millisecond value.
     */
    @PostMapping("/check")
    public Mono<ResponseEntity<RateLimitResult>> check(@Valid @RequestBody RateLimitCheckRequest request) {
        return Mono.fromCallable(() -> dispatchContext.getRateLimiter()
                .checkLimit(request.getKey(), request.getScope(), request.getTokens()))
            .map(result -> {
                if (result.isAllowed()) {
                    return ResponseEntity.ok(result);
                }
                ResponseEntity.BodyBuilder builder = ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS);
                if (result.getRetryAfterMs() >= 0) {
                    builder.header(HttpHeaders.RETRY_AFTER, String.valueOf(Math.max(1, (result.getRetryAfterMs() + 999) / 1000)));
                }
                return builder.body(result);
            });
    }

    @GetMapping("/status")
    public Mono<RateLimitStatus> getStatus(@RequestParam String key, @RequestParam ScopeType scope) {
        return Mono.fromCallable(() -> dispatchContext.getRateLimiter().getStatus(key, scope));
    }

    @PostMapping("/reset")
    public Mono<Map<String, Object>> reset(@RequestParam String key, @RequestParam ScopeType scope) {
        return Mono.fromCallable(() -> {
            boolean reset = dispatchContext.getRateLimiter().reset(key, scope);
            log.info("Rate limit bucket {}:{} reset requested, existed: {}", scope, key, reset);
            return Map.<String, Object>of("key", key, "scope", scope, "reset", reset);
        });
    }

    @GetMapping("/buckets")
    public Mono<List<RateLimitStatus>> getActiveBuckets(@RequestParam(required = false) ScopeType scope) {
        return Mono.fromCallable(() -> dispatchContext.getRateLimiter().getActiveBuckets(scope));
    }

    @GetMapping("/violations")
    public Flux<RateLimitViolation> getViolations(
        @RequestParam ScopeType scope,
        @RequestParam(required = false) String key,
        @RequestParam(defaultValue = "100") int limit
    ) {
        return dispatchContext.getRateLimiter().getViolations(key, scope, limit);
    }

    /**
     * Allowed and denied checks per UTC day and scope. Defaults to the last seven days.
     */
    @GetMapping("/statistics")
    public Mono<List<RateLimitStatistics>> getStatistics(
        @RequestParam(required = false) Long from,
        @RequestParam(required = false) Long to,
        @RequestParam(required = false) ScopeType scope
    ) {
        long end = to != null ? to : clock.millis();
        long start = from != null ? from : end - DEFAULT_STATISTICS_WINDOW_MS;
        if (start > end) {
            return Mono.error(new IllegalArgumentException("from must not be after to"));
        }
        return dispatchContext.getRateLimiter().getStatistics(start, end, scope);
    }

    @GetMapping("/config")
    public Mono<Map<ScopeType, DispatchProperties.ScopeLimit>> getScopeConfigs() {
        return Mono.fromCallable(() -> dispatchContext.getRateLimiter().getScopeConfigs());
    }

    @PutMapping("/config/{scope}")
    public Mono<Map<ScopeType, DispatchProperties.ScopeLimit>> updateScopeConfig(
        @PathVariable ScopeType scope,
        @RequestBody DispatchProperties.ScopeLimit limit
    ) {
        return Mono.fromCallable(() -> {
            dispatchContext.getRateLimiter().updateScopeConfig(scope, limit);
            return dispatchContext.getRateLimiter().getScopeConfigs();
        });
    }

    @GetMapping("/quotas/{userId}")
    public Mono<UserQuota> getUserQuota(@PathVariable String userId) {
        return Mono.justOrEmpty(dispatchContext.getRateLimiter().getUserQuota(userId))
            .switchIfEmpty(Mono.error(new ResourceNotFoundException("User quota", userId)));
    }

    @PutMapping("/quotas/{userId}")
    public Mono<UserQuota> setUserQuota(@PathVariable String userId, @Valid @RequestBody UserQuotaRequest request) {
        UserQuota quota = UserQuota.builder()
            .userId(userId)
            .maxRequests(request.getMaxRequests())
            .windowMs(request.getWindowMs())
            .burstSize(request.getBurstSize())
            .enabled(request.isEnabled())
            .expiresAt(request.getExpiresAt())
            .build();
        return dispatchContext.getRateLimiter().setUserQuota(quota)
            .doOnSuccess(saved -> log.info("Quota for user {} set to {} per {}ms", userId,
                saved.getMaxRequests(), saved.getWindowMs()));
    }

    @DeleteMapping("/quotas/{userId}")
    public Mono<ResponseEntity<Void>> removeUserQuota(@PathVariable String userId) {
        return dispatchContext.getRateLimiter().removeUserQuota(userId)
            .map(removed -> removed
                ? ResponseEntity.noContent().<Void>build()
                : ResponseEntity.notFound().<Void>build());
    }
}
