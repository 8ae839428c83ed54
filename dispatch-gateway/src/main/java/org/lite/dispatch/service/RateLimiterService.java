package org.lite.dispatch.service;

import org.lite.dispatch.config.DispatchProperties;
import org.lite.dispatch.entity.RateLimitViolation;
import org.lite.dispatch.entity.UserQuota;
import org.lite.dispatch.enums.ScopeType;
import org.lite.dispatch.model.RateLimitResult;
import org.lite.dispatch.model.RateLimitStatistics;
import org.lite.dispatch.model.RateLimitStatus;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;

/**
 * Token bucket admission control for one scope at a time. Callers composing several scopes decide
 * the order and stop at the first denial.
 */
public interface RateLimiterService {

    default RateLimitResult checkLimit(String key, ScopeType scope) {
        return checkLimit(key, scope, 1);
    }

    RateLimitResult checkLimit(String key, ScopeType scope, long tokensRequested);

    RateLimitStatus getStatus(String key, ScopeType scope);

    boolean reset(String key, ScopeType scope);

    List<RateLimitStatus> getActiveBuckets(ScopeType scope);

    Flux<RateLimitViolation> getViolations(String key, ScopeType scope, int limit);

    Mono<List<RateLimitStatistics>> getStatistics(long from, long to, ScopeType scope);

    Mono<UserQuota> setUserQuota(UserQuota quota);

    Mono<Boolean> removeUserQuota(String userId);

    UserQuota getUserQuota(String userId);

    void updateScopeConfig(ScopeType scope, DispatchProperties.ScopeLimit limit);

    Map<ScopeType, DispatchProperties.ScopeLimit> getScopeConfigs();

    /**
     * Writes the latest state of every bucket changed since the previous flush. Returns the number
     * of buckets written; failed writes stay pending for the next flush.
     */
    Mono<Integer> flushBuckets();

    /**
     * Evicts buckets idle longer than the configured period. Returns the number evicted.
     */
    int evictIdleBuckets();

    /**
     * Removes idle bucket states and expired violations from storage.
     */
    Mono<Long> purgeDurable();
}
