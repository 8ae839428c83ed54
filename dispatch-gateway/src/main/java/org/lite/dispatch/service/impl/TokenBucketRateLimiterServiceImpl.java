package org.lite.dispatch.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.lite.dispatch.config.DispatchProperties;
import org.lite.dispatch.entity.MetricEvent;
import org.lite.dispatch.entity.RateLimitBucketState;
import org.lite.dispatch.entity.RateLimitViolation;
import org.lite.dispatch.entity.UserQuota;
import org.lite.dispatch.enums.MetricKind;
import org.lite.dispatch.enums.RateLimitEventType;
import org.lite.dispatch.enums.ScopeType;
import org.lite.dispatch.exception.RateLimitStoreException;
import org.lite.dispatch.model.MetricFilter;
import org.lite.dispatch.model.RateLimitKey;
import org.lite.dispatch.model.RateLimitResult;
import org.lite.dispatch.model.RateLimitStatistics;
import org.lite.dispatch.model.RateLimitStatus;
import org.lite.dispatch.model.TokenBucket;
import org.lite.dispatch.repository.RateLimitBucketRepository;
import org.lite.dispatch.repository.RateLimitViolationRepository;
import org.lite.dispatch.repository.UserQuotaRepository;
import org.lite.dispatch.service.MetricsStore;
import org.lite.dispatch.service.RateLimiterService;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Token bucket rate limiter with an in-memory bucket map backed by MongoDB.
 *
 * <p>Every check runs inside {@link ConcurrentHashMap#compute} for its key, so checks on one key
 * are serialized while different keys proceed independently. A check only marks its key dirty;
 * {@link #flushBuckets()} writes the latest state of each dirty key in one batch, so the stored
 * copy lags the in-memory bucket by at most one flush interval.
 */
@Service
@Slf4j
public class TokenBucketRateLimiterServiceImpl implements RateLimiterService {

    private static final long STORE_RECHECK_INTERVAL_MS = 1_000;

    private final RateLimitBucketRepository bucketRepository;
    private final RateLimitViolationRepository violationRepository;
    private final UserQuotaRepository userQuotaRepository;
    private final MetricsStore metricsStore;
    private final DispatchProperties.RateLimit config;
    private final Clock clock;

    private final ConcurrentHashMap<RateLimitKey, TokenBucket> buckets = new ConcurrentHashMap<>();
    private final Map<ScopeType, DispatchProperties.ScopeLimit> scopeConfigs = new ConcurrentHashMap<>();
    private final Map<String, UserQuota> userQuotas = new ConcurrentHashMap<>();
    private final AtomicBoolean storeAvailable = new AtomicBoolean(true);
    private final AtomicLong lastStoreCheck = new AtomicLong(0);
    private final Set<RateLimitKey> dirtyKeys = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean flushing = new AtomicBoolean(false);

    public TokenBucketRateLimiterServiceImpl(RateLimitBucketRepository bucketRepository,
                                             RateLimitViolationRepository violationRepository,
                                             UserQuotaRepository userQuotaRepository,
                                             MetricsStore metricsStore,
                                             DispatchProperties properties,
                                             Clock clock) {
        this.bucketRepository = bucketRepository;
        this.violationRepository = violationRepository;
        this.userQuotaRepository = userQuotaRepository;
        this.metricsStore = metricsStore;
        this.config = properties.getRateLimit();
        this.clock = clock;
        scopeConfigs.put(ScopeType.USER, config.getUser());
        scopeConfigs.put(ScopeType.PROVIDER, config.getProvider());
        scopeConfigs.put(ScopeType.IP, config.getIp());
        scopeConfigs.put(ScopeType.GLOBAL, config.getGlobal());
    }

    @EventListener(ApplicationReadyEvent.class)
    public void loadPersistedState() {
        long now = clock.millis();
        userQuotaRepository.findByEnabledTrue()
                .doOnNext(quota -> userQuotas.put(quota.getUserId(), quota))
                .count()
                .doOnSuccess(count -> log.info("Loaded {} user quotas", count))
                .doOnError(e -> log.error("Failed to load user quotas: {}", e.getMessage()))
                .onErrorResume(e -> Mono.empty())
                .subscribe();
        if (!config.isPersistBuckets()) {
            return;
        }
        bucketRepository.findAll()
                .filter(state -> now - state.getLastAccess() <= config.getIdleEvictionMs())
                .filter(state -> state.getLimit() > 0 && state.getWindowMs() > 0)
                .doOnNext(state -> buckets.putIfAbsent(new RateLimitKey(state.getScope(), state.getKey()),
                        fromState(state)))
                .count()
                .doOnSuccess(count -> log.info("Restored {} rate limit buckets", count))
                .doOnError(e -> log.error("Failed to restore rate limit buckets: {}", e.getMessage()))
                .onErrorResume(e -> Mono.empty())
                .subscribe();
    }

    @Override
    public RateLimitResult checkLimit(String key, ScopeType scope, long tokensRequested) {
        if (key == null || scope == null) {
            throw new IllegalArgumentException("Rate limit key and scope are required");
        }
        if (tokensRequested <= 0) {
            throw new IllegalArgumentException("tokensRequested must be positive: " + tokensRequested);
        }
        long now = clock.millis();
        Limit limit = effectiveLimit(key, scope, now);
        if (limit == null) {
            return RateLimitResult.unlimited(now);
        }

        RateLimitKey bucketKey = new RateLimitKey(scope, key);
        if (config.isPersistBuckets() && !storeAvailable.get()) {
            RateLimitResult degraded = checkWithStoreDown(bucketKey, limit, tokensRequested, now);
            if (degraded != null) {
                return degraded;
            }
        }

        RateLimitResult[] result = new RateLimitResult[1];
        double[] available = new double[1];
        buckets.compute(bucketKey, (k, bucket) -> {
            TokenBucket current = reshape(bucket, limit, now);
            double before = current.peekTokens(now);
            boolean allowed = current.tryConsume(tokensRequested, now);
            available[0] = before;
            result[0] = RateLimitResult.builder()
                    .allowed(allowed)
                    .remaining((long) Math.floor(current.getTokens()))
                    .retryAfterMs(allowed ? 0 : current.retryAfterMs(tokensRequested))
                    .resetAtMs(current.resetAtMs(now))
                    .limit(limit.limit)
                    .build();
            return current;
        });

        if (config.isPersistBuckets()) {
            dirtyKeys.add(bucketKey);
        }
        recordOutcome(bucketKey, result[0], now);
        if (!result[0].isAllowed()) {
            recordViolation(bucketKey, tokensRequested, available[0], result[0], now);
        }
        return result[0];
    }

    // null means the in-memory bucket decides
    private RateLimitResult checkWithStoreDown(RateLimitKey bucketKey, Limit limit, long tokensRequested, long now) {
        recheckStore(bucketKey, now);
        if (config.getFailurePolicy() == DispatchProperties.FailurePolicy.FAIL_OPEN) {
            return null;
        }
        log.warn("Rate limit store unavailable, denying {} (fail-closed)", bucketKey.asString());
        RateLimitResult denied = RateLimitResult.builder()
                .allowed(false)
                .remaining(0)
                .retryAfterMs(STORE_RECHECK_INTERVAL_MS)
                .resetAtMs(now + STORE_RECHECK_INTERVAL_MS)
                .limit(limit.limit)
                .build();
        recordOutcome(bucketKey, denied, now);
        recordViolation(bucketKey, tokensRequested, 0, denied, now);
        return denied;
    }

    private void recheckStore(RateLimitKey bucketKey, long now) {
        long last = lastStoreCheck.get();
        if (now - last < STORE_RECHECK_INTERVAL_MS || !lastStoreCheck.compareAndSet(last, now)) {
            return;
        }
        log.debug("Rechecking rate limit store on behalf of {}", bucketKey.asString());
        bucketRepository.count()
                .doOnSuccess(c -> markStore(true))
                .doOnError(e -> markStore(false))
                .onErrorResume(e -> Mono.empty())
                .subscribe();
    }

    @Override
    public Mono<Integer> flushBuckets() {
        return Mono.defer(() -> {
            if (!config.isPersistBuckets() || dirtyKeys.isEmpty() || !flushing.compareAndSet(false, true)) {
                return Mono.just(0);
            }
            return persistDirty().doFinally(signal -> flushing.set(false));
        });
    }

    private Mono<Integer> persistDirty() {
        List<RateLimitBucketState> states = new ArrayList<>();
        for (RateLimitKey key : new ArrayList<>(dirtyKeys)) {
            // unmark before reading so a concurrent check marks the key again
            dirtyKeys.remove(key);
            buckets.computeIfPresent(key, (k, bucket) -> {
                states.add(toState(k, bucket));
                return bucket;
            });
        }
        if (states.isEmpty()) {
            return Mono.just(0);
        }
        return Flux.defer(() -> bucketRepository.saveAll(states))
                .then(Mono.just(states.size()))
                .retryWhen(Retry.backoff(config.getMaxRetries(), Duration.ofMillis(config.getMinBackoffMs()))
                        .maxBackoff(Duration.ofMillis(config.getMaxBackoffMs()))
                        .doBeforeRetry(signal -> log.warn("Rate limit bucket flush attempt {} failed, retrying: {}",
                                signal.totalRetries() + 1, signal.failure().getMessage())))
                .doOnSuccess(count -> markStore(true))
                .onErrorResume(e -> {
                    RateLimitStoreException failure = new RateLimitStoreException(states.size(), e);
                    log.error("{}, keeping them pending", failure.getMessage(), e);
                    markStore(false);
                    states.forEach(state -> dirtyKeys.add(new RateLimitKey(state.getScope(), state.getKey())));
                    return Mono.just(0);
                });
    }

    private void markStore(boolean available) {
        if (storeAvailable.getAndSet(available) != available) {
            if (available) {
                log.info("Rate limit store is reachable again");
            } else {
                log.warn("Rate limit store marked unavailable, applying {} policy", config.getFailurePolicy());
            }
        }
    }

    private void recordOutcome(RateLimitKey bucketKey, RateLimitResult result, long now) {
        metricsStore.record(MetricEvent.builder()
                .timestamp(now)
                .kind(MetricKind.RATE_LIMIT)
                .provider(bucketKey.getScope() == ScopeType.PROVIDER ? bucketKey.getKey() : null)
                .userId(bucketKey.getScope() == ScopeType.USER ? bucketKey.getKey() : null)
                .rateLimit(MetricEvent.RateLimitDetail.builder()
                        .type(result.isAllowed() ? RateLimitEventType.ALLOWED : RateLimitEventType.DENIED)
                        .scope(bucketKey.getScope())
                        .key(bucketKey.getKey())
                        .remaining(result.getRemaining())
                        .build())
                .build());
    }

    private void recordViolation(RateLimitKey bucketKey, long requested, double available, RateLimitResult result,
                                 long now) {
        RateLimitViolation violation = RateLimitViolation.builder()
                .scope(bucketKey.getScope())
                .key(bucketKey.getKey())
                .configName(configName(bucketKey))
                .requested(requested)
                .available(available)
                .limit(result.getLimit())
                .retryAfterMs(result.getRetryAfterMs())
                .timestamp(now)
                .build();
        log.debug("Rate limit exceeded for {} (retry after {}ms)", bucketKey.asString(), result.getRetryAfterMs());
        violationRepository.save(violation)
                .doOnError(e -> log.error("Failed to record rate limit violation for {}: {}",
                        bucketKey.asString(), e.getMessage()))
                .onErrorResume(e -> Mono.empty())
                .subscribe();
    }

    private String configName(RateLimitKey bucketKey) {
        if (bucketKey.getScope() == ScopeType.USER && userQuotas.containsKey(bucketKey.getKey())) {
            return "user_quota";
        }
        return bucketKey.getScope().configName();
    }

    @Override
    public RateLimitStatus getStatus(String key, ScopeType scope) {
        long now = clock.millis();
        Limit limit = effectiveLimit(key, scope, now);
        if (limit == null) {
            return RateLimitStatus.builder()
                    .key(key)
                    .scope(scope)
                    .limited(false)
                    .resetAtMs(now)
                    .build();
        }
        TokenBucket bucket = buckets.get(new RateLimitKey(scope, key));
        if (bucket == null || !bucket.sameShape(limit.limit, limit.windowMs, limit.burst)) {
            bucket = new TokenBucket(limit.limit, limit.windowMs, limit.burst, now);
        }
        return toStatus(key, scope, bucket, now);
    }

    @Override
    public boolean reset(String key, ScopeType scope) {
        RateLimitKey bucketKey = new RateLimitKey(scope, key);
        boolean removed = buckets.remove(bucketKey) != null;
        dirtyKeys.remove(bucketKey);
        if (config.isPersistBuckets()) {
            bucketRepository.deleteById(bucketKey.asString())
                    .doOnError(e -> log.error("Failed to delete stored bucket {}: {}", bucketKey.asString(), e.getMessage()))
                    .onErrorResume(e -> Mono.empty())
                    .subscribe();
        }
        log.info("Reset rate limit bucket {}", bucketKey.asString());
        return removed;
    }

    @Override
    public List<RateLimitStatus> getActiveBuckets(ScopeType scope) {
        long now = clock.millis();
        return buckets.entrySet().stream()
                .filter(e -> scope == null || e.getKey().getScope() == scope)
                .map(e -> toStatus(e.getKey().getKey(), e.getKey().getScope(), e.getValue(), now))
                .sorted(Comparator.comparing(RateLimitStatus::getScope).thenComparing(RateLimitStatus::getKey))
                .collect(Collectors.toList());
    }

    @Override
    public Flux<RateLimitViolation> getViolations(String key, ScopeType scope, int limit) {
        Flux<RateLimitViolation> source = key == null
                ? violationRepository.findByScopeOrderByTimestampDesc(scope)
                : violationRepository.findByScopeAndKeyOrderByTimestampDesc(scope, key);
        return source.take(Math.max(0, limit));
    }

    @Override
    public Mono<List<RateLimitStatistics>> getStatistics(long from, long to, ScopeType scope) {
        return metricsStore.query(MetricFilter.none(), MetricKind.RATE_LIMIT, from, to, Integer.MAX_VALUE, 0)
                .filter(e -> e.getRateLimit() != null)
                .filter(e -> scope == null || e.getRateLimit().getScope() == scope)
                .collectList()
                .map(events -> {
                    Map<String, Tally> tallies = new TreeMap<>();
                    for (MetricEvent event : events) {
                        String day = Instant.ofEpochMilli(event.getTimestamp()).atZone(ZoneOffset.UTC).toLocalDate().toString();
                        ScopeType eventScope = event.getRateLimit().getScope();
                        tallies.computeIfAbsent(day + "|" + eventScope.name(), k -> new Tally(day, eventScope))
                                .add(event.getRateLimit());
                    }
                    return tallies.values().stream().map(Tally::toStatistics).collect(Collectors.toList());
                });
    }

    @Override
    public Mono<UserQuota> setUserQuota(UserQuota quota) {
        if (quota.getUserId() == null || quota.getMaxRequests() <= 0 || quota.getWindowMs() <= 0
                || quota.getBurstSize() < 0) {
            return Mono.error(new IllegalArgumentException("Quota requires userId, positive maxRequests and windowMs"));
        }
        long now = clock.millis();
        UserQuota existing = userQuotas.get(quota.getUserId());
        quota.setCreatedAt(existing == null ? now : existing.getCreatedAt());
        quota.setUpdatedAt(now);
        return userQuotaRepository.save(quota)
                .doOnSuccess(saved -> {
                    userQuotas.put(saved.getUserId(), saved);
                    reset(saved.getUserId(), ScopeType.USER);
                    log.info("Set quota for user {}: {} requests per {}ms, burst {}",
                            saved.getUserId(), saved.getMaxRequests(), saved.getWindowMs(), saved.getBurstSize());
                })
                .doOnError(e -> log.error("Failed to save quota for user {}: {}", quota.getUserId(), e.getMessage()));
    }

    @Override
    public Mono<Boolean> removeUserQuota(String userId) {
        return userQuotaRepository.deleteById(userId)
                .then(Mono.fromSupplier(() -> {
                    boolean removed = userQuotas.remove(userId) != null;
                    reset(userId, ScopeType.USER);
                    return removed;
                }))
                .doOnError(e -> log.error("Failed to remove quota for user {}: {}", userId, e.getMessage()));
    }

    @Override
    public UserQuota getUserQuota(String userId) {
        return userQuotas.get(userId);
    }

    @Override
    public void updateScopeConfig(ScopeType scope, DispatchProperties.ScopeLimit limit) {
        if (limit.isEnabled() && (limit.getLimit() <= 0 || limit.getWindowMs() <= 0 || limit.getBurst() < 0)) {
            throw new IllegalArgumentException("Scope limit requires positive limit and windowMs");
        }
        scopeConfigs.put(scope, limit);
        log.info("Updated {} rate limit: enabled={} limit={} windowMs={} burst={}", scope.configName(),
                limit.isEnabled(), limit.getLimit(), limit.getWindowMs(), limit.getBurst());
    }

    @Override
    public Map<ScopeType, DispatchProperties.ScopeLimit> getScopeConfigs() {
        Map<ScopeType, DispatchProperties.ScopeLimit> copy = new EnumMap<>(ScopeType.class);
        copy.putAll(scopeConfigs);
        return copy;
    }

    @Override
    public int evictIdleBuckets() {
        long now = clock.millis();
        int evicted = 0;
        for (RateLimitKey key : new ArrayList<>(buckets.keySet())) {
            boolean[] removed = {false};
            buckets.computeIfPresent(key, (k, bucket) -> {
                if (now - bucket.getLastAccess() > config.getIdleEvictionMs()) {
                    removed[0] = true;
                    return null;
                }
                return bucket;
            });
            if (removed[0]) {
                evicted++;
            }
        }
        if (evicted > 0) {
            log.info("Evicted {} idle rate limit buckets", evicted);
        }
        return evicted;
    }

    @Override
    public Mono<Long> purgeDurable() {
        long now = clock.millis();
        return Flux.concat(
                        bucketRepository.deleteByLastAccessLessThan(now - config.getIdleEvictionMs()),
                        violationRepository.deleteByTimestampLessThan(now - config.getViolationRetentionMs()))
                .reduce(0L, Long::sum)
                .doOnSuccess(count -> log.info("Purged {} stale rate limit documents", count))
                .doOnError(e -> log.error("Failed to purge rate limit documents: {}", e.getMessage()));
    }

    private Limit effectiveLimit(String key, ScopeType scope, long now) {
        if (scope == ScopeType.USER) {
            UserQuota quota = userQuotas.get(key);
            if (quota != null && quota.isActive(now)) {
                return new Limit(quota.getMaxRequests(), quota.getWindowMs(), quota.getBurstSize());
            }
        }
        DispatchProperties.ScopeLimit scopeLimit = scopeConfigs.get(scope);
        if (scopeLimit == null || !scopeLimit.isEnabled() || scopeLimit.getLimit() <= 0 || scopeLimit.getWindowMs() <= 0) {
            return null;
        }
        return new Limit(scopeLimit.getLimit(), scopeLimit.getWindowMs(), scopeLimit.getBurst());
    }

    private static TokenBucket reshape(TokenBucket bucket, Limit limit, long now) {
        if (bucket == null) {
            return new TokenBucket(limit.limit, limit.windowMs, limit.burst, now);
        }
        if (bucket.sameShape(limit.limit, limit.windowMs, limit.burst)) {
            return bucket;
        }
        // configuration changed: keep the refilled level, clamped to the new capacity
        return new TokenBucket(limit.limit, limit.windowMs, limit.burst, bucket.peekTokens(now), now,
                bucket.getLastAccess());
    }

    private static TokenBucket fromState(RateLimitBucketState state) {
        return new TokenBucket(state.getLimit(), state.getWindowMs(), state.getBurst(),
                state.getTokens(), state.getLastRefill(), state.getLastAccess());
    }

    private static RateLimitBucketState toState(RateLimitKey key, TokenBucket bucket) {
        return RateLimitBucketState.builder()
                .id(key.asString())
                .scope(key.getScope())
                .key(key.getKey())
                .limit(bucket.getLimit())
                .windowMs(bucket.getWindowMs())
                .burst(bucket.getBurst())
                .capacity(bucket.getCapacity())
                .tokens(bucket.getTokens())
                .refillRatePerMs(bucket.getRefillRatePerMs())
                .lastRefill(bucket.getLastRefill())
                .lastAccess(bucket.getLastAccess())
                .build();
    }

    private static RateLimitStatus toStatus(String key, ScopeType scope, TokenBucket bucket, long now) {
        return RateLimitStatus.builder()
                .key(key)
                .scope(scope)
                .limited(true)
                .tokens(bucket.peekTokens(now))
                .capacity(bucket.getCapacity())
                .limit(bucket.getLimit())
                .windowMs(bucket.getWindowMs())
                .resetAtMs(now + (long) Math.ceil((bucket.getCapacity() - bucket.peekTokens(now)) / bucket.getRefillRatePerMs()))
                .lastAccess(bucket.getLastAccess())
                .build();
    }

    private record Limit(long limit, long windowMs, long burst) {
    }

    private static final class Tally {
        private final String day;
        private final ScopeType scope;
        private long allowed;
        private long denied;
        private final Set<String> keys = new HashSet<>();

        private Tally(String day, ScopeType scope) {
            this.day = day;
            this.scope = scope;
        }

        private void add(MetricEvent.RateLimitDetail detail) {
            if (detail.getType() == RateLimitEventType.DENIED) {
                denied++;
            } else {
                allowed++;
            }
            keys.add(detail.getKey());
        }

        private RateLimitStatistics toStatistics() {
            return RateLimitStatistics.builder()
                    .day(day)
                    .scope(scope)
                    .total(allowed + denied)
                    .allowed(allowed)
                    .denied(denied)
                    .uniqueKeys(keys.size())
                    .build();
        }
    }
}
