package org.lite.dispatch.model;

import lombok.Getter;

/**
 * Mutable token bucket. Instances are only touched inside a map {@code compute} for their key.
 */
@Getter
public class TokenBucket {
    private final long limit;
    private final long windowMs;
    private final long burst;
    private final double capacity;
    private final double refillRatePerMs;
    private double tokens;
    private long lastRefill;
    private long lastAccess;

    public TokenBucket(long limit, long windowMs, long burst, long now) {
        this(limit, windowMs, burst, limit + burst, now, now);
    }

    public TokenBucket(long limit, long windowMs, long burst, double tokens, long lastRefill, long lastAccess) {
        if (limit <= 0 || windowMs <= 0 || burst < 0) {
            throw new IllegalArgumentException(String.format(
                    "Invalid bucket limit=%d windowMs=%d burst=%d", limit, windowMs, burst));
        }
        this.limit = limit;
        this.windowMs = windowMs;
        this.burst = burst;
        this.capacity = limit + burst;
        this.refillRatePerMs = (double) limit / windowMs;
        this.tokens = Math.max(0, Math.min(capacity, tokens));
        this.lastRefill = lastRefill;
        this.lastAccess = lastAccess;
    }

    public boolean sameShape(long limit, long windowMs, long burst) {
        return this.limit == limit && this.windowMs == windowMs && this.burst == burst;
    }

    public void refill(long now) {
        long elapsed = now - lastRefill;
        if (elapsed > 0) {
            tokens = Math.min(capacity, tokens + elapsed * refillRatePerMs);
            lastRefill = now;
        }
    }

    /**
     * Refills, then takes {@code requested} tokens if available.
     */
    public boolean tryConsume(long requested, long now) {
        refill(now);
        lastAccess = now;
        if (tokens >= requested) {
            tokens -= requested;
            return true;
        }
        return false;
    }

    /**
     * Milliseconds until {@code requested} tokens are available, or -1 when the request exceeds capacity.
     */
    public long retryAfterMs(long requested) {
        if (requested > capacity) {
            return -1;
        }
        return Math.max(0, (long) Math.ceil((requested - tokens) / refillRatePerMs));
    }

    public long resetAtMs(long now) {
        return now + (long) Math.ceil((capacity - tokens) / refillRatePerMs);
    }

    /**
     * Tokens as they would be after refilling at {@code now}, without changing the bucket.
     */
    public double peekTokens(long now) {
        long elapsed = Math.max(0, now - lastRefill);
        return Math.min(capacity, tokens + elapsed * refillRatePerMs);
    }
}
