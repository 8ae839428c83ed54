package org.lite.dispatch.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RateLimitResult {
    /** Remaining value reported when the scope is not limited. */
    public static final long UNLIMITED = Long.MAX_VALUE;

    boolean allowed;
    long remaining;
    long retryAfterMs;
    long resetAtMs;
    long limit;

    public static RateLimitResult unlimited(long now) {
        return RateLimitResult.builder()
                .allowed(true)
                .remaining(UNLIMITED)
                .resetAtMs(now)
                .limit(UNLIMITED)
                .build();
    }
}
