package org.lite.dispatch.enums;

import java.util.Arrays;
import java.util.Optional;

/**
 * Dimensions the metrics store aggregates. Boolean dimensions are recorded as 1/0 so that
 * their average is a rate.
 */
public enum MetricName {
    LATENCY("latency", MetricKind.REQUEST),
    COST("cost", MetricKind.REQUEST),
    TOKENS("tokens", MetricKind.REQUEST),
    SUCCESS("success", MetricKind.REQUEST),
    CACHE_HIT("cache_hit", MetricKind.CACHE),
    RATE_LIMIT_DENIED("rate_limit_denied", MetricKind.RATE_LIMIT);

    private final String key;
    private final MetricKind source;

    MetricName(String key, MetricKind source) {
        this.key = key;
        this.source = source;
    }

    public String key() {
        return key;
    }

    public MetricKind source() {
        return source;
    }

    public static Optional<MetricName> fromKey(String key) {
        if (key == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(m -> m.key.equalsIgnoreCase(key.trim()) || m.name().equalsIgnoreCase(key.trim()))
                .findFirst();
    }
}
