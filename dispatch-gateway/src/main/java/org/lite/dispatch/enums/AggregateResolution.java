package org.lite.dispatch.enums;

import java.time.Duration;

/**
 * Rollup tiers of the metrics store, finest first.
 */
public enum AggregateResolution {
    MINUTE(Duration.ofMinutes(1)),
    HOUR(Duration.ofHours(1)),
    DAY(Duration.ofDays(1));

    private final Duration width;

    AggregateResolution(Duration width) {
        this.width = width;
    }

    public long widthMs() {
        return width.toMillis();
    }

    public long bucketStart(long timestampMs) {
        return Math.floorDiv(timestampMs, widthMs()) * widthMs();
    }
}
